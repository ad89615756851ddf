package com.mainframe.analyzer.model;

import lombok.NonNull;
import lombok.Value;

/**
 * A PERFORM or CALL reference found in a paragraph body.
 */
@Value(staticConstructor = "of")
public class DependencyEdge {

    @NonNull
    EdgeKind kind;

    /**
     * Uppercased paragraph or program name. Not checked against the model.
     */
    @NonNull
    String target;

    public static DependencyEdge invoke(String target) {
        return of(EdgeKind.INVOKE, target);
    }

    public static DependencyEdge externalCall(String target) {
        return of(EdgeKind.EXTERNAL_CALL, target);
    }
}
