package com.mainframe.analyzer.model;

import lombok.NonNull;
import lombok.Value;

/**
 * An OPEN/READ/WRITE/CLOSE statement against a named file.
 */
@Value(staticConstructor = "of")
public class ResourceOperation {

    @NonNull
    OperationKind operation;

    @NonNull
    String target;
}
