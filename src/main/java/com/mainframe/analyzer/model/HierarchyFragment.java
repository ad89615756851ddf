package com.mainframe.analyzer.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import lombok.NonNull;
import lombok.Value;

/**
 * Output of the section/paragraph pass.
 *
 * {@code paragraphBodies} keeps every body seen for a name in source order; the
 * scanner decides which of them end up in the model.
 */
@Value
public class HierarchyFragment {

    @NonNull
    Map<String, List<String>> sections;

    @NonNull
    Map<String, List<String>> paragraphBodies;

    public static HierarchyFragment of(Map<String, List<String>> sections, Map<String, List<String>> paragraphBodies) {
        return new HierarchyFragment(freeze(sections), freeze(paragraphBodies));
    }

    public static HierarchyFragment empty() {
        return new HierarchyFragment(Map.of(), Map.of());
    }

    private static Map<String, List<String>> freeze(Map<String, List<String>> source) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }
}
