package com.mainframe.analyzer.config;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Settings for the structural scanner.
 *
 * The defaults reproduce the plain single-pass behaviour: last body wins and
 * edges are grouped by pattern class.
 */
@Value
@Builder(toBuilder = true)
public class ScannerConfig {

    /**
     * How repeated division and paragraph names are merged.
     */
    @NonNull
    @Builder.Default
    DuplicateNamePolicy duplicateNamePolicy = DuplicateNamePolicy.LAST_WINS;

    /**
     * Order of PERFORM and CALL edges within a paragraph.
     */
    @NonNull
    @Builder.Default
    EdgeOrdering edgeOrdering = EdgeOrdering.PATTERN_CLASS;

    /**
     * Whether repeated names are reported as warnings.
     */
    @Builder.Default
    boolean reportDuplicates = false;

    public static ScannerConfig defaults() {
        return ScannerConfig.builder().build();
    }
}
