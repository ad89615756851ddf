package com.mainframe.analyzer.config;

/**
 * Ordering of the PERFORM/CALL edges recorded for a paragraph.
 */
public enum EdgeOrdering {
    /**
     * All PERFORM edges in text order, then all CALL edges in text order.
     */
    PATTERN_CLASS,

    /**
     * PERFORM and CALL edges interleaved by their position in the text.
     */
    DOCUMENT_ORDER
}
