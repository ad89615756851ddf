package com.mainframe.analyzer.model;

/**
 * Kind of a paragraph dependency edge.
 */
public enum EdgeKind {
    /**
     * PERFORM of another paragraph in the same program.
     */
    INVOKE("PERFORM"),

    /**
     * CALL of a program outside the current one.
     */
    EXTERNAL_CALL("CALL");

    private final String keyword;

    EdgeKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * The COBOL verb that produces this edge.
     */
    public String getKeyword() {
        return keyword;
    }
}
