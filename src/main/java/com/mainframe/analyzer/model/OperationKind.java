package com.mainframe.analyzer.model;

import java.util.Locale;

/**
 * File lifecycle verbs recognised in paragraph bodies.
 */
public enum OperationKind {
    OPEN,
    READ,
    WRITE,
    CLOSE;

    public static OperationKind fromKeyword(String keyword) {
        return valueOf(keyword.trim().toUpperCase(Locale.ROOT));
    }
}
