package com.mainframe.analyzer.util;

import lombok.experimental.UtilityClass;

import java.util.Locale;

@UtilityClass
public class CobolNamingUtil {

    /**
     * Uppercases a COBOL name the way the scanner stores it. Null becomes empty.
     */
    public static String normalizeName(String cobolName) {
        if (cobolName == null) return "";
        return cobolName.trim().toUpperCase(Locale.ROOT);
    }

    /**
     * Convert a COBOL name to a file name stem.
     * Example: "0100-READ-CUSTOMER" -> "0100-read-customer"
     */
    public static String toFileStem(String cobolName) {
        if (cobolName == null || cobolName.isBlank()) return "unnamed";

        String stem = cobolName.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]+", "-");
        stem = stem.replaceAll("^-+|-+$", "");

        return stem.isEmpty() ? "unnamed" : stem;
    }

    /**
     * Strip the directory and extension from a source file name.
     * Example: "src/PAYROLL.cbl" -> "PAYROLL"
     */
    public static String stripExtension(String fileName) {
        if (fileName == null) return "";
        int slash = Math.max(fileName.lastIndexOf('/'), fileName.lastIndexOf('\\'));
        String file = fileName.substring(slash + 1);
        int dot = file.lastIndexOf('.');
        return (dot > 0) ? file.substring(0, dot) : file;
    }
}
