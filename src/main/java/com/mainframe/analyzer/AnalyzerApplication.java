package com.mainframe.analyzer;

import com.mainframe.analyzer.cli.ScanCommand;
import picocli.CommandLine;

/**
 * Main entry point for the COBOL Structure Analyzer.
 * Scans a COBOL program into divisions, sections and paragraphs and records the
 * COPY, PERFORM, CALL and file I/O references found in them.
 */
public class AnalyzerApplication {

    public static void main(String[] args) {
        System.exit(run(args));
    }

    static int run(String... args) {
        return new CommandLine(new ScanCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
    }
}
