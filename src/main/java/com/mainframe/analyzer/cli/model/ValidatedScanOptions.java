package com.mainframe.analyzer.cli.model;

import java.nio.charset.Charset;
import java.nio.file.Path;

import com.mainframe.analyzer.config.ScannerConfig;
import com.mainframe.analyzer.docs.SummarizerConfig;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Derived values needed by the executor. Keeps ScanCommand thin.
 */
@Data
@AllArgsConstructor
public class ValidatedScanOptions {
    Path sourcePath;
    Charset charset;
    Path outputPath;
    ScannerConfig scannerConfig;
    /** Null when no documentation is requested. */
    Path docsDir;
    /** Null unless the Azure OpenAI summarizer is selected. */
    SummarizerConfig summarizerConfig;
}
