package com.mainframe.analyzer.cli.output;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.model.ScanOptions;
import com.mainframe.analyzer.cli.model.ValidatedScanOptions;
import com.mainframe.analyzer.docs.DocumentationResult;
import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.model.ScanDiagnostics;

/**
 * Responsible only for printing CLI output for the "scan" command.
 * No validation, no execution.
 */
public class ScanResultsPrinter {

    private static final Logger log = LoggerFactory.getLogger(ScanResultsPrinter.class);

    public void printBanner(ScanOptions o, ValidatedScanOptions v) {
        log.info("=================================================");
        log.info("COBOL Structure Analyzer");
        log.info("=================================================");
        log.info("Source File: {}", v.getSourcePath());
        log.info("Charset: {}", v.getCharset());
        log.info("Output File: {}", v.getOutputPath());
        log.info("Duplicate Names: {}", v.getScannerConfig().getDuplicateNamePolicy());
        log.info("Edge Order: {}", v.getScannerConfig().getEdgeOrdering());

        if (v.getDocsDir() != null) {
            log.info("-------------------------------------------------");
            log.info("Documentation:");
            log.info("  Output Dir: {}", v.getDocsDir());
            log.info("  Summarizer: {}", o.getSummarizer());
            if (v.getSummarizerConfig() != null) {
                log.info("  Endpoint:   {}", v.getSummarizerConfig().getEndpoint());
                log.info("  Deployment: {}", v.getSummarizerConfig().getDeployment());
            }
        }

        log.info("=================================================");
    }

    public void printSuccess(ValidatedScanOptions v, ProgramStructure structure, ScanDiagnostics diagnostics,
                             DocumentationResult docs) {
        log.info("");
        log.info("=================================================");
        log.info("SCAN SUCCESSFUL");
        log.info("=================================================");
        log.info("Divisions: {}", structure.getDivisions().size());
        log.info("Sections: {}", structure.getSections().size());
        log.info("Paragraphs: {}", structure.getParagraphs().size());
        log.info("COPY References: {}", structure.getCopyReferences().size());
        log.info("Paragraphs with PERFORM/CALL: {}", structure.getDependencies().size());
        log.info("Paragraphs with File Operations: {}", structure.getResourceOperations().size());
        log.info("External Programs Called: {}", structure.externalCallTargets().size());
        log.info("Structure Written To: {}", v.getOutputPath());

        if (diagnostics.hasWarnings()) {
            log.info("");
            log.info("Warnings:");
            diagnostics.getWarnings().forEach(w -> log.warn("  {}", w));
        }

        if (docs != null) {
            log.info("");
            log.info("Documentation Summary:");
            log.info("  Pages Written: {}", docs.getParagraphsDocumented());
            log.info("  Summary Failures: {}", docs.getSummariesFailed());
            log.info("  Index: {}", docs.getIndexFile());
            docs.getErrors().forEach(e -> log.error("  {}", e));
        }

        log.info("=================================================");
    }

    public void printValidationErrors(OptionsValidationException e) {
        log.error("Invalid options:");
        e.getErrors().forEach(error -> log.error("  - {}", error));
    }
}
