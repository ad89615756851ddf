package com.mainframe.analyzer.cli;

import java.nio.charset.CharacterCodingException;
import java.nio.file.Files;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.cli.exception.OptionsValidationException;
import com.mainframe.analyzer.cli.model.ScanOptions;
import com.mainframe.analyzer.cli.model.ValidatedScanOptions;
import com.mainframe.analyzer.cli.output.ScanResultsPrinter;
import com.mainframe.analyzer.cli.validation.ScanOptionsValidator;
import com.mainframe.analyzer.docs.AzureOpenAiParagraphSummarizer;
import com.mainframe.analyzer.docs.DocumentationGenerator;
import com.mainframe.analyzer.docs.DocumentationRenderer;
import com.mainframe.analyzer.docs.DocumentationResult;
import com.mainframe.analyzer.docs.ParagraphSummarizer;
import com.mainframe.analyzer.docs.StructuralParagraphSummarizer;
import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.model.ScanDiagnostics;
import com.mainframe.analyzer.output.ProgramStructureJsonWriter;
import com.mainframe.analyzer.scanner.StructuralScanner;
import com.mainframe.analyzer.util.CobolNamingUtil;

import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that scans one COBOL source file, writes its structure as JSON
 * and optionally documents every paragraph.
 */
@Command(
        name = "scan",
        mixinStandardHelpOptions = true,
        version = "cobol-structure-analyzer 1.0.0",
        description = "Extracts divisions, sections, paragraphs, COPY references, PERFORM/CALL edges and file operations from a COBOL program."
)
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    @Mixin
    private ScanOptions options;

    private final ScanOptionsValidator validator = new ScanOptionsValidator();
    private final ScanResultsPrinter printer = new ScanResultsPrinter();

    @Override
    public Integer call() {
        try {
            ValidatedScanOptions validated = validator.validate(options);
            printer.printBanner(options, validated);

            String source = Files.readString(validated.getSourcePath(), validated.getCharset());

            ScanDiagnostics diagnostics = new ScanDiagnostics();
            ProgramStructure structure = new StructuralScanner(validated.getScannerConfig()).scan(source, diagnostics);

            new ProgramStructureJsonWriter().write(structure, validated.getOutputPath());

            DocumentationResult docs = null;
            if (validated.getDocsDir() != null) {
                DocumentationRenderer renderer = new DocumentationRenderer();
                DocumentationGenerator generator = new DocumentationGenerator(createSummarizer(validated, renderer), renderer);
                String title = CobolNamingUtil.stripExtension(validated.getSourcePath().getFileName().toString());
                docs = generator.generate(structure, validated.getDocsDir(), title);
            }

            printer.printSuccess(validated, structure, diagnostics, docs);
            return 0;

        } catch (OptionsValidationException e) {
            printer.printValidationErrors(e);
            return 1;
        } catch (CharacterCodingException e) {
            log.error("Source file is not valid {} text; pass its encoding with --charset (for example --charset IBM037)",
                    options.getCharset());
            log.debug("Decoding failure", e);
            return 1;
        } catch (Exception e) {
            log.error("Scan failed with exception", e);
            return 1;
        }
    }

    private ParagraphSummarizer createSummarizer(ValidatedScanOptions validated, DocumentationRenderer renderer) {
        if (validated.getSummarizerConfig() != null) {
            return new AzureOpenAiParagraphSummarizer(validated.getSummarizerConfig(), renderer);
        }
        return new StructuralParagraphSummarizer();
    }
}
