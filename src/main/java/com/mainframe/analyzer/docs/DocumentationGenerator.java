package com.mainframe.analyzer.docs;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.util.CobolNamingUtil;
import com.mainframe.analyzer.util.FileWriteUtil;

/**
 * Writes one Markdown page per paragraph plus a README.md index.
 *
 * Each page combines the paragraph's text, its edges and file operations with
 * prose from a {@link ParagraphSummarizer}. A failed summary is recorded in the
 * result and the page is still written.
 */
public class DocumentationGenerator {
    private static final Logger log = LoggerFactory.getLogger(DocumentationGenerator.class);

    static final String INDEX_FILE = "README.md";

    private final ParagraphSummarizer summarizer;
    private final DocumentationRenderer renderer;

    public DocumentationGenerator(ParagraphSummarizer summarizer, DocumentationRenderer renderer) {
        this.summarizer = Objects.requireNonNull(summarizer, "summarizer");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    /**
     * @param structure scanned program
     * @param outputDir directory receiving the pages, created if missing
     * @param title heading of the index page
     * @throws IOException if a page cannot be rendered or written
     */
    public DocumentationResult generate(ProgramStructure structure, Path outputDir, String title) throws IOException {
        Objects.requireNonNull(structure, "structure");
        Objects.requireNonNull(outputDir, "outputDir");

        FileWriteUtil.ensureDirectory(outputDir);
        log.info("Generating documentation for {} paragraph(s) into {}", structure.getParagraphs().size(), outputDir);

        DocumentationResult.DocumentationResultBuilder result = DocumentationResult.builder().outputDir(outputDir);
        List<ParagraphDocument> documents = new ArrayList<>();
        // Compared lowercased so pages stay distinct on case-insensitive file systems
        Set<String> usedFileNames = new HashSet<>();
        usedFileNames.add(INDEX_FILE.toLowerCase(Locale.ROOT));
        int failed = 0;

        for (Map.Entry<String, String> paragraph : structure.getParagraphs().entrySet()) {
            String name = paragraph.getKey();
            String code = paragraph.getValue();

            String summary = null;
            try {
                summary = summarizer.summarize(name, code);
            } catch (SummarizationException e) {
                failed++;
                result.error("Summary failed for " + name + ": " + e.getMessage());
                log.error("Summary failed for paragraph {}", name, e);
            }

            ParagraphDocument document = ParagraphDocument.builder()
                    .name(name)
                    .section(structure.sectionOf(name).orElse(null))
                    .code(code)
                    .summary(summary)
                    .fileName(pageFileName(name, usedFileNames))
                    .dependencies(structure.dependenciesOf(name))
                    .operations(structure.resourceOperationsOf(name))
                    .build();
            documents.add(document);

            Path page = outputDir.resolve(document.getFileName());
            FileWriteUtil.safeWriteString(page, renderer.renderParagraph(document));
            result.writtenFile(page);
            log.debug("Wrote {}", page);
        }

        Path index = outputDir.resolve(INDEX_FILE);
        FileWriteUtil.safeWriteString(index, renderer.renderIndex(title, documents, structure.getCopyReferences()));
        result.writtenFile(index);

        log.info("Documented {} paragraph(s), {} summary failure(s)", documents.size(), failed);

        return result
                .indexFile(index)
                .paragraphsDocumented(documents.size())
                .summariesFailed(failed)
                .build();
    }

    /**
     * Markdown file name for a paragraph page. A stem already taken (by the
     * index or an earlier page) gets a numeric suffix.
     */
    static String pageFileName(String paragraph, Set<String> usedFileNames) {
        String stem = CobolNamingUtil.toFileStem(paragraph);
        String fileName = stem + ".md";
        for (int n = 2; !usedFileNames.add(fileName.toLowerCase(Locale.ROOT)); n++) {
            fileName = stem + "-" + n + ".md";
        }
        return fileName;
    }
}
