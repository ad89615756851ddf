package com.mainframe.analyzer.scanner;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.config.DuplicateNamePolicy;
import com.mainframe.analyzer.config.ScannerConfig;
import com.mainframe.analyzer.model.HierarchyFragment;
import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.model.ScanDiagnostics;

/**
 * Scans COBOL source text into a {@link ProgramStructure}.
 *
 * <p>Runs five independent passes over the same line buffer: divisions,
 * sections/paragraphs, COPY references, PERFORM/CALL edges and file
 * operations. The last two only read paragraph bodies produced by the
 * second pass. Every pass returns its own immutable fragment.
 *
 * <p>The scanner holds no state between calls and can be shared.
 */
public class StructuralScanner {
    private static final Logger log = LoggerFactory.getLogger(StructuralScanner.class);

    private final ScannerConfig config;
    private final DivisionSegmenter divisionSegmenter;
    private final HierarchySegmenter hierarchySegmenter;
    private final CopyReferenceExtractor copyReferenceExtractor;
    private final InvocationGraphExtractor invocationGraphExtractor;
    private final ResourceOperationExtractor resourceOperationExtractor;

    public StructuralScanner() {
        this(ScannerConfig.defaults());
    }

    public StructuralScanner(ScannerConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.divisionSegmenter = new DivisionSegmenter();
        this.hierarchySegmenter = new HierarchySegmenter();
        this.copyReferenceExtractor = new CopyReferenceExtractor();
        this.invocationGraphExtractor = new InvocationGraphExtractor(config.getEdgeOrdering());
        this.resourceOperationExtractor = new ResourceOperationExtractor();
    }

    public ProgramStructure scan(String source) {
        return scan(source, new ScanDiagnostics());
    }

    /**
     * Scan source text. Never fails: text without any recognisable structure
     * yields an empty model.
     */
    public ProgramStructure scan(String source, ScanDiagnostics diagnostics) {
        Objects.requireNonNull(diagnostics, "diagnostics");
        return scan(SourceBuffer.of(source), diagnostics);
    }

    public ProgramStructure scan(SourceBuffer buffer, ScanDiagnostics diagnostics) {
        Objects.requireNonNull(buffer, "buffer");
        Objects.requireNonNull(diagnostics, "diagnostics");

        if (buffer.isEmpty()) {
            diagnostics.getInfos().add("Source is empty");
            return ProgramStructure.empty();
        }

        Map<String, List<String>> divisionBodies = divisionSegmenter.segment(buffer);
        HierarchyFragment hierarchy = hierarchySegmenter.segment(buffer);
        List<String> copyReferences = copyReferenceExtractor.extract(buffer);

        boolean collectAll = config.getDuplicateNamePolicy() == DuplicateNamePolicy.COLLECT_ALL;
        if (config.isReportDuplicates()) {
            reportDuplicates("division", divisionBodies, collectAll, diagnostics);
            reportDuplicates("paragraph", hierarchy.getParagraphBodies(), collectAll, diagnostics);
        }

        Map<String, List<String>> scannedBodies = collectAll
                ? hierarchy.getParagraphBodies()
                : lastBodies(hierarchy.getParagraphBodies());

        ProgramStructure structure = ProgramStructure.builder()
                .divisions(lastBody(divisionBodies))
                .sections(hierarchy.getSections())
                .paragraphs(lastBody(hierarchy.getParagraphBodies()))
                .copyReferences(copyReferences)
                .dependencies(invocationGraphExtractor.extract(scannedBodies))
                .resourceOperations(resourceOperationExtractor.extract(scannedBodies))
                .divisionOccurrences(collectAll ? divisionBodies : Map.of())
                .paragraphOccurrences(collectAll ? hierarchy.getParagraphBodies() : Map.of())
                .build();

        log.debug("Scanned {} line(s): {} division(s), {} section(s), {} paragraph(s), {} COPY reference(s)",
                buffer.size(), structure.getDivisions().size(), structure.getSections().size(),
                structure.getParagraphs().size(), structure.getCopyReferences().size());

        return structure;
    }

    private static void reportDuplicates(String kind, Map<String, List<String>> bodies, boolean collectAll,
                                         ScanDiagnostics diagnostics) {
        bodies.forEach((name, occurrences) -> {
            if (occurrences.size() > 1) {
                String msg = "Duplicate " + kind + " name " + name + " declared " + occurrences.size() + " times; "
                        + (collectAll ? "all bodies are kept as occurrences" : "only the last body is kept");
                diagnostics.getWarnings().add(msg);
                log.warn(msg);
            }
        });
    }

    private static Map<String, String> lastBody(Map<String, List<String>> bodies) {
        Map<String, String> result = new LinkedHashMap<>();
        bodies.forEach((name, occurrences) -> result.put(name, occurrences.get(occurrences.size() - 1)));
        return Collections.unmodifiableMap(result);
    }

    private static Map<String, List<String>> lastBodies(Map<String, List<String>> bodies) {
        Map<String, List<String>> result = new LinkedHashMap<>();
        bodies.forEach((name, occurrences) -> result.put(name, List.of(occurrences.get(occurrences.size() - 1))));
        return Collections.unmodifiableMap(result);
    }
}
