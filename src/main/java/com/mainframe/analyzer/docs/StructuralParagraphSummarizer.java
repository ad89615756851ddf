package com.mainframe.analyzer.docs;

import java.util.List;
import java.util.stream.Collectors;

import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.EdgeKind;
import com.mainframe.analyzer.model.ResourceOperation;
import com.mainframe.analyzer.scanner.InvocationGraphExtractor;
import com.mainframe.analyzer.scanner.ResourceOperationExtractor;

/**
 * Offline summarizer that describes a paragraph from its own PERFORM, CALL and
 * file statements. Deterministic and free of network access.
 */
public class StructuralParagraphSummarizer implements ParagraphSummarizer {

    private final InvocationGraphExtractor invocationGraphExtractor = new InvocationGraphExtractor();
    private final ResourceOperationExtractor resourceOperationExtractor = new ResourceOperationExtractor();

    @Override
    public String summarize(String name, String code) {
        String text = code == null ? "" : code;
        List<DependencyEdge> edges = invocationGraphExtractor.extractEdges(text);
        List<ResourceOperation> operations = resourceOperationExtractor.extractOperations(text);

        StringBuilder sb = new StringBuilder();
        long lineCount = text.isEmpty() ? 0 : text.lines().count();
        sb.append("Paragraph ").append(name).append(" spans ").append(lineCount).append(" line(s).");

        String performs = targets(edges, EdgeKind.INVOKE);
        if (!performs.isEmpty()) {
            sb.append(" It performs ").append(performs).append('.');
        }

        String calls = targets(edges, EdgeKind.EXTERNAL_CALL);
        if (!calls.isEmpty()) {
            sb.append(" It calls external program(s) ").append(calls).append('.');
        }

        if (!operations.isEmpty()) {
            sb.append(" File operations: ")
                    .append(operations.stream()
                            .map(op -> op.getOperation() + " " + op.getTarget())
                            .collect(Collectors.joining(", ")))
                    .append('.');
        }

        if (edges.isEmpty() && operations.isEmpty()) {
            sb.append(" It has no PERFORM/CALL references and no file operations.");
        }

        return sb.toString();
    }

    private static String targets(List<DependencyEdge> edges, EdgeKind kind) {
        return edges.stream()
                .filter(e -> e.getKind() == kind)
                .map(DependencyEdge::getTarget)
                .distinct()
                .collect(Collectors.joining(", "));
    }
}
