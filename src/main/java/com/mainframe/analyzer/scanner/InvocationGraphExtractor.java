package com.mainframe.analyzer.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.config.EdgeOrdering;
import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.EdgeKind;
import com.mainframe.analyzer.util.CobolNamingUtil;

import lombok.Value;

/**
 * Builds the PERFORM/CALL edge list of each paragraph from its own body text.
 */
public class InvocationGraphExtractor {
    private static final Logger log = LoggerFactory.getLogger(InvocationGraphExtractor.class);

    // A hyphen joins words into one COBOL name, so END-PERFORM never counts as PERFORM
    static final Pattern PERFORM_PATTERN = Pattern.compile(
            "(?<![\\w-])PERFORM\\s+(\\w[\\w-]*)",
            Pattern.CASE_INSENSITIVE
    );

    // Quotes around the program name are optional and never part of the target
    static final Pattern CALL_PATTERN = Pattern.compile(
            "(?<![\\w-])CALL\\s+['\"]?(\\w[\\w-]*)['\"]?",
            Pattern.CASE_INSENSITIVE
    );

    private final EdgeOrdering ordering;

    public InvocationGraphExtractor() {
        this(EdgeOrdering.PATTERN_CLASS);
    }

    public InvocationGraphExtractor(EdgeOrdering ordering) {
        this.ordering = ordering;
    }

    /**
     * @param paragraphBodies paragraph name to the bodies to scan, in order
     * @return paragraph name to its edges; paragraphs without edges are absent
     */
    public Map<String, List<DependencyEdge>> extract(Map<String, List<String>> paragraphBodies) {
        Map<String, List<DependencyEdge>> dependencies = new LinkedHashMap<>();

        paragraphBodies.forEach((paragraph, bodies) -> {
            List<DependencyEdge> edges = new ArrayList<>();
            for (String body : bodies) {
                edges.addAll(extractEdges(body));
            }
            if (!edges.isEmpty()) {
                dependencies.put(paragraph, List.copyOf(edges));
            }
        });

        log.debug("Extracted edges for {} paragraph(s) using {} ordering", dependencies.size(), ordering);
        return Collections.unmodifiableMap(dependencies);
    }

    /**
     * Edges of a single body in the configured order.
     */
    public List<DependencyEdge> extractEdges(String body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }

        List<PositionedEdge> performs = find(PERFORM_PATTERN, EdgeKind.INVOKE, body);
        List<PositionedEdge> calls = find(CALL_PATTERN, EdgeKind.EXTERNAL_CALL, body);

        List<PositionedEdge> all = new ArrayList<>(performs);
        all.addAll(calls);
        if (ordering == EdgeOrdering.DOCUMENT_ORDER) {
            all.sort(Comparator.comparingInt(PositionedEdge::getPosition));
        }

        return all.stream().map(PositionedEdge::getEdge).toList();
    }

    private static List<PositionedEdge> find(Pattern pattern, EdgeKind kind, String body) {
        List<PositionedEdge> found = new ArrayList<>();
        Matcher matcher = pattern.matcher(body);
        while (matcher.find()) {
            String target = CobolNamingUtil.normalizeName(matcher.group(1));
            found.add(new PositionedEdge(matcher.start(), DependencyEdge.of(kind, target)));
        }
        return found;
    }

    @Value
    private static class PositionedEdge {
        int position;
        DependencyEdge edge;
    }
}
