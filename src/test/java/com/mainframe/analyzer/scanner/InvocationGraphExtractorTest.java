package com.mainframe.analyzer.scanner;

import com.mainframe.analyzer.config.EdgeOrdering;
import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.EdgeKind;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class InvocationGraphExtractorTest {

    private static final String MIXED_BODY = """
            PARA-A.
                PERFORM STEP-ONE
                CALL 'EXT-PROG'
                PERFORM STEP-TWO.
            """;

    @Test
    void testPatternClassOrderGroupsPerformsBeforeCalls() {
        List<DependencyEdge> edges = new InvocationGraphExtractor().extractEdges(MIXED_BODY);

        assertThat(edges).containsExactly(
                DependencyEdge.invoke("STEP-ONE"),
                DependencyEdge.invoke("STEP-TWO"),
                DependencyEdge.externalCall("EXT-PROG"));
    }

    @Test
    void testDocumentOrderInterleavesByPosition() {
        List<DependencyEdge> edges = new InvocationGraphExtractor(EdgeOrdering.DOCUMENT_ORDER).extractEdges(MIXED_BODY);

        assertThat(edges).containsExactly(
                DependencyEdge.invoke("STEP-ONE"),
                DependencyEdge.externalCall("EXT-PROG"),
                DependencyEdge.invoke("STEP-TWO"));
    }

    @Test
    void testCallTargetHasQuotesStripped() {
        InvocationGraphExtractor extractor = new InvocationGraphExtractor();

        assertThat(extractor.extractEdges("CALL 'EXTERNAL-MOD' USING WS-AREA"))
                .containsExactly(DependencyEdge.externalCall("EXTERNAL-MOD"));
        assertThat(extractor.extractEdges("CALL \"DATEUTIL\""))
                .containsExactly(DependencyEdge.externalCall("DATEUTIL"));
        assertThat(extractor.extractEdges("CALL WS-DYNAMIC-PGM"))
                .containsExactly(DependencyEdge.externalCall("WS-DYNAMIC-PGM"));
    }

    @Test
    void testKeywordsAndTargetsAreCaseInsensitive() {
        List<DependencyEdge> edges = new InvocationGraphExtractor().extractEdges("perform read-next\ncall 'sub1'");

        assertThat(edges).extracting(DependencyEdge::getKind)
                .containsExactly(EdgeKind.INVOKE, EdgeKind.EXTERNAL_CALL);
        assertThat(edges).extracting(DependencyEdge::getTarget)
                .containsExactly("READ-NEXT", "SUB1");
    }

    @Test
    void testKeywordMustStandAlone() {
        List<DependencyEdge> edges = new InvocationGraphExtractor()
                .extractEdges("MOVE PERFORMANCE-CODE TO X\nMOVE RECALL-FLAG TO Y");

        assertThat(edges).isEmpty();
    }

    @Test
    void testScopeTerminatorsDoNotStartEdges() {
        List<DependencyEdge> edges = new InvocationGraphExtractor().extractEdges("""
                PERFORM 2000-LOOP UNTIL WS-EOF = 'Y'
                    READ IN-FILE
                    END-READ
                END-PERFORM
                CALL 'SUB1'
                END-CALL
                DISPLAY 'DONE'.
                """);

        assertThat(edges).containsExactly(
                DependencyEdge.invoke("2000-LOOP"),
                DependencyEdge.externalCall("SUB1"));
    }

    @Test
    void testHyphenatedNamesEndingInKeywordAreIgnored() {
        assertThat(new InvocationGraphExtractor()
                .extractEdges("MOVE WS-PERFORM TO X\nMOVE LAST-CALL TO Y")).isEmpty();
    }

    @Test
    void testParagraphsWithoutEdgesAreAbsent() {
        Map<String, List<String>> bodies = new LinkedHashMap<>();
        bodies.put("A", List.of("A.\n    PERFORM B."));
        bodies.put("B", List.of("B.\n    DISPLAY 'B'."));
        bodies.put("C", List.of("C."));

        Map<String, List<DependencyEdge>> dependencies = new InvocationGraphExtractor().extract(bodies);

        assertThat(dependencies).containsOnlyKeys("A");
        assertThat(dependencies.get("A")).containsExactly(DependencyEdge.invoke("B"));
    }

    @Test
    void testEdgesFromSeveralBodiesAreConcatenated() {
        Map<String, List<DependencyEdge>> dependencies = new InvocationGraphExtractor()
                .extract(Map.of("A", List.of("PERFORM X", "CALL 'Y'")));

        assertThat(dependencies.get("A"))
                .containsExactly(DependencyEdge.invoke("X"), DependencyEdge.externalCall("Y"));
    }

    @Test
    void testEmptyBodyYieldsNoEdges() {
        assertThat(new InvocationGraphExtractor().extractEdges("")).isEmpty();
        assertThat(new InvocationGraphExtractor().extractEdges(null)).isEmpty();
    }
}
