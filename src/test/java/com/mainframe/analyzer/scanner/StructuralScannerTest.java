package com.mainframe.analyzer.scanner;

import com.mainframe.analyzer.SamplePrograms;
import com.mainframe.analyzer.config.DuplicateNamePolicy;
import com.mainframe.analyzer.config.EdgeOrdering;
import com.mainframe.analyzer.config.ScannerConfig;
import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.OperationKind;
import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.model.ResourceOperation;
import com.mainframe.analyzer.model.ScanDiagnostics;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the composed five-pass scan.
 */
class StructuralScannerTest {

    private static final String DUPLICATE_PARAGRAPHS = """
            A.
                PERFORM X.
            B.
                DISPLAY 'HI'.
            A.
                CALL 'Y'.
            """;

    private final StructuralScanner scanner = new StructuralScanner();

    @Test
    void testScanCustomerReport() {
        ProgramStructure structure = scanner.scan(SamplePrograms.CUSTOMER_REPORT);

        assertThat(structure.getDivisions().keySet())
                .containsExactly("IDENTIFICATION", "ENVIRONMENT", "DATA", "PROCEDURE");
        assertThat(structure.getParagraphs().keySet())
                .containsExactly("0000-MAIN", "1000-INIT", "2000-PROCESS", "9999-EXIT");
        assertThat(structure.getCopyReferences()).containsExactly("CUSTREC");

        assertThat(structure.getDependencies()).containsOnlyKeys("0000-MAIN", "2000-PROCESS");
        assertThat(structure.getDependencies().get("0000-MAIN")).containsExactly(
                DependencyEdge.invoke("1000-INIT"),
                DependencyEdge.invoke("2000-PROCESS"),
                DependencyEdge.externalCall("AUDITLOG"));
        assertThat(structure.getDependencies().get("2000-PROCESS")).containsExactly(
                DependencyEdge.invoke("1000-INIT"),
                DependencyEdge.externalCall("DATEUTIL"));

        assertThat(structure.getResourceOperations()).containsOnlyKeys("1000-INIT", "2000-PROCESS", "9999-EXIT");
        assertThat(structure.getResourceOperations().get("1000-INIT")).containsExactly(
                ResourceOperation.of(OperationKind.OPEN, "INPUT-FILE"),
                ResourceOperation.of(OperationKind.READ, "INPUT-FILE"));
        assertThat(structure.getResourceOperations().get("9999-EXIT"))
                .containsExactly(ResourceOperation.of(OperationKind.CLOSE, "INPUT-FILE"));
    }

    @Test
    void testDivisionSpansRunToNextBoundary() {
        ProgramStructure structure = scanner.scan(SamplePrograms.CUSTOMER_REPORT);

        assertThat(structure.getDivisions().get("DATA"))
                .startsWith("   DATA DIVISION.")
                .contains("COPY CUSTREC.")
                .doesNotContain("PROCEDURE");
        assertThat(structure.getDivisions().get("PROCEDURE"))
                .startsWith("   PROCEDURE DIVISION.")
                .endsWith("CLOSE INPUT-FILE.");
    }

    @Test
    void testThreeLineScenario() {
        ProgramStructure structure = scanner.scan("PROC-A.\n    PERFORM PROC-B.\nPROC-B.");

        assertThat(structure.getParagraphs()).containsOnlyKeys("PROC-A", "PROC-B");
        assertThat(structure.getParagraphs().get("PROC-A")).isEqualTo("PROC-A.\n    PERFORM PROC-B.");
        assertThat(structure.getParagraphs().get("PROC-B")).isEqualTo("PROC-B.");
        assertThat(structure.getDependencies()).containsOnlyKeys("PROC-A");
        assertThat(structure.getDependencies().get("PROC-A")).containsExactly(DependencyEdge.invoke("PROC-B"));
    }

    @Test
    void testPerformAndCallInOneParagraph() {
        ProgramStructure structure = scanner.scan("""
            MAIN-PARA.
                PERFORM FOO-BAR
                DISPLAY 'BETWEEN'
                CALL 'EXTERNAL-MOD'.
            """);

        assertThat(structure.dependenciesOf("MAIN-PARA")).containsExactly(
                DependencyEdge.invoke("FOO-BAR"),
                DependencyEdge.externalCall("EXTERNAL-MOD"));
    }

    @Test
    void testScopeTerminatorsAddNoEdgesOrOperations() {
        ProgramStructure structure = scanner.scan("""
            P1.
                PERFORM UNTIL WS-EOF = 'Y'
                    READ IN-FILE
                    END-READ
                END-PERFORM
                DISPLAY 'DONE'.
            """);

        assertThat(structure.dependenciesOf("P1")).doesNotContain(DependencyEdge.invoke("DISPLAY"));
        assertThat(structure.resourceOperationsOf("P1"))
                .containsExactly(ResourceOperation.of(OperationKind.READ, "IN-FILE"));
    }

    @Test
    void testEmptyInputYieldsEmptyModel() {
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        ProgramStructure structure = scanner.scan("", diagnostics);

        assertThat(structure.isEmpty()).isTrue();
        assertThat(structure.getDivisions()).isEmpty();
        assertThat(structure.getSections()).isEmpty();
        assertThat(structure.getParagraphs()).isEmpty();
        assertThat(structure.getCopyReferences()).isEmpty();
        assertThat(structure.getDependencies()).isEmpty();
        assertThat(structure.getResourceOperations()).isEmpty();
        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testNullInputIsTreatedAsEmpty() {
        assertThat(scanner.scan((String) null)).isEqualTo(ProgramStructure.empty());
    }

    @Test
    void testUnstructuredTextYieldsEmptyModel() {
        ProgramStructure structure = scanner.scan("this is not cobol\nat all");

        assertThat(structure.isEmpty()).isTrue();
    }

    @Test
    void testScanIsIdempotent() {
        ProgramStructure first = scanner.scan(SamplePrograms.CUSTOMER_REPORT);
        ProgramStructure second = scanner.scan(SamplePrograms.CUSTOMER_REPORT);

        assertThat(second).isEqualTo(first);
        assertThat(second).isNotSameAs(first);
    }

    @Test
    void testParagraphWithEmptyBodyHasNoEdgesOrOperations() {
        ProgramStructure structure = scanner.scan("EMPTY-PARA.\nNEXT-PARA.\n    PERFORM EMPTY-PARA.");

        assertThat(structure.getParagraphs()).containsKey("EMPTY-PARA");
        assertThat(structure.dependenciesOf("EMPTY-PARA")).isEmpty();
        assertThat(structure.resourceOperationsOf("EMPTY-PARA")).isEmpty();
        assertThat(structure.getDependencies()).doesNotContainKey("EMPTY-PARA");
    }

    @Test
    void testEdgesComeOnlyFromOwnBody() {
        ProgramStructure structure = scanner.scan("""
            OUTER SECTION.
                PERFORM NOT-OWNED.
            P1.
                DISPLAY 'P1'.
            P2.
                PERFORM P1.
            """);

        assertThat(structure.getDependencies()).containsOnlyKeys("P2");
    }

    @Test
    void testModelIsReadOnly() {
        ProgramStructure structure = scanner.scan(SamplePrograms.CUSTOMER_REPORT);

        assertThatThrownBy(() -> structure.getParagraphs().put("X", "X."))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> structure.getSections().get("MAIN-LOGIC").add("X"))
                .isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> structure.getDependencies().get("0000-MAIN").clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testDuplicateParagraphLastWinsByDefault() {
        ProgramStructure structure = scanner.scan(DUPLICATE_PARAGRAPHS);

        assertThat(structure.getParagraphs().keySet()).containsExactly("A", "B");
        assertThat(structure.getParagraphs().get("A")).isEqualTo("A.\n    CALL 'Y'.");
        assertThat(structure.dependenciesOf("A")).containsExactly(DependencyEdge.externalCall("Y"));
        assertThat(structure.getParagraphOccurrences()).isEmpty();
    }

    @Test
    void testCollectAllKeepsEveryBody() {
        StructuralScanner collecting = new StructuralScanner(ScannerConfig.builder()
                .duplicateNamePolicy(DuplicateNamePolicy.COLLECT_ALL)
                .build());

        ProgramStructure structure = collecting.scan(DUPLICATE_PARAGRAPHS);

        assertThat(structure.getParagraphs().get("A")).isEqualTo("A.\n    CALL 'Y'.");
        assertThat(structure.getParagraphOccurrences().get("A"))
                .containsExactly("A.\n    PERFORM X.", "A.\n    CALL 'Y'.");
        assertThat(structure.getParagraphOccurrences().get("B")).hasSize(1);
        assertThat(structure.dependenciesOf("A"))
                .containsExactly(DependencyEdge.invoke("X"), DependencyEdge.externalCall("Y"));
    }

    @Test
    void testCollectAllKeepsEveryDivisionBody() {
        StructuralScanner collecting = new StructuralScanner(ScannerConfig.builder()
                .duplicateNamePolicy(DuplicateNamePolicy.COLLECT_ALL)
                .build());

        ProgramStructure structure = collecting.scan("DATA DIVISION.\nFIRST\nDATA DIVISION.\nSECOND");

        assertThat(structure.getDivisions().get("DATA")).isEqualTo("DATA DIVISION.\nSECOND");
        assertThat(structure.getDivisionOccurrences().get("DATA"))
                .containsExactly("DATA DIVISION.\nFIRST", "DATA DIVISION.\nSECOND");
    }

    @Test
    void testDuplicatesAreReportedWhenEnabled() {
        StructuralScanner reporting = new StructuralScanner(ScannerConfig.builder()
                .reportDuplicates(true)
                .build());
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        reporting.scan(DUPLICATE_PARAGRAPHS, diagnostics);

        assertThat(diagnostics.getWarnings()).hasSize(1);
        assertThat(diagnostics.getWarnings().get(0)).contains("paragraph").contains(" A ");
    }

    @Test
    void testDuplicatesAreSilentByDefault() {
        ScanDiagnostics diagnostics = new ScanDiagnostics();

        scanner.scan(DUPLICATE_PARAGRAPHS, diagnostics);

        assertThat(diagnostics.hasWarnings()).isFalse();
    }

    @Test
    void testDocumentOrderConfiguration() {
        StructuralScanner ordered = new StructuralScanner(ScannerConfig.builder()
                .edgeOrdering(EdgeOrdering.DOCUMENT_ORDER)
                .build());

        ProgramStructure structure = ordered.scan(SamplePrograms.CUSTOMER_REPORT);

        assertThat(structure.dependenciesOf("2000-PROCESS")).containsExactly(
                DependencyEdge.externalCall("DATEUTIL"),
                DependencyEdge.invoke("1000-INIT"));
    }
}
