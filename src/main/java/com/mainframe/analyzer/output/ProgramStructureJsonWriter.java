package com.mainframe.analyzer.output;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.ProgramStructure;
import com.mainframe.analyzer.model.ResourceOperation;
import com.mainframe.analyzer.util.FileWriteUtil;

/**
 * Writes a {@link ProgramStructure} as a pretty-printed JSON document.
 *
 * Layout:
 * <pre>
 * {
 *   "divisions":       { "PROCEDURE": "..." },
 *   "sections":        { "MAIN": ["PARA-A"] },
 *   "paragraphs":      { "PARA-A": "..." },
 *   "copybooks":       ["CUSTREC"],
 *   "dependencies":    { "PARA-A": [{"type": "PERFORM", "target": "PARA-B"}] },
 *   "file_operations": { "PARA-A": [{"operation": "OPEN", "target": "CUST-FILE"}] }
 * }
 * </pre>
 * {@code division_occurrences} and {@code paragraph_occurrences} are appended
 * only when the model carries them.
 */
public class ProgramStructureJsonWriter {
    private static final Logger log = LoggerFactory.getLogger(ProgramStructureJsonWriter.class);

    private final ObjectMapper objectMapper;

    public ProgramStructureJsonWriter() {
        this(new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT));
    }

    public ProgramStructureJsonWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ObjectNode toTree(ProgramStructure structure) {
        ObjectNode root = objectMapper.createObjectNode();

        ObjectNode divisions = root.putObject("divisions");
        structure.getDivisions().forEach(divisions::put);

        ObjectNode sections = root.putObject("sections");
        structure.getSections().forEach((name, paragraphs) -> putStrings(sections.putArray(name), paragraphs));

        ObjectNode paragraphs = root.putObject("paragraphs");
        structure.getParagraphs().forEach(paragraphs::put);

        putStrings(root.putArray("copybooks"), structure.getCopyReferences());

        ObjectNode dependencies = root.putObject("dependencies");
        structure.getDependencies().forEach((name, edges) -> {
            ArrayNode array = dependencies.putArray(name);
            for (DependencyEdge edge : edges) {
                array.addObject()
                        .put("type", edge.getKind().getKeyword())
                        .put("target", edge.getTarget());
            }
        });

        ObjectNode fileOperations = root.putObject("file_operations");
        structure.getResourceOperations().forEach((name, operations) -> {
            ArrayNode array = fileOperations.putArray(name);
            for (ResourceOperation operation : operations) {
                array.addObject()
                        .put("operation", operation.getOperation().name())
                        .put("target", operation.getTarget());
            }
        });

        if (!structure.getDivisionOccurrences().isEmpty()) {
            putOccurrences(root.putObject("division_occurrences"), structure.getDivisionOccurrences());
        }
        if (!structure.getParagraphOccurrences().isEmpty()) {
            putOccurrences(root.putObject("paragraph_occurrences"), structure.getParagraphOccurrences());
        }

        return root;
    }

    public String toJson(ProgramStructure structure) {
        try {
            return objectMapper.writeValueAsString(toTree(structure));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize program structure", e);
        }
    }

    public void write(ProgramStructure structure, Path target) throws IOException {
        FileWriteUtil.safeWriteString(target, toJson(structure));
        log.info("Wrote program structure to {}", target);
    }

    private static void putStrings(ArrayNode array, List<String> values) {
        values.forEach(array::add);
    }

    private static void putOccurrences(ObjectNode node, Map<String, List<String>> occurrences) {
        occurrences.forEach((name, bodies) -> putStrings(node.putArray(name), bodies));
    }
}
