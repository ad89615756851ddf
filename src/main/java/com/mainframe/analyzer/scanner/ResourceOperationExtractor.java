package com.mainframe.analyzer.scanner;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.model.OperationKind;
import com.mainframe.analyzer.model.ResourceOperation;
import com.mainframe.analyzer.util.CobolNamingUtil;

/**
 * Finds OPEN/READ/WRITE/CLOSE statements in paragraph bodies.
 *
 * Purely lexical: the token right after the verb is taken as the file name,
 * so "OPEN INPUT CUST-FILE" records INPUT. Verbs glued to a name by a hyphen
 * (END-READ, WS-OPEN) are part of that name.
 */
public class ResourceOperationExtractor {
    private static final Logger log = LoggerFactory.getLogger(ResourceOperationExtractor.class);

    static final Pattern FILE_OPERATION_PATTERN = Pattern.compile(
            "(?<![\\w-])(OPEN|READ|WRITE|CLOSE)\\s+(\\w[\\w-]*)",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * @param paragraphBodies paragraph name to the bodies to scan, in order
     * @return paragraph name to its operations; paragraphs without any are absent
     */
    public Map<String, List<ResourceOperation>> extract(Map<String, List<String>> paragraphBodies) {
        Map<String, List<ResourceOperation>> operations = new LinkedHashMap<>();

        paragraphBodies.forEach((paragraph, bodies) -> {
            List<ResourceOperation> found = new ArrayList<>();
            for (String body : bodies) {
                found.addAll(extractOperations(body));
            }
            if (!found.isEmpty()) {
                operations.put(paragraph, List.copyOf(found));
            }
        });

        log.debug("Extracted file operations for {} paragraph(s)", operations.size());
        return Collections.unmodifiableMap(operations);
    }

    public List<ResourceOperation> extractOperations(String body) {
        if (body == null || body.isEmpty()) {
            return List.of();
        }

        List<ResourceOperation> found = new ArrayList<>();
        Matcher matcher = FILE_OPERATION_PATTERN.matcher(body);
        while (matcher.find()) {
            found.add(ResourceOperation.of(
                    OperationKind.fromKeyword(matcher.group(1)),
                    CobolNamingUtil.normalizeName(matcher.group(2))));
        }
        return found;
    }
}
