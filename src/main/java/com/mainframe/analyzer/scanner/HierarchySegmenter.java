package com.mainframe.analyzer.scanner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.model.HierarchyFragment;
import com.mainframe.analyzer.util.CobolNamingUtil;

/**
 * Splits source lines into sections and paragraphs in one forward pass.
 *
 * <p>A paragraph header is a line holding nothing but "name." and the header
 * line is the first line of the paragraph's body. A section header ("name
 * SECTION.") ends the open paragraph without being part of it; lines between a
 * section header and the next paragraph header belong to no paragraph.
 *
 * <p>The section check runs first, so "MAIN SECTION." is never a paragraph.
 */
public class HierarchySegmenter {
    private static final Logger log = LoggerFactory.getLogger(HierarchySegmenter.class);

    static final Pattern SECTION_PATTERN = Pattern.compile(
            "^\\s*(\\w[\\w-]*)\\s+SECTION\\.",
            Pattern.CASE_INSENSITIVE
    );

    static final Pattern PARAGRAPH_PATTERN = Pattern.compile(
            "^\\s*(\\w[\\w-]*)\\.\\s*$",
            Pattern.CASE_INSENSITIVE
    );

    public HierarchyFragment segment(SourceBuffer buffer) {
        Map<String, List<String>> sections = new LinkedHashMap<>();
        Map<String, List<String>> paragraphs = new LinkedHashMap<>();

        String currentSection = null;
        // Paragraph that still receives lines
        String currentParagraph = null;
        // Paragraph whose buffered lines have not been stored yet
        String pendingParagraph = null;
        List<String> lines = new ArrayList<>();

        for (String line : buffer.lines()) {
            Matcher sectionMatcher = SECTION_PATTERN.matcher(line);
            Matcher paragraphMatcher = PARAGRAPH_PATTERN.matcher(line);

            if (sectionMatcher.lookingAt()) {
                currentSection = CobolNamingUtil.normalizeName(sectionMatcher.group(1));
                sections.put(currentSection, new ArrayList<>());
                currentParagraph = null;
            } else if (paragraphMatcher.matches()) {
                if (pendingParagraph != null) {
                    flush(paragraphs, pendingParagraph, lines);
                    lines = new ArrayList<>();
                }

                currentParagraph = CobolNamingUtil.normalizeName(paragraphMatcher.group(1));
                pendingParagraph = currentParagraph;
                paragraphs.computeIfAbsent(currentParagraph, k -> new ArrayList<>());
                if (currentSection != null) {
                    sections.get(currentSection).add(currentParagraph);
                }
            }

            if (currentParagraph != null) {
                lines.add(line);
            }
        }

        if (pendingParagraph != null) {
            flush(paragraphs, pendingParagraph, lines);
        }

        log.debug("Segmented {} section(s) and {} paragraph(s)", sections.size(), paragraphs.size());
        return HierarchyFragment.of(sections, paragraphs);
    }

    private static void flush(Map<String, List<String>> paragraphs, String name, List<String> lines) {
        paragraphs.get(name).add(String.join("\n", lines));
    }
}
