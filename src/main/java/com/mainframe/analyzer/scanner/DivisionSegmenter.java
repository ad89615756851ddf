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

import com.mainframe.analyzer.util.CobolNamingUtil;

/**
 * Splits source lines into divisions.
 *
 * A division runs from its "name DIVISION." line up to the next such line or
 * the end of the buffer. Anything before the first boundary belongs to no
 * division.
 */
public class DivisionSegmenter {
    private static final Logger log = LoggerFactory.getLogger(DivisionSegmenter.class);

    static final Pattern DIVISION_PATTERN = Pattern.compile(
            "^\\s*(\\w+)\\s+DIVISION\\.",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * Returns every division body per name, in source order. Repeated names keep
     * their first map position and append further bodies.
     */
    public Map<String, List<String>> segment(SourceBuffer buffer) {
        Map<String, List<String>> divisions = new LinkedHashMap<>();
        String currentDivision = null;
        List<String> lines = new ArrayList<>();

        for (String line : buffer.lines()) {
            Matcher matcher = DIVISION_PATTERN.matcher(line);
            if (matcher.lookingAt()) {
                if (currentDivision != null) {
                    flush(divisions, currentDivision, lines);
                }
                currentDivision = CobolNamingUtil.normalizeName(matcher.group(1));
                lines = new ArrayList<>();
                lines.add(line);
            } else if (currentDivision != null) {
                lines.add(line);
            }
        }

        if (currentDivision != null) {
            flush(divisions, currentDivision, lines);
        }

        log.debug("Segmented {} division(s) from {} line(s)", divisions.size(), buffer.size());
        Map<String, List<String>> frozen = new LinkedHashMap<>();
        divisions.forEach((name, bodies) -> frozen.put(name, List.copyOf(bodies)));
        return Collections.unmodifiableMap(frozen);
    }

    private static void flush(Map<String, List<String>> divisions, String name, List<String> lines) {
        divisions.computeIfAbsent(name, k -> new ArrayList<>()).add(String.join("\n", lines));
    }
}
