package com.mainframe.analyzer.scanner;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.mainframe.analyzer.util.CobolNamingUtil;

/**
 * Collects COPY targets from every line of the buffer, inside or outside any division.
 */
public class CopyReferenceExtractor {
    private static final Logger log = LoggerFactory.getLogger(CopyReferenceExtractor.class);

    static final Pattern COPY_PATTERN = Pattern.compile(
            "(?<![\\w-])COPY\\s+(\\w[\\w-]*)",
            Pattern.CASE_INSENSITIVE
    );

    public List<String> extract(SourceBuffer buffer) {
        List<String> copybooks = new ArrayList<>();

        for (String line : buffer.lines()) {
            Matcher matcher = COPY_PATTERN.matcher(line);
            while (matcher.find()) {
                copybooks.add(CobolNamingUtil.normalizeName(matcher.group(1)));
            }
        }

        log.debug("Found {} COPY reference(s)", copybooks.size());
        return List.copyOf(copybooks);
    }
}
