package com.mainframe.analyzer.scanner;

import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;

/**
 * Immutable line view of one program's source text.
 *
 * Lines split on LF, CRLF or CR. A trailing terminator does not produce an
 * extra empty line, and empty text has no lines at all.
 */
@EqualsAndHashCode
@ToString
public final class SourceBuffer {

    private final List<String> lines;

    private SourceBuffer(List<String> lines) {
        this.lines = lines;
    }

    public static SourceBuffer of(String text) {
        if (text == null || text.isEmpty()) {
            return new SourceBuffer(List.of());
        }
        return new SourceBuffer(text.lines().toList());
    }

    public static SourceBuffer ofLines(@NonNull List<String> lines) {
        return new SourceBuffer(List.copyOf(lines));
    }

    public List<String> lines() {
        return lines;
    }

    public int size() {
        return lines.size();
    }

    public boolean isEmpty() {
        return lines.isEmpty();
    }
}
