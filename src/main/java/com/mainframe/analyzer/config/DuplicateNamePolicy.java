package com.mainframe.analyzer.config;

/**
 * What to do when a division or paragraph name is declared more than once.
 */
public enum DuplicateNamePolicy {
    /**
     * Keep only the last body; earlier bodies are lost.
     */
    LAST_WINS,

    /**
     * Keep the last body in the primary maps and every body in the occurrence maps.
     * Dependency and file operation extraction covers every body.
     */
    COLLECT_ALL
}
