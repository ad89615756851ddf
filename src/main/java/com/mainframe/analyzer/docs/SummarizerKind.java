package com.mainframe.analyzer.docs;

/**
 * Available {@link ParagraphSummarizer} implementations.
 */
public enum SummarizerKind {
    /**
     * Offline prose built from the paragraph's own statements.
     */
    STRUCTURAL,

    /**
     * Azure OpenAI chat completions.
     */
    AZURE_OPENAI
}
