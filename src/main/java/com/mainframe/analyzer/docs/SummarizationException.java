package com.mainframe.analyzer.docs;

/**
 * Raised when a summarizer cannot produce text for a paragraph.
 */
public class SummarizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;
    private final String paragraph;

    public SummarizationException(String paragraph, String message) {
        super(message);
        this.paragraph = paragraph;
    }

    public SummarizationException(String paragraph, String message, Throwable cause) {
        super(message, cause);
        this.paragraph = paragraph;
    }

    public String getParagraph() {
        return paragraph;
    }
}
