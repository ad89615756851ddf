package com.mainframe.analyzer.docs;

/**
 * Turns one paragraph into human-readable prose.
 */
public interface ParagraphSummarizer {

    /**
     * @param name uppercased paragraph name
     * @param code raw paragraph text, header line included
     * @return generated summary text
     * @throws SummarizationException if no summary could be produced
     */
    String summarize(String name, String code);
}
