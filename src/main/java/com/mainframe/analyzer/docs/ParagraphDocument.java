package com.mainframe.analyzer.docs;

import java.util.List;

import com.mainframe.analyzer.model.DependencyEdge;
import com.mainframe.analyzer.model.ResourceOperation;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Everything rendered into one paragraph's Markdown page.
 */
@Value
@Builder
public class ParagraphDocument {

    @NonNull
    String name;

    /**
     * Owning section, or null for paragraphs outside any section.
     */
    String section;

    @NonNull
    String code;

    /**
     * Generated prose, or null when the summarizer failed.
     */
    String summary;

    @NonNull
    String fileName;

    @NonNull
    @Builder.Default
    List<DependencyEdge> dependencies = List.of();

    @NonNull
    @Builder.Default
    List<ResourceOperation> operations = List.of();

    public boolean isSummaryAvailable() {
        return summary != null;
    }
}
