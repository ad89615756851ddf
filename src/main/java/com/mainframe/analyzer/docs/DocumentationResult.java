package com.mainframe.analyzer.docs;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.Data;
import lombok.Singular;

/**
 * Result of a documentation run.
 */
@Data
@Builder
public class DocumentationResult {
    private Path outputDir;
    private Path indexFile;

    private int paragraphsDocumented;
    private int summariesFailed;

    @Singular
    private List<Path> writtenFiles;

    @Singular
    private List<String> errors;

    public boolean hasErrors() {
        return errors != null && !errors.isEmpty();
    }
}
