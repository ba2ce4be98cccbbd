package com.purchasingpower.codegraph.model.graph;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;

/**
 * A walked source file with the properties persisted on its File node.
 */
@Data
@Builder
public class SourceFile {

    /** Project-relative path with {@code /} separators, the File merge key together with the service. */
    private String path;
    private Path absolutePath;
    private String language;
    private String hash;
    private int lineCount;
    private long size;
}
