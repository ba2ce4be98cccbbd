package com.purchasingpower.codegraph.model.graph;

/**
 * Source span of an entity. Lines and columns are 1-based, byte offsets are
 * 0-based. End column and end byte are exclusive; {@value #UNKNOWN} marks an
 * unknown offset.
 */
public record SourcePosition(int startLine, int startColumn, int endLine, int endColumn,
                             int startByte, int endByte) {

    public static final int UNKNOWN = -1;

    public int lineCount() {
        return endLine - startLine + 1;
    }

    public boolean hasByteOffsets() {
        return startByte != UNKNOWN && endByte != UNKNOWN;
    }
}
