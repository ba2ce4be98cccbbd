package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.model.graph.SourcePosition;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Translates 1-based line/column positions into 0-based UTF-8 byte offsets by
 * summing line lengths plus their terminator.
 *
 * <p>Returns {@link SourcePosition#UNKNOWN} for positions outside the text.
 */
public final class ByteOffsetCalculator {

    private static final ByteOffsetCalculator UNAVAILABLE = new ByteOffsetCalculator(null, null);

    private final String[] lines;
    private final int[] lineStarts;

    private ByteOffsetCalculator(String[] lines, int[] lineStarts) {
        this.lines = lines;
        this.lineStarts = lineStarts;
    }

    public static ByteOffsetCalculator of(String content) {
        String[] lines = content.split("\n", -1);
        int[] starts = new int[lines.length];
        int offset = 0;
        for (int i = 0; i < lines.length; i++) {
            starts[i] = offset;
            offset += lines[i].getBytes(StandardCharsets.UTF_8).length + 1;
        }
        return new ByteOffsetCalculator(lines, starts);
    }

    /**
     * Reads the file once; an unreadable file yields a calculator that knows no offsets.
     */
    public static ByteOffsetCalculator forFile(Path file) {
        try {
            return of(Files.readString(file, StandardCharsets.UTF_8));
        } catch (IOException | RuntimeException e) {
            return UNAVAILABLE;
        }
    }

    public static ByteOffsetCalculator unavailable() {
        return UNAVAILABLE;
    }

    /**
     * @param line   1-based line
     * @param column 1-based column in characters; {@code length + 1} addresses the end of the line
     * @return 0-based byte offset or {@link SourcePosition#UNKNOWN}
     */
    public int offset(int line, int column) {
        if (lines == null || line < 1 || line > lines.length || column < 1) {
            return SourcePosition.UNKNOWN;
        }
        String text = lines[line - 1];
        if (column - 1 > text.length()) {
            return SourcePosition.UNKNOWN;
        }
        return lineStarts[line - 1] + text.substring(0, column - 1).getBytes(StandardCharsets.UTF_8).length;
    }

    /**
     * Position with byte offsets filled in; {@code endColumn} is exclusive.
     */
    public SourcePosition position(int startLine, int startColumn, int endLine, int endColumnExclusive) {
        return new SourcePosition(startLine, startColumn, endLine, endColumnExclusive,
                offset(startLine, startColumn), offset(endLine, endColumnExclusive));
    }

    public int lineCount() {
        return lines == null ? 0 : lines.length;
    }

    /**
     * Text of a 1-based line, or an empty string when out of range.
     */
    public String line(int line) {
        if (lines == null || line < 1 || line > lines.length) {
            return "";
        }
        return lines[line - 1];
    }
}
