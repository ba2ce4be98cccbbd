package com.purchasingpower.codegraph.extraction.javaparser;

import com.github.javaparser.JavaToken;
import com.github.javaparser.Range;
import com.github.javaparser.TokenRange;
import com.github.javaparser.ast.Node;
import com.purchasingpower.codegraph.model.graph.SourcePosition;
import com.purchasingpower.codegraph.sync.ByteOffsetCalculator;

import java.nio.charset.StandardCharsets;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Byte offsets of parser tokens, accumulated from the token text of the whole
 * compilation unit. Nodes without token information fall back to the line
 * table.
 */
final class TokenOffsets {

    private final Map<JavaToken, Integer> starts = new IdentityHashMap<>();
    private final ByteOffsetCalculator fallback;

    private TokenOffsets(ByteOffsetCalculator fallback) {
        this.fallback = fallback;
    }

    static TokenOffsets index(Node root, ByteOffsetCalculator fallback) {
        TokenOffsets offsets = new TokenOffsets(fallback);
        root.getTokenRange().ifPresent(tokens -> offsets.accumulate(tokens));
        return offsets;
    }

    private void accumulate(TokenRange tokens) {
        int offset = -1;
        for (JavaToken token : tokens) {
            if (offset < 0) {
                offset = token.getRange()
                        .map(range -> fallback.offset(range.begin.line, range.begin.column))
                        .orElse(SourcePosition.UNKNOWN);
                if (offset < 0) {
                    return;
                }
            }
            starts.put(token, offset);
            offset += utf8Length(token.getText());
        }
    }

    /**
     * Span of a node; the parser's inclusive end column becomes exclusive.
     */
    SourcePosition position(Node node) {
        Range range = node.getRange().orElse(null);
        if (range == null) {
            return new SourcePosition(0, 0, 0, 0, SourcePosition.UNKNOWN, SourcePosition.UNKNOWN);
        }
        int startByte = SourcePosition.UNKNOWN;
        int endByte = SourcePosition.UNKNOWN;
        TokenRange tokens = node.getTokenRange().orElse(null);
        if (tokens != null) {
            Integer begin = starts.get(tokens.getBegin());
            Integer end = starts.get(tokens.getEnd());
            if (begin != null && end != null) {
                startByte = begin;
                endByte = end + utf8Length(tokens.getEnd().getText());
            }
        }
        if (startByte == SourcePosition.UNKNOWN) {
            startByte = fallback.offset(range.begin.line, range.begin.column);
            endByte = fallback.offset(range.end.line, range.end.column + 1);
        }
        return new SourcePosition(range.begin.line, range.begin.column, range.end.line, range.end.column + 1,
                startByte, endByte);
    }

    private static int utf8Length(String text) {
        return text.getBytes(StandardCharsets.UTF_8).length;
    }
}
