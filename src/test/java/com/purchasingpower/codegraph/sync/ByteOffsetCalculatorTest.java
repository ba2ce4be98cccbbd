package com.purchasingpower.codegraph.sync;

import com.purchasingpower.codegraph.model.graph.SourcePosition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ByteOffsetCalculator Tests")
class ByteOffsetCalculatorTest {

    @Test
    @DisplayName("Should count earlier lines plus their terminators")
    void offset_ShouldSumPreviousLines() {
        // Given
        ByteOffsetCalculator calculator = ByteOffsetCalculator.of("ab\ncde\nf");

        // Then
        assertThat(calculator.offset(1, 1)).isZero();
        assertThat(calculator.offset(2, 1)).isEqualTo(3);
        assertThat(calculator.offset(2, 3)).isEqualTo(5);
        assertThat(calculator.offset(3, 1)).isEqualTo(7);
        assertThat(calculator.lineCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should measure multi-byte characters in UTF-8 bytes")
    void offset_ShouldCountUtf8Bytes() {
        // Given - 'é' is two bytes, '€' three
        String content = "é€x\nnext";
        ByteOffsetCalculator calculator = ByteOffsetCalculator.of(content);

        // Then
        assertThat(calculator.offset(1, 3)).isEqualTo(5);
        assertThat(calculator.offset(1, 4)).isEqualTo(6);
        assertThat(calculator.offset(2, 1)).isEqualTo(7);
    }

    @Test
    @DisplayName("Should return unknown for positions outside the text")
    void offset_ShouldRejectOutOfRange() {
        ByteOffsetCalculator calculator = ByteOffsetCalculator.of("abc");

        assertThat(calculator.offset(0, 1)).isEqualTo(SourcePosition.UNKNOWN);
        assertThat(calculator.offset(2, 1)).isEqualTo(SourcePosition.UNKNOWN);
        assertThat(calculator.offset(1, 6)).isEqualTo(SourcePosition.UNKNOWN);
        assertThat(calculator.offset(1, 4)).isEqualTo(3);
    }

    @Test
    @DisplayName("Should fill both byte offsets of a position")
    void position_ShouldCarryStartAndEndBytes() {
        ByteOffsetCalculator calculator = ByteOffsetCalculator.of("class A {}\n");

        SourcePosition position = calculator.position(1, 7, 1, 8);

        assertThat(position.startByte()).isEqualTo(6);
        assertThat(position.endByte()).isEqualTo(7);
    }

    @Test
    @DisplayName("Should know no offsets when the file cannot be read")
    void forFile_ShouldDegradeForMissingFile(@TempDir Path dir) {
        ByteOffsetCalculator calculator = ByteOffsetCalculator.forFile(dir.resolve("missing.java"));

        assertThat(calculator.offset(1, 1)).isEqualTo(SourcePosition.UNKNOWN);
        assertThat(calculator.lineCount()).isZero();
        assertThat(calculator.line(1)).isEmpty();
    }
}
