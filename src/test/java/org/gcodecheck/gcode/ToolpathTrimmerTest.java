package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.TrimOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolpathTrimmerTest {

    private static final String PROGRAM = """
            %
            O1000
            G90 G54 G00 X0 Y0
            G43 H01 Z50.
            G00 Z5.
            G01 Z-1. F200
            T02 M06
            X10.
            G00 Z50.
            G91 G28 Z0.
            M30
            %
            """;

    @Test
    void trim_removesSegmentBelowSafeHeightAndKeepsImportantLines() {
        TrimOutcome outcome = ToolpathTrimmer.trim(PROGRAM);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.COMPLETED);
        assertThat(outcome.startLine()).isEqualTo(5);
        assertThat(outcome.endLine()).isEqualTo(9);
        assertThat(outcome.removedLines()).isEqualTo(3);
        assertThat(outcome.text()).isEqualTo("""
                %
                O1000
                G90 G54 G00 X0 Y0
                G43 H01 Z50.
                T02 M06
                G00 Z50.
                G91 G28 Z0.
                M30
                %
                """);
        assertThat(outcome.message()).isEqualTo("删除完成：第5行起删除，至第9行停止（保留该行）。删除行数=3");
    }

    @Test
    void trim_secondPassFindsNoStart() {
        String once = ToolpathTrimmer.trim(PROGRAM).text();

        TrimOutcome again = ToolpathTrimmer.trim(once);

        assertThat(again.status()).isEqualTo(TrimOutcome.Status.NO_START);
        assertThat(again.text()).isSameAs(once);
        assertThat(again.changed()).isFalse();
    }

    @Test
    void trim_noStartWhenAllHighOrIncremental() {
        String program = "G90\nG00 Z50.\nG01 Z20.\nG91\nG01 Z-5.\n";

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.NO_START);
        assertThat(outcome.text()).isEqualTo(program);
        assertThat(outcome.message()).isEqualTo("未找到删除起点");
        assertThat(outcome.startLine()).isNull();
    }

    @Test
    void trim_ignoresCommentsAndMachineCoordinateMoves() {
        String program = "G90\n(Z0.)\nG53 Z0.\nG28 Z0.\nG00 Z50.\n";

        assertThat(ToolpathTrimmer.trim(program).status()).isEqualTo(TrimOutcome.Status.NO_START);
    }

    @Test
    void trim_unterminatedRemovesToEnd() {
        String program = "G90\nG00 Z0.05\nG01 X10.\nG00 Z5.\nG01 Z-1.\n";

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.UNTERMINATED);
        assertThat(outcome.text()).isEqualTo("G90\n");
        assertThat(outcome.startLine()).isEqualTo(2);
        assertThat(outcome.endLine()).isNull();
        assertThat(outcome.removedLines()).isEqualTo(4);
        assertThat(outcome.message()).isEqualTo("已从第2行开始删除，但未找到安全回升终点。删除行数=4");
    }

    @Test
    void trim_rapidAtSafeHeightEndsOnlyInRapidMode() {
        String program = "G90\nG00 X0 Y0 Z0.\nG01 Z-1.\nG01 Z30.\nG00 Z30.\n";

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.text()).isEqualTo("G90\nG00 Z30.\n");
        assertThat(outcome.startLine()).isEqualTo(2);
        assertThat(outcome.endLine()).isEqualTo(5);
    }

    @Test
    void trim_lowApproachStartsTrimAndKeepsCrlf() {
        String program = "G90\r\nG00 Z3.\r\nG01 Z-1.\r\nG00 Z25.\r\nM30\r\n";

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.COMPLETED);
        assertThat(outcome.text()).isEqualTo("G90\r\nG00 Z25.\r\nM30\r\n");
        assertThat(outcome.startLine()).isEqualTo(2);
        assertThat(outcome.endLine()).isEqualTo(4);
        assertThat(outcome.removedLines()).isEqualTo(2);
    }

    @Test
    void trim_reentryReportsLatestSegment() {
        String program = """
                G90
                G01 Z0.
                G01 Z-1.
                G00 Z50.
                G01 Z0.
                G01 Z-2.
                G00 Z40.
                M30
                """;

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.COMPLETED);
        assertThat(outcome.startLine()).isEqualTo(5);
        assertThat(outcome.endLine()).isEqualTo(7);
        assertThat(outcome.removedLines()).isEqualTo(4);
        assertThat(outcome.text()).isEqualTo("G90\nG00 Z50.\nG00 Z40.\nM30\n");
    }

    @Test
    void trim_reentryWithoutSecondEndIsUnterminated() {
        String program = "G90\nG01 Z0.\nG01 Z-1.\nG00 Z50.\nG01 Z0.\nG01 Z-2.\nM30\n";

        TrimOutcome outcome = ToolpathTrimmer.trim(program);

        assertThat(outcome.status()).isEqualTo(TrimOutcome.Status.UNTERMINATED);
        assertThat(outcome.startLine()).isEqualTo(5);
        assertThat(outcome.endLine()).isNull();
        assertThat(outcome.removedLines()).isEqualTo(5);
        assertThat(outcome.text()).isEqualTo("G90\nG00 Z50.\n");
    }
}
