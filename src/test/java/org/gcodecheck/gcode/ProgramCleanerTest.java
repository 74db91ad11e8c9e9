package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.TrimOutcome;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProgramCleanerTest {

    @Test
    void clean_trimsThenRemovesToolList() {
        String program = """
                %
                O2000
                (TOOL LIST)
                (T01 D10 FLAT)
                G90 G54 G00 X0 Y0 S1500 M03
                G43 H01 Z50.
                G00 Z5.
                G01 Z-1. F200
                X20.
                G00 Z50.
                M30
                %
                """;

        CleanedProgram cleaned = ProgramCleaner.clean(program);

        assertThat(cleaned.trim().status()).isEqualTo(TrimOutcome.Status.COMPLETED);
        assertThat(cleaned.trim().removedLines()).isEqualTo(3);
        assertThat(cleaned.toolList().blocksRemoved()).isEqualTo(1);
        assertThat(cleaned.toolList().linesRemoved()).isEqualTo(3);
        assertThat(cleaned.text()).isEqualTo("""
                %
                O2000
                G43 H01 Z50.
                G00 Z50.
                M30
                %
                """);
        assertThat(cleaned.changed(program)).isTrue();
    }

    @Test
    void clean_programWithNothingToRemoveIsUnchanged() {
        String program = "G90 G00 Z50.\nM30\n";

        CleanedProgram cleaned = ProgramCleaner.clean(program);

        assertThat(cleaned.text()).isEqualTo(program);
        assertThat(cleaned.changed(program)).isFalse();
    }
}
