package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.ToolListRemoval;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ToolListBlockRemoverTest {

    @Test
    void remove_blockWithPaddingAndFollowingPositioningLine() {
        String program = """
                O1
                (TOOL LIST)
                (T1 D10)
                (T2 D6)

                G00 X0 Y0 S1200 M03
                G01 X1
                """;

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isEqualTo("O1\nG01 X1\n");
        assertThat(removal.blocksRemoved()).isEqualTo(1);
        assertThat(removal.linesRemoved()).isEqualTo(5);
    }

    @Test
    void remove_walksBackOverBlankLinesAboveTitle() {
        String program = """
                O1


                (TOOL LIST)
                (T1 D10)
                G00 X10 Y10 S1200 M03
                G01 X1
                """;

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isEqualTo("O1\nG01 X1\n");
        assertThat(removal.blocksRemoved()).isEqualTo(1);
        assertThat(removal.linesRemoved()).isEqualTo(5);
    }

    @Test
    void remove_overlappingBackwardWalkCountsLinesOnce() {
        String program = "(TOOL LIST)\n(T1)\n\nM01 (TOOL LIST)\n(T2)\nG01 X1\n";

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isEqualTo("G01 X1\n");
        assertThat(removal.blocksRemoved()).isEqualTo(2);
        assertThat(removal.linesRemoved()).isEqualTo(5);
    }

    @Test
    void remove_keepsFollowingLineThatIsNotRapidPositioning() {
        String program = """
                O1
                (TOOL LIST)
                (T1 D10)
                (T2 D6)

                G01 X0 Y0
                """;

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isEqualTo("O1\nG01 X0 Y0\n");
        assertThat(removal.linesRemoved()).isEqualTo(4);
    }

    @Test
    void remove_titleMatchesSpacedLowercaseLetters() {
        ToolListRemoval removal = ToolListBlockRemover.remove("O1\n( t o o l   l i s t )\nG90\n");

        assertThat(removal.text()).isEqualTo("O1\nG90\n");
        assertThat(removal.blocksRemoved()).isEqualTo(1);
    }

    @Test
    void remove_multipleBlocksAndSpindleInsideCommentDoesNotCount() {
        String program = "(TOOL LIST)\n(T1)\nG00 X1. (S1000)\nG90\n(TOOL LIST)\nG00 Y2. M3\nM30\n";

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isEqualTo("G00 X1. (S1000)\nG90\nM30\n");
        assertThat(removal.blocksRemoved()).isEqualTo(2);
        assertThat(removal.linesRemoved()).isEqualTo(4);
    }

    @Test
    void remove_noBlockLeavesTextUntouched() {
        String program = "G90\nM30\n";

        ToolListRemoval removal = ToolListBlockRemover.remove(program);

        assertThat(removal.text()).isSameAs(program);
        assertThat(removal.blocksRemoved()).isZero();
        assertThat(removal.linesRemoved()).isZero();
    }

    @Test
    void isToolChangePositioning_requiresRapidSpindleAndXy() {
        assertThat(ToolListBlockRemover.isToolChangePositioning("G00 X10. Y5. S800")).isTrue();
        assertThat(ToolListBlockRemover.isToolChangePositioning("G00 Z50. S800")).isFalse();
        assertThat(ToolListBlockRemover.isToolChangePositioning("G00 X10.")).isFalse();
        assertThat(ToolListBlockRemover.isToolChangePositioning("G01 X10. M03")).isFalse();
    }
}
