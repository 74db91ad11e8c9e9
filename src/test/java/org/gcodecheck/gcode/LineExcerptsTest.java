package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.LineExcerpt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LineExcerptsTest {

    private static final List<String> LINES = List.of("O1", "G90", "G00 Z50.", "M03", "M30");

    @Test
    void excerpt_clampsToFirstLine() {
        LineExcerpt excerpt = LineExcerpts.excerpt(LINES, 1, 2);

        assertThat(excerpt.startLine()).isEqualTo(1);
        assertThat(excerpt.endLine()).isEqualTo(3);
        assertThat(excerpt.rangeText()).isEqualTo("第1-3行");
        assertThat(excerpt.text()).isEqualTo("     1: O1\n     2: G90\n     3: G00 Z50.");
    }

    @Test
    void excerpt_zeroRadiusIsSingleLine() {
        LineExcerpt excerpt = LineExcerpts.excerpt(LINES, 5, 0);

        assertThat(excerpt.rangeText()).isEqualTo("第5行");
        assertThat(excerpt.text()).isEqualTo("     5: M30");
    }

    @Test
    void excerpt_emptyForMissingAnchor() {
        assertThat(LineExcerpts.excerpt(LINES, 0, 2).isEmpty()).isTrue();
        assertThat(LineExcerpts.excerpt(List.of(), 1, 2).isEmpty()).isTrue();
    }

    @Test
    void rawPreview_stripsAndTruncates() {
        String longLine = "  " + "X".repeat(200) + "  ";

        assertThat(LineExcerpts.rawPreview(List.of(" G90 "), 1)).isEqualTo("G90");
        assertThat(LineExcerpts.rawPreview(List.of(longLine), 1)).hasSize(141).endsWith("…");
        assertThat(LineExcerpts.rawPreview(LINES, 9)).isEmpty();
    }
}
