package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.AddressSummary;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressCollectorTest {

    @Test
    void collect_dedupsByValueAndKeepsFirstSpelling() {
        AddressSummary summary = AddressCollector.collect("T06 M06\nT6\nT12", 'T');

        assertThat(summary.values()).containsExactly("06", "12");
        assertThat(summary.labels()).containsExactly("T06", "T12");
        assertThat(summary.firstOffset()).isEqualTo(0);
    }

    @Test
    void collect_sortsByNumberButAnchorsOnEarliestText() {
        String text = "G43 H12 Z50.\nG43 H2 Z50.\nG43 h02";
        AddressSummary summary = AddressCollector.collect(text, 'h');

        assertThat(summary.letter()).isEqualTo('H');
        assertThat(summary.values()).containsExactly("2", "12");
        assertThat(summary.firstOffset()).isEqualTo(4);
    }

    @Test
    void collect_ignoresMaskedCommentsAndEmbeddedLetters() {
        String masked = CommentMasker.mask("(T99) MT5 T1");
        AddressSummary summary = AddressCollector.collect(masked, 'T');

        assertThat(summary.values()).containsExactly("1");
    }

    @Test
    void collect_handlesVeryLongDigitRuns() {
        AddressSummary summary = AddressCollector.collect("T99999999999999999999999 T1", 'T');

        assertThat(summary.values()).containsExactly("1", "99999999999999999999999");
    }

    @Test
    void collect_emptyWhenAbsent() {
        AddressSummary summary = AddressCollector.collect("G90 G54", 'T');

        assertThat(summary.isEmpty()).isTrue();
        assertThat(summary.firstOffset()).isNull();
    }
}
