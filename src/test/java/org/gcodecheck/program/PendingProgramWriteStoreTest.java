package org.gcodecheck.program;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PendingProgramWriteStoreTest {

    @Test
    void take_consumesTokenOnce() {
        PendingProgramWriteStore store = new PendingProgramWriteStore(Duration.ofMinutes(5), 1024);
        byte[] bytes = "G90\n".getBytes(StandardCharsets.UTF_8);

        PendingProgramWriteStore.PendingProgramWrite pending =
                store.create("root0", "a.nc", "a_processed.nc", Path.of("a_processed.nc"), bytes, false, false, null);

        assertThat(pending.newSha256()).isEqualTo(ProgramFiles.sha256Hex(bytes));
        assertThat(store.peek(pending.token())).isNotNull();
        assertThat(store.take(pending.token())).isNotNull();
        assertThat(store.take(pending.token())).isNull();
        assertThat(store.peek(pending.token())).isNull();
    }

    @Test
    void peek_expiredTokenIsGone() {
        PendingProgramWriteStore store = new PendingProgramWriteStore(Duration.ofMillis(-1), 1024);

        PendingProgramWriteStore.PendingProgramWrite pending =
                store.create("root0", "a.nc", "b.nc", Path.of("b.nc"), new byte[1], false, false, null);

        assertThat(store.peek(pending.token())).isNull();
        assertThat(store.peek(null)).isNull();
    }

    @Test
    void create_rejectsOversizedContent() {
        PendingProgramWriteStore store = new PendingProgramWriteStore(Duration.ofMinutes(5), 4);

        assertThatThrownBy(() -> store.create("root0", "a.nc", "b.nc", Path.of("b.nc"), new byte[5], false, false, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("待确认写入内容过大");
    }
}
