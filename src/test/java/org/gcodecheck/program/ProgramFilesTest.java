package org.gcodecheck.program;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class ProgramFilesTest {

    @TempDir
    Path tempDir;

    @Test
    void decode_stripsUtf8Bom() {
        byte[] bytes = {(byte) 0xEF, (byte) 0xBB, (byte) 0xBF, 'G', '9', '0'};

        ProgramFiles.DecodedText decoded = ProgramFiles.decode(bytes);

        assertThat(decoded.text()).isEqualTo("G90");
        assertThat(decoded.decodedWith()).isEqualTo("utf-8-sig");
        assertThat(decoded.lossy()).isFalse();
    }

    @Test
    void decode_plainUtf8() {
        ProgramFiles.DecodedText decoded = ProgramFiles.decode("(中文) G90".getBytes(StandardCharsets.UTF_8));

        assertThat(decoded.text()).isEqualTo("(中文) G90");
        assertThat(decoded.decodedWith()).isEqualTo("utf-8");
    }

    @Test
    void decode_fallsBackToTraditionalChineseCodePage() {
        assumeTrue(Charset.isSupported("Big5"));
        byte[] bytes = "(刀具) G90".getBytes(Charset.forName("Big5"));

        ProgramFiles.DecodedText decoded = ProgramFiles.decode(bytes);

        assertThat(decoded.text()).isEqualTo("(刀具) G90");
        assertThat(decoded.decodedWith()).isIn("x-windows-950", "big5");
        assertThat(decoded.lossy()).isFalse();
    }

    @Test
    void decode_emptyInput() {
        ProgramFiles.DecodedText decoded = ProgramFiles.decode(new byte[0]);

        assertThat(decoded.text()).isEmpty();
        assertThat(decoded.lossy()).isFalse();
    }

    @Test
    void processedFileName_keepsExtensionOrAddsDefault() {
        assertThat(ProgramFiles.processedFileName("part.nc", "_processed", ".nc")).isEqualTo("part_processed.nc");
        assertThat(ProgramFiles.processedFileName("O1234", "_processed", ".nc")).isEqualTo("O1234_processed.nc");
        assertThat(ProgramFiles.processedFileName("a.b.tap", "_x", ".nc")).isEqualTo("a.b_x.tap");
    }

    @Test
    void processedFileName_trailingDotAndLeadingDotNames() {
        assertThat(ProgramFiles.processedFileName("a.", "_processed", ".nc")).isEqualTo("a_processed.");
        assertThat(ProgramFiles.processedFileName(".profile", "_processed", ".nc")).isEqualTo(".profile_processed.nc");
        assertThat(ProgramFiles.processedFileName("..nc", "_processed", ".nc")).isEqualTo("..nc_processed.nc");
    }

    @Test
    void readAll_rejectsOversizedFile() throws IOException {
        Path file = tempDir.resolve("big.nc");
        Files.write(file, new byte[64]);

        assertThatThrownBy(() -> ProgramFiles.readAll(file, 32))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("程序文件过大");
        assertThat(ProgramFiles.readAll(file, 64)).hasSize(64);
    }

    @Test
    void writeAtomically_overwritesOnlyWhenAllowed() throws IOException {
        Path target = tempDir.resolve("out.nc");
        Files.writeString(target, "old");

        assertThatThrownBy(() -> ProgramFiles.writeAtomically(target, "new".getBytes(StandardCharsets.UTF_8), false))
                .isInstanceOf(IOException.class);
        assertThat(Files.readString(target)).isEqualTo("old");

        ProgramFiles.writeAtomically(target, "new".getBytes(StandardCharsets.UTF_8), true);

        assertThat(Files.readString(target)).isEqualTo("new");
        try (var files = Files.list(tempDir)) {
            assertThat(files).containsExactly(target);
        }
    }

    @Test
    void sha256Hex_fileAndBytesAgree() throws IOException {
        Path file = tempDir.resolve("a.nc");
        Files.writeString(file, "abc");

        assertThat(ProgramFiles.sha256Hex(file))
                .isEqualTo(ProgramFiles.sha256Hex("abc".getBytes(StandardCharsets.UTF_8)))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }
}
