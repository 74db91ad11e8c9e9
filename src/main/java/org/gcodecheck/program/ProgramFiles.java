package org.gcodecheck.program;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;

/**
 * 程序文件的读取、解码、哈希与原子写入。
 * <p>
 * 解码顺序：UTF-8（带 BOM）→ UTF-8 → CP950 → Big5 → GB18030，全部严格解码；
 * 都失败时按 UTF-8 解码并把非法字节替换为替换字符（此时 {@code lossy=true}）。
 * 运行环境不支持的字符集会被跳过。
 */
public final class ProgramFiles {

    private static final HexFormat HEX = HexFormat.of();
    private static final List<String> FALLBACK_CHARSETS = List.of("x-windows-950", "Big5", "GB18030");

    private ProgramFiles() {
    }

    /**
     * 解码结果。
     *
     * @param text        文本（不含 BOM）
     * @param decodedWith 实际使用的字符集名称（小写），UTF-8 带 BOM 时为 {@code utf-8-sig}
     * @param lossy       是否有字节被替换
     */
    public record DecodedText(String text, String decodedWith, boolean lossy) {
    }

    public static byte[] readAll(Path file, long maxBytes) {
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件大小失败：" + file, e);
        }
        if (size > maxBytes) {
            throw new IllegalArgumentException("程序文件过大：" + size + " 字节（上限 " + maxBytes + "）");
        }
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IllegalStateException("读取文件失败：" + file, e);
        }
    }

    public static DecodedText decode(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new DecodedText("", "utf-8", false);
        }
        boolean bom = bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF;
        if (bom) {
            String text = decodeStrict(bytes, 3, StandardCharsets.UTF_8);
            if (text != null) {
                return new DecodedText(text, "utf-8-sig", false);
            }
        }
        String utf8 = decodeStrict(bytes, 0, StandardCharsets.UTF_8);
        if (utf8 != null) {
            return new DecodedText(utf8, "utf-8", false);
        }
        for (String name : FALLBACK_CHARSETS) {
            if (!Charset.isSupported(name)) {
                continue;
            }
            Charset charset = Charset.forName(name);
            String text = decodeStrict(bytes, 0, charset);
            if (text != null) {
                return new DecodedText(text, charset.name().toLowerCase(Locale.ROOT), false);
            }
        }
        return new DecodedText(new String(bytes, StandardCharsets.UTF_8), "utf-8", true);
    }

    public static String sha256Hex(byte[] bytes) {
        return HEX.formatHex(sha256Digest().digest(bytes));
    }

    public static String sha256Hex(Path file) throws IOException {
        MessageDigest digest = sha256Digest();
        try (InputStream in = Files.newInputStream(file)) {
            byte[] buffer = new byte[8192];
            int read;
            while ((read = in.read(buffer)) >= 0) {
                digest.update(buffer, 0, read);
            }
        }
        return HEX.formatHex(digest.digest());
    }

    /**
     * 先写同目录临时文件，再 move 到目标路径；不支持原子 move 时降级为普通 move。
     */
    public static void writeAtomically(Path target, byte[] bytes, boolean overwrite) throws IOException {
        Path parent = target.getParent();
        if (parent == null) {
            throw new IllegalArgumentException("目标路径无效：" + target);
        }
        // ATOMIC_MOVE 在部分平台上会直接替换已存在的目标
        if (!overwrite && Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            throw new FileAlreadyExistsException(target.toString());
        }
        Path tmp = Files.createTempFile(parent, "gcode-write-", ".tmp");
        try {
            Files.write(tmp, bytes);
            List<StandardCopyOption> options = new ArrayList<>();
            if (overwrite) {
                options.add(StandardCopyOption.REPLACE_EXISTING);
            }
            try {
                options.add(StandardCopyOption.ATOMIC_MOVE);
                Files.move(tmp, target, options.toArray(new StandardCopyOption[0]));
            } catch (AtomicMoveNotSupportedException e) {
                options.remove(StandardCopyOption.ATOMIC_MOVE);
                Files.move(tmp, target, options.toArray(new StandardCopyOption[0]));
            }
        } finally {
            Files.deleteIfExists(tmp);
        }
    }

    /**
     * 修正版默认文件名：{@code <主文件名><后缀><扩展名>}，没有扩展名时使用默认扩展名。
     * <p>
     * 最后一个 {@code .} 之前必须有非 {@code .} 字符才算扩展名（{@code .profile} 没有扩展名）；
     * 以 {@code .} 结尾的文件名保留这个 {@code .}（{@code a.} → {@code a_processed.}）。
     */
    public static String processedFileName(String fileName, String suffix, String defaultExtension) {
        int dot = fileName.lastIndexOf('.');
        boolean hasExtension = dot > 0 && fileName.substring(0, dot).chars().anyMatch(ch -> ch != '.');
        if (!hasExtension) {
            return fileName + suffix + defaultExtension;
        }
        return fileName.substring(0, dot) + suffix + fileName.substring(dot);
    }

    private static String decodeStrict(byte[] bytes, int offset, Charset charset) {
        var decoder = charset.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes, offset, bytes.length - offset)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }

    private static MessageDigest sha256Digest() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("当前运行环境不支持 SHA-256 摘要算法（MessageDigest）", e);
        }
    }
}
