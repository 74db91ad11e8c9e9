package org.gcodecheck.program;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 待确认的“修正版写出”存储（内存版）。
 * <p>
 * 工作流：
 * <ol>
 *   <li>{@code gcode_prepare_cleaned_program}：生成修正版内容与 token，内容暂存在这里。</li>
 *   <li>{@code gcode_confirm_write}：{@code confirm=true} 时用 token 取出内容并写出。</li>
 * </ol>
 * 每个 token 有 TTL；单条内容有大小上限。仅适用于单进程。
 */
public class PendingProgramWriteStore {

    private final Duration ttl;
    private final long maxBytesPerItem;
    private final ConcurrentHashMap<String, PendingProgramWrite> store = new ConcurrentHashMap<>();

    public PendingProgramWriteStore(Duration ttl, long maxBytesPerItem) {
        this.ttl = ttl;
        this.maxBytesPerItem = maxBytesPerItem;
    }

    public PendingProgramWrite create(
            String rootId,
            String sourcePath,
            String displayPath,
            Path targetFile,
            byte[] bytes,
            boolean overwrite,
            boolean expectExists,
            String expectedSha256
    ) {
        purgeExpired();
        if (bytes.length > maxBytesPerItem) {
            throw new IllegalArgumentException("待确认写入内容过大：" + bytes.length + " 字节（上限 " + maxBytesPerItem + "）");
        }
        Instant now = Instant.now();
        PendingProgramWrite pending = new PendingProgramWrite(
                UUID.randomUUID().toString(),
                rootId,
                sourcePath,
                displayPath,
                targetFile,
                bytes,
                overwrite,
                expectExists,
                expectedSha256,
                ProgramFiles.sha256Hex(bytes),
                now,
                now.plus(ttl)
        );
        store.put(pending.token(), pending);
        return pending;
    }

    /**
     * 查看 token 对应的内容，不删除；过期或不存在时返回 null。
     */
    public PendingProgramWrite peek(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingProgramWrite pending = store.get(token);
        if (pending != null && pending.isExpired()) {
            store.remove(token);
            return null;
        }
        return pending;
    }

    /**
     * 取出并删除 token，避免同一 token 被重复确认。
     */
    public PendingProgramWrite take(String token) {
        if (token == null || token.isBlank()) {
            return null;
        }
        PendingProgramWrite pending = store.remove(token);
        return (pending == null || pending.isExpired()) ? null : pending;
    }

    private void purgeExpired() {
        Instant now = Instant.now();
        store.values().removeIf(p -> p.expiresAt().isBefore(now));
    }

    public record PendingProgramWrite(
            String token,
            String rootId,
            String sourcePath,
            String displayPath,
            Path targetFile,
            byte[] bytes,
            boolean overwrite,
            boolean expectExists,
            String expectedSha256,
            String newSha256,
            Instant createdAt,
            Instant expiresAt
    ) {
        public boolean isExpired() {
            return Instant.now().isAfter(expiresAt);
        }
    }
}
