package org.gcodecheck.program.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code gcode_confirm_write} 的返回结果（确认/取消）。
 *
 * @param token        token
 * @param rootId       根目录标识
 * @param sourcePath   原程序路径
 * @param path         输出路径
 * @param confirmed    是否确认
 * @param written      是否实际写出
 * @param bytesWritten 写出字节数
 * @param sha256       写出内容的 sha256
 * @param wroteAt      写出时间
 * @param warnings     提示
 */
public record ProgramWriteConfirmResult(
        String token,
        String rootId,
        String sourcePath,
        String path,
        boolean confirmed,
        boolean written,
        long bytesWritten,
        String sha256,
        Instant wroteAt,
        List<String> warnings
) {
}
