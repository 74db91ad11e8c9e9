package org.gcodecheck.program.dto;

import java.time.Instant;
import java.util.List;

/**
 * {@code gcode_prepare_cleaned_program} 的返回结果（仅准备，不会真的写出）。
 *
 * @param token                 用于 {@code gcode_confirm_write} 的 token
 * @param rootId                根目录标识
 * @param sourcePath            原程序路径
 * @param outputPath            修正版输出路径
 * @param exists                输出文件是否已存在
 * @param overwrite             是否允许覆盖
 * @param trimStatus            路径删除结果（NO_START/UNTERMINATED/COMPLETED）
 * @param trimMessage           路径删除说明
 * @param trimStartLine         删除起点行号（原程序行号）
 * @param trimEndLine           停止行号（原程序行号，该行保留）
 * @param trimRemovedLines      路径删除的行数
 * @param toolListBlocksRemoved 移除的 TOOL LIST 区块数
 * @param toolListLinesRemoved  TOOL LIST 相关移除行数
 * @param originalLineCount     原程序行数
 * @param cleanedLineCount      修正版行数
 * @param bytes                 待写出字节数（UTF-8）
 * @param expectedSha256        已存在输出文件的 sha256（用于确认时校验是否被外部修改）
 * @param newSha256             待写出内容的 sha256
 * @param expiresAt             token 过期时间
 * @param warnings              风险提示
 */
public record CleanedProgramPrepareResult(
        String token,
        String rootId,
        String sourcePath,
        String outputPath,
        boolean exists,
        boolean overwrite,
        String trimStatus,
        String trimMessage,
        Integer trimStartLine,
        Integer trimEndLine,
        int trimRemovedLines,
        int toolListBlocksRemoved,
        int toolListLinesRemoved,
        int originalLineCount,
        int cleanedLineCount,
        long bytes,
        String expectedSha256,
        String newSha256,
        Instant expiresAt,
        List<String> warnings
) {
}
