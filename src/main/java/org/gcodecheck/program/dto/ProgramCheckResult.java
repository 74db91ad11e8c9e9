package org.gcodecheck.program.dto;

import java.util.List;

/**
 * {@code gcode_check_program} / {@code gcode_check_text} 的返回结果。
 *
 * @param rootId        根目录标识（检查内联文本时为 null）
 * @param path          相对 root 的路径（检查内联文本时为 null）
 * @param decodedWith   解码所用字符集（检查内联文本时为 null）
 * @param sizeBytes     文件字节数（检查内联文本时为 null）
 * @param lineCount     行数
 * @param passed        是否全部通过
 * @param missingCount  缺少项数量
 * @param errorCount    错误项数量
 * @param totalCount    检查项总数
 * @param toolNumbers   T 号汇总（例如 T01、T12；未勾选时为 null）
 * @param lengthOffsets H 号汇总（未勾选时为 null）
 * @param items         各检查项
 * @param warnings      非致命告警
 */
public record ProgramCheckResult(
        String rootId,
        String path,
        String decodedWith,
        Long sizeBytes,
        int lineCount,
        boolean passed,
        long missingCount,
        long errorCount,
        int totalCount,
        List<String> toolNumbers,
        List<String> lengthOffsets,
        List<CheckItem> items,
        List<String> warnings
) {
}
