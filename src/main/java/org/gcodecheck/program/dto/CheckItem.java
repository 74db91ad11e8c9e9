package org.gcodecheck.program.dto;

/**
 * 单项检查结果（带原文节录，用于展示）。
 *
 * @param id         检查项标识（DECL/HOME/M03/G54.../T/H）
 * @param label      项目 / 规则
 * @param category   类型
 * @param status     状态（OK/MISSING/ERROR）
 * @param statusText 状态中文名
 * @param evidence   位置 / 证据
 * @param offset     定位偏移（未定位时为 null）
 * @param line       定位行号（1-based）
 * @param column     定位列号（1-based）
 * @param range      节录范围，例如 “第3-7行”
 * @param rawLine    定位行原文（去首尾空白，超长截断）
 * @param excerpt    节录文本（带行号）
 */
public record CheckItem(
        String id,
        String label,
        String category,
        String status,
        String statusText,
        String evidence,
        Integer offset,
        Integer line,
        Integer column,
        String range,
        String rawLine,
        String excerpt
) {
}
