package org.gcodecheck.gcode.model;

/**
 * 单项检查结果（创建后不可变）。
 * <p>
 * 定位信息（offset/line/column）要么同时存在，要么同时为 null。
 *
 * @param id       检查项标识（例如 DECL、HOME、M03、G54、T）
 * @param label    展示名称
 * @param category 类别标签
 * @param status   状态
 * @param evidence 证据文本（可能为空字符串）
 * @param offset   定位偏移
 * @param line     定位行号（1-based）
 * @param column   定位列号（1-based）
 */
public record CheckResult(
        String id,
        String label,
        String category,
        CheckStatus status,
        String evidence,
        Integer offset,
        Integer line,
        Integer column
) {

    public static CheckResult anchored(String id, String label, String category, CheckStatus status,
                                       String evidence, int offset, LinePosition position) {
        return new CheckResult(id, label, category, status, evidence, offset, position.line(), position.column());
    }

    public static CheckResult unanchored(String id, String label, String category, CheckStatus status, String evidence) {
        return new CheckResult(id, label, category, status, evidence, null, null, null);
    }

    public boolean hasAnchor() {
        return line != null;
    }
}
