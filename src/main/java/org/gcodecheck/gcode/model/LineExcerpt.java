package org.gcodecheck.gcode.model;

/**
 * 原文节录（行范围）。
 *
 * @param startLine 起始行号（含，1-based；无节录时为 0）
 * @param endLine   结束行号（含，1-based；无节录时为 0）
 * @param rangeText 范围描述，例如 “第3-7行”
 * @param text      带行号的节录文本（每行 {@code %6d: 内容}）
 */
public record LineExcerpt(int startLine, int endLine, String rangeText, String text) {

    public static LineExcerpt empty() {
        return new LineExcerpt(0, 0, "", "");
    }

    public boolean isEmpty() {
        return startLine == 0;
    }
}
