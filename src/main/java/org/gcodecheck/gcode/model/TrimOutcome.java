package org.gcodecheck.gcode.model;

/**
 * 路径删除的结果。
 *
 * @param text         删除后的文本（{@link Status#NO_START} 时为原文）
 * @param status       结果类型
 * @param startLine    删除起点行号（1-based；未找到时为 null）
 * @param endLine      停止行号（1-based，该行保留；未找到时为 null）
 * @param removedLines 删除的行数（含起点行，不含停止行）
 * @param message      给使用者看的说明
 */
public record TrimOutcome(String text, Status status, Integer startLine, Integer endLine, int removedLines, String message) {

    public enum Status {
        /** 未找到删除起点，文本保持不变。 */
        NO_START,
        /** 找到起点，但一直没有出现安全回升终点。 */
        UNTERMINATED,
        /** 找到起点与终点。 */
        COMPLETED
    }

    public boolean changed() {
        return status != Status.NO_START;
    }
}
