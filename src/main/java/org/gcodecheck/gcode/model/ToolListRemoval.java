package org.gcodecheck.gcode.model;

/**
 * TOOL LIST 区块移除结果。
 *
 * @param text          移除后的文本
 * @param blocksRemoved 移除的区块数
 * @param linesRemoved  移除的总行数（含区块前后的注释/空行，以及被一并移除的定位行）
 */
public record ToolListRemoval(String text, int blocksRemoved, int linesRemoved) {
}
