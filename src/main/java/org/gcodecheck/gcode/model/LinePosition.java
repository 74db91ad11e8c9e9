package org.gcodecheck.gcode.model;

/**
 * 文本中的行列位置（均从 1 开始）。
 *
 * @param line   行号
 * @param column 列号
 */
public record LinePosition(int line, int column) {
}
