package org.gcodecheck.gcode.model;

/**
 * 一次代码/地址命中。
 *
 * @param text     命中的原样文本（例如 {@code g90}、{@code T12}）
 * @param offset   命中起点（字母所在偏移）
 * @param position 命中起点对应的行列位置
 */
public record TokenMatch(String text, int offset, LinePosition position) {
}
