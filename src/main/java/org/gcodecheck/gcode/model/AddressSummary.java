package org.gcodecheck.gcode.model;

import java.util.List;

/**
 * 地址码（T/H 等）收集结果。
 *
 * @param letter      地址字母（大写）
 * @param values      去重后的数字串，按数值升序；同一数值保留首次出现的写法（例如 {@code 06}）
 * @param firstOffset 最早出现位置（按文本位置，而非按数值）；未找到时为 null
 */
public record AddressSummary(char letter, List<String> values, Integer firstOffset) {

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * 带字母前缀的展示形式，例如 {@code [T06, T12]}。
     */
    public List<String> labels() {
        return values.stream().map(v -> letter + v).toList();
    }
}
