package org.gcodecheck.gcode;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * 一次检查的可选项。
 * <p>
 * 声明码/回零/主轴三项必检，不受这里的设置影响。
 *
 * @param tokens              需要检查的可选代码（{@link #SELECTABLE_TOKENS} 的子集，按固定顺序排列）
 * @param checkToolNumbers    是否检查 T 号
 * @param checkLengthOffsets  是否检查 H 号
 */
public record CheckOptions(List<String> tokens, boolean checkToolNumbers, boolean checkLengthOffsets) {

    public static final List<String> SELECTABLE_TOKENS = List.of("G54", "G55", "G56", "G57", "G58", "G59", "G43");

    public CheckOptions {
        tokens = normalizeTokens(tokens);
    }

    /**
     * 默认选项：G54 + G43，显示 T 号与 H 号。
     */
    public static CheckOptions defaults() {
        return new CheckOptions(List.of("G54", "G43"), true, true);
    }

    private static List<String> normalizeTokens(Collection<String> requested) {
        if (requested == null || requested.isEmpty()) {
            return List.of();
        }
        Set<String> wanted = new LinkedHashSet<>();
        for (String token : requested) {
            if (token == null || token.isBlank()) {
                continue;
            }
            String upper = token.trim().toUpperCase(Locale.ROOT);
            if (!SELECTABLE_TOKENS.contains(upper)) {
                throw new IllegalArgumentException("不支持的检查代码：" + token + "（可选：" + String.join(", ", SELECTABLE_TOKENS) + "）");
            }
            wanted.add(upper);
        }
        List<String> ordered = new ArrayList<>(wanted.size());
        for (String token : SELECTABLE_TOKENS) {
            if (wanted.contains(token)) {
                ordered.add(token);
            }
        }
        return List.copyOf(ordered);
    }
}
