package org.gcodecheck.gcode;

import java.util.List;

/**
 * 一次加载的程序快照：原文 + 遮罩文本 + 行首偏移表 + 行区间。
 * <p>
 * 四者均只读，可在多个检查项之间共享。
 *
 * @param original 原文（用于展示/证据）
 * @param masked   遮罩文本（用于匹配，长度与原文一致）
 * @param index    行首偏移表
 * @param lines    行区间（同时作用于原文与遮罩文本）
 */
public record MaskedProgram(String original, String masked, LineIndex index, List<ProgramLines.Span> lines) {

    public static MaskedProgram of(String text) {
        String original = (text == null) ? "" : text;
        return new MaskedProgram(
                original,
                CommentMasker.mask(original),
                LineIndex.of(original),
                List.copyOf(ProgramLines.split(original))
        );
    }

    public String originalLine(int i) {
        return lines.get(i).of(original);
    }

    public String maskedLine(int i) {
        return lines.get(i).of(masked);
    }

    public int lineCount() {
        return lines.size();
    }
}
