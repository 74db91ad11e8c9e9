package org.gcodecheck.gcode;

import java.util.ArrayList;
import java.util.List;

/**
 * 把程序文本切分成“行区间”（保留行尾换行符）。
 * <p>
 * 说明：
 * <ul>
 *   <li>换行规则：{@code \r\n}、{@code \n}、单独的 {@code \r} 都视为一行结束，与 {@link LineIndex} 保持一致。</li>
 *   <li>行区间只记录偏移量，因此同一组区间可以同时作用于原文与遮罩文本（两者长度一致）。</li>
 *   <li>空文本返回空列表；文本末尾有换行时不会额外产生一个空行。</li>
 * </ul>
 */
public final class ProgramLines {

    private ProgramLines() {
    }

    /**
     * 一行在文本中的位置。
     *
     * @param start      行首偏移（含）
     * @param contentEnd 行内容结束偏移（不含换行符）
     * @param end        行结束偏移（含换行符，不含下一行）
     */
    public record Span(int start, int contentEnd, int end) {

        public String of(String text) {
            return text.substring(start, end);
        }

        public String contentOf(String text) {
            return text.substring(start, contentEnd);
        }
    }

    public static List<Span> split(String text) {
        List<Span> spans = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return spans;
        }
        int n = text.length();
        int start = 0;
        int i = 0;
        while (i < n) {
            char c = text.charAt(i);
            if (c == '\n') {
                spans.add(new Span(start, i, i + 1));
                start = i + 1;
            } else if (c == '\r') {
                int end = (i + 1 < n && text.charAt(i + 1) == '\n') ? i + 2 : i + 1;
                spans.add(new Span(start, i, end));
                start = end;
                i = end;
                continue;
            }
            i++;
        }
        if (start < n) {
            spans.add(new Span(start, n, n));
        }
        return spans;
    }

    /**
     * 按行切分并去掉行尾换行符，用于节录展示。
     */
    public static List<String> contents(String text) {
        List<Span> spans = split(text);
        List<String> result = new ArrayList<>(spans.size());
        for (Span span : spans) {
            result.add(span.contentOf(text));
        }
        return result;
    }
}
