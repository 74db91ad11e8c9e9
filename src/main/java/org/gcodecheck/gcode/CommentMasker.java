package org.gcodecheck.gcode;

/**
 * 注释遮罩：把 {@code (...)} 与 {@code ;} 到行尾的注释内容替换为空格，保持文本长度与偏移量不变。
 * <p>
 * 规则：
 * <ul>
 *   <li>{@code (} 使括号深度 +1，{@code )}（深度大于 0 时）使深度 -1，括号本身也会被遮罩。</li>
 *   <li>深度大于 0 时，除换行符（{@code \n}、{@code \r}）以外的字符全部遮罩。</li>
 *   <li>深度为 0 时遇到 {@code ;}：从 {@code ;} 遮罩到行尾（{@code \n} 或单独的 {@code \r}）之前。</li>
 *   <li>括号不配对不会报错：未闭合的 {@code (} 会一直遮罩到文本结尾。</li>
 * </ul>
 * 遮罩文本只用于匹配；展示与证据始终取自原文。
 */
public final class CommentMasker {

    private CommentMasker() {
    }

    public static String mask(String text) {
        if (text == null || text.isEmpty()) {
            return (text == null) ? "" : text;
        }
        char[] chars = text.toCharArray();
        int n = chars.length;
        int depth = 0;
        int i = 0;
        while (i < n) {
            char c = chars[i];
            if (c == '(') {
                depth++;
                chars[i++] = ' ';
                continue;
            }
            if (c == ')' && depth > 0) {
                depth--;
                chars[i++] = ' ';
                continue;
            }
            if (depth > 0) {
                if (!isLineBreak(c)) {
                    chars[i] = ' ';
                }
                i++;
                continue;
            }
            if (c == ';') {
                while (i < n && !isLineBreak(chars[i])) {
                    chars[i++] = ' ';
                }
                continue;
            }
            i++;
        }
        return new String(chars);
    }

    private static boolean isLineBreak(char c) {
        return c == '\n' || c == '\r';
    }
}
