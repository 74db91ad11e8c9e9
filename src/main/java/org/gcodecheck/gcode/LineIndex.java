package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.LinePosition;

import java.util.Arrays;

/**
 * 行首偏移表：把字符偏移量换算为（行，列）。
 * <p>
 * 每个程序只构建一次（O(n)），之后每次查询使用二分查找（O(log n)）。
 * 遮罩文本与原文长度一致，因此同一张表对两者都有效。
 */
public final class LineIndex {

    private final int[] lineStarts;

    private LineIndex(int[] lineStarts) {
        this.lineStarts = lineStarts;
    }

    public static LineIndex of(String text) {
        return new LineIndex(buildLineStarts(text));
    }

    public static int[] buildLineStarts(String text) {
        String value = (text == null) ? "" : text;
        int[] starts = new int[16];
        int count = 0;
        starts[count++] = 0;
        int n = value.length();
        for (int i = 0; i < n; i++) {
            char c = value.charAt(i);
            boolean lineBreak = c == '\n' || (c == '\r' && (i + 1 >= n || value.charAt(i + 1) != '\n'));
            if (lineBreak) {
                if (count == starts.length) {
                    starts = Arrays.copyOf(starts, count * 2);
                }
                starts[count++] = i + 1;
            }
        }
        return Arrays.copyOf(starts, count);
    }

    public static LinePosition toLineCol(int offset, int[] lineStarts) {
        // 找到“最后一个 <= offset 的行首”
        int lo = 0;
        int hi = lineStarts.length - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lineStarts[mid] <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return new LinePosition(lo + 1, offset - lineStarts[lo] + 1);
    }

    public LinePosition toLineCol(int offset) {
        return toLineCol(offset, lineStarts);
    }

    public int lineCount() {
        return lineStarts.length;
    }
}
