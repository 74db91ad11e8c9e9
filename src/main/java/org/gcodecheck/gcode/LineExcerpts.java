package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.LineExcerpt;

import java.util.List;

/**
 * 以某一行为中心，截取前后若干行原文（范围会被限制在 {@code [1, 总行数]} 内）。
 */
public final class LineExcerpts {

    public static final int DEFAULT_RADIUS = 2;

    static final int RAW_PREVIEW_MAX_CHARS = 140;

    private LineExcerpts() {
    }

    public static LineExcerpt excerpt(List<String> lines, int centerLine, int radius) {
        if (lines == null || lines.isEmpty() || centerLine <= 0) {
            return LineExcerpt.empty();
        }
        int total = lines.size();
        int r = Math.max(0, radius);
        int start = clamp(centerLine - r, 1, total);
        int end = clamp(centerLine + r, 1, total);

        StringBuilder sb = new StringBuilder();
        for (int line = start; line <= end; line++) {
            if (line > start) {
                sb.append('\n');
            }
            sb.append(String.format("%6d: %s", line, lines.get(line - 1)));
        }
        String rangeText = (start != end) ? "第" + start + "-" + end + "行" : "第" + start + "行";
        return new LineExcerpt(start, end, rangeText, sb.toString());
    }

    /**
     * 单行预览：去掉首尾空白，超过 140 个字符时截断并追加 “…”。
     */
    public static String rawPreview(List<String> lines, int line) {
        if (lines == null || line < 1 || line > lines.size()) {
            return "";
        }
        String raw = lines.get(line - 1).strip();
        if (raw.length() > RAW_PREVIEW_MAX_CHARS) {
            return raw.substring(0, RAW_PREVIEW_MAX_CHARS) + "…";
        }
        return raw;
    }

    private static int clamp(int value, int lo, int hi) {
        return Math.max(lo, Math.min(hi, value));
    }
}
