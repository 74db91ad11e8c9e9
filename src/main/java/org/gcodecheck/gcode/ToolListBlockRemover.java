package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.ToolListRemoval;

import java.util.List;
import java.util.regex.Pattern;

/**
 * 移除 {@code (TOOL LIST)} 注释区块。
 * <p>
 * 以标题行为中心，向上、向下扩展连续的“整行注释/空行”，整段移除。
 * 如果区块后紧跟一行 G00 定位（带 S 转速或 M03/M3，且带 X/Y 坐标），视为换刀后的定位行一并移除。
 * 多个区块在一次从前往后的扫描中分别处理。
 */
public final class ToolListBlockRemover {

    // 字母之间允许空白，例如 "( T O O L  L I S T )"
    private static final Pattern TOOL_LIST_TITLE = Pattern.compile(
            "\\(\\s*T\\s*O\\s*O\\s*L\\s*L\\s*I\\s*S\\s*T\\s*\\)",
            Pattern.CASE_INSENSITIVE
    );

    private ToolListBlockRemover() {
    }

    public static ToolListRemoval remove(String text) {
        String source = (text == null) ? "" : text;
        List<ProgramLines.Span> spans = ProgramLines.split(source);
        int n = spans.size();
        boolean[] remove = new boolean[n];
        int blocks = 0;
        int removedLines = 0;

        int i = 0;
        while (i < n) {
            if (!TOOL_LIST_TITLE.matcher(spans.get(i).of(source)).find()) {
                i++;
                continue;
            }

            int start = i;
            for (int j = i - 1; j >= 0 && isPadding(spans.get(j).of(source)); j--) {
                start = j;
            }
            int end = i + 1;
            while (end < n && isPadding(spans.get(end).of(source))) {
                end++;
            }

            for (int k = start; k < end; k++) {
                if (!remove[k]) {
                    remove[k] = true;
                    removedLines++;
                }
            }
            blocks++;

            if (end < n && isToolChangePositioning(spans.get(end).of(source))) {
                if (!remove[end]) {
                    remove[end] = true;
                    removedLines++;
                }
                end++;
            }
            i = end;
        }

        if (blocks == 0) {
            return new ToolListRemoval(source, 0, 0);
        }
        StringBuilder out = new StringBuilder(source.length());
        for (int k = 0; k < n; k++) {
            if (!remove[k]) {
                out.append(spans.get(k).of(source));
            }
        }
        return new ToolListRemoval(out.toString(), blocks, removedLines);
    }

    static boolean isCommentLine(String line) {
        String s = line.strip();
        return s.startsWith("(") && s.endsWith(")");
    }

    static boolean isBlank(String line) {
        return line.isBlank();
    }

    /**
     * 区块后的定位行：G00 + 主轴（S 号或 M03/M3）+ X/Y 坐标。
     */
    static boolean isToolChangePositioning(String line) {
        String masked = CommentMasker.mask(line);
        if (!TokenScanner.lineHasToken(masked, "G00")) {
            return false;
        }
        boolean spindle = TokenScanner.lineHasAddress(masked, 'S')
                || TokenScanner.lineHasToken(masked, "M03")
                || TokenScanner.lineHasToken(masked, "M3");
        boolean xy = TokenScanner.lineHasCoordinate(masked, 'X') || TokenScanner.lineHasCoordinate(masked, 'Y');
        return spindle && xy;
    }

    private static boolean isPadding(String line) {
        return isCommentLine(line) || isBlank(line);
    }
}
