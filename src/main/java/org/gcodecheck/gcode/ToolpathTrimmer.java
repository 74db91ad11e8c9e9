package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.TrimOutcome;

import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * 路径删除：逐行状态机，删掉一段“绝对坐标下、低于安全高度”的移动，同时保留关键代码。
 * <p>
 * 进入条件（不在删除中）：
 * <ol>
 *   <li>G90 且 Z &lt;= 0.1，且该行没有 G28/G53 → 开始删除（该行删除）。</li>
 *   <li>尚未记录过起点、G90 且 Z &lt; 10.0，且没有 G28/G53 → 开始删除，并视为已下探到安全高度以下（只触发一次）。</li>
 * </ol>
 * 删除中：
 * <ul>
 *   <li>已下探过、当前为 G00 且 Z &gt;= 10.0 → 停止删除，该行保留。</li>
 *   <li>包含工件座标（G54~G59）、刀长补正（G43）、T/H 号、换刀（M06/M6）的行保留，但不结束删除。</li>
 *   <li>其余行删除。</li>
 * </ul>
 * 模式（G90/G91、G00~G03）在判定前先按本行内容更新。
 */
public final class ToolpathTrimmer {

    static final double START_Z_MAX = 0.1;
    static final double SAFE_Z_MIN = 10.0;
    static final double EPS = 1e-12;

    private static final Pattern IMPORTANT_KEEP = Pattern.compile(
            "(?<![0-9A-Z])(G43|G54|G55|G56|G57|G58|G59|T[0-9]+|H[0-9]+|M0?6)(?![0-9])",
            Pattern.CASE_INSENSITIVE
    );

    private enum Positioning { UNSET, ABSOLUTE, INCREMENTAL }

    private enum Motion { UNSET, RAPID, LINEAR, ARC_CW, ARC_CCW }

    private ToolpathTrimmer() {
    }

    public static TrimOutcome trim(String text) {
        return trim(MaskedProgram.of(text));
    }

    public static TrimOutcome trim(MaskedProgram program) {
        Positioning positioning = Positioning.UNSET;
        Motion motion = Motion.UNSET;

        boolean trimming = false;
        boolean sawBelowSafe = false;
        boolean startRecorded = false;
        Integer startLine = null;
        Integer endLine = null;
        int removed = 0;

        StringBuilder out = new StringBuilder(program.original().length());

        for (int i = 0; i < program.lineCount(); i++) {
            String original = program.originalLine(i);
            String masked = program.maskedLine(i);

            positioning = updatePositioning(positioning, masked);
            motion = updateMotion(motion, masked);

            OptionalDouble z = TokenScanner.extractZ(masked);
            boolean absolute = positioning == Positioning.ABSOLUTE;
            boolean guarded = TokenScanner.lineHasToken(masked, "G28") || TokenScanner.lineHasToken(masked, "G53");

            if (!trimming && absolute && z.isPresent() && z.getAsDouble() <= START_Z_MAX + EPS && !guarded) {
                trimming = true;
                startRecorded = true;
                startLine = i + 1;
                // 再次进入删除：终点以最新一段为准
                endLine = null;
                removed++;
                continue;
            }

            if (!trimming && !startRecorded && absolute && z.isPresent() && z.getAsDouble() < SAFE_Z_MIN - EPS && !guarded) {
                trimming = true;
                startRecorded = true;
                startLine = i + 1;
                sawBelowSafe = true;
                removed++;
                continue;
            }

            if (trimming) {
                if (z.isPresent() && z.getAsDouble() < SAFE_Z_MIN - EPS) {
                    sawBelowSafe = true;
                }
                if (sawBelowSafe && motion == Motion.RAPID && z.isPresent() && z.getAsDouble() >= SAFE_Z_MIN - EPS) {
                    trimming = false;
                    endLine = i + 1;
                    out.append(original);
                    continue;
                }
                if (IMPORTANT_KEEP.matcher(masked).find()) {
                    out.append(original);
                    continue;
                }
                removed++;
                continue;
            }

            out.append(original);
        }

        if (!startRecorded) {
            return new TrimOutcome(program.original(), TrimOutcome.Status.NO_START, null, null, 0, "未找到删除起点");
        }
        if (endLine == null) {
            return new TrimOutcome(out.toString(), TrimOutcome.Status.UNTERMINATED, startLine, null, removed,
                    "已从第" + startLine + "行开始删除，但未找到安全回升终点。删除行数=" + removed);
        }
        return new TrimOutcome(out.toString(), TrimOutcome.Status.COMPLETED, startLine, endLine, removed,
                "删除完成：第" + startLine + "行起删除，至第" + endLine + "行停止（保留该行）。删除行数=" + removed);
    }

    private static Positioning updatePositioning(Positioning current, String masked) {
        if (TokenScanner.lineHasToken(masked, "G90")) {
            return Positioning.ABSOLUTE;
        }
        if (TokenScanner.lineHasToken(masked, "G91")) {
            return Positioning.INCREMENTAL;
        }
        return current;
    }

    private static Motion updateMotion(Motion current, String masked) {
        if (TokenScanner.lineHasToken(masked, "G00")) {
            return Motion.RAPID;
        }
        if (TokenScanner.lineHasToken(masked, "G01")) {
            return Motion.LINEAR;
        }
        if (TokenScanner.lineHasToken(masked, "G02")) {
            return Motion.ARC_CW;
        }
        if (TokenScanner.lineHasToken(masked, "G03")) {
            return Motion.ARC_CCW;
        }
        return current;
    }
}
