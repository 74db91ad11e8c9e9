package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.AddressSummary;
import org.gcodecheck.gcode.model.CheckResult;
import org.gcodecheck.gcode.model.CheckStatus;
import org.gcodecheck.gcode.model.LinePosition;
import org.gcodecheck.gcode.model.TokenMatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * 各检查项的判定逻辑。
 * <p>
 * 每个方法只依赖传入的 {@link MaskedProgram}，不持有任何可变状态；“未找到”是正常结果（MISSING），不会抛异常。
 */
public final class RuleEvaluators {

    public static final List<String> DECLARATION_TOKENS = List.of("G17", "G40", "G49", "G80", "G90");

    static final int HOME_LOOKAHEAD_LINES = 3;
    static final double ZERO_TOLERANCE = 1e-6;

    private static final String DECL_LABEL = "声明码检查（G17 G40 G49 G80 G90）";
    private static final String HOME_LABEL = "回零检查（G91 G28 Z0.0）";
    private static final String SPINDLE_LABEL = "主轴正转检查（M03）";

    private RuleEvaluators() {
    }

    /**
     * 声明码检查：G17/G40/G49/G80/G90 必须全部出现。
     * <p>
     * 优先寻找“同一行包含全部声明码”的行；找不到时（分散于多行）仍判定通过，定位到最早出现的声明码。
     */
    public static CheckResult declaration(MaskedProgram program) {
        List<String> missing = new ArrayList<>();
        for (String token : DECLARATION_TOKENS) {
            if (!TokenScanner.containsToken(program.masked(), token)) {
                missing.add(token);
            }
        }
        if (!missing.isEmpty()) {
            return CheckResult.unanchored("DECL", DECL_LABEL, "声明码", CheckStatus.MISSING,
                    "缺少：" + String.join(", ", missing));
        }

        for (int i = 0; i < program.lineCount(); i++) {
            String maskedLine = program.maskedLine(i);
            if (DECLARATION_TOKENS.stream().allMatch(t -> TokenScanner.lineHasToken(maskedLine, t))) {
                int offset = program.lines().get(i).start();
                LinePosition pos = program.index().toLineCol(offset);
                String evidence = "同一行声明：第" + pos.line() + "行 | " + program.originalLine(i).strip();
                return CheckResult.anchored("DECL", DECL_LABEL, "声明码", CheckStatus.OK, evidence, offset, pos);
            }
        }

        TokenMatch first = null;
        String firstToken = null;
        for (String token : DECLARATION_TOKENS) {
            Optional<TokenMatch> match = TokenScanner.findToken(program.masked(), token, program.index());
            if (match.isPresent() && (first == null || match.get().offset() < first.offset())) {
                first = match.get();
                firstToken = token;
            }
        }
        // 前面已确认全部存在，first 不会为 null
        String evidence = "分散于多行（仍通过）。首次出现：" + firstToken + "@第" + first.position().line() + "行";
        return CheckResult.anchored("DECL", DECL_LABEL, "声明码", CheckStatus.OK, evidence, first.offset(), first.position());
    }

    /**
     * 回零检查：G91 + G28 + Z0.0。
     * <ol>
     *   <li>同一行同时包含 G91、G28 与 Z0 → 通过。</li>
     *   <li>某行包含 G91 与 G28，且其后 3 行内出现 Z0 → 通过（定位到 G91/G28 行）。</li>
     *   <li>否则缺少。</li>
     * </ol>
     */
    public static CheckResult homeReturn(MaskedProgram program) {
        for (int i = 0; i < program.lineCount(); i++) {
            String maskedLine = program.maskedLine(i);
            if (hasHomeCodes(maskedLine) && isZeroZ(maskedLine)) {
                int offset = program.lines().get(i).start();
                LinePosition pos = program.index().toLineCol(offset);
                String evidence = "同行命中：第" + pos.line() + "行 | " + program.originalLine(i).strip();
                return CheckResult.anchored("HOME", HOME_LABEL, "安全回零", CheckStatus.OK, evidence, offset, pos);
            }
        }

        for (int i = 0; i < program.lineCount(); i++) {
            if (!hasHomeCodes(program.maskedLine(i))) {
                continue;
            }
            int last = Math.min(i + HOME_LOOKAHEAD_LINES, program.lineCount() - 1);
            for (int j = i + 1; j <= last; j++) {
                if (isZeroZ(program.maskedLine(j))) {
                    int offset = program.lines().get(i).start();
                    LinePosition pos = program.index().toLineCol(offset);
                    String evidence = "跨行命中：第" + pos.line() + "行（G91/G28） + 第" + (j + 1) + "行（Z0.0）";
                    return CheckResult.anchored("HOME", HOME_LABEL, "安全回零", CheckStatus.OK, evidence, offset, pos);
                }
            }
        }

        return CheckResult.unanchored("HOME", HOME_LABEL, "安全回零", CheckStatus.MISSING,
                "未找到同一行或相邻行组合（G91 + G28 + Z0.0）");
    }

    /**
     * 主轴正转检查：优先找 M03，找不到再找别名 M3。
     */
    public static CheckResult spindle(MaskedProgram program) {
        String used = "M03";
        Optional<TokenMatch> match = TokenScanner.findToken(program.masked(), used, program.index());
        if (match.isEmpty()) {
            used = "M3";
            match = TokenScanner.findToken(program.masked(), used, program.index());
        }
        if (match.isEmpty()) {
            return CheckResult.unanchored("M03", SPINDLE_LABEL, "主轴", CheckStatus.MISSING, "未找到 M03（或 M3）");
        }
        TokenMatch m = match.get();
        String evidence = "命中：" + used + "｜第" + m.position().line() + "行，第" + m.position().column() + "列";
        return CheckResult.anchored("M03", SPINDLE_LABEL, "主轴", CheckStatus.OK, evidence, m.offset(), m.position());
    }

    public static CheckResult quickToken(MaskedProgram program, String token) {
        Optional<TokenMatch> match = TokenScanner.findToken(program.masked(), token, program.index());
        if (match.isEmpty()) {
            return CheckResult.unanchored(token, token, "G码", CheckStatus.MISSING, "");
        }
        TokenMatch m = match.get();
        String evidence = "第" + m.position().line() + "行，第" + m.position().column() + "列";
        return CheckResult.anchored(token, token, "G码", CheckStatus.OK, evidence, m.offset(), m.position());
    }

    public static CheckResult addressPresence(MaskedProgram program, char letter) {
        AddressSummary summary = AddressCollector.collect(program.masked(), letter);
        return addressPresence(program, summary);
    }

    static CheckResult addressPresence(MaskedProgram program, AddressSummary summary) {
        String id = String.valueOf(summary.letter());
        String label = summary.letter() + " 号";
        if (summary.isEmpty()) {
            return CheckResult.unanchored(id, label, "地址码", CheckStatus.MISSING, "");
        }
        String evidence = "找到：" + String.join(", ", summary.labels()) + "（共" + summary.values().size() + "个）";
        LinePosition pos = program.index().toLineCol(summary.firstOffset());
        evidence += "｜首次：第" + pos.line() + "行，第" + pos.column() + "列";
        return CheckResult.anchored(id, label, "地址码", CheckStatus.OK, evidence, summary.firstOffset(), pos);
    }

    private static boolean hasHomeCodes(String maskedLine) {
        return TokenScanner.lineHasToken(maskedLine, "G91") && TokenScanner.lineHasToken(maskedLine, "G28");
    }

    private static boolean isZeroZ(String maskedLine) {
        OptionalDouble z = TokenScanner.extractZ(maskedLine);
        return z.isPresent() && Math.abs(z.getAsDouble()) <= ZERO_TOLERANCE;
    }
}
