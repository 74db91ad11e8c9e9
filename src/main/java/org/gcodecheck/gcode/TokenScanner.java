package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.TokenMatch;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * G 码 token 扫描器（允许连写，例如 {@code G90Z.1}、{@code T01M06}）。
 * <p>
 * 边界规则：
 * <ul>
 *   <li>token 前面必须是文本开头，或不是字母/数字的字符（避免 {@code XG54} 之类误判）。</li>
 *   <li>token 后面必须是非数字或文本结尾（避免 {@code G54} 误判到 {@code G543}）。</li>
 * </ul>
 * 匹配不区分大小写；传入的文本应为遮罩后的文本（注释已被替换为空格）。
 */
public final class TokenScanner {

    private static final String BEFORE = "(?<![0-9A-Z])";
    private static final String AFTER = "(?![0-9])";
    private static final String DECIMAL = "[+-]?(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)";
    private static final int FLAGS = Pattern.CASE_INSENSITIVE | Pattern.MULTILINE;

    private static final Map<String, Pattern> TOKEN_PATTERNS = new ConcurrentHashMap<>();
    private static final Map<Character, Pattern> ADDRESS_PATTERNS = new ConcurrentHashMap<>();
    private static final Map<Character, Pattern> COORDINATE_PATTERNS = new ConcurrentHashMap<>();

    private TokenScanner() {
    }

    public static Pattern tokenPattern(String token) {
        return TOKEN_PATTERNS.computeIfAbsent(token.toUpperCase(Locale.ROOT),
                t -> Pattern.compile(BEFORE + Pattern.quote(t) + AFTER, FLAGS));
    }

    /**
     * 地址字母 + 数字串，数字串为第 1 组（例如 {@code T06} 的 {@code 06}）。
     */
    public static Pattern addressPattern(char letter) {
        return ADDRESS_PATTERNS.computeIfAbsent(Character.toUpperCase(letter),
                l -> Pattern.compile(BEFORE + l + "([0-9]+)" + AFTER, FLAGS));
    }

    /**
     * 坐标字母 + 带符号小数，数值为第 1 组（例如 {@code Z-.5}、{@code X10.}）。
     */
    public static Pattern coordinatePattern(char letter) {
        return COORDINATE_PATTERNS.computeIfAbsent(Character.toUpperCase(letter),
                l -> Pattern.compile(BEFORE + l + "(" + DECIMAL + ")" + AFTER, FLAGS));
    }

    public static Optional<TokenMatch> findToken(String maskedText, String token, LineIndex index) {
        Matcher m = tokenPattern(token).matcher(maskedText);
        if (!m.find()) {
            return Optional.empty();
        }
        return Optional.of(new TokenMatch(m.group(), m.start(), index.toLineCol(m.start())));
    }

    public static boolean containsToken(String maskedText, String token) {
        return tokenPattern(token).matcher(maskedText).find();
    }

    public static boolean lineHasToken(String line, String token) {
        return containsToken(line, token);
    }

    public static boolean lineHasAddress(String line, char letter) {
        return addressPattern(letter).matcher(line).find();
    }

    public static boolean lineHasCoordinate(String line, char letter) {
        return coordinatePattern(letter).matcher(line).find();
    }

    /**
     * 提取一行中第一个 Z 值；数值无法解析时视为“没有 Z 值”。
     */
    public static OptionalDouble extractZ(String line) {
        Matcher m = coordinatePattern('Z').matcher(line);
        if (!m.find()) {
            return OptionalDouble.empty();
        }
        try {
            return OptionalDouble.of(Double.parseDouble(m.group(1)));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }
}
