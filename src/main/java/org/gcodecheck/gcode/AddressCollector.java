package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.AddressSummary;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Map;
import java.util.TreeMap;
import java.util.regex.Matcher;

/**
 * 地址码收集器：找出某个地址字母（例如 T、H）在程序中出现过的所有编号。
 */
public final class AddressCollector {

    private AddressCollector() {
    }

    public static AddressSummary collect(String maskedText, char letter) {
        char upper = Character.toUpperCase(letter);
        // key 用 BigInteger，超长数字串也能按数值排序
        Map<BigInteger, String> seen = new TreeMap<>();
        Integer firstOffset = null;

        Matcher m = TokenScanner.addressPattern(upper).matcher(maskedText);
        while (m.find()) {
            String digits = m.group(1);
            seen.putIfAbsent(new BigInteger(digits), digits);
            if (firstOffset == null || m.start() < firstOffset) {
                firstOffset = m.start();
            }
        }
        return new AddressSummary(upper, new ArrayList<>(seen.values()), firstOffset);
    }
}
