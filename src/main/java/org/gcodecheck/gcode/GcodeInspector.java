package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.AddressSummary;
import org.gcodecheck.gcode.model.CheckResult;

import java.util.ArrayList;
import java.util.List;

/**
 * 检查入口：遮罩一次、建索引一次，然后依次执行各检查项。
 */
public final class GcodeInspector {

    private GcodeInspector() {
    }

    public static InspectionReport inspect(String text, CheckOptions options) {
        return inspect(MaskedProgram.of(text), options);
    }

    public static InspectionReport inspect(MaskedProgram program, CheckOptions options) {
        CheckOptions resolved = (options == null) ? CheckOptions.defaults() : options;

        List<CheckResult> results = new ArrayList<>();
        results.add(RuleEvaluators.declaration(program));
        results.add(RuleEvaluators.homeReturn(program));
        results.add(RuleEvaluators.spindle(program));
        for (String token : resolved.tokens()) {
            results.add(RuleEvaluators.quickToken(program, token));
        }

        AddressSummary toolNumbers = null;
        if (resolved.checkToolNumbers()) {
            toolNumbers = AddressCollector.collect(program.masked(), 'T');
            results.add(RuleEvaluators.addressPresence(program, toolNumbers));
        }
        AddressSummary lengthOffsets = null;
        if (resolved.checkLengthOffsets()) {
            lengthOffsets = AddressCollector.collect(program.masked(), 'H');
            results.add(RuleEvaluators.addressPresence(program, lengthOffsets));
        }
        return new InspectionReport(List.copyOf(results), toolNumbers, lengthOffsets);
    }
}
