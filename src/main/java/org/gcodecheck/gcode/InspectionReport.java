package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.AddressSummary;
import org.gcodecheck.gcode.model.CheckResult;
import org.gcodecheck.gcode.model.CheckStatus;

import java.util.List;

/**
 * 一次检查的完整输出。
 *
 * @param results     按固定顺序排列的检查结果（DECL、HOME、M03、可选代码、T、H）
 * @param toolNumbers T 号汇总（未勾选时为 null）
 * @param lengthOffsets H 号汇总（未勾选时为 null）
 */
public record InspectionReport(List<CheckResult> results, AddressSummary toolNumbers, AddressSummary lengthOffsets) {

    public long count(CheckStatus status) {
        return results.stream().filter(r -> r.status() == status).count();
    }

    public boolean passed() {
        return results.stream().allMatch(r -> r.status() == CheckStatus.OK);
    }
}
