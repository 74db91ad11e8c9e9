package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.ToolListRemoval;
import org.gcodecheck.gcode.model.TrimOutcome;

/**
 * 生成修正版程序：先做路径删除，再对其输出移除 TOOL LIST 区块。
 * <p>
 * 两步必须按顺序执行：区块后“紧跟的定位行”是按路径删除后的行序判断的。
 */
public final class ProgramCleaner {

    private ProgramCleaner() {
    }

    public static CleanedProgram clean(String text) {
        TrimOutcome trim = ToolpathTrimmer.trim(MaskedProgram.of(text));
        ToolListRemoval toolList = ToolListBlockRemover.remove(trim.text());
        return new CleanedProgram(toolList.text(), trim, toolList);
    }
}
