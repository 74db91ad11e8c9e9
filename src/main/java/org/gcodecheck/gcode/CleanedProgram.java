package org.gcodecheck.gcode;

import org.gcodecheck.gcode.model.ToolListRemoval;
import org.gcodecheck.gcode.model.TrimOutcome;

/**
 * 修正版程序：路径删除 + TOOL LIST 移除之后的结果。
 *
 * @param text     最终文本
 * @param trim     路径删除结果
 * @param toolList TOOL LIST 移除结果
 */
public record CleanedProgram(String text, TrimOutcome trim, ToolListRemoval toolList) {

    public boolean changed(String original) {
        return !text.equals(original);
    }
}
