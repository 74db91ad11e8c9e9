package org.gcodecheck.program.dto;

import java.util.List;

/**
 * {@code gcode_list_roots} 的返回结果。
 *
 * @param roots 根目录白名单
 */
public record ProgramRootsResult(List<ProgramRoot> roots) {
}
