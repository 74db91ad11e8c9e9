package org.gcodecheck.program.dto;

/**
 * 允许访问的根目录。
 *
 * @param id   根目录标识（root0、root1...）
 * @param path 绝对路径
 */
public record ProgramRoot(String id, String path) {
}
