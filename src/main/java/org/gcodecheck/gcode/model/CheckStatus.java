package org.gcodecheck.gcode.model;

/**
 * 检查状态。
 * <p>
 * 引擎内部只会产生 {@link #OK}/{@link #MISSING}；{@link #ERROR} 留给外层（读档失败等）。
 */
public enum CheckStatus {
    OK("通过"),
    MISSING("缺少"),
    ERROR("错误");

    private final String displayName;

    CheckStatus(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
