package org.gcodecheck.program;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;

/**
 * G 码检查 MCP Server 的业务配置（{@code app.gcode.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取程序/写出修正版的根目录白名单。</li>
 *   <li>通过 {@link #readMaxBytes} 限制单个程序的大小；程序不完整时无法可靠检查，因此超限直接拒绝而不是截断。</li>
 *   <li>修正版写入走“两段式确认”，暂存内容受 {@link #pendingWriteMaxBytes} 与 {@link #pendingWriteTtl} 限制。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.gcode")
public class GcodeServerProperties {

    /**
     * 允许访问的根目录白名单（自动分配 rootId：root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 单个程序文件允许读取的最大字节数。
     */
    @NotNull
    private DataSize readMaxBytes = DataSize.ofMegabytes(16);

    /**
     * 检查结果节录：以定位行为中心，前后各取多少行。
     */
    @Min(0)
    @Max(50)
    private int excerptRadius = 2;

    /**
     * 修正版默认文件名后缀（插在扩展名之前），例如 {@code part_processed.nc}。
     */
    @NotBlank
    private String processedSuffix = "_processed";

    /**
     * 原文件没有扩展名时，修正版使用的扩展名。
     */
    @NotBlank
    private String defaultExtension = ".nc";

    /**
     * 在 prepare 阶段对“已存在目标文件”计算 sha256 的最大文件大小。
     */
    @NotNull
    private DataSize hashMaxBytes = DataSize.ofMegabytes(32);

    /**
     * 单次待写入内容的最大字节数（prepare 阶段内容暂存在内存中）。
     */
    @NotNull
    private DataSize pendingWriteMaxBytes = DataSize.ofMegabytes(32);

    /**
     * 待写入 token 的有效期。
     */
    @NotNull
    private Duration pendingWriteTtl = Duration.ofMinutes(10);

    /**
     * 是否允许写出修正版。
     */
    private boolean allowWrite = true;

    /**
     * 是否允许访问符号链接（默认不允许，防止路径逃逸）。
     */
    private boolean allowSymlink = false;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public DataSize getReadMaxBytes() {
        return readMaxBytes;
    }

    public void setReadMaxBytes(DataSize readMaxBytes) {
        this.readMaxBytes = readMaxBytes;
    }

    public int getExcerptRadius() {
        return excerptRadius;
    }

    public void setExcerptRadius(int excerptRadius) {
        this.excerptRadius = excerptRadius;
    }

    public String getProcessedSuffix() {
        return processedSuffix;
    }

    public void setProcessedSuffix(String processedSuffix) {
        this.processedSuffix = processedSuffix;
    }

    public String getDefaultExtension() {
        return defaultExtension;
    }

    public void setDefaultExtension(String defaultExtension) {
        this.defaultExtension = defaultExtension;
    }

    public DataSize getHashMaxBytes() {
        return hashMaxBytes;
    }

    public void setHashMaxBytes(DataSize hashMaxBytes) {
        this.hashMaxBytes = hashMaxBytes;
    }

    public DataSize getPendingWriteMaxBytes() {
        return pendingWriteMaxBytes;
    }

    public void setPendingWriteMaxBytes(DataSize pendingWriteMaxBytes) {
        this.pendingWriteMaxBytes = pendingWriteMaxBytes;
    }

    public Duration getPendingWriteTtl() {
        return pendingWriteTtl;
    }

    public void setPendingWriteTtl(Duration pendingWriteTtl) {
        this.pendingWriteTtl = pendingWriteTtl;
    }

    public boolean isAllowWrite() {
        return allowWrite;
    }

    public void setAllowWrite(boolean allowWrite) {
        this.allowWrite = allowWrite;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }
}
