package org.gcodecheck.mcp;

import org.gcodecheck.gcode.CheckOptions;
import org.gcodecheck.gcode.CleanedProgram;
import org.gcodecheck.gcode.GcodeInspector;
import org.gcodecheck.gcode.InspectionReport;
import org.gcodecheck.gcode.LineExcerpts;
import org.gcodecheck.gcode.ProgramCleaner;
import org.gcodecheck.gcode.ProgramLines;
import org.gcodecheck.gcode.model.AddressSummary;
import org.gcodecheck.gcode.model.CheckResult;
import org.gcodecheck.gcode.model.CheckStatus;
import org.gcodecheck.gcode.model.LineExcerpt;
import org.gcodecheck.gcode.model.TrimOutcome;
import org.gcodecheck.program.GcodeServerProperties;
import org.gcodecheck.program.PendingProgramWriteStore;
import org.gcodecheck.program.ProgramFiles;
import org.gcodecheck.program.SecurePathResolver;
import org.gcodecheck.program.dto.CheckItem;
import org.gcodecheck.program.dto.CleanedProgramPrepareResult;
import org.gcodecheck.program.dto.ProgramCheckResult;
import org.gcodecheck.program.dto.ProgramRootsResult;
import org.gcodecheck.program.dto.ProgramWriteConfirmResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * G 码程序检查 MCP 工具集合。
 * <p>
 * 提供能力：
 * <ul>
 *   <li>列出根目录白名单（{@code gcode_list_roots}）。</li>
 *   <li>检查程序文件或内联文本（{@code gcode_check_program} / {@code gcode_check_text}）：
 *       声明码、回零、主轴正转三项必检，工件座标/刀长补正/T 号/H 号按需检查。</li>
 *   <li>另存修正版（{@code gcode_prepare_cleaned_program} -> {@code gcode_confirm_write} 两段式确认）：
 *       删除低于安全高度的多余路径，并移除 TOOL LIST 注释区块。</li>
 * </ul>
 * <p>
 * 检查结果只读，不会修改原程序；修正版只会写到确认过的输出路径。
 */
@Component
public class GcodeMcpTools {

    private static final Logger log = LoggerFactory.getLogger(GcodeMcpTools.class);

    private final GcodeServerProperties properties;
    private final SecurePathResolver pathResolver;
    private final PendingProgramWriteStore pendingWriteStore;

    public GcodeMcpTools(GcodeServerProperties properties, SecurePathResolver pathResolver, PendingProgramWriteStore pendingWriteStore) {
        this.properties = properties;
        this.pathResolver = pathResolver;
        this.pendingWriteStore = pendingWriteStore;
    }

    @Tool(
            name = "gcode_list_roots",
            description = "列出允许读取程序/写出修正版的根目录（rootId + path）。"
    )
    public ProgramRootsResult listRoots() {
        return new ProgramRootsResult(pathResolver.listRoots());
    }

    @Tool(
            name = "gcode_check_program",
            description = "检查 G 码程序文件：声明码（G17 G40 G49 G80 G90）、回零（G91 G28 Z0.0）、主轴正转（M03/M3）必检；"
                    + "可选检查 G54~G59、G43，以及列出 T 号/H 号。注释（括号与分号）内容不参与匹配。返回每项的状态、证据与原文节录。"
    )
    public ProgramCheckResult checkProgram(
            @ToolParam(required = false, description = "rootId（可从 gcode_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "程序文件路径（相对 rootId 或绝对路径；无扩展名也可）") String path,
            @ToolParam(required = false, description = "要检查的可选代码，取值 G54/G55/G56/G57/G58/G59/G43；不传时默认 [G54, G43]，传空数组则不检查可选代码") List<String> tokens,
            @ToolParam(required = false, description = "是否检查 T 号（默认 true）") Boolean checkToolNumbers,
            @ToolParam(required = false, description = "是否检查 H 号（默认 true）") Boolean checkLengthOffsets
    ) {
        CheckOptions options = resolveOptions(tokens, checkToolNumbers, checkLengthOffsets);
        SecurePathResolver.ResolvedPath resolved = pathResolver.resolveProgram(rootId, path);

        byte[] bytes = ProgramFiles.readAll(resolved.absolutePath(), properties.getReadMaxBytes().toBytes());
        ProgramFiles.DecodedText decoded = ProgramFiles.decode(bytes);
        List<String> warnings = new ArrayList<>();
        if (decoded.lossy()) {
            log.warn("程序无法按已知编码严格解码，已按 UTF-8 替换非法字节：{}", resolved.displayPath());
            warnings.add("文件不是 UTF-8/CP950/Big5/GB18030 中任何一种有效编码，已按 UTF-8 解码并替换非法字节。");
        }

        ProgramCheckResult result = buildCheckResult(
                resolved.rootId(), resolved.displayPath(), decoded.decodedWith(), (long) bytes.length,
                decoded.text(), options, warnings
        );
        log.info("检查完成：{}（编码 {}）缺少={} 错误={} 总计={}",
                resolved.displayPath(), decoded.decodedWith(), result.missingCount(), result.errorCount(), result.totalCount());
        return result;
    }

    @Tool(
            name = "gcode_check_text",
            description = "检查一段内联 G 码文本（规则与 gcode_check_program 相同），适合程序尚未保存为文件的场景。"
    )
    public ProgramCheckResult checkText(
            @ToolParam(description = "G 码程序文本") String content,
            @ToolParam(required = false, description = "要检查的可选代码，取值 G54/G55/G56/G57/G58/G59/G43；不传时默认 [G54, G43]，传空数组则不检查可选代码") List<String> tokens,
            @ToolParam(required = false, description = "是否检查 T 号（默认 true）") Boolean checkToolNumbers,
            @ToolParam(required = false, description = "是否检查 H 号（默认 true）") Boolean checkLengthOffsets
    ) {
        if (content == null) {
            throw new IllegalArgumentException("参数错误：content 不能为空");
        }
        CheckOptions options = resolveOptions(tokens, checkToolNumbers, checkLengthOffsets);
        return buildCheckResult(null, null, null, null, content, options, new ArrayList<>());
    }

    @Tool(
            name = "gcode_prepare_cleaned_program",
            description = "准备另存修正版（不直接写出）：删除绝对坐标下低于安全高度的多余路径（保留 G43/G54~G59/T/H/M06 行），"
                    + "再移除 (TOOL LIST) 注释区块；返回删除说明与 token，需再调用 gcode_confirm_write 才会写出。"
    )
    public CleanedProgramPrepareResult prepareCleanedProgram(
            @ToolParam(required = false, description = "rootId（可从 gcode_list_roots 获取；为空默认 root0）") String rootId,
            @ToolParam(description = "原程序文件路径（相对 rootId 或绝对路径）") String path,
            @ToolParam(required = false, description = "修正版输出路径；为空则写到原文件同目录，文件名为 <原名>_processed<扩展名>") String outputPath,
            @ToolParam(required = false, description = "输出文件已存在时是否覆盖（默认 false）") Boolean overwrite
    ) {
        if (!properties.isAllowWrite()) {
            throw new IllegalStateException("已禁止写出修正版：配置 app.gcode.allow-write=false");
        }
        SecurePathResolver.ResolvedPath source = pathResolver.resolveProgram(rootId, path);
        byte[] sourceBytes = ProgramFiles.readAll(source.absolutePath(), properties.getReadMaxBytes().toBytes());
        ProgramFiles.DecodedText decoded = ProgramFiles.decode(sourceBytes);

        SecurePathResolver.ResolvedPath output = resolveOutput(source, outputPath);
        Path target = output.absolutePath();
        if (target.equals(source.absolutePath())) {
            throw new IllegalArgumentException("输出路径不能与原程序相同：" + output.displayPath());
        }
        Path parent = target.getParent();
        if (parent == null || !Files.isDirectory(parent, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("输出目录不存在：" + output.displayPath());
        }

        List<String> warnings = new ArrayList<>();
        boolean overwriteResolved = Boolean.TRUE.equals(overwrite);
        boolean exists = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        if (exists) {
            if (Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new IllegalArgumentException("输出路径是目录：" + output.displayPath());
            }
            if (!overwriteResolved) {
                throw new IllegalArgumentException("输出文件已存在；请设置 overwrite=true 以覆盖：" + output.displayPath());
            }
            warnings.add("输出文件已存在，确认后将覆盖。");
        }

        CleanedProgram cleaned = ProgramCleaner.clean(decoded.text());
        TrimOutcome trim = cleaned.trim();
        if (decoded.lossy()) {
            warnings.add("原程序编码无法识别，已按 UTF-8 替换非法字节；修正版中对应字符可能已损坏。");
        }
        if (trim.status() == TrimOutcome.Status.UNTERMINATED) {
            warnings.add("路径删除未找到安全回升终点：删除起点之后的非关键行都已删除，请仔细核对修正版。");
        }
        if (!cleaned.changed(decoded.text())) {
            warnings.add("修正版与原程序内容相同（未找到可删除的路径或 TOOL LIST 区块）。");
        }

        String expectedSha256 = null;
        if (exists) {
            try {
                if (Files.size(target) <= properties.getHashMaxBytes().toBytes()) {
                    expectedSha256 = ProgramFiles.sha256Hex(target);
                } else {
                    warnings.add("现有输出文件过大，跳过 sha256 校验。");
                }
            } catch (IOException e) {
                warnings.add("计算现有输出文件 sha256 失败，跳过校验：" + e.getMessage());
            }
        }

        byte[] bytes = cleaned.text().getBytes(StandardCharsets.UTF_8);
        PendingProgramWriteStore.PendingProgramWrite pending = pendingWriteStore.create(
                output.rootId(),
                source.displayPath(),
                output.displayPath(),
                target,
                bytes,
                overwriteResolved,
                exists,
                expectedSha256
        );
        log.info("修正版已准备：{} -> {}；{}；TOOL LIST 区块={} 行={}",
                source.displayPath(), output.displayPath(), trim.message(),
                cleaned.toolList().blocksRemoved(), cleaned.toolList().linesRemoved());

        return new CleanedProgramPrepareResult(
                pending.token(),
                pending.rootId(),
                source.displayPath(),
                pending.displayPath(),
                exists,
                overwriteResolved,
                trim.status().name(),
                trim.message(),
                trim.startLine(),
                trim.endLine(),
                trim.removedLines(),
                cleaned.toolList().blocksRemoved(),
                cleaned.toolList().linesRemoved(),
                ProgramLines.split(decoded.text()).size(),
                ProgramLines.split(cleaned.text()).size(),
                bytes.length,
                expectedSha256,
                pending.newSha256(),
                pending.expiresAt(),
                warnings.isEmpty() ? null : warnings
        );
    }

    @Tool(
            name = "gcode_confirm_write",
            description = "确认或取消写出修正版：confirm=true 才会写出；confirm=false 则取消并丢弃 token。"
    )
    public ProgramWriteConfirmResult confirmWrite(
            @ToolParam(description = "gcode_prepare_cleaned_program 返回的 token") String token,
            @ToolParam(required = false, description = "是否确认写出（true 写出 / false 取消；默认 false）") Boolean confirm
    ) {
        PendingProgramWriteStore.PendingProgramWrite peek = pendingWriteStore.peek(token);
        if (peek == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }
        if (!Boolean.TRUE.equals(confirm)) {
            pendingWriteStore.take(token);
            log.info("已取消写出修正版：{} -> {}", peek.sourcePath(), peek.displayPath());
            return new ProgramWriteConfirmResult(
                    peek.token(), peek.rootId(), peek.sourcePath(), peek.displayPath(), false, false, 0, null, null,
                    List.of("已取消写出（confirm=false）")
            );
        }

        PendingProgramWriteStore.PendingProgramWrite pending = pendingWriteStore.take(token);
        if (pending == null) {
            throw new IllegalArgumentException("token 无效或已过期");
        }

        // 重新解析一次，确保输出路径仍在白名单内
        Path target = pathResolver.resolveForWrite(pending.rootId(), pending.targetFile().toString()).absolutePath();
        if (!properties.isAllowSymlink() && Files.isSymbolicLink(target)) {
            throw new IllegalArgumentException("不允许写入到符号链接目标路径：" + pending.displayPath());
        }

        List<String> warnings = new ArrayList<>();
        boolean existsNow = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
        if (pending.expectExists()) {
            if (!existsNow) {
                throw new IllegalStateException("确认失败：输出文件在 prepare 后被删除");
            }
            if (pending.expectedSha256() != null) {
                try {
                    if (!pending.expectedSha256().equalsIgnoreCase(ProgramFiles.sha256Hex(target))) {
                        throw new IllegalStateException("确认失败：输出文件内容已被修改（sha256 不一致）");
                    }
                } catch (IOException e) {
                    warnings.add("校验现有输出文件 sha256 失败，将继续执行：" + e.getMessage());
                }
            }
        } else if (existsNow) {
            throw new IllegalStateException("确认失败：输出文件在 prepare 后已被创建");
        }

        try {
            ProgramFiles.writeAtomically(target, pending.bytes(), pending.overwrite());
        } catch (IOException e) {
            throw new IllegalStateException("写出修正版失败：" + pending.displayPath(), e);
        }
        log.info("修正版已写出：{} -> {}（{} 字节）", pending.sourcePath(), pending.displayPath(), pending.bytes().length);

        return new ProgramWriteConfirmResult(
                pending.token(),
                pending.rootId(),
                pending.sourcePath(),
                pending.displayPath(),
                true,
                true,
                pending.bytes().length,
                pending.newSha256(),
                Instant.now(),
                warnings.isEmpty() ? null : warnings
        );
    }

    private ProgramCheckResult buildCheckResult(
            String rootId,
            String displayPath,
            String decodedWith,
            Long sizeBytes,
            String text,
            CheckOptions options,
            List<String> warnings
    ) {
        InspectionReport report = GcodeInspector.inspect(text, options);
        List<String> lines = ProgramLines.contents(text);
        if (lines.isEmpty()) {
            warnings.add("程序内容为空。");
        }

        List<CheckItem> items = new ArrayList<>(report.results().size());
        for (CheckResult r : report.results()) {
            items.add(toItem(r, lines));
        }
        return new ProgramCheckResult(
                rootId,
                displayPath,
                decodedWith,
                sizeBytes,
                lines.size(),
                report.passed(),
                report.count(CheckStatus.MISSING),
                report.count(CheckStatus.ERROR),
                items.size(),
                labelsOf(report.toolNumbers()),
                labelsOf(report.lengthOffsets()),
                items,
                warnings.isEmpty() ? null : warnings
        );
    }

    private CheckItem toItem(CheckResult r, List<String> lines) {
        LineExcerpt excerpt = r.hasAnchor()
                ? LineExcerpts.excerpt(lines, r.line(), properties.getExcerptRadius())
                : LineExcerpt.empty();
        String raw = r.hasAnchor() ? LineExcerpts.rawPreview(lines, r.line()) : "";
        return new CheckItem(
                r.id(),
                r.label(),
                r.category(),
                r.status().name(),
                r.status().displayName(),
                r.evidence(),
                r.offset(),
                r.line(),
                r.column(),
                excerpt.rangeText(),
                raw,
                excerpt.text()
        );
    }

    private SecurePathResolver.ResolvedPath resolveOutput(SecurePathResolver.ResolvedPath source, String outputPath) {
        if (outputPath != null && !outputPath.isBlank()) {
            return pathResolver.resolveForWrite(source.rootId(), outputPath);
        }
        String fileName = source.absolutePath().getFileName().toString();
        String processed = ProgramFiles.processedFileName(fileName, properties.getProcessedSuffix(), properties.getDefaultExtension());
        Path sibling = source.absolutePath().resolveSibling(processed);
        return pathResolver.resolveForWrite(source.rootId(), sibling.toString());
    }

    private static CheckOptions resolveOptions(List<String> tokens, Boolean checkToolNumbers, Boolean checkLengthOffsets) {
        CheckOptions defaults = CheckOptions.defaults();
        return new CheckOptions(
                (tokens == null) ? defaults.tokens() : tokens,
                (checkToolNumbers == null) ? defaults.checkToolNumbers() : checkToolNumbers,
                (checkLengthOffsets == null) ? defaults.checkLengthOffsets() : checkLengthOffsets
        );
    }

    private static List<String> labelsOf(AddressSummary summary) {
        return (summary == null) ? null : summary.labels();
    }
}
