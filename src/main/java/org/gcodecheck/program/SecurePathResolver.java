package org.gcodecheck.program;

import org.gcodecheck.program.dto.ProgramRoot;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * 安全路径解析器：把调用方传入的程序路径/输出路径解析成受控的绝对路径，并确保不会逃逸出根目录白名单。
 * <p>
 * 规则：
 * <ul>
 *   <li>相对路径：相对于 rootId 指定的根目录（rootId 为空时使用 root0）。</li>
 *   <li>绝对路径：rootId 为空时自动匹配层级最深的根目录。</li>
 *   <li>逐级校验已存在的目录链路的 realPath，防止 symlink/junction 把路径带出根目录。</li>
 *   <li>写出目标允许尚不存在，只校验已存在的父目录链路。</li>
 * </ul>
 */
public class SecurePathResolver {

    private final boolean allowSymlink;
    private final List<Root> roots;

    public SecurePathResolver(List<String> configuredRoots, boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
        this.roots = normalizeRoots(configuredRoots);
    }

    public List<ProgramRoot> listRoots() {
        List<ProgramRoot> result = new ArrayList<>(roots.size());
        for (Root root : roots) {
            result.add(new ProgramRoot(root.id(), root.path().toString()));
        }
        return result;
    }

    /**
     * 解析一个必须已存在的普通文件（待检查的程序）。
     */
    public ResolvedPath resolveProgram(String rootId, String inputPath) {
        if (inputPath == null || inputPath.isBlank()) {
            throw new IllegalArgumentException("参数错误：path 不能为空");
        }
        ResolvedPath resolved = resolve(rootId, inputPath, true);
        if (!Files.isRegularFile(resolved.absolutePath(), LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("不是普通文件：" + resolved.displayPath());
        }
        return resolved;
    }

    public ResolvedPath resolveForWrite(String rootId, String inputPath) {
        return resolve(rootId, inputPath, false);
    }

    public ResolvedPath resolve(String rootId, String inputPath, boolean requireExists) {
        if (roots.isEmpty()) {
            throw new IllegalStateException("未配置允许访问的根目录（app.gcode.roots）");
        }

        Path raw = (inputPath == null || inputPath.isBlank()) ? null : Path.of(inputPath.trim());
        Root root;
        Path absolute;
        if (raw != null && raw.isAbsolute()) {
            absolute = raw.normalize();
            root = isBlank(rootId) ? bestRootFor(absolute) : rootById(rootId);
        } else {
            root = isBlank(rootId) ? roots.get(0) : rootById(rootId);
            absolute = (raw == null) ? root.path() : root.path().resolve(raw).normalize();
        }

        // 字符串层面先挡掉明显的越界（例如 ../../etc/passwd）
        if (!absolute.startsWith(root.path())) {
            throw new IllegalArgumentException("路径不在允许访问的根目录范围内：" + inputPath);
        }
        if (requireExists && !Files.exists(absolute, LinkOption.NOFOLLOW_LINKS)) {
            throw new IllegalArgumentException("路径不存在：" + inputPath);
        }
        checkLinks(root, absolute);

        return new ResolvedPath(root.id(), root.path(), absolute, displayPath(root, absolute));
    }

    private void checkLinks(Root root, Path absolute) {
        Path rootReal;
        try {
            rootReal = root.path().toRealPath();
        } catch (IOException e) {
            throw new IllegalStateException("根目录不存在或无法解析：" + root.path(), e);
        }

        Path current = root.path();
        for (Path segment : root.path().relativize(absolute)) {
            current = current.resolve(segment);
            if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                // 之后的层级尚不存在（写出新文件），无需继续校验
                return;
            }
            if (!allowSymlink && Files.isSymbolicLink(current)) {
                throw new IllegalArgumentException("不允许访问符号链接路径：" + current);
            }
            try {
                if (!current.toRealPath().startsWith(rootReal)) {
                    throw new IllegalArgumentException("路径通过链接/junction 逃逸出根目录：" + current);
                }
            } catch (IOException e) {
                throw new IllegalArgumentException("路径无法解析：" + current, e);
            }
        }
    }

    private Root rootById(String rootId) {
        for (Root root : roots) {
            if (root.id().equals(rootId.trim())) {
                return root;
            }
        }
        throw new IllegalArgumentException("未知的 rootId：" + rootId);
    }

    private Root bestRootFor(Path absolute) {
        return roots.stream()
                .filter(r -> absolute.startsWith(r.path()))
                .max(Comparator.comparingInt(r -> r.path().getNameCount()))
                .orElseThrow(() -> new IllegalArgumentException("路径不在允许访问的根目录范围内：" + absolute));
    }

    private static List<Root> normalizeRoots(List<String> configured) {
        if (configured == null || configured.isEmpty()) {
            return List.of();
        }
        List<Root> result = new ArrayList<>(configured.size());
        for (int i = 0; i < configured.size(); i++) {
            String value = Objects.requireNonNull(configured.get(i), "配置项 app.gcode.roots[" + i + "] 不能为空");
            result.add(new Root("root" + i, Path.of(value).toAbsolutePath().normalize()));
        }
        return result;
    }

    private static String displayPath(Root root, Path absolute) {
        return root.path().relativize(absolute).toString().replace('\\', '/');
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private record Root(String id, Path path) {
    }

    public record ResolvedPath(String rootId, Path rootPath, Path absolutePath, String displayPath) {
    }
}
