package io.leavesfly.vshell.command;

import io.leavesfly.vshell.workspace.GlobMatcher;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 命令实现的公共工具方法
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CommandSupport {

    /**
     * 展开参数中的 glob 模式，无匹配的模式被丢弃，普通路径原样保留
     */
    public static Mono<List<String>> expandGlobs(WorkspaceProvider fs, List<String> paths) {
        return Flux.fromIterable(paths)
                .concatMap(path -> GlobMatcher.isGlob(path)
                        ? fs.glob(path).flatMapMany(Flux::fromIterable)
                        : Flux.just(path))
                .collectList();
    }

    /**
     * 依次读取文件
     */
    public static Mono<List<FileInput>> readAll(WorkspaceProvider fs, List<String> paths) {
        return Flux.fromIterable(paths)
                .concatMap(path -> read(fs, path))
                .collectList();
    }

    public static Mono<FileInput> read(WorkspaceProvider fs, String path) {
        return fs.read(path)
                .map(content -> FileInput.found(path, content))
                .switchIfEmpty(Mono.defer(() -> fs.isDirectory(path)
                        .map(directory -> FileInput.missing(path, directory))));
    }

    /**
     * 按 '\n' 切分，末尾换行不产生空行
     */
    public static List<String> splitLines(String content) {
        if (content == null || content.isEmpty()) {
            return new ArrayList<>();
        }
        List<String> lines = new ArrayList<>(Arrays.asList(content.split("\n", -1)));
        if (content.endsWith("\n")) {
            lines.remove(lines.size() - 1);
        }
        return lines;
    }

    /**
     * 每行追加换行符后拼接
     */
    public static String joinLines(List<String> lines) {
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        return sb.toString();
    }

    /**
     * 超长行截断并追加 "..."
     */
    public static String truncateLine(String line, int maxLength) {
        return line.length() > maxLength ? line.substring(0, maxLength) + "..." : line;
    }

    /**
     * 解析整数，失败时返回 null
     */
    public static Integer parseInt(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 判断是否为组合短选项（如 -rf），且仅包含允许的字母
     */
    public static boolean isFlagGroup(String arg, String allowed) {
        if (arg.length() < 2 || arg.charAt(0) != '-' || arg.charAt(1) == '-') {
            return false;
        }
        for (int i = 1; i < arg.length(); i++) {
            if (allowed.indexOf(arg.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }
}
