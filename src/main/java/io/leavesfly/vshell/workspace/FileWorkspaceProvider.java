package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.PathViolationException;
import io.leavesfly.vshell.exception.VshellException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 磁盘工作区
 * <p>
 * 以本地目录为根，存储键 '/a/b' 映射到 root/a/b。
 * 文件 I/O 为阻塞操作，统一调度到 boundedElastic 线程池执行。
 */
@Slf4j
public class FileWorkspaceProvider implements WorkspaceProvider {

    @Getter
    private final Path root;

    /**
     * 解析符号链接后的根目录，用于越界检查
     */
    private final Path realRoot;

    public FileWorkspaceProvider(Path root) {
        this.root = root.toAbsolutePath().normalize();
        try {
            Files.createDirectories(this.root);
            this.realRoot = this.root.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to create workspace root: " + this.root, e);
        }
        log.debug("Workspace root: {}", this.root);
    }

    @Override
    public Mono<String> read(String path) {
        return blocking(() -> {
            Path file = toFile(path);
            if (!Files.isRegularFile(file)) {
                return null;
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        });
    }

    @Override
    public Mono<Void> write(String path, String content) {
        return blocking(() -> {
            Path file = toFile(path);
            if (Files.isDirectory(file)) {
                throw new VshellException(PathValidator.toRelative(path) + ": Is a directory");
            }
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, content == null ? "" : content, StandardCharsets.UTF_8);
            return null;
        }).then();
    }

    @Override
    public Mono<Boolean> delete(String path) {
        return blocking(() -> {
            Path target = toFile(path);
            if (!Files.exists(target)) {
                return false;
            }
            if (Files.isDirectory(target)) {
                List<Path> entries;
                try (Stream<Path> walk = Files.walk(target)) {
                    entries = walk.sorted(Comparator.reverseOrder()).collect(Collectors.toList());
                }
                for (Path entry : entries) {
                    if (!entry.equals(root)) {
                        Files.delete(entry);
                    }
                }
                return true;
            }
            Files.delete(target);
            return true;
        });
    }

    @Override
    public Mono<Boolean> exists(String path) {
        return blocking(() -> Files.exists(toFile(path)));
    }

    @Override
    public Mono<List<String>> list(String path) {
        return blocking(() -> {
            Path dir = toFile(path);
            if (!Files.isDirectory(dir)) {
                return List.<String>of();
            }
            try (Stream<Path> children = Files.list(dir)) {
                return children
                        .map(child -> child.getFileName().toString() + (Files.isDirectory(child) ? "/" : ""))
                        .sorted()
                        .collect(Collectors.toList());
            }
        });
    }

    @Override
    public Mono<List<String>> glob(String pattern) {
        return blocking(() -> {
            String normalized = pattern.startsWith("/") ? pattern : "/" + pattern;
            List<String> matched = new ArrayList<>();
            try (Stream<Path> walk = Files.walk(root)) {
                walk.filter(entry -> !entry.equals(root))
                        .map(this::toKey)
                        .filter(key -> GlobMatcher.matches(key, normalized))
                        .forEach(matched::add);
            }
            matched.sort(Comparator.naturalOrder());
            return matched;
        });
    }

    @Override
    public Mono<Void> mkdir(String path) {
        return blocking(() -> {
            Path dir = toFile(path);
            if (Files.isRegularFile(dir)) {
                throw new VshellException(PathValidator.toRelative(path) + ": File exists");
            }
            Files.createDirectories(dir);
            return null;
        }).then();
    }

    @Override
    public Mono<Boolean> isDirectory(String path) {
        return blocking(() -> Files.isDirectory(toFile(path)));
    }

    @Override
    public Mono<Long> size(String path) {
        return blocking(() -> {
            Path file = toFile(path);
            return Files.isRegularFile(file) ? Files.size(file) : null;
        });
    }

    /**
     * 存储键映射为磁盘路径，结果必须仍位于根目录之内
     * <p>
     * 对最深的已存在祖先解析符号链接，链接指向根目录之外时同样视为越界。
     */
    Path toFile(String path) {
        String relative = PathValidator.toRelative(path);
        Path resolved = root.resolve(relative).normalize();
        if (!resolved.startsWith(root)) {
            throw new PathViolationException(path, "Path escapes workspace root: " + path);
        }

        Path existing = resolved;
        while (existing != null && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing != null) {
            Path real;
            try {
                real = existing.toRealPath();
            } catch (IOException e) {
                // 悬空链接无法解析，写入时会落到未知位置
                log.debug("Failed to resolve {}: {}", existing, e.getMessage());
                throw new PathViolationException(path, "Path escapes workspace root: " + path);
            }
            if (!real.startsWith(realRoot)) {
                throw new PathViolationException(path, "Path escapes workspace root: " + path);
            }
        }
        return resolved;
    }

    private String toKey(Path entry) {
        StringBuilder key = new StringBuilder();
        for (Path segment : root.relativize(entry)) {
            key.append('/').append(segment);
        }
        return key.toString();
    }

    private static <T> Mono<T> blocking(Callable<T> action) {
        return Mono.fromCallable(() -> {
                    try {
                        return action.call();
                    } catch (IOException e) {
                        throw new UncheckedIOException(e);
                    }
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
