package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.VshellException;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.NavigableSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 内存工作区
 * <p>
 * 文件保存在有序 Map 中，目录单独记录；根目录 '/' 始终存在。
 * 写文件时自动补齐祖先目录。
 */
public class InMemoryWorkspaceProvider implements WorkspaceProvider {

    private final NavigableMap<String, String> files = new TreeMap<>();
    private final NavigableSet<String> directories = new TreeSet<>();

    public InMemoryWorkspaceProvider() {
        directories.add(PathValidator.ROOT);
    }

    /**
     * @param seed 初始文件，键为存储路径或相对路径
     */
    public InMemoryWorkspaceProvider(Map<String, String> seed) {
        this();
        seed.forEach(this::putFile);
    }

    @Override
    public Mono<String> read(String path) {
        return Mono.fromCallable(() -> {
            synchronized (this) {
                return files.get(normalize(path));
            }
        });
    }

    @Override
    public Mono<Void> write(String path, String content) {
        return Mono.fromRunnable(() -> putFile(path, content));
    }

    @Override
    public Mono<Boolean> delete(String path) {
        return Mono.fromCallable(() -> {
            String key = normalize(path);
            synchronized (this) {
                if (files.remove(key) != null) {
                    return true;
                }
                if (!directories.contains(key)) {
                    return false;
                }
                String prefix = childPrefix(key);
                // 下界不含 prefix 本身：根目录的 prefix 就是 "/"
                files.subMap(prefix, false, prefix + Character.MAX_VALUE, true).clear();
                directories.subSet(prefix, false, prefix + Character.MAX_VALUE, true).clear();
                if (!PathValidator.ROOT.equals(key)) {
                    directories.remove(key);
                }
                return true;
            }
        });
    }

    @Override
    public Mono<Boolean> exists(String path) {
        return Mono.fromCallable(() -> {
            String key = normalize(path);
            synchronized (this) {
                return files.containsKey(key) || directories.contains(key);
            }
        });
    }

    @Override
    public Mono<List<String>> list(String path) {
        return Mono.fromCallable(() -> {
            String key = normalize(path);
            synchronized (this) {
                if (!directories.contains(key)) {
                    return List.of();
                }
                String prefix = childPrefix(key);
                NavigableSet<String> names = new TreeSet<>();
                for (String dir : directories.subSet(prefix, false, prefix + Character.MAX_VALUE, true)) {
                    String rest = dir.substring(prefix.length());
                    if (!rest.contains("/")) {
                        names.add(rest + "/");
                    }
                }
                for (String file : files.subMap(prefix, true, prefix + Character.MAX_VALUE, true).keySet()) {
                    String rest = file.substring(prefix.length());
                    if (!rest.contains("/")) {
                        names.add(rest);
                    }
                }
                return new ArrayList<>(names);
            }
        });
    }

    @Override
    public Mono<List<String>> glob(String pattern) {
        return Mono.fromCallable(() -> {
            String normalized = pattern.startsWith("/") ? pattern : "/" + pattern;
            NavigableSet<String> matched = new TreeSet<>();
            synchronized (this) {
                for (String file : files.keySet()) {
                    if (GlobMatcher.matches(file, normalized)) {
                        matched.add(file);
                    }
                }
                for (String dir : directories) {
                    if (!PathValidator.ROOT.equals(dir) && GlobMatcher.matches(dir, normalized)) {
                        matched.add(dir);
                    }
                }
            }
            return new ArrayList<>(matched);
        });
    }

    @Override
    public Mono<Void> mkdir(String path) {
        return Mono.fromRunnable(() -> {
            String key = normalize(path);
            synchronized (this) {
                if (files.containsKey(key)) {
                    throw new VshellException(PathValidator.toRelative(key) + ": File exists");
                }
                addDirectories(key);
            }
        });
    }

    @Override
    public Mono<Boolean> isDirectory(String path) {
        return Mono.fromCallable(() -> {
            String key = normalize(path);
            synchronized (this) {
                return directories.contains(key);
            }
        });
    }

    @Override
    public Mono<Long> size(String path) {
        return read(path).map(content -> (long) content.getBytes(StandardCharsets.UTF_8).length);
    }

    private synchronized void putFile(String path, String content) {
        String key = normalize(path);
        if (directories.contains(key)) {
            throw new VshellException(PathValidator.toRelative(key) + ": Is a directory");
        }
        int slash = key.lastIndexOf('/');
        if (slash > 0) {
            addDirectories(key.substring(0, slash));
        }
        files.put(key, content == null ? "" : content);
    }

    private void addDirectories(String dir) {
        int index = 0;
        while ((index = dir.indexOf('/', index + 1)) > 0) {
            addDirectory(dir.substring(0, index));
        }
        addDirectory(dir);
    }

    private void addDirectory(String dir) {
        if (files.containsKey(dir)) {
            throw new VshellException(PathValidator.toRelative(dir) + ": Not a directory");
        }
        directories.add(dir);
    }

    private static String childPrefix(String dir) {
        return PathValidator.ROOT.equals(dir) ? dir : dir + "/";
    }

    /**
     * 规范化存储键：补齐前导 '/'，合并连续 '/'，去掉末尾 '/'
     */
    static String normalize(String path) {
        String key = path.startsWith("/") ? path : "/" + path;
        key = key.replaceAll("/{2,}", "/");
        if (key.length() > 1 && key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }
}
