package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.PathViolationException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import lombok.Value;

/**
 * 工作区路径校验器
 * <p>
 * 所有工作区路径必须是相对路径，规则依次为：
 * <ol>
 *   <li>'.' 与空串映射为根 '/'</li>
 *   <li>去掉开头的 './'</li>
 *   <li>拒绝以 '/' 开头的绝对路径，并提示对应的相对路径</li>
 *   <li>拒绝包含 '..' 段的路径</li>
 *   <li>合法路径加上 '/' 前缀作为存储键</li>
 * </ol>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class PathValidator {

    public static final String ROOT = "/";

    /**
     * 校验结果：error 非空表示路径非法
     */
    @Value
    public static class Result {
        String fsPath;
        String error;

        public boolean isValid() {
            return error == null;
        }
    }

    /**
     * 校验并规范化路径
     *
     * @param path 调用方书写的路径
     * @return 校验结果
     */
    public static Result validate(String path) {
        if (path == null || path.isEmpty() || ".".equals(path)) {
            return new Result(ROOT, null);
        }

        String cleaned = path.startsWith("./") ? path.substring(2) : path;

        if (cleaned.startsWith("/")) {
            String suggestion = cleaned.substring(1);
            if (suggestion.isEmpty()) {
                suggestion = ".";
            }
            return new Result("", String.format(
                    "Absolute paths are not allowed. Use relative path instead: '%s'", suggestion));
        }

        for (String segment : cleaned.split("/")) {
            if ("..".equals(segment)) {
                return new Result("", "Path traversal ('..') is not allowed");
            }
        }

        if (cleaned.isEmpty()) {
            return new Result(ROOT, null);
        }
        return new Result(ROOT + cleaned, null);
    }

    /**
     * 校验路径，非法时抛出 {@link PathViolationException}
     *
     * @return 存储键（以 '/' 开头）
     */
    public static String resolve(String path) {
        Result result = validate(path);
        if (!result.isValid()) {
            throw new PathViolationException(path, result.getError());
        }
        return result.getFsPath();
    }

    /**
     * 存储键转回调用方使用的相对路径
     */
    public static String toRelative(String fsPath) {
        return fsPath.startsWith(ROOT) ? fsPath.substring(1) : fsPath;
    }
}
