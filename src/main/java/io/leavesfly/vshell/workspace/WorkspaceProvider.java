package io.leavesfly.vshell.workspace;

import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 工作区存储接口
 * <p>
 * 路径均为已校验的存储键（以 '/' 开头，'/' 表示工作区根目录）。
 * 对外暴露给命令的实现会经过 {@link ValidatedWorkspaceProvider} 包装，
 * 命令自身只接触相对路径。
 */
public interface WorkspaceProvider {

    /**
     * 读取文件内容
     *
     * @return 文件内容；文件不存在或为目录时返回空 Mono
     */
    Mono<String> read(String path);

    /**
     * 写入文件（覆盖），自动创建父目录
     */
    Mono<Void> write(String path, String content);

    /**
     * 删除文件或目录（目录连同其内容一起删除）
     *
     * @return 是否确有内容被删除
     */
    Mono<Boolean> delete(String path);

    Mono<Boolean> exists(String path);

    /**
     * 列出目录的直接子项，目录名以 '/' 结尾，按名称排序
     *
     * @return 子项名称；路径不是目录时返回空列表
     */
    Mono<List<String>> list(String path);

    /**
     * 按 glob 模式匹配文件与目录
     *
     * @return 匹配的路径，排序后返回
     */
    Mono<List<String>> glob(String pattern);

    /**
     * 创建目录，连同缺失的父目录；目录已存在时不做任何事
     */
    Mono<Void> mkdir(String path);

    Mono<Boolean> isDirectory(String path);

    /**
     * 文件字节大小（UTF-8）
     *
     * @return 不支持或文件不存在时返回空 Mono
     */
    default Mono<Long> size(String path) {
        return Mono.empty();
    }
}
