package io.leavesfly.vshell.workspace;

import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 路径校验包装
 * <p>
 * 命令只接触相对路径，每次调用先经 {@link PathValidator#resolve(String)} 转为存储键；
 * 非法路径以 {@link io.leavesfly.vshell.exception.PathViolationException} 终止 Mono。
 * glob 结果再转回相对路径。
 */
public class ValidatedWorkspaceProvider implements WorkspaceProvider {

    private final WorkspaceProvider delegate;

    public ValidatedWorkspaceProvider(WorkspaceProvider delegate) {
        this.delegate = delegate;
    }

    @Override
    public Mono<String> read(String path) {
        return Mono.defer(() -> delegate.read(PathValidator.resolve(path)));
    }

    @Override
    public Mono<Void> write(String path, String content) {
        return Mono.defer(() -> delegate.write(PathValidator.resolve(path), content));
    }

    @Override
    public Mono<Boolean> delete(String path) {
        return Mono.defer(() -> delegate.delete(PathValidator.resolve(path)));
    }

    @Override
    public Mono<Boolean> exists(String path) {
        return Mono.defer(() -> delegate.exists(PathValidator.resolve(path)));
    }

    @Override
    public Mono<List<String>> list(String path) {
        return Mono.defer(() -> delegate.list(PathValidator.resolve(path)));
    }

    @Override
    public Mono<List<String>> glob(String pattern) {
        return Mono.defer(() -> delegate.glob(PathValidator.resolve(pattern)))
                .map(paths -> paths.stream()
                        .map(PathValidator::toRelative)
                        .collect(Collectors.toList()));
    }

    @Override
    public Mono<Void> mkdir(String path) {
        return Mono.defer(() -> delegate.mkdir(PathValidator.resolve(path)));
    }

    @Override
    public Mono<Boolean> isDirectory(String path) {
        return Mono.defer(() -> delegate.isDirectory(PathValidator.resolve(path)));
    }

    @Override
    public Mono<Long> size(String path) {
        return Mono.defer(() -> delegate.size(PathValidator.resolve(path)));
    }

    public WorkspaceProvider getDelegate() {
        return delegate;
    }
}
