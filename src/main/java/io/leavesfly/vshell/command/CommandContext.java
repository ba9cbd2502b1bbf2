package io.leavesfly.vshell.command;

import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.env.EnvironmentProvider;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import lombok.Builder;
import lombok.Getter;

import java.util.Map;
import java.util.Optional;

/**
 * 单次命令调用的上下文
 */
@Getter
@Builder(toBuilder = true)
public class CommandContext {

    /**
     * 工作区（已经过路径校验包装）
     */
    private final WorkspaceProvider fs;

    /**
     * 运行时变量
     */
    private final Map<String, String> env;

    private final ShellConfig config;

    /**
     * 管道或 heredoc 输入，没有输入时为 null
     */
    private final String stdin;

    /**
     * 是否处于管道下游（或读取 heredoc / 输入重定向）
     */
    private final boolean piped;

    private final EnvironmentProvider envProvider;

    /**
     * 当前 Shell 的命令注册表，help 命令使用
     */
    private final CommandRegistry commands;

    public boolean hasStdin() {
        return stdin != null;
    }

    public Optional<EnvironmentProvider> envProvider() {
        return Optional.ofNullable(envProvider);
    }

    public ShellConfig.Limits limits() {
        return config.getLimits();
    }
}
