package io.leavesfly.vshell.command;

import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * 命令处理器接口
 * <p>
 * 处理器在两次调用之间不保留状态，状态全部存放在工作区中。
 * 用户错误（文件不存在、参数非法）以非零退出码的结果返回，不抛出异常。
 */
public interface CommandHandler {

    /**
     * 命令名
     */
    String getName();

    /**
     * 帮助信息
     */
    CommandHelp getHelp();

    /**
     * 执行命令
     *
     * @param args    参数（已完成变量展开，不含重定向）
     * @param context 调用上下文
     * @return 执行结果
     */
    Mono<ShellResult> execute(List<String> args, CommandContext context);
}
