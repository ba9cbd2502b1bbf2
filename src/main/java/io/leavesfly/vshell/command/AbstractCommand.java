package io.leavesfly.vshell.command;

import lombok.Getter;

/**
 * 命令处理器基类
 * 持有命令名与帮助信息
 */
@Getter
public abstract class AbstractCommand implements CommandHandler {

    private final String name;
    private final CommandHelp help;

    protected AbstractCommand(String name, CommandHelp help) {
        this.name = name;
        this.help = help;
    }
}
