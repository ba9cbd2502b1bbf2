package io.leavesfly.vshell.command;

import io.leavesfly.vshell.command.handlers.BrowseCommand;
import io.leavesfly.vshell.command.handlers.CatCommand;
import io.leavesfly.vshell.command.handlers.CurlCommand;
import io.leavesfly.vshell.command.handlers.DateCommand;
import io.leavesfly.vshell.command.handlers.EchoCommand;
import io.leavesfly.vshell.command.handlers.EnvCommand;
import io.leavesfly.vshell.command.handlers.FileCommand;
import io.leavesfly.vshell.command.handlers.FindCommand;
import io.leavesfly.vshell.command.handlers.GrepCommand;
import io.leavesfly.vshell.command.handlers.HeadCommand;
import io.leavesfly.vshell.command.handlers.HelpCommand;
import io.leavesfly.vshell.command.handlers.JqCommand;
import io.leavesfly.vshell.command.handlers.LsCommand;
import io.leavesfly.vshell.command.handlers.MkdirCommand;
import io.leavesfly.vshell.command.handlers.RmCommand;
import io.leavesfly.vshell.command.handlers.SedCommand;
import io.leavesfly.vshell.command.handlers.SortCommand;
import io.leavesfly.vshell.command.handlers.TailCommand;
import io.leavesfly.vshell.command.handlers.WcCommand;

import java.util.function.Function;

/**
 * 内置命令
 * 每个枚举值对应一个命令名及其处理器工厂
 */
public enum BuiltinCommand {

    CAT("cat", services -> new CatCommand()),
    ECHO("echo", services -> new EchoCommand()),
    LS("ls", services -> new LsCommand()),
    RM("rm", services -> new RmCommand()),
    MKDIR("mkdir", services -> new MkdirCommand()),
    GREP("grep", services -> new GrepCommand()),
    FIND("find", services -> new FindCommand()),
    CURL("curl", services -> new CurlCommand(services.getWebClient())),
    HEAD("head", services -> new HeadCommand()),
    TAIL("tail", services -> new TailCommand()),
    JQ("jq", services -> new JqCommand(services.getObjectMapper())),
    BROWSE("browse", services -> new BrowseCommand(services.getWebClient())),
    ENV("env", services -> new EnvCommand()),
    SORT("sort", services -> new SortCommand()),
    WC("wc", services -> new WcCommand()),
    FILE("file", services -> new FileCommand(services.getObjectMapper())),
    SED("sed", services -> new SedCommand()),
    DATE("date", services -> new DateCommand(services.getClock())),
    HELP("help", services -> new HelpCommand());

    private final String verb;
    private final Function<CommandServices, CommandHandler> factory;

    BuiltinCommand(String verb, Function<CommandServices, CommandHandler> factory) {
        this.verb = verb;
        this.factory = factory;
    }

    public String getVerb() {
        return verb;
    }

    public CommandHandler create(CommandServices services) {
        return factory.apply(services);
    }
}
