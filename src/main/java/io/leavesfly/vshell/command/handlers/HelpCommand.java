package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHandler;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandRegistry;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Optional;

/**
 * help - 列出命令或显示某个命令的详细帮助
 */
public class HelpCommand extends AbstractCommand {

    public HelpCommand() {
        super("help", CommandHelp.builder()
                .usage("help [COMMAND]")
                .description("Show available commands or detailed help for a specific command")
                .addExample("help", "List all available commands")
                .addExample("help curl", "Show detailed help for curl")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        CommandRegistry commands = context.getCommands();
        if (commands == null) {
            return Mono.just(ShellResult.error("help: no commands registered"));
        }

        if (args.isEmpty()) {
            StringBuilder sb = new StringBuilder("Available commands:\n\n");
            for (String name : commands.getCommandNames()) {
                CommandHelp help = commands.getCommand(name).map(CommandHandler::getHelp).orElse(null);
                String description = help != null && help.getDescription() != null ? help.getDescription() : "";
                sb.append(String.format("  %-12s %s", name, description)).append('\n');
            }
            sb.append("\nRun `help <command>` for detailed usage.\n");
            return Mono.just(ShellResult.ok(sb.toString()));
        }

        String name = args.get(0);
        Optional<CommandHandler> handler = commands.getCommand(name);
        if (handler.isEmpty()) {
            return Mono.just(ShellResult.error("help: unknown command '" + name + "'"));
        }
        CommandHelp help = handler.get().getHelp();
        if (help == null) {
            return Mono.just(ShellResult.ok(name + ": no detailed help available\n"));
        }
        return Mono.just(ShellResult.ok(help.render(name)));
    }
}
