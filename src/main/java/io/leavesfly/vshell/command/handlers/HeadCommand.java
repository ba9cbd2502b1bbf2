package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * head - 输出开头若干行
 */
public class HeadCommand extends AbstractCommand {

    private static final int DEFAULT_LINES = 10;

    public HeadCommand() {
        super("head", CommandHelp.builder()
                .usage("head [OPTIONS] [FILE...]")
                .description("Output the first part of files")
                .addFlag("-n N", "Number of lines to show (default: 10)")
                .addFlag("-N", "Shorthand for -n N")
                .addExample("head data.log", "Show first 10 lines")
                .addExample("head -n 50 data.log", "Show first 50 lines")
                .addExample("cat data.log | head -5", "First 5 lines of piped input")
                .note("Long lines are truncated")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        LineArgs parsed = LineArgs.parse("head", args, DEFAULT_LINES);
        if (parsed.getError() != null) {
            return Mono.just(ShellResult.error(parsed.getError()));
        }
        int count = parsed.getCount();
        int maxLineLength = context.limits().getMaxLineLength();

        if (parsed.getPaths().isEmpty()) {
            if (context.hasStdin()) {
                return Mono.just(ShellResult.ok(head(context.getStdin(), count, maxLineLength)));
            }
            return Mono.just(ShellResult.error("head: missing file operand"));
        }

        return CommandSupport.expandGlobs(context.getFs(), parsed.getPaths())
                .flatMap(files -> CommandSupport.readAll(context.getFs(), files))
                .map(inputs -> {
                    StringBuilder stdout = new StringBuilder();
                    for (FileInput input : inputs) {
                        if (!input.exists()) {
                            return ShellResult.error("head: " + input.getPath() + ": No such file");
                        }
                        if (inputs.size() > 1) {
                            stdout.append("==> ").append(input.getPath()).append(" <==\n");
                        }
                        stdout.append(head(input.getContent(), count, maxLineLength));
                    }
                    return ShellResult.ok(stdout.toString());
                });
    }

    private static String head(String content, int count, int maxLineLength) {
        List<String> lines = CommandSupport.splitLines(content);
        List<String> selected = new ArrayList<>();
        for (int i = 0; i < Math.min(count, lines.size()); i++) {
            selected.add(CommandSupport.truncateLine(lines.get(i), maxLineLength));
        }
        return CommandSupport.joinLines(selected);
    }
}
