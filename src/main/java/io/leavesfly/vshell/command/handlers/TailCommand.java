package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * tail - 输出末尾若干行
 * <p>
 * {@code -n +N} 表示从第 N 行开始输出到末尾。
 */
public class TailCommand extends AbstractCommand {

    private static final int DEFAULT_LINES = 10;

    public TailCommand() {
        super("tail", CommandHelp.builder()
                .usage("tail [OPTIONS] [FILE...]")
                .description("Output the last part of files")
                .addFlag("-n N", "Number of lines to show (default: 10)")
                .addFlag("-n +N", "Output starting with line N")
                .addFlag("-N", "Shorthand for -n N")
                .addExample("tail app.log", "Show last 10 lines")
                .addExample("tail -n 100 app.log", "Show last 100 lines")
                .addExample("tail -n +2 data.csv", "Skip the header line")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        LineArgs parsed = LineArgs.parse("tail", args, DEFAULT_LINES);
        if (parsed.getError() != null) {
            return Mono.just(ShellResult.error(parsed.getError()));
        }

        if (parsed.getPaths().isEmpty()) {
            if (context.hasStdin()) {
                return Mono.just(ShellResult.ok(tail(context.getStdin(), parsed)));
            }
            return Mono.just(ShellResult.error("tail: missing file operand"));
        }

        return CommandSupport.expandGlobs(context.getFs(), parsed.getPaths())
                .flatMap(files -> CommandSupport.readAll(context.getFs(), files))
                .map(inputs -> {
                    StringBuilder stdout = new StringBuilder();
                    for (FileInput input : inputs) {
                        if (!input.exists()) {
                            return ShellResult.error("tail: " + input.getPath() + ": No such file");
                        }
                        if (inputs.size() > 1) {
                            stdout.append("==> ").append(input.getPath()).append(" <==\n");
                        }
                        stdout.append(tail(input.getContent(), parsed));
                    }
                    return ShellResult.ok(stdout.toString());
                });
    }

    private static String tail(String content, LineArgs parsed) {
        List<String> lines = CommandSupport.splitLines(content);
        int from;
        if (parsed.isFromStart()) {
            from = Math.max(parsed.getCount() - 1, 0);
        } else {
            from = Math.max(lines.size() - parsed.getCount(), 0);
        }
        if (from >= lines.size()) {
            return "";
        }
        return CommandSupport.joinLines(lines.subList(from, lines.size()));
    }
}
