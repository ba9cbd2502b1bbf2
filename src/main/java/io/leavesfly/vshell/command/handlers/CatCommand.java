package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * cat - 连接并输出文件
 * <p>
 * 超过大小上限的文件必须通过 --offset / --limit 分页读取（管道输入不受限）。
 */
public class CatCommand extends AbstractCommand {

    public CatCommand() {
        super("cat", CommandHelp.builder()
                .usage("cat [OPTIONS] [FILE...]")
                .description("Concatenate and print files")
                .addFlag("-n", "Show line numbers")
                .addFlag("--offset N", "Start from line N (0-based)")
                .addFlag("--limit N", "Max lines to show (default: 2000)")
                .addExample("cat data.json", "Print file contents")
                .addExample("cat -n data.json", "Print with line numbers")
                .addExample("cat --offset 0 --limit 100 big.txt", "Read first 100 lines")
                .addExample("cat a b", "Concatenate multiple files")
                .addExample("cat *.json", "Print all JSON files")
                .note("Supports glob patterns (e.g. *.json)")
                .note("Reads from stdin when no files given and input is piped")
                .note("Large files require --offset/--limit for paginated access")
                .note("Long lines are truncated")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        if (args.isEmpty() && context.hasStdin()) {
            return Mono.just(ShellResult.ok(context.getStdin()));
        }

        boolean showLineNumbers = false;
        Integer offset = null;
        Integer limit = null;
        List<String> paths = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-n".equals(arg)) {
                showLineNumbers = true;
            } else if ("--offset".equals(arg) || "--limit".equals(arg)) {
                Integer value = i + 1 < args.size() ? CommandSupport.parseInt(args.get(++i)) : null;
                if (value == null || value < 0) {
                    return Mono.just(ShellResult.error("cat: invalid number for " + arg));
                }
                if ("--offset".equals(arg)) {
                    offset = value;
                } else {
                    limit = value;
                }
            } else {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            return Mono.just(ShellResult.error("cat: missing file operand"));
        }

        ShellConfig.Limits limits = context.limits();
        Options options = new Options(showLineNumbers, offset,
                limit != null ? limit : limits.getDefaultLineLimit(),
                offset != null || limit != null);
        WorkspaceProvider fs = context.getFs();

        return CommandSupport.expandGlobs(fs, paths)
                .flatMapMany(Flux::fromIterable)
                .concatMap(file -> catFile(fs, file, options, context))
                .collectList()
                .map(results -> {
                    StringBuilder stdout = new StringBuilder();
                    for (ShellResult result : results) {
                        if (!result.isSuccess()) {
                            return result;
                        }
                        stdout.append(result.getStdout());
                    }
                    return ShellResult.ok(stdout.toString());
                });
    }

    private Mono<ShellResult> catFile(WorkspaceProvider fs, String file, Options options, CommandContext context) {
        ShellConfig.Limits limits = context.limits();
        return fs.size(file)
                .map(size -> {
                    if (size > limits.getMaxFileSize() && !options.paginated && !context.isPiped()) {
                        return ShellResult.error(String.format(
                                "cat: %s (%d bytes) exceeds max size (%d bytes). "
                                        + "Use `head -n 2000 %s` to read the first 2000 lines, "
                                        + "`tail -n 2000 %s` for the last, or `grep \"pattern\" %s` to search.",
                                file, size, limits.getMaxFileSize(), file, file, file));
                    }
                    return ShellResult.ok("");
                })
                .defaultIfEmpty(ShellResult.ok(""))
                .flatMap(gate -> {
                    if (!gate.isSuccess()) {
                        return Mono.just(gate);
                    }
                    return CommandSupport.read(fs, file).map(input -> {
                        if (!input.exists()) {
                            return ShellResult.error(input.isDirectory()
                                    ? "cat: " + file + ": Is a directory"
                                    : "cat: " + file + ": No such file");
                        }
                        return ShellResult.ok(render(input.getContent(), options, limits.getMaxLineLength()));
                    });
                });
    }

    private String render(String content, Options options, int maxLineLength) {
        List<String> allLines = CommandSupport.splitLines(content);
        int total = allLines.size();
        int start = Math.min(options.offset != null ? options.offset : 0, total);
        int end = (int) Math.min((long) start + options.limit, total);

        StringBuilder sb = new StringBuilder();
        if (options.offset != null) {
            sb.append(String.format("[Showing lines %d-%d of %d]", start + 1, end, total)).append('\n');
        }

        List<String> shown = new ArrayList<>();
        for (int i = start; i < end; i++) {
            String line = CommandSupport.truncateLine(allLines.get(i), maxLineLength);
            shown.add(options.lineNumbers ? (i + 1) + "\t" + line : line);
        }
        sb.append(String.join("\n", shown));
        // 输出到文件最后一行且原文件无末尾换行时不补换行
        if (!shown.isEmpty() && (end < total || content.endsWith("\n"))) {
            sb.append('\n');
        }
        return sb.toString();
    }

    private static final class Options {
        final boolean lineNumbers;
        final Integer offset;
        final int limit;
        final boolean paginated;

        Options(boolean lineNumbers, Integer offset, int limit, boolean paginated) {
            this.lineNumbers = lineNumbers;
            this.offset = offset;
            this.limit = limit;
            this.paginated = paginated;
        }
    }
}
