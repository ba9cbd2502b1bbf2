package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * wc - 统计行数、单词数与字节数
 */
public class WcCommand extends AbstractCommand {

    public WcCommand() {
        super("wc", CommandHelp.builder()
                .usage("wc [OPTIONS] [FILE...]")
                .description("Print newline, word, and byte counts")
                .addFlag("-l", "Print line count only")
                .addFlag("-w", "Print word count only")
                .addFlag("-c", "Print byte count only")
                .addFlag("-m", "Print character count only")
                .addExample("wc file.txt", "Show all counts for file")
                .addExample("wc -l file.txt", "Count lines only")
                .addExample("cat file.txt | wc -l", "Count lines from stdin")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        Counts.Selection selection = new Counts.Selection();
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if (CommandSupport.isFlagGroup(arg, "lwcm")) {
                selection.lines |= arg.indexOf('l') >= 0;
                selection.words |= arg.indexOf('w') >= 0;
                selection.bytes |= arg.indexOf('c') >= 0;
                selection.chars |= arg.indexOf('m') >= 0;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            if (context.hasStdin()) {
                return Mono.just(ShellResult.ok(Counts.of(context.getStdin()).format(selection, null) + "\n"));
            }
            return Mono.just(ShellResult.error("wc: missing file operand"));
        }

        return CommandSupport.expandGlobs(context.getFs(), paths)
                .flatMap(files -> CommandSupport.readAll(context.getFs(), files))
                .map(inputs -> {
                    StringBuilder stdout = new StringBuilder();
                    Counts total = new Counts(0, 0, 0, 0);
                    for (FileInput input : inputs) {
                        if (!input.exists()) {
                            return ShellResult.error(input.isDirectory()
                                    ? "wc: " + input.getPath() + ": Is a directory"
                                    : "wc: " + input.getPath() + ": No such file");
                        }
                        Counts counts = Counts.of(input.getContent());
                        total = total.plus(counts);
                        stdout.append(counts.format(selection, input.getPath())).append('\n');
                    }
                    if (inputs.size() > 1) {
                        stdout.append(total.format(selection, "total")).append('\n');
                    }
                    return ShellResult.ok(stdout.toString());
                });
    }

    private static final class Counts {
        final long lines;
        final long words;
        final long bytes;
        final long chars;

        Counts(long lines, long words, long bytes, long chars) {
            this.lines = lines;
            this.words = words;
            this.bytes = bytes;
            this.chars = chars;
        }

        static Counts of(String content) {
            long newlines = content.chars().filter(c -> c == '\n').count();
            String trimmed = content.trim();
            long words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
            return new Counts(newlines, words,
                    content.getBytes(StandardCharsets.UTF_8).length,
                    content.codePointCount(0, content.length()));
        }

        Counts plus(Counts other) {
            return new Counts(lines + other.lines, words + other.words,
                    bytes + other.bytes, chars + other.chars);
        }

        String format(Selection selection, String label) {
            StringBuilder sb = new StringBuilder();
            boolean all = selection.none();
            if (all || selection.lines) {
                sb.append(pad(lines));
            }
            if (all || selection.words) {
                sb.append(pad(words));
            }
            if (selection.chars) {
                sb.append(pad(chars));
            }
            if (all || selection.bytes) {
                sb.append(pad(bytes));
            }
            if (label != null) {
                sb.append(' ').append(label);
            }
            return sb.toString();
        }

        private static String pad(long value) {
            return String.format("%8d", value);
        }

        static final class Selection {
            boolean lines;
            boolean words;
            boolean bytes;
            boolean chars;

            boolean none() {
                return !lines && !words && !bytes && !chars;
            }
        }
    }
}
