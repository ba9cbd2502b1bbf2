package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * sort - 排序文本行
 * <p>
 * 字符串比较采用码点顺序（等价于 C locale），排序稳定。
 */
public class SortCommand extends AbstractCommand {

    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\s*([-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public SortCommand() {
        super("sort", CommandHelp.builder()
                .usage("sort [OPTIONS] [FILE...]")
                .description("Sort lines of text")
                .addFlag("-r", "Reverse the result of comparisons")
                .addFlag("-n", "Compare according to string numerical value")
                .addFlag("-u", "Output only unique lines")
                .addFlag("-f", "Fold lower case to upper case characters")
                .addFlag("-t SEP", "Use SEP as field separator")
                .addFlag("-k NUM", "Sort by field NUM (1-based)")
                .addExample("sort names.txt", "Sort lines alphabetically")
                .addExample("sort -r names.txt", "Sort in reverse order")
                .addExample("sort -n numbers.txt", "Sort numerically")
                .addExample("find . -type f | sort", "Sort piped input")
                .addExample("sort -u data.txt", "Sort and remove duplicates")
                .addExample("sort -t \",\" -k 2 data.csv", "Sort CSV by second column")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        Options options = new Options();
        List<String> paths = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-t".equals(arg) || "-k".equals(arg)) {
                if (i + 1 >= args.size()) {
                    return Mono.just(ShellResult.error("sort: option requires an argument -- '" + arg.charAt(1) + "'"));
                }
                String value = args.get(++i);
                String error = "-t".equals(arg) ? options.separator(value) : options.key(value);
                if (error != null) {
                    return Mono.just(ShellResult.error(error));
                }
            } else if (arg.startsWith("-t") && arg.length() > 2) {
                options.separator(arg.substring(2));
            } else if (arg.startsWith("-k") && arg.length() > 2) {
                String error = options.key(arg.substring(2));
                if (error != null) {
                    return Mono.just(ShellResult.error(error));
                }
            } else if (CommandSupport.isFlagGroup(arg, "rnuf")) {
                options.reverse |= arg.indexOf('r') >= 0;
                options.numeric |= arg.indexOf('n') >= 0;
                options.unique |= arg.indexOf('u') >= 0;
                options.foldCase |= arg.indexOf('f') >= 0;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            if (context.hasStdin()) {
                return Mono.just(ShellResult.ok(sort(CommandSupport.splitLines(context.getStdin()), options)));
            }
            return Mono.just(ShellResult.error("sort: missing file operand"));
        }

        return CommandSupport.expandGlobs(context.getFs(), paths)
                .flatMap(files -> CommandSupport.readAll(context.getFs(), files))
                .map(inputs -> {
                    List<String> lines = new ArrayList<>();
                    for (FileInput input : inputs) {
                        if (!input.exists()) {
                            return ShellResult.error("sort: " + input.getPath() + ": No such file");
                        }
                        lines.addAll(CommandSupport.splitLines(input.getContent()));
                    }
                    return ShellResult.ok(sort(lines, options));
                });
    }

    private static String sort(List<String> lines, Options options) {
        Comparator<String> comparator = options.comparator();
        List<String> sorted = new ArrayList<>(lines);
        sorted.sort(comparator);

        if (options.unique) {
            List<String> distinct = new ArrayList<>();
            for (String line : sorted) {
                if (distinct.isEmpty() || comparator.compare(distinct.get(distinct.size() - 1), line) != 0) {
                    distinct.add(line);
                }
            }
            sorted = distinct;
        }
        return CommandSupport.joinLines(sorted);
    }

    static double leadingNumber(String value) {
        Matcher matcher = LEADING_NUMBER.matcher(value);
        if (!matcher.find()) {
            return 0;
        }
        try {
            return Double.parseDouble(matcher.group(1));
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static final class Options {
        boolean reverse;
        boolean numeric;
        boolean unique;
        boolean foldCase;
        String separator;
        Integer field;

        String separator(String value) {
            if (value.isEmpty()) {
                return "sort: empty tab";
            }
            separator = value;
            return null;
        }

        /**
         * -k N 或 -k N,M，只使用起始字段
         */
        String key(String value) {
            String start = value.split(",")[0];
            Integer parsed = CommandSupport.parseInt(start.replaceAll("[a-zA-Z]+$", ""));
            if (parsed == null || parsed < 1) {
                return "sort: invalid field specification '" + value + "'";
            }
            field = parsed;
            return null;
        }

        Comparator<String> comparator() {
            Function<String, String> keyOf = this::extractKey;
            Comparator<String> comparator;
            if (numeric) {
                comparator = Comparator.comparingDouble(line -> leadingNumber(keyOf.apply(line)));
            } else if (foldCase) {
                comparator = Comparator.comparing(keyOf, String.CASE_INSENSITIVE_ORDER);
            } else {
                comparator = Comparator.comparing(keyOf);
            }
            return reverse ? comparator.reversed() : comparator;
        }

        private String extractKey(String line) {
            if (field == null) {
                return line;
            }
            String[] parts = separator != null
                    ? line.split(Pattern.quote(separator), -1)
                    : WHITESPACE.split(line.trim());
            return field <= parts.length ? parts[field - 1] : "";
        }
    }
}
