package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.GlobMatcher;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * grep - 按正则表达式搜索
 * <p>
 * 两道输出限制：单行按字符数截断；总输出超出预算时追加截断提示并停止扫描。
 * 退出码：有匹配为 0，无匹配为 1；非法正则同样为 1，但 stderr 给出 "invalid pattern"。
 */
public class GrepCommand extends AbstractCommand {

    public GrepCommand() {
        super("grep", CommandHelp.builder()
                .usage("grep [OPTIONS] PATTERN [FILE...]")
                .description("Search for patterns in files or stdin")
                .addFlag("-i", "Case-insensitive matching")
                .addFlag("-n", "Show line numbers")
                .addFlag("-v", "Invert match (show non-matching lines)")
                .addFlag("-l", "Only list filenames with matches")
                .addFlag("-c", "Only print a count of matching lines")
                .addFlag("-r", "Recursive search")
                .addFlag("-E", "Extended regex (enabled by default)")
                .addFlag("-F", "Treat the pattern as a fixed string")
                .addExample("grep \"error\" app.log", "Search for pattern in file")
                .addExample("grep -i \"warn\" logs/**/*.log", "Case-insensitive search across files")
                .addExample("grep -rn \"TODO\" src", "Recursive search with line numbers")
                .addExample("cat data.txt | grep \"key\"", "Search piped input")
                .note("Uses Java regular expression syntax")
                .note("Exit code 1 when no matches found")
                .note("Output is truncated when it exceeds the configured budget")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        Options options = new Options();
        String patternText = null;
        List<String> paths = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-e".equals(arg) && i + 1 < args.size()) {
                patternText = args.get(++i);
            } else if (CommandSupport.isFlagGroup(arg, "inlvcrREF")) {
                options.apply(arg);
            } else if (arg.startsWith("-") && arg.length() > 1) {
                // 未知选项忽略
                continue;
            } else if (patternText == null) {
                patternText = arg;
            } else {
                paths.add(arg);
            }
        }

        if (patternText == null) {
            return Mono.just(ShellResult.error("grep: missing pattern"));
        }

        Pattern pattern;
        try {
            int flags = options.ignoreCase ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
            pattern = Pattern.compile(options.fixed ? Pattern.quote(patternText) : patternText, flags);
        } catch (PatternSyntaxException e) {
            return Mono.just(ShellResult.error("grep: invalid pattern: " + patternText
                    + " (" + e.getDescription() + ")"));
        }

        if (paths.isEmpty() && !options.recursive) {
            if (!context.hasStdin()) {
                return Mono.just(ShellResult.error("grep: missing file operand"));
            }
            Scan scan = new Scan(pattern, options, false, context.limits());
            scan.search("(standard input)", context.getStdin());
            return Mono.just(scan.result());
        }
        if (paths.isEmpty()) {
            paths.add(".");
        }

        WorkspaceProvider fs = context.getFs();
        boolean prefixed = paths.size() > 1 || options.recursive;

        return Flux.fromIterable(paths)
                .concatMap(path -> resolve(fs, path, options.recursive))
                .collectList()
                .map(groups -> {
                    int fileCount = groups.stream().mapToInt(List::size).sum();
                    Scan scan = new Scan(pattern, options, prefixed || fileCount > 1, context.limits());
                    for (List<FileInput> group : groups) {
                        for (FileInput input : group) {
                            if (scan.isExhausted()) {
                                return scan.result();
                            }
                            if (input.exists()) {
                                scan.search(input.getPath(), input.getContent());
                            } else if (input.isDirectory()) {
                                if (!options.recursive) {
                                    scan.error("grep: " + input.getPath() + ": Is a directory");
                                }
                            } else {
                                scan.error("grep: " + input.getPath() + ": No such file or directory");
                            }
                        }
                    }
                    return scan.result();
                });
    }

    /**
     * 把路径参数展开为待搜索文件：-r 时目录改写为 dir/**&#47;*，glob 模式直接展开
     */
    private Mono<List<FileInput>> resolve(WorkspaceProvider fs, String path, boolean recursive) {
        Mono<List<String>> files;
        if (recursive) {
            files = fs.isDirectory(path).flatMap(dir -> {
                if (!dir) {
                    return Mono.just(List.of(path));
                }
                return fs.glob(recursiveGlob(path));
            });
        } else if (GlobMatcher.isGlob(path)) {
            files = fs.glob(path);
        } else {
            files = Mono.just(List.of(path));
        }
        return files.flatMap(list -> CommandSupport.readAll(fs, list));
    }

    static String recursiveGlob(String path) {
        String base = path;
        while (base.endsWith("/") && base.length() > 1) {
            base = base.substring(0, base.length() - 1);
        }
        if (base.isEmpty() || ".".equals(base) || "./".equals(base)) {
            return "**/*";
        }
        return base + "/**/*";
    }

    private static final class Options {
        boolean ignoreCase;
        boolean lineNumbers;
        boolean filesOnly;
        boolean invert;
        boolean count;
        boolean recursive;
        boolean fixed;

        void apply(String flagGroup) {
            for (int i = 1; i < flagGroup.length(); i++) {
                switch (flagGroup.charAt(i)) {
                    case 'i':
                        ignoreCase = true;
                        break;
                    case 'n':
                        lineNumbers = true;
                        break;
                    case 'l':
                        filesOnly = true;
                        break;
                    case 'v':
                        invert = true;
                        break;
                    case 'c':
                        count = true;
                        break;
                    case 'r':
                    case 'R':
                        recursive = true;
                        break;
                    case 'F':
                        fixed = true;
                        break;
                    default:
                        // -E：Java 正则本身即为扩展语法
                        break;
                }
            }
        }
    }

    /**
     * 一次搜索的累积状态
     */
    private static final class Scan {
        private final Pattern pattern;
        private final Options options;
        private final boolean prefixed;
        private final int maxLineLength;
        private final int budget;

        private final StringBuilder stdout = new StringBuilder();
        private final List<String> errors = new ArrayList<>();
        private boolean matched;
        private boolean exhausted;

        Scan(Pattern pattern, Options options, boolean prefixed, ShellConfig.Limits limits) {
            this.pattern = pattern;
            this.options = options;
            this.prefixed = prefixed;
            this.maxLineLength = limits.getGrepMaxLineLength();
            this.budget = limits.getMaxOutputChars();
        }

        void search(String name, String content) {
            List<String> lines = CommandSupport.splitLines(content);
            int matches = 0;
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i);
                if (pattern.matcher(line).find() == options.invert) {
                    continue;
                }
                matched = true;
                matches++;
                if (options.filesOnly) {
                    emit(name);
                    return;
                }
                if (options.count) {
                    continue;
                }
                StringBuilder out = new StringBuilder();
                if (prefixed) {
                    out.append(name).append(':');
                }
                if (options.lineNumbers) {
                    out.append(i + 1).append(':');
                }
                out.append(CommandSupport.truncateLine(line, maxLineLength));
                if (!emit(out.toString())) {
                    return;
                }
            }
            if (options.count && !options.filesOnly) {
                emit(prefixed ? name + ":" + matches : String.valueOf(matches));
            }
        }

        /**
         * 追加一行输出，超出预算时写入截断提示
         *
         * @return 是否还能继续输出
         */
        boolean emit(String line) {
            if (exhausted) {
                return false;
            }
            if (stdout.length() + line.length() + 1 > budget) {
                stdout.append("[output truncated: exceeded ").append(budget)
                        .append(" characters. Narrow the pattern or search fewer files]\n");
                exhausted = true;
                return false;
            }
            stdout.append(line).append('\n');
            return true;
        }

        void error(String message) {
            errors.add(message);
        }

        boolean isExhausted() {
            return exhausted;
        }

        ShellResult result() {
            return ShellResult.of(matched ? 0 : 1, stdout.toString(), String.join("\n", errors));
        }
    }
}
