package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.GlobMatcher;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * find - 递归查找文件
 * <p>
 * 遍历 base/**&#47;*，按 -name / -iname（多个模式为或关系，只匹配文件名）、
 * -type 与 -maxdepth 过滤；base 本身满足全部条件时也会输出。
 */
public class FindCommand extends AbstractCommand {

    public FindCommand() {
        super("find", CommandHelp.builder()
                .usage("find [PATH] [OPTIONS]")
                .description("Search for files in a directory hierarchy")
                .addFlag("-name PATTERN", "File name matches glob pattern (multiple patterns are OR'd)")
                .addFlag("-iname PATTERN", "Like -name, but case-insensitive")
                .addFlag("-type f|d", "Only files (f) or directories (d)")
                .addFlag("-maxdepth N", "Descend at most N levels below PATH")
                .addExample("find . -name \"*.json\"", "Find all JSON files")
                .addExample("find reports -type d", "List directories under reports")
                .addExample("find . -maxdepth 1", "List entries one level deep")
                .addExample("find . -name \"*.md\" -o -name \"*.txt\"", "Match either pattern")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        String basePath = ".";
        List<NameFilter> names = new ArrayList<>();
        Character type = null;
        Integer maxDepth = null;

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            String next = i + 1 < args.size() ? args.get(i + 1) : null;
            switch (arg) {
                case "-name":
                case "-iname":
                    if (next == null) {
                        return Mono.just(ShellResult.error("find: missing argument to `" + arg + "'"));
                    }
                    names.add(new NameFilter(next, "-iname".equals(arg)));
                    i++;
                    break;
                case "-type":
                    if (!"f".equals(next) && !"d".equals(next)) {
                        return Mono.just(ShellResult.error("find: unknown argument to -type: " + next));
                    }
                    type = next.charAt(0);
                    i++;
                    break;
                case "-maxdepth":
                    Integer depth = CommandSupport.parseInt(next);
                    if (depth == null || depth < 0) {
                        return Mono.just(ShellResult.error("find: invalid -maxdepth value: " + next));
                    }
                    maxDepth = depth;
                    i++;
                    break;
                case "-o":
                case "-or":
                    // 多个 -name 默认即为或关系
                    break;
                default:
                    if (!arg.startsWith("-")) {
                        basePath = arg;
                    }
            }
        }

        String trimmed = trimTrailingSlash(basePath);
        String base = trimmed.isEmpty() ? "." : trimmed;
        boolean root = ".".equals(base);
        int baseDepth = root ? 0 : base.split("/").length;
        Filter filter = new Filter(names, type, maxDepth);
        WorkspaceProvider fs = context.getFs();

        return fs.exists(base).flatMap(exists -> {
            if (!exists) {
                return Mono.just(ShellResult.error("find: " + base + ": No such file or directory"));
            }
            Mono<List<String>> baseMatch = fs.isDirectory(base)
                    .map(dir -> filter.accept(base, dir, 0)
                            ? List.of(base)
                            : List.<String>of());

            Mono<List<String>> descendants = fs.glob(root ? "**/*" : base + "/**/*")
                    .flatMapMany(Flux::fromIterable)
                    .concatMap(file -> fs.isDirectory(file)
                            .filter(dir -> filter.accept(file, dir, file.split("/").length - baseDepth))
                            .map(dir -> file))
                    .collectList();

            return baseMatch.zipWith(descendants, (head, rest) -> {
                List<String> all = new ArrayList<>(head);
                all.addAll(rest);
                return ShellResult.ok(CommandSupport.joinLines(all));
            });
        });
    }

    private static String trimTrailingSlash(String path) {
        String result = path;
        while (result.length() > 1 && result.endsWith("/")) {
            result = result.substring(0, result.length() - 1);
        }
        return result.startsWith("./") && result.length() > 2 ? result.substring(2) : result;
    }

    private static final class NameFilter {
        final String pattern;
        final boolean ignoreCase;

        NameFilter(String pattern, boolean ignoreCase) {
            this.pattern = ignoreCase ? pattern.toLowerCase(Locale.ROOT) : pattern;
            this.ignoreCase = ignoreCase;
        }

        boolean matches(String fileName) {
            String name = ignoreCase ? fileName.toLowerCase(Locale.ROOT) : fileName;
            return GlobMatcher.matches(name, pattern);
        }
    }

    private static final class Filter {
        final List<NameFilter> names;
        final Character type;
        final Integer maxDepth;

        Filter(List<NameFilter> names, Character type, Integer maxDepth) {
            this.names = names;
            this.type = type;
            this.maxDepth = maxDepth;
        }

        boolean accept(String path, boolean directory, int depth) {
            if (maxDepth != null && depth > maxDepth) {
                return false;
            }
            if (type != null && (type == 'd') != directory) {
                return false;
            }
            if (names.isEmpty()) {
                return true;
            }
            String fileName = path.substring(path.lastIndexOf('/') + 1);
            return names.stream().anyMatch(name -> name.matches(fileName));
        }
    }
}
