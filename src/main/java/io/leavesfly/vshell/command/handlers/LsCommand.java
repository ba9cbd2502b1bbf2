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

/**
 * ls - 列出目录内容
 */
public class LsCommand extends AbstractCommand {

    public LsCommand() {
        super("ls", CommandHelp.builder()
                .usage("ls [OPTIONS] [PATH...]")
                .description("List directory contents")
                .addFlag("-l", "Long format with type and size")
                .addFlag("-a", "Show hidden entries (starting with '.')")
                .addExample("ls", "List the workspace root")
                .addExample("ls -l reports", "Long listing of a directory")
                .addExample("ls *.json", "List matching files")
                .note("Directories are shown with a trailing '/'")
                .note("Only immediate children are listed; use find for recursion")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean longFormat = false;
        boolean showAll = false;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if (CommandSupport.isFlagGroup(arg, "la")) {
                longFormat |= arg.indexOf('l') >= 0;
                showAll |= arg.indexOf('a') >= 0;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }
        if (paths.isEmpty()) {
            paths.add(".");
        }

        WorkspaceProvider fs = context.getFs();
        final boolean longListing = longFormat;
        final boolean all = showAll;

        return Flux.fromIterable(paths)
                .concatMap(path -> listPath(fs, path, longListing, all))
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

    private Mono<ShellResult> listPath(WorkspaceProvider fs, String path, boolean longFormat, boolean showAll) {
        if (GlobMatcher.isGlob(path)) {
            return fs.glob(path).flatMap(matches -> {
                if (matches.isEmpty()) {
                    return Mono.just(ShellResult.error("ls: " + path + ": No matches found"));
                }
                return Flux.fromIterable(matches)
                        .concatMap(match -> fs.isDirectory(match)
                                .flatMap(dir -> formatEntry(fs, match, dir ? match + "/" : match, longFormat)))
                        .collectList()
                        .map(lines -> ShellResult.ok(CommandSupport.joinLines(lines)));
            });
        }

        return fs.exists(path).flatMap(exists -> {
            if (!exists) {
                return Mono.just(ShellResult.error("ls: " + path + ": No such file or directory"));
            }
            return fs.isDirectory(path).flatMap(dir -> {
                if (!dir) {
                    return formatEntry(fs, path, path, longFormat)
                            .map(line -> ShellResult.ok(line + "\n"));
                }
                return fs.list(path)
                        .flatMapMany(Flux::fromIterable)
                        .filter(entry -> showAll || !entry.startsWith("."))
                        .concatMap(entry -> formatEntry(fs, child(path, entry), entry, longFormat))
                        .collectList()
                        .map(lines -> ShellResult.ok(CommandSupport.joinLines(lines)));
            });
        });
    }

    private Mono<String> formatEntry(WorkspaceProvider fs, String fullPath, String label, boolean longFormat) {
        if (!longFormat) {
            return Mono.just(label);
        }
        boolean dir = label.endsWith("/");
        if (dir) {
            return Mono.just(longLine('d', 0L, label));
        }
        return fs.size(fullPath)
                .defaultIfEmpty(0L)
                .map(size -> longLine('-', size, label));
    }

    private static String longLine(char type, long size, String label) {
        return String.format("%crw-r--r--  1 user  user  %8d  %s", type, size, label);
    }

    private static String child(String dir, String entry) {
        String name = entry.endsWith("/") ? entry.substring(0, entry.length() - 1) : entry;
        if (".".equals(dir) || dir.isEmpty() || "./".equals(dir)) {
            return name;
        }
        return dir.endsWith("/") ? dir + name : dir + "/" + name;
    }
}
