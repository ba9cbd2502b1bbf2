package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.GlobMatcher;
import io.leavesfly.vshell.workspace.PathValidator;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * rm - 删除文件或目录
 */
public class RmCommand extends AbstractCommand {

    public RmCommand() {
        super("rm", CommandHelp.builder()
                .usage("rm [OPTIONS] FILE...")
                .description("Remove files or directories")
                .addFlag("-r", "Remove directories and their contents recursively")
                .addFlag("-f", "Force removal, ignore nonexistent files")
                .addExample("rm temp.json", "Remove a file")
                .addExample("rm -r cache", "Remove directory recursively")
                .addExample("rm -rf old/*", "Force remove with glob pattern")
                .note("Supports glob patterns")
                .note("Use -r for directories")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean recursive = false;
        boolean force = false;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if (CommandSupport.isFlagGroup(arg, "rRf")) {
                recursive |= arg.indexOf('r') >= 0 || arg.indexOf('R') >= 0;
                force |= arg.indexOf('f') >= 0;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            return Mono.just(ShellResult.error("rm: missing operand"));
        }

        WorkspaceProvider fs = context.getFs();
        final boolean recurse = recursive;
        final boolean ignoreMissing = force;

        return Flux.fromIterable(paths)
                .concatMap(path -> GlobMatcher.isGlob(path)
                        ? fs.glob(path).flatMapMany(Flux::fromIterable)
                        : Flux.just(path))
                .concatMap(file -> remove(fs, file, recurse, ignoreMissing))
                .filter(result -> !result.isSuccess())
                .next()
                .defaultIfEmpty(ShellResult.ok(""));
    }

    private Mono<ShellResult> remove(WorkspaceProvider fs, String file, boolean recursive, boolean force) {
        PathValidator.Result validated = PathValidator.validate(file);
        if (validated.isValid() && PathValidator.ROOT.equals(validated.getFsPath())) {
            return Mono.just(ShellResult.error("rm: refusing to remove '" + file + "'"));
        }
        return fs.exists(file).flatMap(exists -> {
            if (!exists) {
                return Mono.just(force
                        ? ShellResult.ok("")
                        : ShellResult.error("rm: " + file + ": No such file or directory"));
            }
            return fs.isDirectory(file).flatMap(dir -> {
                if (dir && !recursive) {
                    return Mono.just(ShellResult.error("rm: " + file + ": is a directory"));
                }
                return fs.delete(file).thenReturn(ShellResult.ok(""));
            });
        });
    }
}
