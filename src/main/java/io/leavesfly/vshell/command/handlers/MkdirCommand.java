package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * mkdir - 创建目录
 * <p>
 * 不带 -p 时目录已存在或父目录缺失均报错；带 -p 时幂等。
 */
public class MkdirCommand extends AbstractCommand {

    public MkdirCommand() {
        super("mkdir", CommandHelp.builder()
                .usage("mkdir [OPTIONS] DIRECTORY...")
                .description("Create directories")
                .addFlag("-p", "Create parent directories as needed, no error if existing")
                .addExample("mkdir reports", "Create a directory")
                .addExample("mkdir -p a/b/c", "Create nested directories")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean parents = false;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if ("-p".equals(arg) || "--parents".equals(arg)) {
                parents = true;
            } else if (!arg.startsWith("-")) {
                paths.add(arg);
            }
        }

        if (paths.isEmpty()) {
            return Mono.just(ShellResult.error("mkdir: missing operand"));
        }

        WorkspaceProvider fs = context.getFs();
        final boolean createParents = parents;

        return Flux.fromIterable(paths)
                .concatMap(path -> create(fs, path, createParents))
                .filter(result -> !result.isSuccess())
                .next()
                .defaultIfEmpty(ShellResult.ok(""));
    }

    private Mono<ShellResult> create(WorkspaceProvider fs, String path, boolean parents) {
        return fs.exists(path).flatMap(exists -> {
            if (exists) {
                if (parents) {
                    return fs.isDirectory(path).map(dir -> dir
                            ? ShellResult.ok("")
                            : ShellResult.error("mkdir: " + path + ": File exists"));
                }
                return Mono.just(ShellResult.error("mkdir: " + path + ": File exists"));
            }
            if (parents) {
                return fs.mkdir(path).thenReturn(ShellResult.ok(""));
            }
            String parent = parentOf(path);
            return fs.isDirectory(parent).flatMap(parentExists -> parentExists
                    ? fs.mkdir(path).thenReturn(ShellResult.ok(""))
                    : Mono.just(ShellResult.error("mkdir: " + path + ": No such file or directory")));
        });
    }

    private static String parentOf(String path) {
        String trimmed = path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
        int slash = trimmed.lastIndexOf('/');
        return slash > 0 ? trimmed.substring(0, slash) : ".";
    }
}
