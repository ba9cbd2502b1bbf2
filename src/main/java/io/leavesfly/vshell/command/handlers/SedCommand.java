package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.command.sed.SedScript;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * sed - 流编辑器
 * <p>
 * 每个文件独立执行脚本（行号与 '$' 按文件计算）；-i 时先读取全部文件再逐个写回。
 */
public class SedCommand extends AbstractCommand {

    public SedCommand() {
        super("sed", CommandHelp.builder()
                .usage("sed [OPTIONS] SCRIPT [FILE...]")
                .description("Stream editor for filtering and transforming text")
                .addFlag("-n", "Suppress automatic printing of pattern space")
                .addFlag("-i", "Edit files in place")
                .addFlag("-e SCRIPT", "Add script to commands (repeatable)")
                .addFlag("-E", "Extended regular expressions (always on)")
                .addExample("sed 's/foo/bar/' file.txt", "Replace first foo with bar on each line")
                .addExample("sed 's/foo/bar/g' file.txt", "Replace all occurrences")
                .addExample("sed -i 's/old/new/g' file.txt", "Edit file in place")
                .addExample("sed -n '/error/p' log.txt", "Print only matching lines")
                .addExample("sed '2,4d' file.txt", "Delete lines 2 through 4")
                .addExample("sed 's#/usr#/opt#g' paths.txt", "Use # as delimiter")
                .note("Commands: s (substitute), d (delete), p (print)")
                .note("Addresses: N, $, /regex/, addr1,addr2")
                .note("Substitute flags: g (global), i (ignore case), p (print)")
                .note("Replacement: & is the whole match, \\1-\\9 are groups")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean quiet = false;
        boolean inPlace = false;
        List<String> expressions = new ArrayList<>();
        String script = null;
        List<String> paths = new ArrayList<>();

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if ("-n".equals(arg) || "--quiet".equals(arg) || "--silent".equals(arg)) {
                quiet = true;
            } else if ("-i".equals(arg) || "--in-place".equals(arg)) {
                inPlace = true;
            } else if ("-e".equals(arg) || "--expression".equals(arg)) {
                if (i + 1 >= args.size()) {
                    return Mono.just(ShellResult.error("sed: option requires an argument -- e"));
                }
                expressions.add(args.get(++i));
            } else if (arg.startsWith("--expression=")) {
                expressions.add(arg.substring("--expression=".length()));
            } else if ("-E".equals(arg) || "-r".equals(arg) || "--regexp-extended".equals(arg)) {
                // Java 正则本身即为扩展语法
                continue;
            } else if (CommandSupport.isFlagGroup(arg, "niEr")) {
                quiet |= arg.indexOf('n') >= 0;
                inPlace |= arg.indexOf('i') >= 0;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                return Mono.just(ShellResult.error("sed: unknown option: " + arg));
            } else if (expressions.isEmpty() && script == null) {
                script = arg;
            } else {
                paths.add(arg);
            }
        }

        if (script != null) {
            expressions.add(0, script);
        }
        if (expressions.isEmpty()) {
            return Mono.just(ShellResult.error("sed: no script specified"));
        }

        SedScript sed;
        try {
            sed = SedScript.parse(expressions);
        } catch (CommandParseException e) {
            return Mono.just(ShellResult.error("sed: " + e.getMessage()));
        }
        if (sed.getInstructions().isEmpty()) {
            return Mono.just(ShellResult.error("sed: no valid commands"));
        }

        final boolean suppress = quiet;
        if (paths.isEmpty()) {
            if (context.hasStdin()) {
                return Mono.just(ShellResult.ok(sed.apply(context.getStdin(), suppress)));
            }
            return Mono.just(ShellResult.error("sed: no input files"));
        }

        final boolean writeBack = inPlace;
        return CommandSupport.expandGlobs(context.getFs(), paths)
                .flatMap(files -> CommandSupport.readAll(context.getFs(), files))
                .flatMap(inputs -> {
                    for (FileInput input : inputs) {
                        if (!input.exists()) {
                            return Mono.just(ShellResult.error(input.isDirectory()
                                    ? "sed: couldn't edit " + input.getPath() + ": not a regular file"
                                    : "sed: " + input.getPath() + ": No such file"));
                        }
                    }
                    if (writeBack) {
                        return Flux.fromIterable(inputs)
                                .concatMap(input -> context.getFs()
                                        .write(input.getPath(), sed.apply(input.getContent(), suppress)))
                                .then(Mono.just(ShellResult.ok("")));
                    }
                    StringBuilder stdout = new StringBuilder();
                    for (FileInput input : inputs) {
                        stdout.append(sed.apply(input.getContent(), suppress));
                    }
                    return Mono.just(ShellResult.ok(stdout.toString()));
                });
    }
}
