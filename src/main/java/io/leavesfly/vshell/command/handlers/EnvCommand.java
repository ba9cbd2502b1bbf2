package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * env - 列出环境变量
 * <p>
 * 运行时变量显示真实值，提供者注入的变量（密钥）以 *** 掩码显示。
 */
public class EnvCommand extends AbstractCommand {

    private static final String MASK = "***";

    public EnvCommand() {
        super("env", CommandHelp.builder()
                .usage("env")
                .description("List available environment variables")
                .addExample("env", "Show all environment variables")
                .note("Provider variables (e.g., API keys) show masked values (***)")
                .note("Runtime variables (set via VAR=value) show their actual values")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        return Mono.fromCallable(() -> {
            List<String> lines = new ArrayList<>();
            Set<String> seen = new HashSet<>();

            for (Map.Entry<String, String> entry : context.getEnv().entrySet()) {
                lines.add(entry.getKey() + "=" + entry.getValue());
                seen.add(entry.getKey());
            }

            context.envProvider().ifPresent(provider -> {
                for (String key : provider.keys()) {
                    if (seen.add(key)) {
                        lines.add(key + "=" + MASK);
                    }
                }
            });

            StringBuilder sb = new StringBuilder();
            lines.forEach(line -> sb.append(line).append('\n'));
            return ShellResult.ok(sb.toString());
        });
    }
}
