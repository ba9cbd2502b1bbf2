package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * echo - 输出文本
 */
public class EchoCommand extends AbstractCommand {

    public EchoCommand() {
        super("echo", CommandHelp.builder()
                .usage("echo [OPTIONS] [STRING...]")
                .description("Display text")
                .addFlag("-n", "Do not output trailing newline")
                .addFlag("-e", "Interpret escape sequences (\\n, \\t, \\r, \\\\)")
                .addExample("echo 'hello world'", "Print text with newline")
                .addExample("echo -n hello", "Print text without newline")
                .addExample("echo '{}' > data.json", "Write to file via redirection")
                .build());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean newline = true;
        boolean interpretEscapes = false;

        // 选项只出现在开头
        int i = 0;
        while (i < args.size() && args.get(i).matches("-[ne]+")) {
            String flags = args.get(i);
            if (flags.indexOf('n') >= 0) {
                newline = false;
            }
            if (flags.indexOf('e') >= 0) {
                interpretEscapes = true;
            }
            i++;
        }

        String output = String.join(" ", args.subList(i, args.size()));
        if (interpretEscapes) {
            output = unescape(output);
        }
        if (newline) {
            output += "\n";
        }
        return Mono.just(ShellResult.ok(output));
    }

    static String unescape(String text) {
        StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '\\' && i + 1 < text.length()) {
                char next = text.charAt(i + 1);
                switch (next) {
                    case 'n':
                        sb.append('\n');
                        i++;
                        continue;
                    case 't':
                        sb.append('\t');
                        i++;
                        continue;
                    case 'r':
                        sb.append('\r');
                        i++;
                        continue;
                    case '\\':
                        sb.append('\\');
                        i++;
                        continue;
                    default:
                        break;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
