package io.leavesfly.vshell.ui;

import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import lombok.extern.slf4j.Slf4j;
import org.jline.reader.EndOfFileException;
import org.jline.reader.LineReader;
import org.jline.reader.LineReaderBuilder;
import org.jline.reader.UserInterruptException;
import org.jline.reader.impl.completer.StringsCompleter;
import org.jline.terminal.Terminal;
import org.jline.terminal.TerminalBuilder;
import org.jline.utils.AttributedString;
import org.jline.utils.AttributedStyle;

import java.io.IOException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 基于 JLine 的交互式 Shell
 * <p>
 * 每次读取一段脚本交给 {@link Shell} 执行；行尾为 '\' 或存在未结束的 heredoc 时继续读取下一行。
 */
@Slf4j
public class ShellRepl implements AutoCloseable {

    private static final Pattern HEREDOC = Pattern.compile("<<-?\\s*(['\"]?)(\\w+)\\1");

    private final Shell shell;
    private final Terminal terminal;
    private final LineReader lineReader;

    public ShellRepl(Shell shell) throws IOException {
        this.shell = shell;
        this.terminal = TerminalBuilder.builder()
                .system(true)
                .encoding("UTF-8")
                .build();
        this.lineReader = LineReaderBuilder.builder()
                .terminal(terminal)
                .appName("vshell")
                .completer(new StringsCompleter(shell.getRegistry().getCommandNames()))
                // 禁用事件扩展（!字符）
                .option(LineReader.Option.DISABLE_EVENT_EXPANSION, true)
                .build();
    }

    /**
     * 主循环，exit / quit 或 Ctrl-D 退出
     */
    public void run() {
        printInfo("vshell - type 'help' for available commands, 'exit' to quit");
        while (true) {
            try {
                String script = readScript();
                if (script == null) {
                    break;
                }
                String trimmed = script.trim();
                if ("exit".equals(trimmed) || "quit".equals(trimmed)) {
                    break;
                }
                if (!trimmed.isEmpty()) {
                    print(shell.run(script));
                }
            } catch (UserInterruptException e) {
                printInfo("Tip: press Ctrl-D or type 'exit' to quit");
            } catch (EndOfFileException e) {
                break;
            } catch (RuntimeException e) {
                log.error("Error in interactive shell", e);
                printError("Error: " + e.getMessage());
            }
        }
        printInfo("Bye!");
    }

    /**
     * 读取一段完整脚本，续行与 heredoc 正文以换行拼接
     */
    private String readScript() {
        String line = lineReader.readLine(prompt());
        if (line == null) {
            return null;
        }
        StringBuilder script = new StringBuilder();
        while (line.endsWith("\\")) {
            script.append(line, 0, line.length() - 1);
            line = lineReader.readLine("> ");
        }
        script.append(line);

        Matcher heredoc = HEREDOC.matcher(line);
        if (heredoc.find()) {
            String delimiter = heredoc.group(2);
            while (true) {
                String body = lineReader.readLine("> ");
                script.append('\n').append(body);
                if (body.trim().equals(delimiter)) {
                    break;
                }
            }
        }
        return script.toString();
    }

    private String prompt() {
        AttributedStyle style = AttributedStyle.DEFAULT.foreground(AttributedStyle.CYAN).bold();
        String label = shell.isReadOnly() ? "vshell[ro]> " : "vshell> ";
        return new AttributedString(label, style).toAnsi(terminal);
    }

    private void print(ShellResult result) {
        if (!result.getStdout().isEmpty()) {
            terminal.writer().print(result.getStdout());
            if (!result.getStdout().endsWith("\n")) {
                terminal.writer().println();
            }
        }
        if (!result.getStderr().isEmpty()) {
            printError(result.getStderr());
        }
        if (!result.isSuccess()) {
            printStyled("[exit " + result.getExitCode() + "]", AttributedStyle.YELLOW);
        }
        terminal.flush();
    }

    private void printInfo(String text) {
        printStyled(text, AttributedStyle.BLUE);
    }

    private void printError(String text) {
        printStyled(text, AttributedStyle.RED);
    }

    private void printStyled(String text, int color) {
        terminal.writer().println(new AttributedString(text,
                AttributedStyle.DEFAULT.foreground(color)).toAnsi(terminal));
        terminal.flush();
    }

    @Override
    public void close() throws IOException {
        terminal.close();
    }
}
