package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.CommandSupport;
import lombok.Getter;

import java.util.ArrayList;
import java.util.List;

/**
 * head / tail 共用的参数解析：-n N、-nN、-N、-n +N
 */
@Getter
final class LineArgs {

    private int count;
    private boolean fromStart;
    private final List<String> paths = new ArrayList<>();
    private String error;

    private LineArgs(int count) {
        this.count = count;
    }

    static LineArgs parse(String command, List<String> args, int defaultCount) {
        LineArgs result = new LineArgs(defaultCount);
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            String value = null;
            if ("-n".equals(arg) || "--lines".equals(arg)) {
                value = i + 1 < args.size() ? args.get(++i) : "";
            } else if (arg.startsWith("-n")) {
                value = arg.substring(2);
            } else if (arg.startsWith("--lines=")) {
                value = arg.substring("--lines=".length());
            } else if (arg.length() > 1 && arg.startsWith("-") && CommandSupport.parseInt(arg.substring(1)) != null) {
                value = arg.substring(1);
            } else if (!arg.startsWith("-") || "-".equals(arg)) {
                result.paths.add(arg);
                continue;
            } else {
                continue;
            }

            boolean plus = value.startsWith("+");
            Integer parsed = CommandSupport.parseInt(plus ? value.substring(1) : value);
            if (parsed == null || parsed < 0) {
                result.error = command + ": invalid number of lines: '" + value + "'";
                return result;
            }
            result.count = parsed;
            result.fromStart = plus;
        }
        return result;
    }
}
