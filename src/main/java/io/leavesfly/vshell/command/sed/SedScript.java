package io.leavesfly.vshell.command.sed;

import io.leavesfly.vshell.command.CommandSupport;
import lombok.Getter;

import java.util.List;

/**
 * 已解析的 sed 脚本，按行依次执行全部指令
 */
@Getter
public class SedScript {

    private final List<SedInstruction> instructions;

    public SedScript(List<SedInstruction> instructions) {
        this.instructions = List.copyOf(instructions);
    }

    /**
     * 解析一个或多个脚本表达式（对应多个 -e）
     */
    public static SedScript parse(List<String> expressions) {
        return new SedScript(SedParser.parse(expressions));
    }

    /**
     * 对文本执行脚本
     *
     * @param content 输入文本
     * @param quiet   -n：关闭默认的逐行输出
     * @return 输出文本，非空时以换行结尾
     */
    public String apply(String content, boolean quiet) {
        List<String> lines = CommandSupport.splitLines(content);
        int total = lines.size();
        StringBuilder out = new StringBuilder();
        boolean any = false;

        for (int i = 0; i < total; i++) {
            String line = lines.get(i);
            int lineNumber = i + 1;
            boolean deleted = false;

            for (SedInstruction instruction : instructions) {
                if (!instruction.appliesTo(lineNumber, total, line)) {
                    continue;
                }
                if (instruction.getType() == SedInstruction.Type.DELETE) {
                    deleted = true;
                    break;
                }
                if (instruction.getType() == SedInstruction.Type.PRINT) {
                    any = append(out, line, any);
                } else {
                    String replaced = instruction.substitute(line);
                    if (replaced != null) {
                        line = replaced;
                        if (instruction.isPrintOnSubstitute()) {
                            any = append(out, line, any);
                        }
                    }
                }
            }

            if (!deleted && !quiet) {
                any = append(out, line, any);
            }
        }
        return any ? out.append('\n').toString() : "";
    }

    private static boolean append(StringBuilder out, String line, boolean any) {
        if (any) {
            out.append('\n');
        }
        out.append(line);
        return true;
    }
}
