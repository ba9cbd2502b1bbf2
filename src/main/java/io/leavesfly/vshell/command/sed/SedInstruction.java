package io.leavesfly.vshell.command.sed;

import lombok.Builder;
import lombok.Getter;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单条 sed 指令：[address]command
 */
@Getter
@Builder
public class SedInstruction {

    public enum Type {
        SUBSTITUTE, DELETE, PRINT
    }

    private final SedAddress address;

    private final Type type;

    /**
     * s 命令的模式
     */
    private final Pattern pattern;

    /**
     * s 命令的替换文本（保留 sed 转义，执行时展开）
     */
    private final String replacement;

    private final boolean global;

    /**
     * s 命令带 p 标志：替换发生时输出该行
     */
    private final boolean printOnSubstitute;

    public boolean appliesTo(int lineNumber, int totalLines, String line) {
        return address == null || address.matches(lineNumber, totalLines, line);
    }

    /**
     * 执行替换
     *
     * @return 替换后的行；未发生替换时返回 null
     */
    public String substitute(String line) {
        Matcher matcher = pattern.matcher(line);
        StringBuilder out = new StringBuilder();
        int last = 0;
        boolean replaced = false;
        while (matcher.find()) {
            out.append(line, last, matcher.start());
            out.append(expand(matcher));
            last = matcher.end();
            replaced = true;
            if (!global) {
                break;
            }
        }
        if (!replaced) {
            return null;
        }
        out.append(line, last, line.length());
        return out.toString();
    }

    /**
     * 展开替换文本：&amp; 为整个匹配，\1-\9 为分组，\n \t 为换行与制表符，\&amp; 为字面 &amp;
     */
    private String expand(Matcher matcher) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < replacement.length(); i++) {
            char c = replacement.charAt(i);
            if (c == '&') {
                sb.append(matcher.group());
            } else if (c == '\\' && i + 1 < replacement.length()) {
                char next = replacement.charAt(++i);
                if (next >= '1' && next <= '9') {
                    int group = next - '0';
                    if (group <= matcher.groupCount() && matcher.group(group) != null) {
                        sb.append(matcher.group(group));
                    }
                } else if (next == 'n') {
                    sb.append('\n');
                } else if (next == 't') {
                    sb.append('\t');
                } else {
                    sb.append(next);
                }
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }
}
