package io.leavesfly.vshell.shell.parser;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 命令分词器
 * <p>
 * 单遍扫描：反斜杠转义、引号开合（引号本身被消耗，引号内不按空白切分）、
 * 空白分隔，以及 {@code >}、{@code >>}、{@code <} 即使紧贴文本也作为独立记号。
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class Tokenizer {

    public static List<String> tokenize(String input) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escape = false;
        // 当前记号中是否出现过引号，用于保留 '' 这样的空参数
        boolean quoted = false;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);

            if (escape) {
                current.append(c);
                escape = false;
                continue;
            }

            if (c == '\\' && !inSingleQuote) {
                escape = true;
                continue;
            }

            if ((c == '\'' || c == '"') && !inSingleQuote && !inDoubleQuote && !quoted && isOperator(current)) {
                tokens.add(current.toString());
                current.setLength(0);
            }

            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
                quoted = true;
                continue;
            }

            if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
                quoted = true;
                continue;
            }

            boolean unquoted = !inSingleQuote && !inDoubleQuote;

            if ((c == ' ' || c == '\t') && unquoted) {
                if (current.length() > 0 || quoted) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    quoted = false;
                }
                continue;
            }

            if (unquoted && c == '>' && ">".contentEquals(current) && !quoted) {
                tokens.add(">>");
                current.setLength(0);
                continue;
            }

            if (unquoted && (c == '>' || c == '<')) {
                if (current.length() > 0 || quoted) {
                    tokens.add(current.toString());
                    current.setLength(0);
                    quoted = false;
                }
                current.append(c);
                continue;
            }

            if (unquoted && !quoted && isOperator(current)) {
                tokens.add(current.toString());
                current.setLength(0);
            }

            current.append(c);
        }

        if (current.length() > 0 || quoted) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    private static boolean isOperator(CharSequence token) {
        return ">".contentEquals(token) || "<".contentEquals(token);
    }
}
