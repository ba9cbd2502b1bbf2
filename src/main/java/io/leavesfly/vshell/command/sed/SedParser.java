package io.leavesfly.vshell.command.sed;

import io.leavesfly.vshell.exception.CommandParseException;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * sed 脚本解析器
 * <p>
 * 支持的语法：
 * <ul>
 *   <li>地址：N、$、/regex/、addr1,addr2</li>
 *   <li>命令：s/pattern/replacement/[gip]（任意分隔符）、d、p</li>
 *   <li>多条命令以 ';' 或换行分隔</li>
 * </ul>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class SedParser {

    public static List<SedInstruction> parse(List<String> expressions) {
        List<SedInstruction> instructions = new ArrayList<>();
        for (String expression : expressions) {
            for (String part : split(expression)) {
                String trimmed = part.trim();
                if (!trimmed.isEmpty()) {
                    instructions.add(parseInstruction(trimmed));
                }
            }
        }
        return instructions;
    }

    /**
     * 按 ';' 和换行切分脚本，跳过 /regex/ 地址与 s 命令内部的文本
     */
    static List<String> split(String script) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inCommand = false;
        int i = 0;
        int n = script.length();

        while (i < n) {
            char c = script.charAt(i);
            if (c == ';' || c == '\n') {
                parts.add(current.toString());
                current.setLength(0);
                inCommand = false;
                i++;
            } else if (inCommand) {
                current.append(c);
                i++;
            } else if (c == '/') {
                i = copyDelimited(script, i + 1, '/', current.append(c));
            } else if (c == 's' && i + 1 < n) {
                char delimiter = script.charAt(i + 1);
                current.append(c).append(delimiter);
                i = copyDelimited(script, i + 2, delimiter, current);
                i = copyDelimited(script, i, delimiter, current);
                inCommand = true;
            } else {
                current.append(c);
                inCommand = Character.isLetter(c);
                i++;
            }
        }
        parts.add(current.toString());
        return parts;
    }

    /**
     * 复制到未转义的分隔符（含分隔符本身），返回其后的位置
     */
    private static int copyDelimited(String text, int start, char delimiter, StringBuilder target) {
        int i = start;
        while (i < text.length()) {
            char c = text.charAt(i);
            target.append(c);
            if (c == '\\' && i + 1 < text.length()) {
                target.append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            i++;
            if (c == delimiter) {
                break;
            }
        }
        return i;
    }

    private static SedInstruction parseInstruction(String text) {
        Cursor cursor = new Cursor(text);
        SedAddress address = parseAddress(cursor, text);
        if (address != null) {
            cursor.skipWhitespace();
            if (cursor.peek() == ',') {
                cursor.pos++;
                cursor.skipWhitespace();
                SedAddress end = parseAddress(cursor, text);
                if (end == null) {
                    throw invalid(text);
                }
                address = SedAddress.range(address, end);
            }
        }
        cursor.skipWhitespace();
        if (cursor.atEnd()) {
            throw invalid(text);
        }

        char command = cursor.next();
        switch (command) {
            case 'd':
            case 'p':
                if (!cursor.rest().isBlank()) {
                    throw invalid(text);
                }
                return SedInstruction.builder()
                        .address(address)
                        .type(command == 'd' ? SedInstruction.Type.DELETE : SedInstruction.Type.PRINT)
                        .build();
            case 's':
                return parseSubstitution(cursor, address, text);
            default:
                throw invalid(text);
        }
    }

    private static SedAddress parseAddress(Cursor cursor, String text) {
        char c = cursor.peek();
        if (c == '$') {
            cursor.pos++;
            return SedAddress.last();
        }
        if (Character.isDigit(c)) {
            int start = cursor.pos;
            while (Character.isDigit(cursor.peek())) {
                cursor.pos++;
            }
            return SedAddress.line(Integer.parseInt(text.substring(start, cursor.pos)));
        }
        if (c == '/') {
            cursor.pos++;
            String regex = cursor.readUntil('/');
            if (regex == null) {
                throw invalid(text);
            }
            return SedAddress.regex(compile(unescapeDelimiter(regex, '/'), false));
        }
        return null;
    }

    private static SedInstruction parseSubstitution(Cursor cursor, SedAddress address, String text) {
        if (cursor.atEnd()) {
            throw invalid(text);
        }
        char delimiter = cursor.next();
        String pattern = cursor.readUntil(delimiter);
        String replacement = pattern == null ? null : cursor.readUntil(delimiter);
        if (replacement == null) {
            throw invalid(text);
        }

        boolean global = false;
        boolean ignoreCase = false;
        boolean print = false;
        for (char flag : cursor.rest().trim().toCharArray()) {
            switch (flag) {
                case 'g':
                    global = true;
                    break;
                case 'i':
                case 'I':
                    ignoreCase = true;
                    break;
                case 'p':
                    print = true;
                    break;
                default:
                    throw invalid(text);
            }
        }

        return SedInstruction.builder()
                .address(address)
                .type(SedInstruction.Type.SUBSTITUTE)
                .pattern(compile(unescapeDelimiter(pattern, delimiter), ignoreCase))
                .replacement(unescapeDelimiter(replacement, delimiter))
                .global(global)
                .printOnSubstitute(print)
                .build();
    }

    private static Pattern compile(String regex, boolean ignoreCase) {
        try {
            return ignoreCase ? Pattern.compile(regex, Pattern.CASE_INSENSITIVE) : Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new CommandParseException("invalid regex '" + regex + "': " + e.getDescription());
        }
    }

    /**
     * 去掉分隔符前的转义：s#a\#b#c# 中的 \# 还原为 #
     */
    private static String unescapeDelimiter(String text, char delimiter) {
        return text.replace("\\" + delimiter, String.valueOf(delimiter));
    }

    private static CommandParseException invalid(String text) {
        return new CommandParseException("invalid command: '" + text + "'");
    }

    private static final class Cursor {
        final String text;
        int pos;

        Cursor(String text) {
            this.text = text;
        }

        boolean atEnd() {
            return pos >= text.length();
        }

        char peek() {
            return atEnd() ? '\0' : text.charAt(pos);
        }

        char next() {
            return text.charAt(pos++);
        }

        void skipWhitespace() {
            while (!atEnd() && Character.isWhitespace(text.charAt(pos))) {
                pos++;
            }
        }

        String rest() {
            return text.substring(Math.min(pos, text.length()));
        }

        /**
         * 读取到未转义的分隔符为止（不含），转义序列原样保留；找不到分隔符时返回 null
         */
        String readUntil(char delimiter) {
            StringBuilder sb = new StringBuilder();
            while (!atEnd()) {
                char c = next();
                if (c == '\\' && !atEnd()) {
                    sb.append(c).append(next());
                } else if (c == delimiter) {
                    return sb.toString();
                } else {
                    sb.append(c);
                }
            }
            return null;
        }
    }
}
