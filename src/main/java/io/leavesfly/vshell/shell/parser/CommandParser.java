package io.leavesfly.vshell.shell.parser;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 命令解析器
 * <p>
 * 将多行命令脚本解析为管道序列，处理流程：
 * <ol>
 *   <li>合并引号跨行的逻辑行</li>
 *   <li>跳过空行与 '#' 注释行</li>
 *   <li>识别 heredoc，收集正文直到定界符行</li>
 *   <li>按顶层 '&amp;&amp;' 切分，再按顶层 '|' 切分为管道阶段</li>
 *   <li>对每个阶段分词并提取重定向</li>
 * </ol>
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class CommandParser {

    /**
     * heredoc 标记：&lt;&lt; WORD、&lt;&lt;-WORD、&lt;&lt; 'WORD'、&lt;&lt; "WORD"
     * 第 1 组为可选引号，第 2 组为定界符
     */
    private static final Pattern HEREDOC = Pattern.compile("<<-?\\s*(['\"]?)(\\w+)\\1");

    /**
     * stderr 重定向片段，虚拟 Shell 没有独立的 stderr 重定向通道
     */
    private static final Pattern STDERR_REDIRECT = Pattern.compile("\\s*2>\\s*(?:/dev/null|&1)\\s*");

    /**
     * 解析命令脚本
     *
     * @param input 命令文本，可包含多行
     * @return 管道序列，空命令被丢弃
     */
    public static List<Pipeline> parse(String input) {
        List<Pipeline> pipelines = new ArrayList<>();
        if (input == null) {
            return pipelines;
        }
        List<String> lines = joinQuotedLines(input.split("\n", -1));

        int i = 0;
        while (i < lines.size()) {
            String line = lines.get(i).trim();

            if (line.isEmpty() || line.startsWith("#")) {
                i++;
                continue;
            }

            Matcher heredoc = HEREDOC.matcher(line);
            if (heredoc.find()) {
                boolean quoted = !heredoc.group(1).isEmpty();
                String delimiter = heredoc.group(2);
                String cleanedLine = heredoc.replaceFirst("").trim();

                List<String> body = new ArrayList<>();
                i++;
                while (i < lines.size() && !lines.get(i).trim().equals(delimiter)) {
                    body.add(lines.get(i));
                    i++;
                }
                // 跳过定界符行
                i++;

                if (!cleanedLine.isEmpty()) {
                    Pipeline pipeline = parsePipeline(cleanedLine);
                    if (pipeline != null) {
                        ParsedCommand first = pipeline.first();
                        first.setStdinContent(body.isEmpty() ? "" : String.join("\n", body) + "\n");
                        first.setHeredocQuoted(quoted);
                        pipelines.add(pipeline);
                    }
                }
                continue;
            }

            for (String part : splitTopLevel(line, '&', true)) {
                String trimmed = part.trim();
                if (trimmed.isEmpty()) {
                    continue;
                }
                Pipeline pipeline = parsePipeline(trimmed);
                if (pipeline != null) {
                    pipelines.add(pipeline);
                }
            }
            i++;
        }
        return pipelines;
    }

    /**
     * 合并引号未闭合的行
     * 末尾仍未闭合的引号视为续行结束，扫描到的内容原样保留
     */
    static List<String> joinQuotedLines(String[] lines) {
        List<String> result = new ArrayList<>();
        StringBuilder pending = null;
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;

        for (String line : lines) {
            if (inSingleQuote || inDoubleQuote) {
                pending.append('\n').append(line);
            } else {
                if (pending != null) {
                    result.add(pending.toString());
                }
                pending = new StringBuilder(line);
            }

            boolean escape = false;
            for (int i = 0; i < line.length(); i++) {
                char c = line.charAt(i);
                if (escape) {
                    escape = false;
                    continue;
                }
                if (c == '\\' && !inSingleQuote) {
                    escape = true;
                    continue;
                }
                if (c == '\'' && !inDoubleQuote) {
                    inSingleQuote = !inSingleQuote;
                } else if (c == '"' && !inSingleQuote) {
                    inDoubleQuote = !inDoubleQuote;
                }
            }
        }

        if (pending != null) {
            result.add(pending.toString());
        }
        return result;
    }

    /**
     * 按顶层分隔符切分（引号内的分隔符不切分，转义字符原样保留）
     *
     * @param doubled 为 true 时分隔符需连续出现两次（'&amp;&amp;'）
     */
    static List<String> splitTopLevel(String input, char separator, boolean doubled) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inSingleQuote = false;
        boolean inDoubleQuote = false;
        boolean escape = false;

        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);

            if (escape) {
                current.append(c);
                escape = false;
                continue;
            }
            if (c == '\\') {
                escape = true;
                current.append(c);
                continue;
            }
            if (c == '\'' && !inDoubleQuote) {
                inSingleQuote = !inSingleQuote;
            } else if (c == '"' && !inSingleQuote) {
                inDoubleQuote = !inDoubleQuote;
            } else if (c == separator && !inSingleQuote && !inDoubleQuote) {
                if (!doubled) {
                    parts.add(current.toString());
                    current.setLength(0);
                    continue;
                }
                if (i + 1 < input.length() && input.charAt(i + 1) == separator) {
                    parts.add(current.toString());
                    current.setLength(0);
                    i++;
                    continue;
                }
            }
            current.append(c);
        }

        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static Pipeline parsePipeline(String line) {
        List<ParsedCommand> stages = new ArrayList<>();
        for (String segment : splitTopLevel(line, '|', false)) {
            String trimmed = segment.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            ParsedCommand stage = parseSegment(trimmed);
            if (stage != null) {
                stages.add(stage);
            }
        }
        return stages.isEmpty() ? null : new Pipeline(stages);
    }

    /**
     * 解析单个管道阶段，零记号时返回 null
     */
    static ParsedCommand parseSegment(String segment) {
        String cleaned = STDERR_REDIRECT.matcher(segment).replaceAll(" ");
        List<String> tokens = Tokenizer.tokenize(cleaned);
        if (tokens.isEmpty()) {
            return null;
        }

        ParsedCommand command = new ParsedCommand();
        command.setCommand(tokens.get(0));

        for (int i = 1; i < tokens.size(); i++) {
            String token = tokens.get(i);
            String next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            switch (token) {
                case ">":
                    command.setOutputFile(next);
                    command.setAppendFile(null);
                    i++;
                    break;
                case ">>":
                    command.setAppendFile(next);
                    command.setOutputFile(null);
                    i++;
                    break;
                case "<":
                    command.setInputFile(next);
                    i++;
                    break;
                default:
                    command.getArgs().add(token);
            }
        }
        return command;
    }
}
