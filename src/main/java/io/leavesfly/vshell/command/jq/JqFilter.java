package io.leavesfly.vshell.command.jq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.NullNode;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.exception.VshellException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.TreeSet;

/**
 * jq 过滤器
 * <p>
 * 过滤器在顶层（括号深度为 0）按 '.' 与 '|' 切分为若干步骤，依次作用在值流上：
 * {@code .field}、{@code []}、{@code [N]}、{@code select(cond)}、{@code map(f)}、
 * {@code keys}、{@code values}、{@code length}。
 */
public final class JqFilter {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final String source;
    private final List<Step> steps;

    private JqFilter(String source, List<Step> steps) {
        this.source = source;
        this.steps = steps;
    }

    /**
     * 解析过滤器
     *
     * @throws CommandParseException 过滤器语法错误
     */
    public static JqFilter parse(String filter) {
        List<Step> steps = new ArrayList<>();
        for (String part : split(filter)) {
            steps.add(parseStep(part));
        }
        return new JqFilter(filter, steps);
    }

    /**
     * 对单个输入求值，返回输出值流
     *
     * @throws VshellException 运行时类型错误
     */
    public List<JsonNode> apply(JsonNode input) {
        List<JsonNode> stream = new ArrayList<>();
        stream.add(input);
        for (Step step : steps) {
            List<JsonNode> next = new ArrayList<>();
            for (JsonNode value : stream) {
                step.apply(value, next);
            }
            stream = next;
        }
        return stream;
    }

    public String getSource() {
        return source;
    }

    /**
     * 顶层切分：括号内与字符串内的 '.'、'|' 不切分；']' 回到顶层时结束一个步骤
     */
    static List<String> split(String filter) {
        List<String> parts = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        int depth = 0;
        boolean inString = false;

        for (int i = 0; i < filter.length(); i++) {
            char c = filter.charAt(i);

            if (inString) {
                current.append(c);
                if (c == '\\' && i + 1 < filter.length()) {
                    current.append(filter.charAt(++i));
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }

            if (c == '"') {
                inString = true;
                current.append(c);
            } else if (c == '(' || c == '[') {
                if (c == '[' && depth == 0 && current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
                depth++;
                current.append(c);
            } else if (c == ')' || c == ']') {
                depth--;
                if (depth < 0) {
                    throw new CommandParseException("unbalanced '" + c + "' in filter: " + filter);
                }
                current.append(c);
                if (depth == 0 && c == ']') {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else if ((c == '.' || c == '|') && depth == 0) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else if (Character.isWhitespace(c) && depth == 0) {
                if (current.length() > 0) {
                    parts.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }

        if (depth != 0 || inString) {
            throw new CommandParseException("unterminated expression in filter: " + filter);
        }
        if (current.length() > 0) {
            parts.add(current.toString());
        }
        return parts;
    }

    private static Step parseStep(String part) {
        if ("[]".equals(part)) {
            return JqFilter::iterate;
        }
        if (part.startsWith("[") && part.endsWith("]")) {
            String inner = part.substring(1, part.length() - 1).trim();
            if (inner.length() >= 2 && inner.startsWith("\"") && inner.endsWith("\"")) {
                String field = inner.substring(1, inner.length() - 1);
                return (value, out) -> field(value, field, out);
            }
            try {
                int index = Integer.parseInt(inner);
                return (value, out) -> index(value, index, out);
            } catch (NumberFormatException e) {
                throw new CommandParseException("invalid index: " + part, e);
            }
        }
        if (part.startsWith("select(") && part.endsWith(")")) {
            JqCondition condition = JqCondition.parse(part.substring("select(".length(), part.length() - 1));
            return (value, out) -> select(value, condition, out);
        }
        if (part.startsWith("map(") && part.endsWith(")")) {
            JqFilter inner = parse(part.substring("map(".length(), part.length() - 1));
            return (value, out) -> map(value, inner, out);
        }
        switch (part) {
            case "keys":
                return JqFilter::keys;
            case "values":
                return JqFilter::values;
            case "length":
                return JqFilter::length;
            default:
                break;
        }
        if (part.matches("[A-Za-z_][\\w-]*")) {
            return (value, out) -> field(value, part, out);
        }
        if (part.length() >= 2 && part.startsWith("\"") && part.endsWith("\"")) {
            String field = part.substring(1, part.length() - 1);
            return (value, out) -> field(value, field, out);
        }
        throw new CommandParseException("unsupported filter step: " + part);
    }

    private static void field(JsonNode value, String name, List<JsonNode> out) {
        if (value.isObject()) {
            JsonNode child = value.get(name);
            out.add(child == null ? NullNode.getInstance() : child);
        } else if (value.isNull()) {
            out.add(NullNode.getInstance());
        } else {
            throw new VshellException("Cannot index " + typeName(value) + " with \"" + name + "\"");
        }
    }

    private static void iterate(JsonNode value, List<JsonNode> out) {
        if (!value.isArray()) {
            throw new VshellException("Cannot iterate over " + typeName(value));
        }
        value.forEach(out::add);
    }

    private static void index(JsonNode value, int index, List<JsonNode> out) {
        if (value.isNull()) {
            out.add(NullNode.getInstance());
            return;
        }
        if (!value.isArray()) {
            throw new VshellException("Cannot index " + typeName(value) + " with number");
        }
        int resolved = index < 0 ? value.size() + index : index;
        JsonNode element = resolved >= 0 ? value.get(resolved) : null;
        out.add(element == null ? NullNode.getInstance() : element);
    }

    /**
     * 数组输入按元素过滤并返回新数组，其它输入按条件保留或丢弃
     */
    private static void select(JsonNode value, JqCondition condition, List<JsonNode> out) {
        if (value.isArray()) {
            ArrayNode filtered = NODES.arrayNode();
            for (JsonNode element : value) {
                if (condition.test(element)) {
                    filtered.add(element);
                }
            }
            out.add(filtered);
        } else if (condition.test(value)) {
            out.add(value);
        }
    }

    private static void map(JsonNode value, JqFilter inner, List<JsonNode> out) {
        if (!value.isArray()) {
            throw new VshellException("Cannot iterate over " + typeName(value));
        }
        ArrayNode mapped = NODES.arrayNode();
        for (JsonNode element : value) {
            inner.apply(element).forEach(mapped::add);
        }
        out.add(mapped);
    }

    /**
     * 对象返回排序后的键，数组返回下标
     */
    private static void keys(JsonNode value, List<JsonNode> out) {
        ArrayNode keys = NODES.arrayNode();
        if (value.isObject()) {
            TreeSet<String> names = new TreeSet<>();
            Iterator<String> it = value.fieldNames();
            while (it.hasNext()) {
                names.add(it.next());
            }
            names.forEach(keys::add);
        } else if (value.isArray()) {
            for (int i = 0; i < value.size(); i++) {
                keys.add(i);
            }
        } else {
            throw new VshellException(typeName(value) + " has no keys");
        }
        out.add(keys);
    }

    private static void values(JsonNode value, List<JsonNode> out) {
        if (!value.isObject() && !value.isArray()) {
            throw new VshellException(typeName(value) + " has no values");
        }
        ArrayNode values = NODES.arrayNode();
        value.forEach(values::add);
        out.add(values);
    }

    private static void length(JsonNode value, List<JsonNode> out) {
        if (value.isArray() || value.isObject()) {
            out.add(IntNode.valueOf(value.size()));
        } else if (value.isTextual()) {
            String text = value.textValue();
            out.add(IntNode.valueOf(text.codePointCount(0, text.length())));
        } else if (value.isNull()) {
            out.add(IntNode.valueOf(0));
        } else if (value.isNumber()) {
            out.add(NODES.numberNode(value.decimalValue().abs()));
        } else {
            throw new VshellException(typeName(value) + " (" + value + ") has no length");
        }
    }

    static String typeName(JsonNode value) {
        switch (value.getNodeType()) {
            case ARRAY:
                return "array";
            case OBJECT:
                return "object";
            case STRING:
                return "string";
            case NUMBER:
                return "number";
            case BOOLEAN:
                return "boolean";
            case NULL:
            case MISSING:
                return "null";
            default:
                return value.getNodeType().name().toLowerCase(Locale.ROOT);
        }
    }

    @FunctionalInterface
    private interface Step {
        void apply(JsonNode value, List<JsonNode> out);
    }
}
