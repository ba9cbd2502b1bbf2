package io.leavesfly.vshell.command.jq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import io.leavesfly.vshell.exception.CommandParseException;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * select() 的条件：{@code .path OP literal} 或仅 {@code .path}（按真值判断）
 * <p>
 * OP 为 == != > < >= <=；literal 为双引号字符串、true、false、null 或数字。
 */
public final class JqCondition {

    private static final Pattern COMPARISON = Pattern.compile("^\\s*(\\.[\\w.]*)\\s*(==|!=|>=|<=|>|<)\\s*(.+?)\\s*$");
    private static final Pattern BARE_PATH = Pattern.compile("^\\s*(\\.[\\w.]*)\\s*$");

    private final String[] path;
    private final String operator;
    private final JsonNode literal;

    private JqCondition(String[] path, String operator, JsonNode literal) {
        this.path = path;
        this.operator = operator;
        this.literal = literal;
    }

    public static JqCondition parse(String text) {
        Matcher comparison = COMPARISON.matcher(text);
        if (comparison.matches()) {
            return new JqCondition(splitPath(comparison.group(1)), comparison.group(2), literal(comparison.group(3)));
        }
        Matcher bare = BARE_PATH.matcher(text);
        if (bare.matches()) {
            return new JqCondition(splitPath(bare.group(1)), null, null);
        }
        throw new CommandParseException("invalid select condition: " + text.trim());
    }

    /**
     * 对单个值求条件
     */
    public boolean test(JsonNode item) {
        JsonNode value = resolve(item);
        if (operator == null) {
            return !value.isNull() && !(value.isBoolean() && !value.booleanValue());
        }
        switch (operator) {
            case "==":
                return equalValues(value, literal);
            case "!=":
                return !equalValues(value, literal);
            default:
                Integer order = compare(value, literal);
                if (order == null) {
                    return false;
                }
                switch (operator) {
                    case ">":
                        return order > 0;
                    case "<":
                        return order < 0;
                    case ">=":
                        return order >= 0;
                    default:
                        return order <= 0;
                }
        }
    }

    private JsonNode resolve(JsonNode item) {
        JsonNode current = item;
        for (String segment : path) {
            if (current == null || !current.isObject()) {
                return NullNode.getInstance();
            }
            current = current.get(segment);
        }
        return current == null ? NullNode.getInstance() : current;
    }

    private static boolean equalValues(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue()) == 0;
        }
        return a.equals(b);
    }

    private static Integer compare(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isTextual() && b.isTextual()) {
            return a.textValue().compareTo(b.textValue());
        }
        return null;
    }

    private static String[] splitPath(String path) {
        String trimmed = path.substring(1);
        if (trimmed.isEmpty()) {
            return new String[0];
        }
        return trimmed.split("\\.");
    }

    private static JsonNode literal(String raw) {
        if (raw.length() >= 2 && raw.startsWith("\"") && raw.endsWith("\"")) {
            return TextNode.valueOf(raw.substring(1, raw.length() - 1));
        }
        switch (raw) {
            case "true":
                return BooleanNode.TRUE;
            case "false":
                return BooleanNode.FALSE;
            case "null":
                return NullNode.getInstance();
            default:
                try {
                    return DecimalNode.valueOf(new BigDecimal(raw));
                } catch (NumberFormatException e) {
                    return TextNode.valueOf(raw);
                }
        }
    }
}
