package io.leavesfly.vshell.command.jq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.exception.VshellException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JqFilter 单元测试
 */
class JqFilterTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    private static List<JsonNode> eval(String filter, String input) throws Exception {
        return JqFilter.parse(filter).apply(json(input));
    }

    @Test
    void testIdentity() throws Exception {
        List<JsonNode> out = eval(".", "{\"a\":1}");
        assertEquals(List.of(json("{\"a\":1}")), out);
    }

    @Test
    void testFieldAccess() throws Exception {
        assertEquals(List.of(json("\"x\"")), eval(".a.b", "{\"a\":{\"b\":\"x\"}}"));
        assertTrue(eval(".missing", "{}").get(0).isNull());
        assertTrue(eval(".a.b", "{\"a\":null}").get(0).isNull());
    }

    @Test
    void testQuotedField() throws Exception {
        assertEquals(List.of(json("1")), eval(".[\"a b\"]", "{\"a b\":1}"));
        assertEquals(List.of(json("2")), eval(".\"x-y\"", "{\"x-y\":2}"));
    }

    @Test
    void testIndexAndIterate() throws Exception {
        String input = "{\"items\":[{\"v\":1},{\"v\":5}]}";
        assertEquals(List.of(json("1")), eval(".items[0].v", input));
        assertEquals(List.of(json("{\"v\":5}")), eval(".items[-1]", input));
        assertTrue(eval(".items[7]", input).get(0).isNull());
        assertEquals(List.of(json("1"), json("5")), eval(".items[].v", input));
    }

    @Test
    void testSelectOnArrayKeepsArray() throws Exception {
        List<JsonNode> out = eval(".items | select(.v > 2)", "{\"items\":[{\"v\":1},{\"v\":5}]}");
        assertEquals(List.of(json("[{\"v\":5}]")), out);
    }

    @Test
    void testSelectOnStream() throws Exception {
        String input = "[{\"name\":\"a\",\"ok\":true},{\"name\":\"b\",\"ok\":false},{\"name\":\"c\"}]";
        assertEquals(List.of(json("\"b\"")), eval(".[] | select(.name == \"b\") | .name", input));
        assertEquals(List.of(json("\"a\"")), eval(".[] | select(.ok) | .name", input));
        assertEquals(2, eval(".[] | select(.name != \"a\")", input).size());
    }

    @Test
    void testMap() throws Exception {
        assertEquals(List.of(json("[1,5]")), eval(".items | map(.v)", "{\"items\":[{\"v\":1},{\"v\":5}]}"));
    }

    @Test
    void testKeysAreSorted() throws Exception {
        assertEquals(List.of(json("[\"a\",\"b\",\"c\"]")), eval("keys", "{\"c\":1,\"a\":2,\"b\":3}"));
        assertEquals(List.of(json("[0,1]")), eval("keys", "[true,false]"));
    }

    @Test
    void testValuesAndLength() throws Exception {
        assertEquals(List.of(json("[1,2]")), eval("values", "{\"a\":1,\"b\":2}"));
        assertEquals(2, eval(".items | length", "{\"items\":[1,2]}").get(0).intValue());
        assertEquals(3, eval(".name | length", "{\"name\":\"abc\"}").get(0).intValue());
        assertEquals(0, eval("length", "null").get(0).intValue());
    }

    @Test
    void testIterateNonArrayFails() {
        VshellException e = assertThrows(VshellException.class, () -> eval(".[]", "{\"a\":1}"));
        assertEquals("Cannot iterate over object", e.getMessage());
    }

    @Test
    void testIndexStringFails() {
        VshellException e = assertThrows(VshellException.class, () -> eval(".name.first", "{\"name\":\"x\"}"));
        assertEquals("Cannot index string with \"first\"", e.getMessage());
    }

    @Test
    void testSyntaxErrors() {
        assertThrows(CommandParseException.class, () -> JqFilter.parse(".items[0"));
        assertThrows(CommandParseException.class, () -> JqFilter.parse(".a | bogus()"));
        assertThrows(CommandParseException.class, () -> JqFilter.parse(".[x]"));
        assertThrows(CommandParseException.class, () -> JqFilter.parse("select(.a >)"));
    }

    @Test
    void testSplit() {
        assertEquals(List.of("items", "[]", "select(.v > 2)"), JqFilter.split(".items[] | select(.v > 2)"));
    }
}
