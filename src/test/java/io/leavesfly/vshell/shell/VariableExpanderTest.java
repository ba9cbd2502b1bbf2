package io.leavesfly.vshell.shell;

import io.leavesfly.vshell.env.MapEnvironmentProvider;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VariableExpander 单元测试
 */
class VariableExpanderTest {

    @Test
    void testExpandBothForms() {
        VariableExpander expander = new VariableExpander(Map.of("NAME", "world"), null);
        assertEquals("hello world/world!", expander.expand("hello $NAME/${NAME}!"));
    }

    @Test
    void testUnknownVariableIsEmpty() {
        VariableExpander expander = new VariableExpander(Map.of(), null);
        assertEquals("[]", expander.expand("[$NOPE]"));
        assertEquals("", expander.lookup("NOPE"));
    }

    @Test
    void testRuntimeShadowsProvider() {
        Map<String, String> env = new HashMap<>();
        env.put("MODE", "runtime");
        VariableExpander expander = new VariableExpander(env,
                new MapEnvironmentProvider(Map.of("MODE", "provided", "TOKEN", "abc")));

        assertEquals("runtime abc", expander.expand("$MODE $TOKEN"));
    }

    @Test
    void testReplacementIsLiteral() {
        VariableExpander expander = new VariableExpander(Map.of("PRICE", "$5\\each"), null);
        assertEquals("cost: $5\\each", expander.expand("cost: $PRICE"));
    }

    @Test
    void testValuesAreNotExpandedAgain() {
        VariableExpander expander = new VariableExpander(Map.of("A", "${B}", "B", "x", "C", "$B"), null);
        assertEquals("${B} $B", expander.expand("$A ${C}"));
    }

    @Test
    void testNonNameBracesKept() {
        VariableExpander expander = new VariableExpander(Map.of(), null);
        assertEquals("${a b} and ${", expander.expand("${a b} and ${"));
    }

    @Test
    void testTextWithoutDollarUnchanged() {
        VariableExpander expander = new VariableExpander(Map.of(), null);
        assertEquals("plain text", expander.expand("plain text"));
        assertNull(expander.expand(null));
    }

    @Test
    void testNameStopsAtNonWordCharacter() {
        VariableExpander expander = new VariableExpander(Map.of("A", "1"), null);
        assertEquals("1-x", expander.expand("$A-x"));
        assertEquals("", expander.expand("$AB"));
    }
}
