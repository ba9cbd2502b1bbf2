package io.leavesfly.vshell.env;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EnvironmentProviderTest {

    @Test
    void mapProviderKeepsInsertionOrder() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("B_KEY", "2");
        values.put("A_KEY", "1");
        MapEnvironmentProvider provider = new MapEnvironmentProvider(values);

        assertEquals(List.of("B_KEY", "A_KEY"), provider.keys());
        assertEquals(Optional.of("1"), provider.get("A_KEY"));
        assertTrue(provider.get("MISSING").isEmpty());
    }

    @Test
    void mapProviderCopiesInput() {
        Map<String, String> values = new HashMap<>();
        values.put("TOKEN", "abc");
        MapEnvironmentProvider provider = new MapEnvironmentProvider(values);
        values.put("TOKEN", "changed");

        assertEquals(Optional.of("abc"), provider.get("TOKEN"));
    }

    @Test
    void systemProviderStripsPrefixAndFilters() {
        Map<String, String> env = Map.of(
                "VSHELL_SECRET_API_KEY", "k1",
                "VSHELL_SECRET_DB_PASS", "p1",
                "VSHELL_SECRET_", "empty-name",
                "HOME", "/home/user");
        SystemEnvironmentProvider provider = new SystemEnvironmentProvider("VSHELL_SECRET_", env);

        assertEquals(List.of("API_KEY", "DB_PASS"), provider.keys());
        assertEquals(Optional.of("k1"), provider.get("API_KEY"));
        assertTrue(provider.get("HOME").isEmpty());
    }
}
