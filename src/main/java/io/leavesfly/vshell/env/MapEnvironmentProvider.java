package io.leavesfly.vshell.env;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于 Map 的环境变量提供者
 */
public class MapEnvironmentProvider implements EnvironmentProvider {

    private final Map<String, String> values;

    public MapEnvironmentProvider(Map<String, String> values) {
        this.values = new LinkedHashMap<>(values);
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    @Override
    public List<String> keys() {
        return new ArrayList<>(values.keySet());
    }
}
