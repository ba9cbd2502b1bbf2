package io.leavesfly.vshell.env;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 进程环境变量提供者
 * <p>
 * 只暴露带指定前缀的变量，例如前缀 "VSHELL_SECRET_" 下的
 * VSHELL_SECRET_API_KEY 以 API_KEY 的名字提供给 Shell。
 */
@Slf4j
public class SystemEnvironmentProvider implements EnvironmentProvider {

    private final String prefix;
    private final Map<String, String> environment;

    public SystemEnvironmentProvider(String prefix) {
        this(prefix, System.getenv());
    }

    SystemEnvironmentProvider(String prefix, Map<String, String> environment) {
        this.prefix = prefix;
        this.environment = environment;
        log.debug("Exposing {} environment variables with prefix {}", keys().size(), prefix);
    }

    @Override
    public Optional<String> get(String name) {
        return Optional.ofNullable(environment.get(prefix + name));
    }

    @Override
    public List<String> keys() {
        return environment.keySet().stream()
                .filter(key -> key.startsWith(prefix) && key.length() > prefix.length())
                .map(key -> key.substring(prefix.length()))
                .sorted()
                .collect(Collectors.toList());
    }
}
