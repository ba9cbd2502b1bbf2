package io.leavesfly.vshell.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.exception.ConfigException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.UnaryOperator;

/**
 * 配置加载服务
 * 负责从配置文件加载、保存 Shell 配置，并应用环境变量覆盖
 */
@Slf4j
@Service
public class ConfigLoader {

    private static final String CONFIG_FILE_NAME = "config.json";
    private static final String VSHELL_DIR = ".vshell";

    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlObjectMapper;
    private final UnaryOperator<String> environment;

    public ConfigLoader(ObjectMapper objectMapper,
                        @Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper) {
        this(objectMapper, yamlObjectMapper, System::getenv);
    }

    ConfigLoader(ObjectMapper objectMapper, ObjectMapper yamlObjectMapper, UnaryOperator<String> environment) {
        this.objectMapper = objectMapper;
        this.yamlObjectMapper = yamlObjectMapper;
        this.environment = environment;
    }

    /**
     * 获取默认配置文件路径
     */
    public Path getConfigFilePath() {
        String userHome = System.getProperty("user.home");
        return Paths.get(userHome, VSHELL_DIR, CONFIG_FILE_NAME);
    }

    /**
     * 加载配置
     * 配置优先级：环境变量 > 指定配置文件 > 默认配置文件 > 内置默认配置
     *
     * @param customConfigFile 指定配置文件，为 null 时使用默认路径
     * @param base             内置默认配置（通常来自 application.yml）
     */
    public ShellConfig loadConfig(Path customConfigFile, ShellConfig base) {
        Path configFile = customConfigFile != null ? customConfigFile : getConfigFilePath();

        ShellConfig config;
        if (Files.exists(configFile)) {
            log.debug("Loading config from file: {}", configFile);
            try {
                config = mapperFor(configFile).readValue(configFile.toFile(), ShellConfig.class);
            } catch (IOException e) {
                throw new ConfigException("Failed to load config from file: " + configFile, e);
            }
        } else if (customConfigFile != null) {
            throw new ConfigException("Config file not found: " + configFile);
        } else {
            log.debug("No config file found, using built-in defaults");
            config = base != null ? base : ShellConfig.builder().build();
        }

        applyEnvironmentOverrides(config);

        try {
            config.validate();
        } catch (IllegalStateException e) {
            throw new ConfigException("Invalid configuration: " + e.getMessage(), e);
        }

        return config;
    }

    /**
     * 保存配置
     */
    public void saveConfig(ShellConfig config, Path configFile) {
        try {
            if (configFile.getParent() != null) {
                Files.createDirectories(configFile.getParent());
            }
            mapperFor(configFile).writerWithDefaultPrettyPrinter()
                    .writeValue(configFile.toFile(), config);
            log.info("Config saved to: {}", configFile);
        } catch (IOException e) {
            throw new ConfigException("Failed to save config to file: " + configFile, e);
        }
    }

    private ObjectMapper mapperFor(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        return name.endsWith(".yml") || name.endsWith(".yaml") ? yamlObjectMapper : objectMapper;
    }

    /**
     * 应用环境变量覆盖
     */
    private void applyEnvironmentOverrides(ShellConfig config) {
        String baseUrl = environment.apply("VSHELL_BASE_URL");
        if (baseUrl != null && !baseUrl.isEmpty()) {
            log.info("Using VSHELL_BASE_URL from environment: {}", baseUrl);
            config.setBaseUrl(baseUrl);
        }

        String timeout = environment.apply("VSHELL_TIMEOUT_MS");
        if (timeout != null && !timeout.isEmpty()) {
            try {
                config.setTimeoutMs(Long.parseLong(timeout.trim()));
                log.info("Using VSHELL_TIMEOUT_MS from environment: {}", timeout);
            } catch (NumberFormatException e) {
                throw new ConfigException("VSHELL_TIMEOUT_MS is not a number: " + timeout, e);
            }
        }
    }
}
