package io.leavesfly.vshell.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.web.reactive.function.client.WebClient;

/**
 * vshell 应用配置类
 * 统一管理核心 Bean 的创建和配置
 */
@Configuration
public class VshellConfiguration {

    /**
     * 网络命令响应体的内存上限
     */
    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    /**
     * ObjectMapper Bean - JSON 序列化/反序列化
     * 全局单例，jq 命令与配置加载共用
     */
    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        // 忽略未知属性（提高容错性）
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * YAML ObjectMapper Bean
     * 用于 YAML 格式的配置文件与工作区种子文件
     */
    @Bean("yamlObjectMapper")
    public ObjectMapper yamlObjectMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    /**
     * ShellConfig Bean - 内置默认配置
     * 从 application.yml 中加载 vshell.shell 配置
     */
    @Bean
    @ConfigurationProperties(prefix = "vshell.shell")
    public ShellConfig shellConfig() {
        return new ShellConfig();
    }

    /**
     * WebClient Bean - curl / browse 命令共用的 HTTP 客户端
     */
    @Bean
    public WebClient webClient(WebClient.Builder builder) {
        return builder
                .codecs(codecs -> codecs.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE))
                .build();
    }
}
