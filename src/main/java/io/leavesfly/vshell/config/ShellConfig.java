package io.leavesfly.vshell.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Shell 配置
 * 网络命令（curl / browse）的基础 URL、默认请求头与超时，以及各命令的输出上限
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ShellConfig {

    /**
     * curl 相对 URL 的基础地址
     */
    @JsonProperty("base_url")
    @Builder.Default
    private String baseUrl = "";

    /**
     * curl 默认请求头
     */
    @JsonProperty("default_headers")
    @Builder.Default
    private Map<String, String> defaultHeaders = new HashMap<>();

    /**
     * 网络请求超时（毫秒），0 表示不限制
     */
    @JsonProperty("timeout_ms")
    @Builder.Default
    private long timeoutMs = 30_000;

    /**
     * 工作区初始文件（相对路径 -> 内容）
     */
    @JsonProperty("initial_context")
    @Builder.Default
    private Map<String, Object> initialContext = new LinkedHashMap<>();

    /**
     * 输出与读取上限
     */
    @JsonProperty("limits")
    @Builder.Default
    private Limits limits = Limits.builder().build();

    public boolean hasBaseUrl() {
        return baseUrl != null && !baseUrl.isEmpty();
    }

    /**
     * 校验配置
     */
    public void validate() {
        if (timeoutMs < 0) {
            throw new IllegalStateException("timeout_ms must not be negative: " + timeoutMs);
        }
        if (limits == null) {
            throw new IllegalStateException("limits must be set");
        }
        limits.validate();
    }

    /**
     * 命令输出上限配置
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Limits {

        /**
         * cat 不分页时允许读取的最大字节数
         */
        @JsonProperty("max_file_size")
        @Builder.Default
        private long maxFileSize = 256 * 1024;

        /**
         * cat 默认最多输出的行数
         */
        @JsonProperty("default_line_limit")
        @Builder.Default
        private int defaultLineLimit = 2000;

        /**
         * cat / head 单行最大字符数
         */
        @JsonProperty("max_line_length")
        @Builder.Default
        private int maxLineLength = 2000;

        /**
         * grep 单行最大字符数
         */
        @JsonProperty("grep_max_line_length")
        @Builder.Default
        private int grepMaxLineLength = 500;

        /**
         * grep 总输出字符预算
         */
        @JsonProperty("max_output_chars")
        @Builder.Default
        private int maxOutputChars = 50_000;

        /**
         * browse 输出最大字符数
         */
        @JsonProperty("browse_max_chars")
        @Builder.Default
        private int browseMaxChars = 50_000;

        void validate() {
            if (maxFileSize <= 0 || defaultLineLimit <= 0 || maxLineLength <= 0
                    || grepMaxLineLength <= 0 || maxOutputChars <= 0 || browseMaxChars <= 0) {
                throw new IllegalStateException("all limits must be positive: " + this);
            }
        }
    }
}
