package io.leavesfly.vshell.env;

import java.util.List;
import java.util.Optional;

/**
 * 环境变量提供者
 * <p>
 * 用于向 Shell 注入密钥等只读变量。变量值可参与 $VAR 展开，
 * 但 env 命令只展示键名，值以掩码显示。
 */
public interface EnvironmentProvider {

    Optional<String> get(String name);

    /**
     * 可用的变量名
     */
    List<String> keys();
}
