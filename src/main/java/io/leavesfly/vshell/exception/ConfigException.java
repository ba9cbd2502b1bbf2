package io.leavesfly.vshell.exception;

/**
 * 配置异常
 * 配置文件无法读取或内容非法时抛出
 */
public class ConfigException extends VshellException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
