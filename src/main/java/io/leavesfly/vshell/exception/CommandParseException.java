package io.leavesfly.vshell.exception;

/**
 * 命令子语言解析异常（sed 脚本、jq 过滤器、日期字符串等）
 */
public class CommandParseException extends VshellException {

    public CommandParseException(String message) {
        super(message);
    }

    public CommandParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
