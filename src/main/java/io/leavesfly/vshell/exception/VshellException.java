package io.leavesfly.vshell.exception;

/**
 * vshell 异常基类
 * 所有业务异常均为非受检异常，由 Shell 顶层统一转换为执行结果
 */
public class VshellException extends RuntimeException {

    public VshellException(String message) {
        super(message);
    }

    public VshellException(String message, Throwable cause) {
        super(message, cause);
    }
}
