package io.leavesfly.vshell.exception;

import lombok.Getter;

/**
 * 路径违规异常
 * 绝对路径、'..' 路径穿越、越出磁盘根目录时抛出
 */
@Getter
public class PathViolationException extends VshellException {

    /**
     * 触发违规的原始路径
     */
    private final String path;

    public PathViolationException(String path, String message) {
        super(message);
        this.path = path;
    }
}
