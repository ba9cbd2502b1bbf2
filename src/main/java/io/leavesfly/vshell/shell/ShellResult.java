package io.leavesfly.vshell.shell;

import lombok.Value;

/**
 * 命令执行结果
 * exitCode 为 0 是唯一的成功信号
 */
@Value
public class ShellResult {

    int exitCode;
    String stdout;
    String stderr;

    public static ShellResult ok(String stdout) {
        return new ShellResult(0, stdout, "");
    }

    public static ShellResult error(String stderr) {
        return new ShellResult(1, "", stderr);
    }

    public static ShellResult of(int exitCode, String stdout, String stderr) {
        return new ShellResult(exitCode, stdout, stderr);
    }

    public boolean isSuccess() {
        return exitCode == 0;
    }

    public ShellResult withStdout(String stdout) {
        return new ShellResult(exitCode, stdout, stderr);
    }
}
