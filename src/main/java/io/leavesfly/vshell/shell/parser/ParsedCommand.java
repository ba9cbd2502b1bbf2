package io.leavesfly.vshell.shell.parser;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 管道中的单个命令阶段
 * <p>
 * outputFile 与 appendFile 至多设置一个；stdinContent 为 heredoc 正文，
 * heredocQuoted 为 true 时正文不做变量展开。
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ParsedCommand {

    private String command;

    @Builder.Default
    private List<String> args = new ArrayList<>();

    /**
     * 输入重定向 {@code < file}
     */
    private String inputFile;

    /**
     * 输出重定向 {@code > file}
     */
    private String outputFile;

    /**
     * 追加重定向 {@code >> file}
     */
    private String appendFile;

    private String stdinContent;

    private boolean heredocQuoted;

    /**
     * 输出重定向目标（覆盖或追加）
     */
    public String getRedirectTarget() {
        return outputFile != null ? outputFile : appendFile;
    }

    public boolean isAppend() {
        return outputFile == null && appendFile != null;
    }
}
