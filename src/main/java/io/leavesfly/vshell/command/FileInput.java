package io.leavesfly.vshell.command;

import lombok.Value;

/**
 * 读取结果：content 为 null 表示文件不存在或为目录
 */
@Value
public class FileInput {

    String path;
    String content;
    boolean directory;

    public static FileInput found(String path, String content) {
        return new FileInput(path, content, false);
    }

    public static FileInput missing(String path, boolean directory) {
        return new FileInput(path, null, directory);
    }

    public boolean exists() {
        return content != null;
    }
}
