package io.leavesfly.vshell.shell.parser;

import lombok.Value;

import java.util.List;

/**
 * 管道：按源码顺序排列的命令阶段，第 i 个阶段的输出作为第 i+1 个阶段的输入
 */
@Value
public class Pipeline {

    List<ParsedCommand> stages;

    public Pipeline(List<ParsedCommand> stages) {
        this.stages = List.copyOf(stages);
    }

    public ParsedCommand first() {
        return stages.get(0);
    }

    public int size() {
        return stages.size();
    }
}
