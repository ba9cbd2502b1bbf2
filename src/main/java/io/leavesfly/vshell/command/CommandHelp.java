package io.leavesfly.vshell.command;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.List;

/**
 * 命令帮助信息
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CommandHelp {

    private String usage;

    private String description;

    @Singular
    private List<Flag> flags;

    @Singular
    private List<Example> examples;

    @Singular
    private List<String> notes;

    @Data
    @AllArgsConstructor
    public static class Flag {
        private String flag;
        private String description;
    }

    @Data
    @AllArgsConstructor
    public static class Example {
        private String command;
        private String description;
    }

    public static class CommandHelpBuilder {

        public CommandHelpBuilder addFlag(String flag, String description) {
            return this.flag(new Flag(flag, description));
        }

        public CommandHelpBuilder addExample(String command, String description) {
            return this.example(new Example(command, description));
        }
    }

    /**
     * 渲染完整帮助文本
     */
    public String render(String name) {
        StringBuilder sb = new StringBuilder();
        sb.append(name).append(" - ").append(description).append("\n\n");
        sb.append("Usage: ").append(usage).append("\n");

        if (flags != null && !flags.isEmpty()) {
            sb.append("\nFlags:\n");
            int width = flags.stream().mapToInt(f -> f.getFlag().length()).max().orElse(0);
            for (Flag f : flags) {
                sb.append("  ").append(String.format("%-" + width + "s", f.getFlag()))
                        .append("  ").append(f.getDescription()).append("\n");
            }
        }

        if (examples != null && !examples.isEmpty()) {
            sb.append("\nExamples:\n");
            for (Example e : examples) {
                sb.append("  ").append(e.getCommand()).append("\n");
                sb.append("      ").append(e.getDescription()).append("\n");
            }
        }

        if (notes != null && !notes.isEmpty()) {
            sb.append("\nNotes:\n");
            for (String note : notes) {
                sb.append("  - ").append(note).append("\n");
            }
        }
        return sb.toString();
    }
}
