package io.leavesfly.vshell.command.handlers;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandSupport;
import io.leavesfly.vshell.command.FileInput;
import io.leavesfly.vshell.command.jq.JqFilter;
import io.leavesfly.vshell.command.jq.JqPrettyPrinter;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.exception.VshellException;
import io.leavesfly.vshell.shell.ShellResult;
import reactor.core.publisher.Mono;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * jq - 轻量 JSON 处理器
 */
public class JqCommand extends AbstractCommand {

    private final ObjectMapper objectMapper;
    private final ObjectWriter prettyWriter;

    public JqCommand(ObjectMapper objectMapper) {
        super("jq", CommandHelp.builder()
                .usage("jq [OPTIONS] FILTER [FILE...]")
                .description("Lightweight JSON processor")
                .addFlag("-r", "Raw output (no quotes on strings)")
                .addFlag("-c", "Compact output (single line)")
                .addExample("cat data.json | jq '.items'", "Extract field")
                .addExample("cat data.json | jq '.items[]'", "Iterate array")
                .addExample("jq -r '.name' data.json", "Raw string output")
                .addExample("jq '.items | length' data.json", "Count array items")
                .addExample("jq '.items | select(.price > 10)' data.json", "Filter array elements")
                .addExample("jq '.items | map(.id)' data.json", "Project a field from each element")
                .note("Supports: field access (.foo), arrays ([]), index ([0]), keys, values, length")
                .note("Supports: select(.field == \"value\"), select(.flag), map(.field)")
                .note("Reads from stdin or file arguments")
                .build());
        this.objectMapper = objectMapper;
        this.prettyWriter = objectMapper.writer(new JqPrettyPrinter());
    }

    @Override
    public Mono<ShellResult> execute(List<String> args, CommandContext context) {
        boolean raw = false;
        boolean compact = false;
        String filterText = null;
        List<String> paths = new ArrayList<>();

        for (String arg : args) {
            if ("--raw-output".equals(arg)) {
                raw = true;
            } else if ("--compact-output".equals(arg)) {
                compact = true;
            } else if (CommandSupport.isFlagGroup(arg, "rc")) {
                raw |= arg.indexOf('r') >= 0;
                compact |= arg.indexOf('c') >= 0;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                return Mono.just(ShellResult.error("jq: unknown option: " + arg));
            } else if (filterText == null) {
                filterText = arg;
            } else {
                paths.add(arg);
            }
        }

        JqFilter filter;
        try {
            filter = JqFilter.parse(filterText == null ? "." : filterText);
        } catch (CommandParseException e) {
            return Mono.just(ShellResult.error("jq: error: " + e.getMessage()));
        }

        final boolean rawOutput = raw;
        final boolean compactOutput = compact;

        return input(context, paths).map(inputs -> {
            if (inputs.getError() != null) {
                return ShellResult.error(inputs.getError());
            }
            String text = inputs.getText();
            if (text == null || text.isBlank()) {
                return ShellResult.error("jq: no input");
            }

            List<JsonNode> documents;
            try {
                documents = readDocuments(text);
            } catch (IOException e) {
                return ShellResult.error("jq: parse error: " + describe(e));
            }

            StringBuilder stdout = new StringBuilder();
            try {
                for (JsonNode document : documents) {
                    for (JsonNode result : filter.apply(document)) {
                        stdout.append(render(result, rawOutput, compactOutput)).append('\n');
                    }
                }
            } catch (VshellException e) {
                return ShellResult.error("jq: error: " + e.getMessage());
            } catch (JsonProcessingException e) {
                return ShellResult.error("jq: error: " + describe(e));
            }
            return ShellResult.ok(stdout.toString());
        });
    }

    private Mono<Input> input(CommandContext context, List<String> paths) {
        if (context.hasStdin() && paths.isEmpty()) {
            return Mono.just(new Input(context.getStdin(), null));
        }
        if (paths.isEmpty()) {
            return Mono.just(new Input(null, null));
        }
        return CommandSupport.readAll(context.getFs(), paths).map(files -> {
            StringBuilder text = new StringBuilder();
            for (FileInput file : files) {
                if (!file.exists()) {
                    return new Input(null, "jq: error: Could not open " + file.getPath() + ": No such file");
                }
                text.append(file.getContent()).append('\n');
            }
            return new Input(text.toString(), null);
        });
    }

    /**
     * 输入可以包含多个顶层 JSON 值
     */
    private List<JsonNode> readDocuments(String text) throws IOException {
        List<JsonNode> documents = new ArrayList<>();
        try (JsonParser parser = objectMapper.createParser(text)) {
            while (parser.nextToken() != null) {
                documents.add(objectMapper.readTree(parser));
            }
        }
        return documents;
    }

    private String render(JsonNode node, boolean raw, boolean compact) throws JsonProcessingException {
        if (raw && node.isTextual()) {
            return node.textValue();
        }
        if (compact) {
            return objectMapper.writeValueAsString(node);
        }
        return prettyWriter.writeValueAsString(node);
    }

    private static String describe(IOException e) {
        if (e instanceof JsonProcessingException) {
            JsonProcessingException jpe = (JsonProcessingException) e;
            String message = jpe.getOriginalMessage();
            if (jpe.getLocation() != null) {
                message += " at line " + jpe.getLocation().getLineNr()
                        + ", column " + jpe.getLocation().getColumnNr();
            }
            return message;
        }
        return e.getMessage();
    }

    private static final class Input {
        private final String text;
        private final String error;

        Input(String text, String error) {
            this.text = text;
            this.error = error;
        }

        String getText() {
            return text;
        }

        String getError() {
            return error;
        }
    }
}
