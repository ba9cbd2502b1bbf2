package io.leavesfly.vshell.shell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHandler;
import io.leavesfly.vshell.command.CommandRegistry;
import io.leavesfly.vshell.command.CommandServices;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.env.EnvironmentProvider;
import io.leavesfly.vshell.exception.VshellException;
import io.leavesfly.vshell.shell.parser.CommandParser;
import io.leavesfly.vshell.shell.parser.ParsedCommand;
import io.leavesfly.vshell.shell.parser.Pipeline;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import io.leavesfly.vshell.workspace.PathValidator;
import io.leavesfly.vshell.workspace.ValidatedWorkspaceProvider;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Shell 执行引擎
 * <p>
 * 解析命令脚本，按顺序执行各管道，遇到第一个失败的命令即停止；
 * 持有运行时变量、只读模式与可写路径白名单。
 * 所有文件访问都经过 {@link ValidatedWorkspaceProvider}。
 */
@Slf4j
public class Shell {

    private static final Pattern ASSIGNMENT = Pattern.compile("^(\\w+)=(.*)$", Pattern.DOTALL);

    /**
     * 丢弃输出的重定向目标
     */
    static final String DEV_NULL = "/dev/null";

    private final WorkspaceProvider fs;
    private final CommandRegistry registry;
    private final ShellConfig config;
    private final Map<String, String> env = new LinkedHashMap<>();

    private boolean readOnly;
    private List<String> writablePaths = List.of();
    private EnvironmentProvider envProvider;

    /**
     * @param workspace    工作区，为 null 时使用以 initialContext 为种子的内存工作区
     * @param registry     命令注册表，为 null 时使用全部内置命令
     * @param config       配置，为 null 时使用默认配置
     * @param envProvider  密钥/环境变量提供者，可为 null
     * @param objectMapper 种子文件中非字符串内容的序列化器，为 null 时使用默认实例
     */
    @Builder
    private Shell(WorkspaceProvider workspace, CommandRegistry registry, ShellConfig config,
                  EnvironmentProvider envProvider, ObjectMapper objectMapper) {
        this.config = config != null ? config : ShellConfig.builder().build();
        this.registry = registry != null ? registry : CommandRegistry.builtins(CommandServices.defaults());
        this.envProvider = envProvider;

        WorkspaceProvider provider = workspace != null
                ? workspace
                : new InMemoryWorkspaceProvider(seedFiles(this.config.getInitialContext(),
                        objectMapper != null ? objectMapper : new ObjectMapper()));
        this.fs = provider instanceof ValidatedWorkspaceProvider
                ? provider
                : new ValidatedWorkspaceProvider(provider);

        log.debug("Shell created with {} commands", this.registry.size());
    }

    /**
     * 以默认配置与内存工作区创建 Shell
     */
    public static Shell create() {
        return Shell.builder().build();
    }

    /**
     * 种子文件转为文本，非字符串值序列化为 JSON
     */
    static Map<String, String> seedFiles(Map<String, Object> initialContext, ObjectMapper objectMapper) {
        Map<String, String> files = new LinkedHashMap<>();
        if (initialContext == null) {
            return files;
        }
        for (Map.Entry<String, Object> entry : initialContext.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof String) {
                files.put(entry.getKey(), (String) value);
                continue;
            }
            try {
                files.put(entry.getKey(), objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value));
            } catch (JsonProcessingException e) {
                throw new VshellException("Cannot serialize initial file: " + entry.getKey(), e);
            }
        }
        return files;
    }

    /**
     * 执行命令脚本（支持多行、&amp;&amp;、管道、重定向、heredoc 与注释）
     * <p>
     * 失败时返回的结果中 stdout 为此前所有成功命令的输出加上失败命令的输出。
     */
    public Mono<ShellResult> execute(String input) {
        return Mono.defer(() -> {
            List<Pipeline> pipelines = CommandParser.parse(input);
            if (pipelines.isEmpty()) {
                return Mono.just(ShellResult.ok(""));
            }

            StringBuilder combined = new StringBuilder();
            return Flux.fromIterable(pipelines)
                    .concatMap(this::executePipeline)
                    .doOnNext(result -> combined.append(result.getStdout()))
                    .takeUntil(result -> !result.isSuccess())
                    .last()
                    .map(result -> result.withStdout(combined.toString()));
        }).onErrorResume(e -> {
            if (e instanceof VshellException) {
                log.debug("Command rejected: {}", e.getMessage());
            } else {
                log.error("Failed to execute: {}", input, e);
            }
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return Mono.just(ShellResult.error(message));
        });
    }

    /**
     * 同步执行，供 CLI 与 REPL 使用
     */
    public ShellResult run(String input) {
        return execute(input).block();
    }

    private Mono<ShellResult> executePipeline(Pipeline pipeline) {
        return executeStage(pipeline.getStages(), 0, null);
    }

    /**
     * 执行第 index 个阶段；成功且存在下一阶段时把 stdout 作为其 stdin
     */
    private Mono<ShellResult> executeStage(List<ParsedCommand> stages, int index, String pipedInput) {
        boolean hasNext = index + 1 < stages.size();
        return executeCommand(stages.get(index), pipedInput, hasNext)
                .flatMap(result -> hasNext && result.isSuccess()
                        ? executeStage(stages, index + 1, result.getStdout())
                        : Mono.just(result));
    }

    private Mono<ShellResult> executeCommand(ParsedCommand parsed, String pipedInput, boolean hasNext) {
        Matcher assignment = ASSIGNMENT.matcher(parsed.getCommand());
        if (assignment.matches() && parsed.getArgs().isEmpty() && !hasNext) {
            env.put(assignment.group(1), assignment.group(2));
            return Mono.just(ShellResult.ok(""));
        }

        ParsedCommand cmd = expand(parsed);
        log.debug("Executing: {} {}", cmd.getCommand(), cmd.getArgs());

        if (readOnly) {
            ShellResult denied = checkReadOnly(cmd);
            if (denied != null) {
                return Mono.just(denied);
            }
        }

        CommandHandler handler = registry.getCommand(cmd.getCommand()).orElse(null);
        if (handler == null) {
            return Mono.just(ShellResult.of(127, "", "command not found: " + cmd.getCommand()
                    + "\nAvailable commands: " + String.join(", ", registry.getCommandNames())));
        }

        String inputFile = cmd.getInputFile();
        if (inputFile == null) {
            String stdin = pipedInput != null ? pipedInput : cmd.getStdinContent();
            return invoke(handler, cmd, stdin, stdin != null);
        }
        if (DEV_NULL.equals(inputFile)) {
            return invoke(handler, cmd, "", true);
        }
        return fs.read(inputFile)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(content -> content.isPresent()
                        ? invoke(handler, cmd, content.get(), true)
                        : Mono.just(ShellResult.error(inputFile + ": No such file")));
    }

    private Mono<ShellResult> invoke(CommandHandler handler, ParsedCommand cmd, String stdin, boolean piped) {
        CommandContext context = CommandContext.builder()
                .fs(fs)
                .env(env)
                .config(config)
                .stdin(stdin)
                .piped(piped)
                .envProvider(envProvider)
                .commands(registry)
                .build();
        return Mono.defer(() -> handler.execute(cmd.getArgs(), context))
                .flatMap(result -> redirect(cmd, result));
    }

    private Mono<ShellResult> redirect(ParsedCommand cmd, ShellResult result) {
        String target = cmd.getRedirectTarget();
        if (target == null) {
            return Mono.just(result);
        }
        ShellResult silenced = result.withStdout("");
        if (DEV_NULL.equals(target)) {
            return Mono.just(silenced);
        }
        if (cmd.isAppend()) {
            return fs.read(target)
                    .defaultIfEmpty("")
                    .flatMap(existing -> fs.write(target, existing + result.getStdout()))
                    .thenReturn(silenced);
        }
        return fs.write(target, result.getStdout()).thenReturn(silenced);
    }

    private ShellResult checkReadOnly(ParsedCommand cmd) {
        if ("rm".equals(cmd.getCommand()) || "mkdir".equals(cmd.getCommand())) {
            return ShellResult.error("read-only mode: '" + cmd.getCommand() + "' is not allowed");
        }
        String target = cmd.getRedirectTarget();
        if (target != null && !DEV_NULL.equals(target) && !isPathWritable(target)) {
            return ShellResult.error("read-only mode: cannot write to '" + target + "'");
        }
        return null;
    }

    /**
     * 只读模式下路径是否可写：与白名单中某项相同，或位于白名单目录之下
     */
    boolean isPathWritable(String path) {
        if (!readOnly) {
            return true;
        }
        String key = writableKey(path);
        for (String writable : writablePaths) {
            String allowed = writableKey(writable);
            if (key.equals(allowed) || key.startsWith(allowed.endsWith("/") ? allowed : allowed + "/")) {
                return true;
            }
        }
        return false;
    }

    private static String writableKey(String path) {
        PathValidator.Result result = PathValidator.validate(path);
        String key = result.isValid() ? result.getFsPath() : (path.startsWith("/") ? path : "/" + path);
        key = key.replaceAll("/{2,}", "/");
        if (key.length() > 1 && key.endsWith("/")) {
            key = key.substring(0, key.length() - 1);
        }
        return key;
    }

    private ParsedCommand expand(ParsedCommand cmd) {
        VariableExpander expander = new VariableExpander(env, envProvider);
        List<String> args = cmd.getArgs().stream()
                .map(expander::expand)
                .collect(Collectors.toCollection(ArrayList::new));
        return cmd.toBuilder()
                .command(expander.expand(cmd.getCommand()))
                .args(args)
                .inputFile(expander.expand(cmd.getInputFile()))
                .outputFile(expander.expand(cmd.getOutputFile()))
                .appendFile(expander.expand(cmd.getAppendFile()))
                .stdinContent(cmd.isHeredocQuoted() ? cmd.getStdinContent() : expander.expand(cmd.getStdinContent()))
                .build();
    }

    /**
     * 开启或关闭只读模式
     *
     * @param enabled       是否只读
     * @param writablePaths 只读模式下仍允许重定向写入的路径（文件或目录）
     */
    public void setReadOnly(boolean enabled, List<String> writablePaths) {
        this.readOnly = enabled;
        this.writablePaths = writablePaths != null ? List.copyOf(writablePaths) : List.of();
    }

    public void setReadOnly(boolean enabled) {
        setReadOnly(enabled, null);
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public List<String> getWritablePaths() {
        return writablePaths;
    }

    public Map<String, String> getEnv() {
        return Collections.unmodifiableMap(env);
    }

    public void setEnv(String key, String value) {
        env.put(key, value);
    }

    public EnvironmentProvider getEnvProvider() {
        return envProvider;
    }

    public void setEnvProvider(EnvironmentProvider envProvider) {
        this.envProvider = envProvider;
    }

    /**
     * 经过路径校验的工作区
     */
    public WorkspaceProvider getFs() {
        return fs;
    }

    public CommandRegistry getRegistry() {
        return registry;
    }

    public ShellConfig getConfig() {
        return config;
    }
}
