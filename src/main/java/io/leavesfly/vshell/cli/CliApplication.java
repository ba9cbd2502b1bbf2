package io.leavesfly.vshell.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.ShellFactory;
import io.leavesfly.vshell.config.ConfigLoader;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.env.EnvironmentProvider;
import io.leavesfly.vshell.env.SystemEnvironmentProvider;
import io.leavesfly.vshell.exception.ConfigException;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.ui.ShellRepl;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * CLI 应用入口
 * 使用 Picocli 实现命令行参数解析
 */
@Slf4j
@Component
@Command(
        name = "vshell",
        description = "Sandboxed bash-like shell over a virtual workspace",
        mixinStandardHelpOptions = true,
        version = "0.1.0"
)
public class CliApplication implements CommandLineRunner, ExitCodeGenerator, Callable<Integer> {

    private final ConfigLoader configLoader;
    private final ShellFactory shellFactory;
    private final ShellConfig defaultConfig;
    private final ObjectMapper objectMapper;
    private final ObjectMapper yamlObjectMapper;

    private int exitCode;

    @Autowired
    public CliApplication(ConfigLoader configLoader, ShellFactory shellFactory, ShellConfig defaultConfig,
                          ObjectMapper objectMapper,
                          @Qualifier("yamlObjectMapper") ObjectMapper yamlObjectMapper) {
        this.configLoader = configLoader;
        this.shellFactory = shellFactory;
        this.defaultConfig = defaultConfig;
        this.objectMapper = objectMapper;
        this.yamlObjectMapper = yamlObjectMapper;
    }

    @Option(names = {"-c", "--command"}, description = "Run a command script and exit with its exit code")
    private String command;

    @Option(names = {"-w", "--workspace"}, description = "Use a directory on disk as the workspace")
    private Path workspace;

    @Option(names = {"--config"}, description = "Config file (JSON or YAML), default ~/.vshell/config.json")
    private Path configFile;

    @Option(names = {"--seed"}, description = "JSON/YAML map of initial files for the in-memory workspace")
    private Path seedFile;

    @Option(names = {"--read-only"}, description = "Block rm, mkdir and redirection outside --writable paths")
    private boolean readOnly;

    @Option(names = {"--writable"}, description = "Path still writable in read-only mode (repeatable)")
    private List<String> writablePaths = new ArrayList<>();

    @Option(names = {"--secret-prefix"}, description = "Expose process environment variables with this prefix")
    private String secretPrefix;

    @Override
    public void run(String... args) {
        exitCode = new CommandLine(this).execute(args);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Picocli 解析参数后调用
     */
    @Override
    public Integer call() {
        Shell shell;
        try {
            shell = createShell();
        } catch (ConfigException e) {
            log.error("Failed to create shell", e);
            System.err.println("Error: " + e.getMessage());
            return 2;
        }

        if (command != null) {
            ShellResult result = shell.run(command);
            System.out.print(result.getStdout());
            if (!result.getStderr().isEmpty()) {
                System.err.println(result.getStderr());
            }
            return result.getExitCode();
        }

        try (ShellRepl repl = new ShellRepl(shell)) {
            repl.run();
            return 0;
        } catch (IOException e) {
            log.error("Failed to start interactive shell", e);
            System.err.println("Error: " + e.getMessage());
            return 1;
        }
    }

    private Shell createShell() {
        ShellConfig config = configLoader.loadConfig(configFile, defaultConfig);
        if (seedFile != null) {
            config.getInitialContext().putAll(loadSeed(seedFile));
        }

        EnvironmentProvider envProvider = secretPrefix != null ? new SystemEnvironmentProvider(secretPrefix) : null;
        Shell shell = workspace != null
                ? shellFactory.createDiskShell(workspace, config, envProvider)
                : shellFactory.createShell(null, config, envProvider);

        if (readOnly) {
            shell.setReadOnly(true, writablePaths);
        }
        return shell;
    }

    private Map<String, Object> loadSeed(Path file) {
        String name = file.getFileName().toString().toLowerCase();
        ObjectMapper mapper = name.endsWith(".yml") || name.endsWith(".yaml") ? yamlObjectMapper : objectMapper;
        try {
            return mapper.readValue(file.toFile(), new TypeReference<Map<String, Object>>() {
            });
        } catch (IOException e) {
            throw new ConfigException("Failed to load seed file: " + file, e);
        }
    }
}
