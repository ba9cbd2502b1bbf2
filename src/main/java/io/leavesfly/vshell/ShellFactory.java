package io.leavesfly.vshell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.command.CommandHandler;
import io.leavesfly.vshell.command.CommandRegistry;
import io.leavesfly.vshell.command.CommandServices;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.env.EnvironmentProvider;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.workspace.FileWorkspaceProvider;
import io.leavesfly.vshell.workspace.WorkspaceProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.client.WebClient;

import java.nio.file.Path;
import java.time.Clock;
import java.util.List;

/**
 * Shell 工厂（Spring Service）
 * 负责组装工作区、命令注册表、配置与环境提供者，创建 Shell 实例
 */
@Slf4j
@Service
public class ShellFactory {

    private final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final ShellConfig defaultConfig;

    @Autowired
    public ShellFactory(ObjectMapper objectMapper, WebClient webClient, ShellConfig defaultConfig) {
        this.objectMapper = objectMapper;
        this.webClient = webClient;
        this.defaultConfig = defaultConfig;
    }

    /**
     * 内置命令共享的服务
     */
    public CommandServices commandServices() {
        return CommandServices.builder()
                .objectMapper(objectMapper)
                .webClient(webClient)
                .clock(Clock.systemDefaultZone())
                .build();
    }

    /**
     * 创建命令注册表，customCommands 可新增或覆盖内置命令
     */
    public CommandRegistry createRegistry(List<CommandHandler> customCommands) {
        CommandRegistry.Builder builder = CommandRegistry.builder().registerBuiltins(commandServices());
        if (customCommands != null) {
            customCommands.forEach(builder::register);
        }
        return builder.build();
    }

    /**
     * 以默认配置创建内存工作区 Shell
     */
    public Shell createShell() {
        return createShell(null, defaultConfig, null);
    }

    /**
     * 创建 Shell
     *
     * @param workspace   工作区，为 null 时使用内存工作区（以 initialContext 为种子）
     * @param config      配置，为 null 时使用 application.yml 中的默认配置
     * @param envProvider 环境提供者，可为 null
     */
    public Shell createShell(WorkspaceProvider workspace, ShellConfig config, EnvironmentProvider envProvider) {
        ShellConfig effective = config != null ? config : defaultConfig;
        Shell shell = Shell.builder()
                .workspace(workspace)
                .registry(createRegistry(null))
                .config(effective)
                .envProvider(envProvider)
                .objectMapper(objectMapper)
                .build();
        log.info("Shell created ({} workspace, {} commands)",
                workspace != null ? workspace.getClass().getSimpleName() : "in-memory",
                shell.getRegistry().size());
        return shell;
    }

    /**
     * 以本地目录为工作区创建 Shell
     */
    public Shell createDiskShell(Path root, ShellConfig config, EnvironmentProvider envProvider) {
        return createShell(new FileWorkspaceProvider(root), config, envProvider);
    }
}
