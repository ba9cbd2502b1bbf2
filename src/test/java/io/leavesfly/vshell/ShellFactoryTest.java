package io.leavesfly.vshell;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.command.AbstractCommand;
import io.leavesfly.vshell.command.CommandContext;
import io.leavesfly.vshell.command.CommandHelp;
import io.leavesfly.vshell.command.CommandRegistry;
import io.leavesfly.vshell.config.ShellConfig;
import io.leavesfly.vshell.env.MapEnvironmentProvider;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ShellFactory 单元测试
 */
class ShellFactoryTest {

    @TempDir
    Path tempDir;

    private ShellFactory factory;

    @BeforeEach
    void setUp() {
        Map<String, Object> seed = new LinkedHashMap<>();
        seed.put("notes.md", "# Notes\n");
        seed.put("meta.json", Map.of("version", 3));
        ShellConfig defaults = ShellConfig.builder().initialContext(seed).build();
        factory = new ShellFactory(new ObjectMapper(), WebClient.create(), defaults);
    }

    @Test
    void testDefaultShellIsSeeded() {
        Shell shell = factory.createShell();
        assertEquals("# Notes\n", shell.run("cat notes.md").getStdout());
        assertEquals("3\n", shell.run("jq .version meta.json").getStdout());
    }

    @Test
    void testExplicitConfigAndEnvironment() {
        ShellConfig config = ShellConfig.builder().baseUrl("https://api.test").build();
        Shell shell = factory.createShell(null, config, new MapEnvironmentProvider(Map.of("KEY", "v")));

        assertSame(config, shell.getConfig());
        assertEquals("v\n", shell.run("echo $KEY").getStdout());
        assertEquals(1, shell.run("cat notes.md").getExitCode());
    }

    @Test
    void testDiskShell() throws Exception {
        Files.writeString(tempDir.resolve("existing.txt"), "on disk\n");
        Shell shell = factory.createDiskShell(tempDir, null, null);

        assertEquals("on disk\n", shell.run("cat existing.txt").getStdout());
        ShellResult result = shell.run("echo written > out/result.txt");
        assertTrue(result.isSuccess());
        assertEquals("written\n", Files.readString(tempDir.resolve("out/result.txt")));
    }

    @Test
    void testCustomCommands() {
        AbstractCommand hello = new AbstractCommand("hello", CommandHelp.builder()
                .usage("hello")
                .description("Say hello")
                .build()) {
            @Override
            public Mono<ShellResult> execute(List<String> args, CommandContext context) {
                return Mono.just(ShellResult.ok("hello " + String.join(" ", args) + "\n"));
            }
        };
        CommandRegistry registry = factory.createRegistry(List.of(hello));

        Shell shell = Shell.builder().registry(registry).build();
        assertEquals("hello world\n", shell.run("hello world").getStdout());
        assertTrue(shell.run("help").getStdout().contains("hello"));
    }
}
