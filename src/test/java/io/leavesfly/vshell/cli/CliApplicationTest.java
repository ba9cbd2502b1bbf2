package io.leavesfly.vshell.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import io.leavesfly.vshell.ShellFactory;
import io.leavesfly.vshell.config.ConfigLoader;
import io.leavesfly.vshell.config.ShellConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.web.reactive.function.client.WebClient;
import picocli.CommandLine;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 命令行入口单元测试（只覆盖 -c 单次执行模式）
 */
class CliApplicationTest {

    @TempDir
    Path tempDir;

    private Path configFile;
    private Path seedFile;

    @BeforeEach
    void setUp() throws Exception {
        configFile = tempDir.resolve("config.json");
        Files.writeString(configFile, "{\"timeout_ms\":1000}");
        seedFile = tempDir.resolve("seed.yaml");
        Files.writeString(seedFile, "a.txt: \"hello\\n\"\nplan.md: \"# plan\\n\"\n");
    }

    private int run(String... args) {
        ObjectMapper json = new ObjectMapper();
        ObjectMapper yaml = new ObjectMapper(new YAMLFactory());
        ShellConfig defaults = ShellConfig.builder().build();
        CliApplication cli = new CliApplication(new ConfigLoader(json, yaml),
                new ShellFactory(json, WebClient.create(), defaults), defaults, json, yaml);
        return new CommandLine(cli).execute(args);
    }

    @Test
    void testCommandExitCode() {
        assertEquals(0, run("--config", configFile.toString(), "--seed", seedFile.toString(), "-c", "cat a.txt"));
        assertEquals(1, run("--config", configFile.toString(), "-c", "cat a.txt"));
        assertEquals(127, run("--config", configFile.toString(), "-c", "nosuchcommand"));
    }

    @Test
    void testReadOnly() {
        String[] common = {"--config", configFile.toString(), "--seed", seedFile.toString(),
                "--read-only", "--writable", "plan.md"};
        assertEquals(1, run(concat(common, "-c", "rm a.txt")));
        assertEquals(0, run(concat(common, "-c", "echo more >> plan.md")));
    }

    @Test
    void testDiskWorkspace() throws Exception {
        assertEquals(0, run("--config", configFile.toString(), "-w", tempDir.toString(), "-c", "echo hi > note.txt"));
        assertEquals("hi\n", Files.readString(tempDir.resolve("note.txt")));
    }

    @Test
    void testBadConfig() {
        assertEquals(2, run("--config", tempDir.resolve("missing.json").toString(), "-c", "echo hi"));
    }

    private static String[] concat(String[] head, String... tail) {
        String[] all = new String[head.length + tail.length];
        System.arraycopy(head, 0, all, 0, head.length);
        System.arraycopy(tail, 0, all, head.length, tail.length);
        return all;
    }
}
