package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * wc 命令单元测试
 */
class WcCommandTest {

    private Shell shell;

    @BeforeEach
    void setUp() {
        shell = Shell.builder()
                .workspace(new InMemoryWorkspaceProvider(Map.of(
                        "data.txt", "banana\napple\ncherry\n",
                        "greek.txt", "αβ\n",
                        "docs/guide.md", "# Guide\n")))
                .build();
    }

    @Test
    void testAllCounts() {
        assertEquals("       3       3      20 data.txt\n", shell.run("wc data.txt").getStdout());
    }

    @Test
    void testSelectedCounts() {
        assertEquals("       3 data.txt\n", shell.run("wc -l data.txt").getStdout());
        assertEquals("       2\n", shell.run("echo hello world | wc -w").getStdout());
    }

    @Test
    void testBytesVersusChars() {
        assertEquals("       5 greek.txt\n", shell.run("wc -c greek.txt").getStdout());
        assertEquals("       3 greek.txt\n", shell.run("wc -m greek.txt").getStdout());
    }

    @Test
    void testTotalLine() {
        assertEquals("       3 data.txt\n       1 greek.txt\n       4 total\n",
                shell.run("wc -l data.txt greek.txt").getStdout());
    }

    @Test
    void testErrors() {
        assertEquals("wc: missing file operand", shell.run("wc").getStderr());
        assertEquals("wc: nope: No such file", shell.run("wc nope").getStderr());
        assertEquals("wc: docs: Is a directory", shell.run("wc docs").getStderr());
    }
}
