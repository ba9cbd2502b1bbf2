package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * head / tail 命令单元测试
 */
class HeadTailCommandTest {

    private Shell shell;

    @BeforeEach
    void setUp() {
        shell = Shell.builder()
                .workspace(new InMemoryWorkspaceProvider(Map.of(
                        "data.txt", "banana\napple\ncherry\n",
                        "one.txt", "only\n")))
                .build();
    }

    @Test
    void testHead() {
        assertEquals("banana\napple\n", shell.run("head -n 2 data.txt").getStdout());
        assertEquals("banana\n", shell.run("head -1 data.txt").getStdout());
        assertEquals("banana\napple\ncherry\n", shell.run("head data.txt").getStdout());
    }

    @Test
    void testTail() {
        assertEquals("cherry\n", shell.run("tail -n 1 data.txt").getStdout());
        assertEquals("apple\ncherry\n", shell.run("tail -n +2 data.txt").getStdout());
        assertEquals("", shell.run("tail -n +9 data.txt").getStdout());
    }

    @Test
    void testMultipleFilesHaveHeaders() {
        assertEquals("==> data.txt <==\nbanana\n==> one.txt <==\nonly\n",
                shell.run("head -n 1 data.txt one.txt").getStdout());
    }

    @Test
    void testPiped() {
        assertEquals("apple\n", shell.run("cat data.txt | head -n 2 | tail -n 1").getStdout());
    }

    @Test
    void testErrors() {
        assertEquals("head: invalid number of lines: 'abc'", shell.run("head -n abc data.txt").getStderr());
        assertEquals("tail: missing file operand", shell.run("tail").getStderr());
        assertEquals("head: nope: No such file", shell.run("head nope").getStderr());
    }

    @Test
    void testLineArgs() {
        LineArgs parsed = LineArgs.parse("tail", List.of("--lines=+3", "a.txt"), 10);
        assertNull(parsed.getError());
        assertEquals(3, parsed.getCount());
        assertTrue(parsed.isFromStart());
        assertEquals(List.of("a.txt"), parsed.getPaths());
    }
}
