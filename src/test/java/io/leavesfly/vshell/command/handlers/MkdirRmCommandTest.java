package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * mkdir / rm 命令单元测试
 */
class MkdirRmCommandTest {

    private InMemoryWorkspaceProvider workspace;
    private Shell shell;

    @BeforeEach
    void setUp() {
        workspace = new InMemoryWorkspaceProvider(Map.of(
                "data.txt", "x\n",
                "cache/a.json", "{}",
                "cache/b.json", "[]"));
        shell = Shell.builder().workspace(workspace).build();
    }

    @Test
    void testMkdirStrictParent() {
        ShellResult result = shell.run("mkdir a/b");
        assertEquals(1, result.getExitCode());
        assertEquals("mkdir: a/b: No such file or directory", result.getStderr());

        assertTrue(shell.run("mkdir a && mkdir a/b").isSuccess());
        assertTrue(workspace.isDirectory("/a/b").block());
    }

    @Test
    void testMkdirExisting() {
        assertEquals("mkdir: cache: File exists", shell.run("mkdir cache").getStderr());
        assertTrue(shell.run("mkdir -p cache").isSuccess());
        assertEquals("mkdir: data.txt: File exists", shell.run("mkdir -p data.txt").getStderr());
        assertEquals("mkdir: missing operand", shell.run("mkdir").getStderr());
    }

    @Test
    void testRmFile() {
        assertTrue(shell.run("rm data.txt").isSuccess());
        assertFalse(workspace.exists("/data.txt").block());
    }

    @Test
    void testRmDirectoryNeedsRecursive() {
        assertEquals("rm: cache: is a directory", shell.run("rm cache").getStderr());
        assertTrue(shell.run("rm -r cache").isSuccess());
        assertFalse(workspace.exists("/cache/a.json").block());
    }

    @Test
    void testRmGlob() {
        assertTrue(shell.run("rm cache/*.json").isSuccess());
        assertTrue(workspace.isDirectory("/cache").block());
        assertEquals("", shell.run("ls cache").getStdout());
    }

    @Test
    void testRmMissing() {
        assertEquals("rm: nope: No such file or directory", shell.run("rm nope").getStderr());
        assertTrue(shell.run("rm -f nope").isSuccess());
    }

    @Test
    void testRmRefusesRoot() {
        assertEquals("rm: refusing to remove '.'", shell.run("rm -rf .").getStderr());
        assertTrue(workspace.exists("/data.txt").block());
    }
}
