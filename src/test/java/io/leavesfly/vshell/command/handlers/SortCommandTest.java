package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * sort 命令单元测试
 */
class SortCommandTest {

    private Shell shell;

    @BeforeEach
    void setUp() {
        shell = Shell.builder()
                .workspace(new InMemoryWorkspaceProvider(Map.of(
                        "fruit.txt", "banana\napple\ncherry\napple\n",
                        "nums.txt", "10\n9\n100\n",
                        "mixed.txt", "b\nB\na\nA\n",
                        "scores.csv", "b,2\na,10\nc,1\n")))
                .build();
    }

    @Test
    void testLexicographic() {
        assertEquals("apple\napple\nbanana\ncherry\n", shell.run("sort fruit.txt").getStdout());
    }

    @Test
    void testReverseAndUnique() {
        assertEquals("cherry\nbanana\napple\n", shell.run("sort -ru fruit.txt").getStdout());
    }

    @Test
    void testNumeric() {
        assertEquals("9\n10\n100\n", shell.run("sort -n nums.txt").getStdout());
        assertEquals("10\n100\n9\n", shell.run("sort nums.txt").getStdout());
    }

    @Test
    void testByteOrderAndFoldCase() {
        assertEquals("A\nB\na\nb\n", shell.run("sort mixed.txt").getStdout());
        assertEquals("a\nA\nb\nB\n", shell.run("sort -f mixed.txt").getStdout());
    }

    @Test
    void testKeyAndSeparator() {
        assertEquals("c,1\nb,2\na,10\n", shell.run("sort -t , -k 2 -n scores.csv").getStdout());
        assertEquals("c,1\nb,2\na,10\n", shell.run("sort -t, -k2n -n scores.csv").getStdout());
    }

    @Test
    void testStdin() {
        assertEquals("apple\nbanana\ncherry\n", shell.run("cat fruit.txt | sort -u").getStdout());
    }

    @Test
    void testErrors() {
        assertEquals("sort: missing file operand", shell.run("sort").getStderr());
        assertEquals("sort: nope.txt: No such file", shell.run("sort nope.txt").getStderr());
        assertEquals("sort: invalid field specification 'x'", shell.run("sort -k x fruit.txt").getStderr());
    }

    @Test
    void testLeadingNumber() {
        assertEquals(12.5, SortCommand.leadingNumber("  12.5kb"));
        assertEquals(0.0, SortCommand.leadingNumber("abc"));
        assertEquals(-3.0, SortCommand.leadingNumber("-3"));
    }
}
