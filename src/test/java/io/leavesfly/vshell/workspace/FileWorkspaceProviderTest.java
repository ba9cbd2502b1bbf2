package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.PathViolationException;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * FileWorkspaceProvider 单元测试：与内存工作区相同的契约
 */
class FileWorkspaceProviderTest {

    @TempDir
    Path tempDir;

    private FileWorkspaceProvider fs;

    @BeforeEach
    void setUp() {
        fs = new FileWorkspaceProvider(tempDir);
    }

    @Test
    void testWriteCreatesParentsAndReadsBack() {
        StepVerifier.create(fs.write("/notes/day1.md", "hello")).verifyComplete();
        assertTrue(Files.isRegularFile(tempDir.resolve("notes/day1.md")));
        StepVerifier.create(fs.read("/notes/day1.md")).expectNext("hello").verifyComplete();
        StepVerifier.create(fs.read("/notes/missing.md")).verifyComplete();
        StepVerifier.create(fs.size("/notes/day1.md")).expectNext(5L).verifyComplete();
    }

    @Test
    void testListAndGlob() {
        StepVerifier.create(fs.write("/a.json", "{}")
                .then(fs.write("/data/b.json", "[]"))
                .then(fs.write("/data/c.txt", "c"))).verifyComplete();

        StepVerifier.create(fs.list("/"))
                .expectNext(List.of("a.json", "data/"))
                .verifyComplete();
        StepVerifier.create(fs.glob("**/*.json"))
                .expectNext(List.of("/a.json", "/data/b.json"))
                .verifyComplete();
    }

    @Test
    void testDeleteDirectoryRecursively() throws IOException {
        Files.createDirectories(tempDir.resolve("tree/sub"));
        Files.writeString(tempDir.resolve("tree/sub/leaf.txt"), "x");

        StepVerifier.create(fs.delete("/tree")).expectNext(true).verifyComplete();
        assertFalse(Files.exists(tempDir.resolve("tree")));
        StepVerifier.create(fs.delete("/tree")).expectNext(false).verifyComplete();
    }

    @Test
    void testMkdirOverFileFails() {
        StepVerifier.create(fs.write("/f", "x").then(fs.mkdir("/f")))
                .expectErrorMatches(e -> e.getMessage().contains("File exists"))
                .verify();
    }

    @Test
    void testEscapingRootRejected() {
        assertThrows(PathViolationException.class, () -> fs.toFile("/../outside.txt"));
    }

    @Test
    void testSymlinkOutsideRootRejected() throws IOException {
        Path outside = Files.createDirectories(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "TOPSECRET");
        Path ws = Files.createDirectories(tempDir.resolve("ws"));
        Files.createSymbolicLink(ws.resolve("link"), outside);
        FileWorkspaceProvider sandboxed = new FileWorkspaceProvider(ws);

        StepVerifier.create(sandboxed.read("/link/secret.txt"))
                .expectError(PathViolationException.class)
                .verify();
        StepVerifier.create(sandboxed.write("/link/new.txt", "x"))
                .expectError(PathViolationException.class)
                .verify();
        assertFalse(Files.exists(outside.resolve("new.txt")));

        ShellResult result = Shell.builder().workspace(sandboxed).build().run("cat link/secret.txt");
        assertEquals(1, result.getExitCode());
        assertEquals("", result.getStdout());
        assertTrue(result.getStderr().startsWith("Path escapes workspace root"));
    }

    @Test
    void testSymlinkInsideRootAllowed() throws IOException {
        Files.createDirectories(tempDir.resolve("data"));
        Files.writeString(tempDir.resolve("data/a.txt"), "inside");
        Files.createSymbolicLink(tempDir.resolve("alias"), tempDir.resolve("data"));

        StepVerifier.create(fs.read("/alias/a.txt")).expectNext("inside").verifyComplete();
    }

    @Test
    void testDanglingSymlinkRejected() throws IOException {
        Files.createSymbolicLink(tempDir.resolve("dangling"), tempDir.resolve("../nowhere/target.txt"));

        StepVerifier.create(fs.write("/dangling", "x"))
                .expectError(PathViolationException.class)
                .verify();
    }
}
