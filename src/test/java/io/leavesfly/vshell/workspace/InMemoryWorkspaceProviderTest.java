package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.VshellException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryWorkspaceProvider 单元测试
 */
class InMemoryWorkspaceProviderTest {

    private InMemoryWorkspaceProvider fs;

    @BeforeEach
    void setUp() {
        fs = new InMemoryWorkspaceProvider(Map.of("docs/readme.md", "# hi\n", "a.txt", "abc"));
    }

    @Test
    void testSeedCreatesParentDirectories() {
        StepVerifier.create(fs.isDirectory("/docs")).expectNext(true).verifyComplete();
        StepVerifier.create(fs.read("/docs/readme.md")).expectNext("# hi\n").verifyComplete();
    }

    @Test
    void testReadMissingIsEmpty() {
        StepVerifier.create(fs.read("/missing.txt")).verifyComplete();
    }

    @Test
    void testListMarksDirectories() {
        StepVerifier.create(fs.list("/"))
                .expectNext(List.of("a.txt", "docs/"))
                .verifyComplete();
        StepVerifier.create(fs.list("/a.txt")).expectNext(List.of()).verifyComplete();
    }

    @Test
    void testDeleteDirectoryCascades() {
        StepVerifier.create(fs.write("/docs/sub/deep.txt", "x")).verifyComplete();
        StepVerifier.create(fs.delete("/docs")).expectNext(true).verifyComplete();
        StepVerifier.create(fs.exists("/docs/sub/deep.txt")).expectNext(false).verifyComplete();
        StepVerifier.create(fs.exists("/docs")).expectNext(false).verifyComplete();
        StepVerifier.create(fs.delete("/docs")).expectNext(false).verifyComplete();
    }

    @Test
    void testDeleteRootKeepsRoot() {
        StepVerifier.create(fs.delete("/")).expectNext(true).verifyComplete();
        StepVerifier.create(fs.list("/")).expectNext(List.of()).verifyComplete();
        StepVerifier.create(fs.isDirectory("/")).expectNext(true).verifyComplete();
        StepVerifier.create(fs.exists("/")).expectNext(true).verifyComplete();
        StepVerifier.create(fs.exists("/docs")).expectNext(false).verifyComplete();

        StepVerifier.create(fs.write("/after.txt", "x")).verifyComplete();
        StepVerifier.create(fs.list("/")).expectNext(List.of("after.txt")).verifyComplete();
    }

    @Test
    void testGlobMatchesFilesAndDirectories() {
        StepVerifier.create(fs.glob("/*"))
                .expectNext(List.of("/a.txt", "/docs"))
                .verifyComplete();
        StepVerifier.create(fs.glob("**/*.md"))
                .expectNext(List.of("/docs/readme.md"))
                .verifyComplete();
    }

    @Test
    void testMkdirConflicts() {
        StepVerifier.create(fs.mkdir("/a.txt"))
                .expectErrorMatches(e -> e instanceof VshellException && e.getMessage().contains("File exists"))
                .verify();
        StepVerifier.create(fs.write("/docs", "x"))
                .expectErrorMatches(e -> e.getMessage().contains("Is a directory"))
                .verify();
        StepVerifier.create(fs.write("/a.txt/child", "x"))
                .expectErrorMatches(e -> e.getMessage().contains("Not a directory"))
                .verify();
    }

    @Test
    void testSizeCountsUtf8Bytes() {
        StepVerifier.create(fs.write("/u.txt", "é")).verifyComplete();
        StepVerifier.create(fs.size("/u.txt")).expectNext(2L).verifyComplete();
    }

    @Test
    void testNormalize() {
        assertEquals("/a/b", InMemoryWorkspaceProvider.normalize("a//b/"));
        assertEquals("/", InMemoryWorkspaceProvider.normalize("/"));
    }
}
