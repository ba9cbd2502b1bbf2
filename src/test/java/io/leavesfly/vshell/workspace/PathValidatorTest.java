package io.leavesfly.vshell.workspace;

import io.leavesfly.vshell.exception.PathViolationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * PathValidator 单元测试
 */
class PathValidatorTest {

    @Test
    void testRelativePathsMapToStorageKeys() {
        assertEquals("/", PathValidator.resolve("."));
        assertEquals("/", PathValidator.resolve(""));
        assertEquals("/", PathValidator.resolve("./"));
        assertEquals("/a.txt", PathValidator.resolve("a.txt"));
        assertEquals("/dir/a.txt", PathValidator.resolve("./dir/a.txt"));
    }

    @Test
    void testAbsolutePathRejectedWithSuggestion() {
        PathValidator.Result result = PathValidator.validate("/etc/passwd");
        assertFalse(result.isValid());
        assertTrue(result.getError().contains("'etc/passwd'"), result.getError());
    }

    @Test
    void testTraversalRejected() {
        PathValidator.Result result = PathValidator.validate("a/../../b");
        assertFalse(result.isValid());
        assertEquals("Path traversal ('..') is not allowed", result.getError());

        PathViolationException e = assertThrows(PathViolationException.class,
                () -> PathValidator.resolve("../secret"));
        assertEquals("../secret", e.getPath());
    }

    @Test
    void testDotsInsideNamesAreAllowed() {
        assertEquals("/a..b/c", PathValidator.resolve("a..b/c"));
    }

    @Test
    void testToRelative() {
        assertEquals("dir/a.txt", PathValidator.toRelative("/dir/a.txt"));
        assertEquals("plain", PathValidator.toRelative("plain"));
    }
}
