package io.leavesfly.vshell.command.handlers;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import io.leavesfly.vshell.workspace.InMemoryWorkspaceProvider;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * file 命令单元测试
 */
class FileCommandTest {

    private Shell shell;

    @BeforeEach
    void setUp() {
        shell = Shell.builder()
                .workspace(new InMemoryWorkspaceProvider(Map.of(
                        "data.txt", "banana\n",
                        "meta.json", "{\"a\":1}",
                        "payload", "[1, 2]",
                        "run", "#!/bin/bash\necho hi\n",
                        "empty.log", "",
                        "docs/guide.md", "# Guide\n")))
                .build();
    }

    @Test
    void testDescribe() {
        assertEquals("data.txt: UTF-8 Unicode text\n", shell.run("file data.txt").getStdout());
        assertEquals("meta.json: JSON text data\n", shell.run("file meta.json").getStdout());
        assertEquals("payload: JSON text data\n", shell.run("file payload").getStdout());
        assertEquals("run: Bourne-Again shell script text executable\n", shell.run("file run").getStdout());
        assertEquals("empty.log: empty\n", shell.run("file empty.log").getStdout());
        assertEquals("docs: directory\n", shell.run("file docs").getStdout());
    }

    @Test
    void testBriefAndMime() {
        assertEquals("UTF-8 Unicode text\n", shell.run("file -b data.txt").getStdout());
        assertEquals("docs/guide.md: text/markdown; charset=utf-8\n", shell.run("file -i docs/guide.md").getStdout());
        assertEquals("application/json; charset=utf-8\n", shell.run("file -bi payload").getStdout());
    }

    @Test
    void testMissingFileReportedInline() {
        ShellResult result = shell.run("file data.txt nope");
        assertEquals(1, result.getExitCode());
        assertEquals("data.txt: UTF-8 Unicode text\nfile: nope: No such file or directory\n", result.getStdout());
    }

    @Test
    void testDetectType() {
        FileCommand command = new FileCommand(new ObjectMapper());
        assertEquals("HTML document, UTF-8 Unicode text", command.detectType("page", "<!DOCTYPE html><html></html>"));
        assertEquals("XML document text", command.detectType("feed", "<?xml version=\"1.0\"?><a/>"));
        assertEquals("Python script text executable", command.detectType("tool", "#!/usr/bin/env python3\n"));
        assertEquals("UTF-8 Unicode text, with very long lines", command.detectType("long.txt", "x".repeat(600)));
        assertEquals("UTF-8 Unicode text", command.detectType("broken", "{not json"));
    }

    @Test
    void testExtension() {
        assertEquals("md", FileCommand.extensionOf("docs/README.MD"));
        assertEquals("", FileCommand.extensionOf(".bashrc"));
        assertEquals("", FileCommand.extensionOf("Makefile"));
    }
}
