package io.leavesfly.vshell.shell.parser;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandParser 单元测试
 */
class CommandParserTest {

    @Test
    void testSimpleCommand() {
        List<Pipeline> pipelines = CommandParser.parse("ls -la docs");
        assertEquals(1, pipelines.size());
        ParsedCommand cmd = pipelines.get(0).first();
        assertEquals("ls", cmd.getCommand());
        assertEquals(List.of("-la", "docs"), cmd.getArgs());
    }

    @Test
    void testBlankAndCommentLinesSkipped() {
        List<Pipeline> pipelines = CommandParser.parse("\n# comment\n   \necho hi\n");
        assertEquals(1, pipelines.size());
        assertEquals("echo", pipelines.get(0).first().getCommand());
    }

    @Test
    void testAndChainSplitsIntoPipelines() {
        List<Pipeline> pipelines = CommandParser.parse("mkdir -p out && echo done > out/log.txt");
        assertEquals(2, pipelines.size());
        assertEquals("mkdir", pipelines.get(0).first().getCommand());
        ParsedCommand echo = pipelines.get(1).first();
        assertEquals(List.of("done"), echo.getArgs());
        assertEquals("out/log.txt", echo.getOutputFile());
    }

    @Test
    void testAndInsideQuotesNotSplit() {
        List<Pipeline> pipelines = CommandParser.parse("echo 'a && b'");
        assertEquals(1, pipelines.size());
        assertEquals(List.of("a && b"), pipelines.get(0).first().getArgs());
    }

    @Test
    void testUnterminatedQuoteAtEndOfInput() {
        List<Pipeline> pipelines = CommandParser.parse("echo \"abc def");
        assertEquals(1, pipelines.size());
        assertEquals("echo", pipelines.get(0).first().getCommand());
        assertEquals(List.of("abc def"), pipelines.get(0).first().getArgs());
    }

    @Test
    void testUnterminatedQuoteSpansRemainingLines() {
        List<Pipeline> pipelines = CommandParser.parse("echo 'first\nsecond");
        assertEquals(1, pipelines.size());
        assertEquals(List.of("first\nsecond"), pipelines.get(0).first().getArgs());
    }

    @Test
    void testPipeStages() {
        List<Pipeline> pipelines = CommandParser.parse("cat data.json | jq '.items | length' | wc -l");
        assertEquals(1, pipelines.size());
        Pipeline pipeline = pipelines.get(0);
        assertEquals(3, pipeline.size());
        assertEquals(List.of(".items | length"), pipeline.getStages().get(1).getArgs());
        assertEquals("wc", pipeline.getStages().get(2).getCommand());
    }

    @Test
    void testRedirectionsExtracted() {
        ParsedCommand cmd = CommandParser.parse("sort < in.txt >> out.txt").get(0).first();
        assertEquals("in.txt", cmd.getInputFile());
        assertEquals("out.txt", cmd.getAppendFile());
        assertNull(cmd.getOutputFile());
        assertTrue(cmd.isAppend());
        assertTrue(cmd.getArgs().isEmpty());
    }

    @Test
    void testRedirectWithoutSpaces() {
        ParsedCommand cmd = CommandParser.parse("echo hi>out.txt").get(0).first();
        assertEquals(List.of("hi"), cmd.getArgs());
        assertEquals("out.txt", cmd.getOutputFile());
    }

    @Test
    void testStderrRedirectStripped() {
        ParsedCommand cmd = CommandParser.parse("grep foo a.txt 2>/dev/null").get(0).first();
        assertEquals(List.of("foo", "a.txt"), cmd.getArgs());
        assertNull(cmd.getOutputFile());

        cmd = CommandParser.parse("cat a.txt 2>&1").get(0).first();
        assertEquals(List.of("a.txt"), cmd.getArgs());
    }

    @Test
    void testHeredoc() {
        String script = "cat << EOF > note.md\nline one\n  line $X\nEOF\necho after";
        List<Pipeline> pipelines = CommandParser.parse(script);
        assertEquals(2, pipelines.size());

        ParsedCommand cat = pipelines.get(0).first();
        assertEquals("cat", cat.getCommand());
        assertEquals("note.md", cat.getOutputFile());
        assertEquals("line one\n  line $X\n", cat.getStdinContent());
        assertFalse(cat.isHeredocQuoted());
        assertEquals("echo", pipelines.get(1).first().getCommand());
    }

    @Test
    void testQuotedHeredocDelimiter() {
        ParsedCommand cat = CommandParser.parse("cat <<'END'\n$HOME\nEND").get(0).first();
        assertTrue(cat.isHeredocQuoted());
        assertEquals("$HOME\n", cat.getStdinContent());
    }

    @Test
    void testMultiLineQuotedArgument() {
        List<Pipeline> pipelines = CommandParser.parse("echo \"first\nsecond\" && echo third");
        assertEquals(2, pipelines.size());
        assertEquals(List.of("first\nsecond"), pipelines.get(0).first().getArgs());
    }

    @Test
    void testEmptyQuotedArgumentKept() {
        ParsedCommand cmd = CommandParser.parse("echo '' x").get(0).first();
        assertEquals(List.of("", "x"), cmd.getArgs());
    }

    @Test
    void testEscapes() {
        ParsedCommand cmd = CommandParser.parse("echo a\\ b \"c\\\"d\"").get(0).first();
        assertEquals(List.of("a b", "c\"d"), cmd.getArgs());
    }
}
