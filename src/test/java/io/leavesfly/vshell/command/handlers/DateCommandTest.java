package io.leavesfly.vshell.command.handlers;

import io.leavesfly.vshell.command.CommandRegistry;
import io.leavesfly.vshell.command.CommandServices;
import io.leavesfly.vshell.exception.CommandParseException;
import io.leavesfly.vshell.shell.Shell;
import io.leavesfly.vshell.shell.ShellResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.*;

/**
 * date 命令单元测试
 */
class DateCommandTest {

    private static final Instant NOW = Instant.parse("2024-03-05T14:07:09Z");

    private Clock clock;
    private Shell shell;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneId.of("Asia/Shanghai"));
        CommandServices services = CommandServices.builder().clock(clock).build();
        shell = Shell.builder().registry(CommandRegistry.builtins(services)).build();
    }

    @Test
    void testDefaultFormatUtc() {
        assertEquals("Tue Mar  5 14:07:09 UTC 2024\n", shell.run("date -u").getStdout());
    }

    @Test
    void testLocalZone() {
        assertEquals("22:07\n", shell.run("date +%H:%M").getStdout());
        assertEquals("+0800\n", shell.run("date +%z").getStdout());
        assertEquals("2024-03-05T22:07:09+0800\n", shell.run("date -I").getStdout());
    }

    @Test
    void testCustomFormat() {
        assertEquals("2024-03-05\n", shell.run("date -u +%Y-%m-%d").getStdout());
        assertEquals("065 2 Tuesday %Q\n", shell.run("date -u \"+%j %u %A %Q\"").getStdout());
        assertEquals("02:07:09 PM\n", shell.run("date -u +%r").getStdout());
    }

    @Test
    void testParseDate() {
        assertEquals("1970-01-01\n", shell.run("date -u -d @0 +%F").getStdout());
        assertEquals("1709647629\n", shell.run("date -d now +%s").getStdout());
        assertEquals("2024-01-02 00:00\n", shell.run("date -u --date=2024-01-02 \"+%F %R\"").getStdout());
    }

    @Test
    void testErrors() {
        ShellResult invalid = shell.run("date -d garbage");
        assertEquals(1, invalid.getExitCode());
        assertEquals("date: invalid date 'garbage'", invalid.getStderr());
        assertEquals("date: invalid option -- '-x'", shell.run("date -x").getStderr());
        assertEquals("date: option requires an argument -- d", shell.run("date -d").getStderr());
    }

    @Test
    void testParseDateFormats() {
        assertEquals(NOW, DateCommand.parseDate("2024-03-05T14:07:09Z", clock));
        assertEquals(NOW, DateCommand.parseDate("2024-03-05T22:07:09+08:00", clock));
        assertEquals(NOW, DateCommand.parseDate("2024-03-05 22:07:09", clock));
        assertThrows(CommandParseException.class, () -> DateCommand.parseDate("@abc", clock));
    }

    @Test
    void testFormatSpecifiers() {
        ZonedDateTime time = ZonedDateTime.parse("2024-12-31T09:05:03Z");
        assertEquals("24/12/31 09 AM Dec", DateCommand.format("%y/%m/%d %I %p %b", time, true));
        assertEquals("12/31/24 100%", DateCommand.format("%D 100%%", time, true));
    }
}
