package io.leavesfly.vshell.command;

import io.leavesfly.vshell.shell.ShellResult;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CommandRegistry 与 CommandHelp 单元测试
 */
class CommandRegistryTest {

    private static AbstractCommand fixed(String name, String output) {
        return new AbstractCommand(name, CommandHelp.builder()
                .usage(name)
                .description("test command")
                .build()) {
            @Override
            public Mono<ShellResult> execute(List<String> args, CommandContext context) {
                return Mono.just(ShellResult.ok(output));
            }
        };
    }

    @Test
    void testBuiltinsRegistered() {
        CommandRegistry registry = CommandRegistry.builtins(CommandServices.defaults());

        List<String> expected = Arrays.stream(BuiltinCommand.values())
                .map(BuiltinCommand::getVerb)
                .sorted()
                .collect(Collectors.toList());
        assertEquals(expected, registry.getCommandNames());
        assertEquals(19, registry.size());
        assertTrue(registry.hasCommand("sed"));
        assertFalse(registry.hasCommand("bash"));
    }

    @Test
    void testEveryBuiltinHasHelp() {
        CommandRegistry registry = CommandRegistry.builtins(CommandServices.defaults());
        for (CommandHandler handler : registry.getAllCommands()) {
            assertNotNull(handler.getHelp().getUsage(), handler.getName());
            assertNotNull(handler.getHelp().getDescription(), handler.getName());
        }
    }

    @Test
    void testRegisterOverridesBuiltin() {
        CommandRegistry registry = CommandRegistry.builder()
                .registerBuiltins(CommandServices.defaults())
                .register(fixed("echo", "custom\n"))
                .register(fixed("greet", "hi\n"))
                .build();

        assertEquals(20, registry.size());
        StepVerifier.create(registry.getCommand("echo").orElseThrow().execute(List.of("x"), null))
                .assertNext(result -> assertEquals("custom\n", result.getStdout()))
                .verifyComplete();
    }

    @Test
    void testUnknownCommand() {
        assertTrue(CommandRegistry.builder().build().getCommand("cat").isEmpty());
    }

    @Test
    void testRenderHelp() {
        CommandHelp help = CommandHelp.builder()
                .usage("demo [-a] FILE")
                .description("Demo command")
                .addFlag("-a", "All")
                .addFlag("--long", "Long flag")
                .addExample("demo x", "Run on x")
                .note("Reads files only")
                .build();

        String expected = "demo - Demo command\n\n"
                + "Usage: demo [-a] FILE\n"
                + "\nFlags:\n"
                + "  -a      All\n"
                + "  --long  Long flag\n"
                + "\nExamples:\n"
                + "  demo x\n"
                + "      Run on x\n"
                + "\nNotes:\n"
                + "  - Reads files only\n";
        assertEquals(expected, help.render("demo"));
    }
}
