package me.golemcore.guard.adapter.inbound.command;

import me.golemcore.guard.domain.model.ValidationAction;
import me.golemcore.guard.domain.model.ValidationResult;
import me.golemcore.guard.domain.model.ValidationStats;
import me.golemcore.guard.port.inbound.CommandPort.CommandDefinition;
import me.golemcore.guard.port.inbound.CommandPort.CommandResult;
import me.golemcore.guard.security.CommandNormalizer;
import me.golemcore.guard.security.CommandValidator;
import me.golemcore.guard.security.FileValidator;
import me.golemcore.guard.security.LogSanitizer;
import me.golemcore.guard.security.PatternRegistry;
import me.golemcore.guard.security.ValidationStatsCollector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SecurityCommandRouterTest {

    private ValidationStatsCollector stats;
    private SecurityCommandRouter router;

    @BeforeEach
    void setUp() {
        PatternRegistry registry = PatternRegistry.defaults();
        LogSanitizer sanitizer = new LogSanitizer();
        stats = new ValidationStatsCollector();
        router = new SecurityCommandRouter(
                new CommandValidator(registry, new CommandNormalizer(), stats, sanitizer),
                new FileValidator(registry, stats, sanitizer),
                stats,
                sanitizer);
    }

    private CommandResult run(String command, String... args) throws Exception {
        return router.execute(command, List.of(args), Map.of()).get();
    }

    // ==================== check ====================

    @Test
    void shouldDenyDangerousCommand() throws Exception {
        CommandResult result = run("check", "rm%20-rf%20/");

        assertTrue(result.success());
        ValidationResult validation = assertInstanceOf(ValidationResult.class, result.data());
        assertEquals(ValidationAction.DENY, validation.getAction());
        assertTrue(result.output().startsWith("DENY: "));
        assertTrue(result.output().contains("[destructive-delete]"));
        assertTrue(result.output().contains("normalized: rm -rf /"));
    }

    @Test
    void shouldJoinCommandArguments() throws Exception {
        CommandResult result = run("check", "npm", "install");

        ValidationResult validation = (ValidationResult) result.data();
        assertEquals("npm install", validation.getNormalizedCommand());
        assertTrue(result.output().startsWith("ALLOW"));
    }

    @Test
    void shouldRequireCommandArgument() throws Exception {
        CommandResult result = run("check");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Usage"));
    }

    // ==================== file ====================

    @Test
    void shouldValidateFile() throws Exception {
        CommandResult result = run("file", ".env.production");

        ValidationResult validation = (ValidationResult) result.data();
        assertTrue(validation.isDenied());
        assertTrue(result.output().contains("[env-file]"));
    }

    @Test
    void shouldRequireExactlyOnePath() throws Exception {
        assertFalse(run("file").success());
        assertFalse(run("file", "a", "b").success());
    }

    // ==================== stats ====================

    @Test
    void shouldReportAndResetStats() throws Exception {
        run("check", "sudo", "apt", "update");
        run("file", "id_rsa");

        CommandResult statsResult = run("stats");
        ValidationStats snapshot = (ValidationStats) statsResult.data();
        assertEquals(1, snapshot.getCommandsValidated());
        assertEquals(1, snapshot.getCommandsWarned());
        assertEquals(1, snapshot.getFilesBlocked());
        assertTrue(statsResult.output().contains("Commands: 1 validated, 0 blocked, 1 warned"));

        CommandResult reset = run("reset-stats");
        assertTrue(reset.success());
        assertEquals(ValidationStats.empty(), stats.snapshot());
    }

    // ==================== help / unknown ====================

    @Test
    void shouldListAllCommandsInHelp() throws Exception {
        CommandResult result = run("help");

        for (CommandDefinition definition : router.listCommands()) {
            assertTrue(result.output().contains(definition.usage()));
        }
    }

    @Test
    void shouldRejectUnknownCommand() throws Exception {
        CommandResult result = run("explode");

        assertFalse(result.success());
        assertTrue(result.output().contains("Unknown command"));
    }

    @Test
    void shouldKnowRegisteredCommands() {
        assertTrue(router.hasCommand("check"));
        assertTrue(router.hasCommand("reset-stats"));
        assertFalse(router.hasCommand("status"));
        assertFalse(router.hasCommand(null));
        assertEquals(5, router.listCommands().size());
    }
}
