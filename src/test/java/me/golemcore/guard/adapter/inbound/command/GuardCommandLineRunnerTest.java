package me.golemcore.guard.adapter.inbound.command;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.guard.domain.model.ValidationResult;
import me.golemcore.guard.port.inbound.CommandPort;
import me.golemcore.guard.port.inbound.CommandPort.CommandResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class GuardCommandLineRunnerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private CommandPort commandPort;
    private ByteArrayOutputStream buffer;
    private GuardCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        commandPort = mock(CommandPort.class);
        buffer = new ByteArrayOutputStream();
        runner = new GuardCommandLineRunner(commandPort, objectMapper,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    void shouldDoNothingWithoutArguments() throws Exception {
        runner.run();

        verify(commandPort, never()).execute(anyString(), anyList(), anyMap());
        assertEquals("", output());
    }

    @Test
    void shouldIgnoreOptionsOnly() throws Exception {
        runner.run("--json", "--spring.main.banner-mode=off");

        verify(commandPort, never()).execute(anyString(), anyList(), anyMap());
    }

    @Test
    void shouldPrintTextOutput() throws Exception {
        when(commandPort.execute(eq("check"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandResult.success("ALLOW", ValidationResult.allow())));

        runner.run("check", "npm", "install");

        verify(commandPort).execute(eq("check"), eq(List.of("npm", "install")), any());
        assertEquals("ALLOW", output().strip());
    }

    @Test
    void shouldPassOptionLikeArgumentsAfterCommand() throws Exception {
        when(commandPort.execute(eq("check"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandResult.success("ok")));

        runner.run("check", "rm", "--force", "x");

        verify(commandPort).execute(eq("check"), eq(List.of("rm", "--force", "x")), any());
    }

    @Test
    void shouldPrintStructuredPayloadAsJson() throws Exception {
        ValidationResult denied = ValidationResult.deny("blocked", "fork-bomb", "p", ":(){ :|:& };:");
        when(commandPort.execute(eq("check"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandResult.success("DENY", denied)));

        runner.run("--json", "check", ":(){ :|:& };:");

        JsonNode json = objectMapper.readTree(output());
        assertEquals("deny", json.get("action").asText());
        assertEquals("fork-bomb", json.get("category").asText());
    }

    @Test
    void shouldWrapPlainOutputAsJson() throws Exception {
        when(commandPort.execute(eq("help"), any(), any()))
                .thenReturn(CompletableFuture.completedFuture(CommandResult.success("Available commands:")));

        runner.run("--json", "help");

        JsonNode json = objectMapper.readTree(output());
        assertTrue(json.get("success").asBoolean());
        assertEquals("Available commands:", json.get("output").asText());
    }
}
