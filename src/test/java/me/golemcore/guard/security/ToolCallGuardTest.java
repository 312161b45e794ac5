package me.golemcore.guard.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.guard.domain.model.ToolInvocation;
import me.golemcore.guard.domain.model.ValidationAction;
import me.golemcore.guard.domain.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolCallGuardTest {

    private static final ValidationResult DENIED = ValidationResult.deny("blocked", "test", "p");

    private CommandValidator commandValidator;
    private FileValidator fileValidator;
    private ToolCallGuard guard;

    @BeforeEach
    void setUp() {
        commandValidator = mock(CommandValidator.class);
        fileValidator = mock(FileValidator.class);
        when(commandValidator.validateCommand(anyString())).thenReturn(ValidationResult.allow());
        when(fileValidator.validateFile(anyString())).thenReturn(ValidationResult.allow());
        guard = new ToolCallGuard(commandValidator, fileValidator);
    }

    // ==================== routing ====================

    @ParameterizedTest
    @ValueSource(strings = { "bash", "Bash", "shell", "EXEC" })
    void shouldRouteShellToolsToCommandValidator(String tool) {
        guard.validate(tool, Map.of("command", "ls -la"));

        verify(commandValidator).validateCommand("ls -la");
        verify(fileValidator, never()).validateFile(anyString());
    }

    @Test
    void shouldFallBackToCmdAndScriptArguments() {
        guard.validate("bash", Map.of("cmd", "make"));
        guard.validate("bash", Map.of("script", "./run.sh"));

        verify(commandValidator).validateCommand("make");
        verify(commandValidator).validateCommand("./run.sh");
    }

    @ParameterizedTest
    @ValueSource(strings = { "read", "Write", "edit", "MultiEdit", "glob", "grep", "NotebookEdit" })
    void shouldRouteFileToolsToFileValidator(String tool) {
        guard.validate(tool, Map.of("file_path", "src/App.java"));

        verify(fileValidator).validateFile("src/App.java");
        verify(commandValidator, never()).validateCommand(anyString());
    }

    @Test
    void shouldPreferFirstPathArgument() {
        Map<String, Object> args = new HashMap<>();
        args.put("path", "src");
        args.put("notebook_path", "nb/analysis.ipynb");

        guard.validate("notebookedit", args);

        verify(fileValidator).validateFile("nb/analysis.ipynb");
    }

    @Test
    void shouldUseFileUrlWhenNoPathArgument() {
        guard.validate("read", Map.of("url", "file:///home/dev/.ssh/id_rsa"));

        verify(fileValidator).validateFile("/home/dev/.ssh/id_rsa");
    }

    @Test
    void shouldIgnoreNonFileUrl() {
        ValidationResult result = guard.validate("read", Map.of("url", "https://example.com"));

        assertTrue(result.isAllowed());
        verify(fileValidator, never()).validateFile(anyString());
    }

    @Test
    void shouldAllowUnknownTools() {
        ValidationResult result = guard.validate("web_search", Map.of("command", "rm -rf /"));

        assertTrue(result.isAllowed());
        verify(commandValidator, never()).validateCommand(anyString());
    }

    @Test
    void shouldAllowWhenArgumentMissingOrNotText() {
        assertTrue(guard.validate("bash", Map.of()).isAllowed());
        assertTrue(guard.validate("bash", Map.of("command", 42)).isAllowed());
        assertTrue(guard.validate("bash", (Map<String, Object>) null).isAllowed());
        assertTrue(guard.validate((String) null, Map.of("command", "ls")).isAllowed());
        verify(commandValidator, never()).validateCommand(anyString());
    }

    @Test
    void shouldReturnValidatorResult() {
        when(commandValidator.validateCommand("rm -rf /")).thenReturn(DENIED);

        assertSame(DENIED, guard.validate("bash", Map.of("command", "rm -rf /")));
    }

    // ==================== JsonNode ====================

    @Test
    void shouldReadJsonArguments() throws Exception {
        JsonNode args = new ObjectMapper().readTree("{\"file_path\": \".env\", \"limit\": 10}");

        guard.validate("read", args);

        verify(fileValidator).validateFile(".env");
    }

    @Test
    void shouldAllowNonObjectJsonArguments() throws Exception {
        JsonNode args = new ObjectMapper().readTree("[\"rm -rf /\"]");

        assertTrue(guard.validate("bash", args).isAllowed());
        verify(commandValidator, never()).validateCommand(anyString());
    }

    // ==================== raw input and invocation ====================

    @Test
    void shouldValidateRawInput() {
        guard.validateRawInput("bash", "git status");
        guard.validateRawInput("read", "README.md");

        verify(commandValidator).validateCommand("git status");
        verify(fileValidator).validateFile("README.md");
    }

    @Test
    void shouldValidateInvocation() {
        ToolInvocation invocation = ToolInvocation.builder()
                .id("call-1")
                .name("shell")
                .arguments(Map.of("command", "npm test"))
                .build();

        guard.validate(invocation);

        verify(commandValidator).validateCommand("npm test");
    }

    @Test
    void shouldThrowFromEnforceOnDeny() {
        when(commandValidator.validateCommand("rm -rf /")).thenReturn(DENIED);
        ToolInvocation invocation = ToolInvocation.builder()
                .name("bash")
                .arguments(Map.of("command", "rm -rf /"))
                .build();

        SecurityValidationException e = assertThrows(SecurityValidationException.class,
                () -> guard.enforce(invocation));

        assertEquals("bash", e.getToolName());
        assertSame(DENIED, e.getResult());
        assertTrue(e.getMessage().contains("blocked"));
    }

    @Test
    void shouldReturnNonDenyFromEnforce() {
        ValidationResult ask = ValidationResult.ask("confirm", "warn", "sudo", "sudo ls");
        when(commandValidator.validateCommand("sudo ls")).thenReturn(ask);
        ToolInvocation invocation = ToolInvocation.builder()
                .name("bash")
                .arguments(Map.of("command", "sudo ls"))
                .build();

        assertSame(ask, guard.enforce(invocation));
    }

    // ==================== fail closed ====================

    @Test
    void shouldDenyWhenValidatorThrows() {
        when(fileValidator.validateFile("x")).thenThrow(new IllegalStateException("boom"));

        ValidationResult result = guard.validate("read", Map.of("path", "x"));

        assertEquals(ValidationAction.DENY, result.getAction());
        assertEquals("validation-error", result.getCategory());
    }

    // ==================== predicates ====================

    @Test
    void shouldExposePredicates() {
        when(commandValidator.validateCommand("rm -rf /")).thenReturn(DENIED);
        when(commandValidator.validateCommand("sudo ls"))
                .thenReturn(ValidationResult.ask("confirm", "warn", "sudo", "sudo ls"));
        when(fileValidator.validateFile("id_rsa")).thenReturn(DENIED);

        assertTrue(guard.isBlocked("rm -rf /"));
        assertFalse(guard.isBlocked("ls"));
        assertTrue(guard.requiresConfirmation("sudo ls"));
        assertFalse(guard.requiresConfirmation("ls"));
        assertTrue(guard.isFileBlocked("id_rsa"));
        assertFalse(guard.isFileBlocked("README.md"));
    }
}
