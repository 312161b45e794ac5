package me.golemcore.guard.security;

import me.golemcore.guard.domain.model.PatternKind;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PatternRegistryTest {

    @Test
    void shouldLoadBuiltInDefaultsForEveryRegistry() {
        PatternRegistry registry = PatternRegistry.defaults();

        assertTrue(registry.size(PatternKind.COMMAND_DENY) > 0);
        assertTrue(registry.size(PatternKind.COMMAND_WARN) > 0);
        assertTrue(registry.size(PatternKind.FILE_BLOCKED) > 0);
        assertTrue(registry.size(PatternKind.PATH_BLOCKED) > 0);
        assertEquals(0, registry.size(PatternKind.COMMAND_ALLOW));
    }

    @Test
    void shouldMirrorSingleSourceOfTruth() {
        PatternRegistry registry = PatternRegistry.defaults();

        for (PatternKind kind : PatternKind.values()) {
            assertEquals(DefaultSecurityPatterns.definitions(kind).size(), registry.size(kind));
        }
    }

    @Test
    void shouldReturnFirstMatchInInsertionOrder() {
        PatternRegistry registry = PatternRegistry.builder()
                .add(PatternDefinition.builtIn(PatternKind.COMMAND_WARN, "first", "deploy"))
                .add(PatternDefinition.builtIn(PatternKind.COMMAND_WARN, "second", "deploy\\s+--prod"))
                .build();

        Optional<ValidationPattern> match = registry.findFirst(PatternKind.COMMAND_WARN, "deploy --prod");

        assertTrue(match.isPresent());
        assertEquals("first", match.get().category());
    }

    @Test
    void shouldMatchCaseInsensitivelyAndIgnoreSurroundingWhitespace() {
        PatternRegistry registry = PatternRegistry.builder()
                .add(PatternDefinition.builtIn(PatternKind.COMMAND_DENY, "anchored", "^format\\s+c:$"))
                .build();

        assertTrue(registry.findFirst(PatternKind.COMMAND_DENY, "  FORMAT C:\n").isPresent());
    }

    @Test
    void shouldReturnEmptyForNullSubject() {
        assertFalse(PatternRegistry.defaults().findFirst(PatternKind.COMMAND_DENY, null).isPresent());
    }

    @Test
    void shouldAppendConfiguredPatternsAfterDefaults() {
        PatternRegistry registry = PatternRegistry.builder()
                .withDefaults()
                .addConfigured(PatternKind.COMMAND_DENY, List.of("regex:\\bterraform\\s+destroy\\b"))
                .build();

        List<ValidationPattern> deny = registry.patterns(PatternKind.COMMAND_DENY);
        ValidationPattern last = deny.get(deny.size() - 1);
        assertEquals("custom", last.category());
        assertTrue(registry.findFirst(PatternKind.COMMAND_DENY, "terraform destroy -auto-approve").isPresent());
    }

    @Test
    void shouldIgnoreNullConfiguredList() {
        PatternRegistry registry = PatternRegistry.builder()
                .addConfigured(PatternKind.FILE_BLOCKED, null)
                .build();

        assertEquals(0, registry.size(PatternKind.FILE_BLOCKED));
    }

    @Test
    void shouldExposeUnmodifiableLists() {
        List<ValidationPattern> patterns = PatternRegistry.defaults().patterns(PatternKind.COMMAND_DENY);

        assertThrows(UnsupportedOperationException.class, () -> patterns.remove(0));
    }

    @Test
    void shouldNotBeAffectedByLaterChangesToConfiguredList() {
        List<String> expressions = new ArrayList<>(List.of("literal:foo"));
        PatternRegistry registry = PatternRegistry.builder()
                .addConfigured(PatternKind.COMMAND_WARN, expressions)
                .build();

        expressions.add("literal:bar");

        assertEquals(1, registry.size(PatternKind.COMMAND_WARN));
    }

    @Test
    void shouldRejectInvalidConfiguredPatternsWithPositions() {
        PatternRegistry.Builder builder = PatternRegistry.builder()
                .addConfigured(PatternKind.COMMAND_DENY, List.of("regex:ok", "regex:(unclosed"))
                .addConfigured(PatternKind.COMMAND_WARN, List.of("regex:(a+)+"))
                .addConfigured(PatternKind.PATH_BLOCKED, List.of("   "));

        InvalidPatternException e = assertThrows(InvalidPatternException.class, builder::build);

        assertTrue(e.getMessage().contains("command-deny #2"), e.getMessage());
        assertTrue(e.getMessage().contains("command-warn #1"), e.getMessage());
        assertTrue(e.getMessage().contains("path-blocked #1"), e.getMessage());
        assertFalse(e.getMessage().contains("command-deny #1"), e.getMessage());
    }

    @Test
    void shouldRejectOverlongConfiguredPattern() {
        PatternRegistry.Builder builder = PatternRegistry.builder()
                .addConfigured(PatternKind.COMMAND_DENY, List.of("x".repeat(PatternSafety.MAX_PATTERN_LENGTH + 1)));

        assertThrows(InvalidPatternException.class, builder::build);
    }
}
