package me.golemcore.guard.security;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.guard.domain.model.PatternKind;
import me.golemcore.guard.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Decides whether a shell command may run.
 *
 * <p>
 * Decision procedure, evaluated on the normalized command:
 * <ol>
 * <li>Malformed input (null, too long, broken UTF-16, NUL after decoding) -
 * deny</li>
 * <li>Any command-deny pattern - deny</li>
 * <li>Any command-warn pattern - ask, unless a command-allow override matches
 * a fully resolved simple command (no chaining, piping, substitution or
 * comment)</li>
 * <li>Decoding did not resolve - ask</li>
 * <li>Otherwise - allow</li>
 * </ol>
 *
 * <p>
 * Never throws: an internal fault is logged and turned into a deny. Statistics
 * are recorded after the decision and a failing collector cannot change the
 * result.
 *
 * @since 1.0
 */
@Slf4j
public class CommandValidator {

    static final String DENY_REASON = "Command matches blocked security pattern";
    static final String WARN_REASON = "Command requires user confirmation";
    static final String UNRESOLVED_REASON = "Command contains unresolved obfuscation after bounded decoding";
    static final String UNRESOLVED_CATEGORY = "obfuscation";
    static final String UNRESOLVED_PATTERN = "decode-pass-bound";
    static final String ERROR_REASON = "Validation error - command denied for safety";
    static final String ERROR_CATEGORY = "validation-error";

    private static final Pattern COMPOUND_SYNTAX = Pattern.compile("[;&|#`\\n\\r]|\\$\\(|[<>]\\(");

    private final PatternRegistry registry;
    private final CommandNormalizer normalizer;
    private final ValidationStatsCollector stats;
    private final LogSanitizer sanitizer;
    private final int maxInputLength;

    public CommandValidator(PatternRegistry registry, CommandNormalizer normalizer,
            ValidationStatsCollector stats, LogSanitizer sanitizer) {
        this(registry, normalizer, stats, sanitizer, InputGuards.DEFAULT_MAX_INPUT_LENGTH);
    }

    public CommandValidator(PatternRegistry registry, CommandNormalizer normalizer,
            ValidationStatsCollector stats, LogSanitizer sanitizer, int maxInputLength) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("maxInputLength must be positive: " + maxInputLength);
        }
        this.maxInputLength = maxInputLength;
    }

    /**
     * Validate a raw command.
     */
    public ValidationResult validateCommand(String raw) {
        long start = System.nanoTime();
        ValidationResult result;
        boolean obfuscated = false;
        try {
            Optional<String> malformed = InputGuards.malformedReason(raw, maxInputLength);
            if (malformed.isPresent()) {
                log.warn("[Security] Malformed command rejected: {}", malformed.get());
                result = ValidationResult.deny("Malformed command input", InputGuards.MALFORMED_INPUT,
                        malformed.get());
            } else {
                NormalizedCommand normalized = normalizer.normalize(raw);
                obfuscated = normalized.isObfuscated();
                if (obfuscated) {
                    log.warn("[Security] Obfuscation detected: {} -> {} (stages={}, unresolved={})",
                            sanitizer.sanitizeCommand(raw), sanitizer.sanitizeCommand(normalized.value()),
                            normalized.transformations(), normalized.unresolved());
                }
                result = decide(normalized);
            }
        } catch (RuntimeException e) {
            log.error("[Security] Command validation failed, denying: {}", e.getMessage(), e);
            result = ValidationResult.deny(ERROR_REASON, ERROR_CATEGORY, e.getClass().getSimpleName());
        }

        recordStats(result, obfuscated, System.nanoTime() - start);
        return result;
    }

    private ValidationResult decide(NormalizedCommand normalized) {
        String command = normalized.value();

        if (command.indexOf('\0') >= 0) {
            log.warn("[Security] NUL character in decoded command: {}", sanitizer.sanitizeCommand(command));
            return ValidationResult.deny("Malformed command input", InputGuards.MALFORMED_INPUT, InputGuards.NUL_BYTE,
                    command);
        }

        Optional<ValidationPattern> deny = registry.findFirst(PatternKind.COMMAND_DENY, command);
        if (deny.isPresent()) {
            log.warn("[Security] Command blocked ({}): {}", deny.get().category(),
                    sanitizer.sanitizeCommand(command));
            return ValidationResult.deny(DENY_REASON, deny.get().category(), deny.get().source(), command);
        }

        Optional<ValidationPattern> warn = registry.findFirst(PatternKind.COMMAND_WARN, command);
        if (warn.isPresent()) {
            if (isOverridable(normalized) && registry.findFirst(PatternKind.COMMAND_ALLOW, command).isPresent()) {
                log.debug("[Security] Warning ({}) relaxed by allow override: {}", warn.get().category(),
                        sanitizer.sanitizeCommand(command));
                return ValidationResult.allow(command);
            }
            log.warn("[Security] Command requires confirmation ({}): {}", warn.get().category(),
                    sanitizer.sanitizeCommand(command));
            return ValidationResult.ask(WARN_REASON, warn.get().category(), warn.get().source(), command);
        }

        if (normalized.unresolved()) {
            log.warn("[Security] Unresolved obfuscation, asking: {}", sanitizer.sanitizeCommand(command));
            return ValidationResult.ask(UNRESOLVED_REASON, UNRESOLVED_CATEGORY, UNRESOLVED_PATTERN, command);
        }

        log.debug("[Security] Command allowed: {}", sanitizer.sanitizeCommand(command));
        return ValidationResult.allow(command);
    }

    /**
     * An override vouches for one command. Anything chained, piped, substituted
     * or commented onto it could carry another warn-class command.
     */
    private static boolean isOverridable(NormalizedCommand normalized) {
        return !normalized.unresolved() && !COMPOUND_SYNTAX.matcher(normalized.value()).find();
    }

    private void recordStats(ValidationResult result, boolean obfuscated, long elapsedNanos) {
        try {
            stats.recordCommand(result.getAction(), obfuscated, elapsedNanos);
        } catch (RuntimeException e) {
            log.debug("[Security] Failed to record command stats: {}", e.getMessage());
        }
    }
}
