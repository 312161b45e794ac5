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
 * Binary allow/deny guard for file operations.
 *
 * <p>
 * The candidate path is not decoded. Only its separators are normalized
 * ({@code \} to {@code /}, repeated slashes collapsed, {@code /./} removed,
 * quotes dropped) so that a pattern written for one spelling covers the
 * others. Then:
 * <ul>
 * <li>a {@code ..} segment or a percent-encoded dot-dot is denied as
 * path traversal (when enabled)</li>
 * <li>the last non-empty segment is matched against the file-blocked
 * registry</li>
 * <li>the whole path is matched against the path-blocked registry</li>
 * </ul>
 * There is no ask tier.
 *
 * @since 1.0
 */
@Slf4j
public class FileValidator {

    static final String FILE_REASON = "File matches blocked security pattern";
    static final String PATH_REASON = "Path matches blocked security pattern";
    static final String TRAVERSAL_REASON = "Path traversal is not allowed";
    static final String TRAVERSAL_CATEGORY = "path-traversal";
    static final String ERROR_REASON = "Validation error - file access denied for safety";
    static final String ERROR_CATEGORY = "validation-error";

    private static final Pattern QUOTES = Pattern.compile("['\"]");
    private static final Pattern REPEATED_SLASH = Pattern.compile("/{2,}");
    private static final Pattern ENCODED_TRAVERSAL = Pattern.compile(
            "%2e%2e|%2e\\.|\\.%2e|\\.\\.%2f|\\.\\.%5c", Pattern.CASE_INSENSITIVE);

    private final PatternRegistry registry;
    private final ValidationStatsCollector stats;
    private final LogSanitizer sanitizer;
    private final int maxInputLength;
    private final boolean blockPathTraversal;

    public FileValidator(PatternRegistry registry, ValidationStatsCollector stats, LogSanitizer sanitizer) {
        this(registry, stats, sanitizer, InputGuards.DEFAULT_MAX_INPUT_LENGTH, true);
    }

    public FileValidator(PatternRegistry registry, ValidationStatsCollector stats, LogSanitizer sanitizer,
            int maxInputLength, boolean blockPathTraversal) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer");
        if (maxInputLength < 1) {
            throw new IllegalArgumentException("maxInputLength must be positive: " + maxInputLength);
        }
        this.maxInputLength = maxInputLength;
        this.blockPathTraversal = blockPathTraversal;
    }

    /**
     * Validate a file path.
     */
    public ValidationResult validateFile(String path) {
        long start = System.nanoTime();
        ValidationResult result;
        try {
            result = decide(path);
        } catch (RuntimeException e) {
            log.error("[Security] File validation failed, denying: {}", e.getMessage(), e);
            result = ValidationResult.deny(ERROR_REASON, ERROR_CATEGORY, e.getClass().getSimpleName());
        }

        try {
            stats.recordFile(result.getAction(), System.nanoTime() - start);
        } catch (RuntimeException e) {
            log.debug("[Security] Failed to record file stats: {}", e.getMessage());
        }
        return result;
    }

    private ValidationResult decide(String path) {
        Optional<String> malformed = InputGuards.malformedReason(path, maxInputLength);
        if (malformed.isEmpty() && path.isBlank()) {
            malformed = Optional.of("blank-path");
        }
        if (malformed.isEmpty() && path.indexOf('\0') >= 0) {
            malformed = Optional.of(InputGuards.NUL_BYTE);
        }
        if (malformed.isPresent()) {
            log.warn("[Security] Malformed path rejected: {}", malformed.get());
            return ValidationResult.deny("Malformed file path", InputGuards.MALFORMED_INPUT, malformed.get());
        }

        String normalized = normalizePath(path);

        if (blockPathTraversal && isTraversal(path, normalized)) {
            log.warn("[Security] Path traversal blocked: {}", sanitizer.sanitizeCommand(path));
            return ValidationResult.deny(TRAVERSAL_REASON, TRAVERSAL_CATEGORY, "..");
        }

        String fileName = fileName(normalized);
        if (!fileName.isEmpty()) {
            Optional<ValidationPattern> file = registry.findFirst(PatternKind.FILE_BLOCKED, fileName);
            if (file.isPresent()) {
                log.warn("[Security] File blocked ({}): {}", file.get().category(),
                        sanitizer.sanitizeCommand(normalized));
                return ValidationResult.deny(FILE_REASON, file.get().category(), file.get().source());
            }
        }

        Optional<ValidationPattern> blockedPath = registry.findFirst(PatternKind.PATH_BLOCKED, normalized);
        if (blockedPath.isPresent()) {
            log.warn("[Security] Path blocked ({}): {}", blockedPath.get().category(),
                    sanitizer.sanitizeCommand(normalized));
            return ValidationResult.deny(PATH_REASON, blockedPath.get().category(), blockedPath.get().source());
        }

        log.debug("[Security] File allowed: {}", sanitizer.sanitizeCommand(normalized));
        return ValidationResult.allow();
    }

    static String normalizePath(String path) {
        String result = QUOTES.matcher(path.strip()).replaceAll("");
        result = result.replace('\\', '/');
        result = REPEATED_SLASH.matcher(result).replaceAll("/");
        String previous;
        do {
            previous = result;
            result = result.replace("/./", "/");
        } while (!result.equals(previous));
        if (result.startsWith("./")) {
            result = result.substring(2);
        }
        if (result.endsWith("/.")) {
            result = result.substring(0, result.length() - 1);
        }
        return result;
    }

    static String fileName(String normalizedPath) {
        int end = normalizedPath.length();
        while (end > 0 && normalizedPath.charAt(end - 1) == '/') {
            end--;
        }
        String trimmed = normalizedPath.substring(0, end);
        int slash = trimmed.lastIndexOf('/');
        return slash < 0 ? trimmed : trimmed.substring(slash + 1);
    }

    private static boolean isTraversal(String raw, String normalized) {
        if (ENCODED_TRAVERSAL.matcher(raw).find()) {
            return true;
        }
        for (String segment : normalized.split("/", -1)) {
            if ("..".equals(segment)) {
                return true;
            }
        }
        return false;
    }
}
