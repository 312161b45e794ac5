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

import com.fasterxml.jackson.databind.JsonNode;
import me.golemcore.guard.domain.model.ToolInvocation;
import me.golemcore.guard.domain.model.ValidationResult;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * Routes an agent tool call to the matching validator.
 *
 * <p>
 * Shell-type tools ({@code bash}, {@code shell}, {@code exec}) are checked with
 * {@link CommandValidator} using the first string among {@code command},
 * {@code cmd} and {@code script}. File tools ({@code read}, {@code write},
 * {@code edit}, {@code multiedit}, {@code glob}, {@code grep},
 * {@code notebookedit}) are checked with {@link FileValidator} using the first
 * path-like argument. Tool names are case-insensitive. Unknown tools and calls
 * without a usable argument are allowed, since there is nothing to check.
 *
 * <p>
 * What to do with {@code ask} is up to the caller; no interactive
 * confirmation channel exists here.
 *
 * @since 1.0
 */
@Slf4j
public class ToolCallGuard {

    private static final Set<String> COMMAND_TOOLS = Set.of("bash", "shell", "exec");
    private static final Set<String> FILE_TOOLS = Set.of(
            "read", "write", "edit", "multiedit", "glob", "grep", "notebookedit");

    private static final List<String> COMMAND_KEYS = List.of("command", "cmd", "script");
    private static final List<String> PATH_KEYS = List.of(
            "file_path", "filePath", "notebook_path", "notebookPath", "path", "pattern",
            "source", "destination", "src", "dest");
    private static final String URL_KEY = "url";
    private static final String FILE_URL_PREFIX = "file://";

    private final CommandValidator commandValidator;
    private final FileValidator fileValidator;

    public ToolCallGuard(CommandValidator commandValidator, FileValidator fileValidator) {
        this.commandValidator = Objects.requireNonNull(commandValidator, "commandValidator");
        this.fileValidator = Objects.requireNonNull(fileValidator, "fileValidator");
    }

    public ValidationResult validate(ToolInvocation invocation) {
        if (invocation == null) {
            return ValidationResult.allow();
        }
        return validate(invocation.getName(), invocation.getArguments());
    }

    public ValidationResult validate(String toolName, Map<String, Object> arguments) {
        return route(toolName, key -> {
            if (arguments == null) {
                return null;
            }
            Object value = arguments.get(key);
            return value instanceof String ? (String) value : null;
        });
    }

    public ValidationResult validate(String toolName, JsonNode arguments) {
        return route(toolName, key -> {
            if (arguments == null || !arguments.isObject()) {
                return null;
            }
            JsonNode value = arguments.get(key);
            return value != null && value.isTextual() ? value.asText() : null;
        });
    }

    /**
     * Validate a tool whose whole input is a single string (the command for
     * shell tools, the path for file tools).
     */
    public ValidationResult validateRawInput(String toolName, String input) {
        return route(toolName, key -> input);
    }

    /**
     * Like {@link #validate(ToolInvocation)}, but a deny is raised as an
     * exception.
     *
     * @throws SecurityValidationException
     *             if the invocation is denied
     */
    public ValidationResult enforce(ToolInvocation invocation) {
        ValidationResult result = validate(invocation);
        if (result.isDenied()) {
            throw new SecurityValidationException(invocation.getName(), result);
        }
        return result;
    }

    public boolean isBlocked(String command) {
        return commandValidator.validateCommand(command).isDenied();
    }

    public boolean requiresConfirmation(String command) {
        return commandValidator.validateCommand(command).requiresConfirmation();
    }

    public boolean isFileBlocked(String path) {
        return fileValidator.validateFile(path).isDenied();
    }

    private ValidationResult route(String toolName, Function<String, String> arguments) {
        if (toolName == null) {
            return ValidationResult.allow();
        }
        String tool = toolName.toLowerCase(Locale.ROOT);
        try {
            if (COMMAND_TOOLS.contains(tool)) {
                String command = firstPresent(arguments, COMMAND_KEYS);
                return command == null ? ValidationResult.allow() : commandValidator.validateCommand(command);
            }
            if (FILE_TOOLS.contains(tool)) {
                String path = extractPath(arguments);
                return path == null ? ValidationResult.allow() : fileValidator.validateFile(path);
            }
        } catch (RuntimeException e) {
            log.error("[Security] Tool call validation failed for '{}', denying: {}", tool, e.getMessage(), e);
            return ValidationResult.deny("Validation error - tool call denied for safety", "validation-error",
                    e.getClass().getSimpleName());
        }
        log.trace("[Security] No validation rule for tool '{}'", tool);
        return ValidationResult.allow();
    }

    private static String extractPath(Function<String, String> arguments) {
        String path = firstPresent(arguments, PATH_KEYS);
        if (path != null) {
            return path;
        }
        String url = arguments.apply(URL_KEY);
        if (url != null && url.regionMatches(true, 0, FILE_URL_PREFIX, 0, FILE_URL_PREFIX.length())) {
            String filePath = url.substring(FILE_URL_PREFIX.length());
            return filePath.isEmpty() ? null : filePath;
        }
        return null;
    }

    private static String firstPresent(Function<String, String> arguments, List<String> keys) {
        for (String key : keys) {
            String value = arguments.apply(key);
            if (value != null && !value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
