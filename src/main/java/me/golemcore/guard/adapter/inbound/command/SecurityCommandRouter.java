package me.golemcore.guard.adapter.inbound.command;

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

import me.golemcore.guard.domain.model.ValidationResult;
import me.golemcore.guard.domain.model.ValidationStats;
import me.golemcore.guard.port.inbound.CommandPort;
import me.golemcore.guard.security.CommandValidator;
import me.golemcore.guard.security.FileValidator;
import me.golemcore.guard.security.LogSanitizer;
import me.golemcore.guard.security.ValidationStatsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Routes diagnostics commands to the validation engine.
 *
 * <ul>
 * <li>check &lt;command...&gt; - validate a shell command
 * <li>file &lt;path&gt; - validate a file path
 * <li>stats - show validation statistics
 * <li>reset-stats - reset validation statistics
 * <li>help - show available commands
 * </ul>
 *
 * <p>
 * Every result carries the structured {@link ValidationResult} or
 * {@link ValidationStats} as its data payload. Echoed input is passed through
 * {@link LogSanitizer} first.
 *
 * @see me.golemcore.guard.port.inbound.CommandPort
 */
@Component
@Slf4j
public class SecurityCommandRouter implements CommandPort {

    private static final String CMD_CHECK = "check";
    private static final String CMD_FILE = "file";
    private static final String CMD_STATS = "stats";
    private static final String CMD_RESET_STATS = "reset-stats";
    private static final String CMD_HELP = "help";

    private static final List<String> KNOWN_COMMANDS = List.of(
            CMD_CHECK, CMD_FILE, CMD_STATS, CMD_RESET_STATS, CMD_HELP);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final CommandValidator commandValidator;
    private final FileValidator fileValidator;
    private final ValidationStatsCollector statsCollector;
    private final LogSanitizer sanitizer;

    public SecurityCommandRouter(CommandValidator commandValidator, FileValidator fileValidator,
            ValidationStatsCollector statsCollector, LogSanitizer sanitizer) {
        this.commandValidator = commandValidator;
        this.fileValidator = fileValidator;
        this.statsCollector = statsCollector;
        this.sanitizer = sanitizer;
        log.debug("SecurityCommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            log.debug("Executing command: {}", command);
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: " + sanitizer.sanitize(command)
                        + ". Use 'help' to list commands.");
            }

            List<String> safeArgs = args != null ? args : List.of();
            return switch (command) {
            case CMD_CHECK -> handleCheck(safeArgs);
            case CMD_FILE -> handleFile(safeArgs);
            case CMD_STATS -> handleStats();
            case CMD_RESET_STATS -> handleResetStats();
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure("Unknown command: " + command);
            };
        });
    }

    @Override
    public boolean hasCommand(String command) {
        return command != null && KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_CHECK, "Validate a shell command", "check <command...>"),
                new CommandDefinition(CMD_FILE, "Validate a file path", "file <path>"),
                new CommandDefinition(CMD_STATS, "Show validation statistics", CMD_STATS),
                new CommandDefinition(CMD_RESET_STATS, "Reset validation statistics", CMD_RESET_STATS),
                new CommandDefinition(CMD_HELP, "Show available commands", CMD_HELP));
    }

    private CommandResult handleCheck(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: check <command...>");
        }
        ValidationResult result = commandValidator.validateCommand(String.join(" ", args));
        return CommandResult.success(describe(result), result);
    }

    private CommandResult handleFile(List<String> args) {
        if (args.size() != 1) {
            return CommandResult.failure("Usage: file <path>");
        }
        ValidationResult result = fileValidator.validateFile(args.get(0));
        return CommandResult.success(describe(result), result);
    }

    private CommandResult handleStats() {
        ValidationStats stats = statsCollector.snapshot();
        String output = String.format(Locale.ROOT,
                "Commands: %d validated, %d blocked, %d warned%n"
                        + "Files: %d validated, %d blocked%n"
                        + "Obfuscation detected: %d%n"
                        + "Average validation time: %.3f ms over %d sample(s)",
                stats.getCommandsValidated(), stats.getCommandsBlocked(), stats.getCommandsWarned(),
                stats.getFilesValidated(), stats.getFilesBlocked(),
                stats.getObfuscationDetected(),
                stats.getAvgValidationTimeMs(), stats.getSamples());
        return CommandResult.success(output, stats);
    }

    private CommandResult handleResetStats() {
        statsCollector.reset();
        log.info("[Security] Validation statistics reset");
        return CommandResult.success("Validation statistics reset", statsCollector.snapshot());
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("Available commands:");
        for (CommandDefinition definition : listCommands()) {
            sb.append("\n  ").append(definition.usage()).append(" - ").append(definition.description());
        }
        return CommandResult.success(sb.toString());
    }

    private String describe(ValidationResult result) {
        StringBuilder sb = new StringBuilder(result.getAction().getValue().toUpperCase(Locale.ROOT));
        if (!result.isAllowed()) {
            sb.append(": ").append(result.getReason())
                    .append(" [").append(result.getCategory()).append(']')
                    .append("\n  pattern: ").append(sanitizer.sanitize(result.getMatchedPattern()));
        }
        if (result.getNormalizedCommand() != null) {
            sb.append("\n  normalized: ").append(sanitizer.sanitizeCommand(result.getNormalizedCommand()));
        }
        return sb.toString();
    }
}
