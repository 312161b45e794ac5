package me.golemcore.guard.infrastructure.config;

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
import me.golemcore.guard.security.CommandNormalizer;
import me.golemcore.guard.security.CommandValidator;
import me.golemcore.guard.security.FileValidator;
import me.golemcore.guard.security.LogSanitizer;
import me.golemcore.guard.security.PatternRegistry;
import me.golemcore.guard.security.ToolCallGuard;
import me.golemcore.guard.security.ValidationStatsCollector;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the validation engine from {@link GuardProperties}.
 *
 * <p>
 * The pattern registry is compiled once here; an invalid configured pattern
 * fails the context at startup.
 */
@Configuration
@Slf4j
public class SecurityEngineConfiguration {

    @Bean
    public PatternRegistry patternRegistry(GuardProperties properties) {
        GuardProperties.SecurityProperties security = properties.getSecurity();
        PatternRegistry registry = PatternRegistry.builder()
                .withDefaults()
                .addConfigured(PatternKind.COMMAND_DENY, security.getBlockedPatterns())
                .addConfigured(PatternKind.COMMAND_WARN, security.getWarningPatterns())
                .addConfigured(PatternKind.COMMAND_ALLOW, security.getAllowedPatterns())
                .addConfigured(PatternKind.FILE_BLOCKED, security.getBlockedFiles())
                .addConfigured(PatternKind.PATH_BLOCKED, security.getBlockedPaths())
                .build();
        log.info("[Security] Pattern registry ready: {} deny, {} warn, {} allow, {} file, {} path",
                registry.size(PatternKind.COMMAND_DENY), registry.size(PatternKind.COMMAND_WARN),
                registry.size(PatternKind.COMMAND_ALLOW), registry.size(PatternKind.FILE_BLOCKED),
                registry.size(PatternKind.PATH_BLOCKED));
        return registry;
    }

    @Bean
    public CommandNormalizer commandNormalizer(GuardProperties properties) {
        return new CommandNormalizer(properties.getSecurity().getMaxDecodePasses());
    }

    @Bean
    public ValidationStatsCollector validationStatsCollector() {
        return new ValidationStatsCollector();
    }

    @Bean
    public LogSanitizer logSanitizer(GuardProperties properties) {
        return new LogSanitizer(properties.getLog().getMaxLength());
    }

    @Bean
    public CommandValidator commandValidator(PatternRegistry patternRegistry, CommandNormalizer commandNormalizer,
            ValidationStatsCollector statsCollector, LogSanitizer logSanitizer, GuardProperties properties) {
        return new CommandValidator(patternRegistry, commandNormalizer, statsCollector, logSanitizer,
                properties.getSecurity().getMaxInputLength());
    }

    @Bean
    public FileValidator fileValidator(PatternRegistry patternRegistry, ValidationStatsCollector statsCollector,
            LogSanitizer logSanitizer, GuardProperties properties) {
        GuardProperties.SecurityProperties security = properties.getSecurity();
        return new FileValidator(patternRegistry, statsCollector, logSanitizer,
                security.getMaxInputLength(), security.isBlockPathTraversal());
    }

    @Bean
    public ToolCallGuard toolCallGuard(CommandValidator commandValidator, FileValidator fileValidator) {
        return new ToolCallGuard(commandValidator, fileValidator);
    }
}
