package me.golemcore.guard.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Value;

import java.util.Objects;

/**
 * Result of validating a command or a file path.
 *
 * <p>
 * {@code reason}, {@code category} and {@code matchedPattern} are present if
 * and only if the action is not {@link ValidationAction#ALLOW}. The static
 * factories are the only way to build an instance, so the invariant holds for
 * every result the engine returns.
 *
 * <p>
 * {@code normalizedCommand} carries the canonical form of a validated command
 * and is {@code null} for file results and for inputs rejected before
 * normalization.
 */
@Value
@Builder(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationResult {

    ValidationAction action;
    String reason;
    String category;
    String matchedPattern;
    String normalizedCommand;

    public static ValidationResult allow() {
        return ValidationResult.builder().action(ValidationAction.ALLOW).build();
    }

    public static ValidationResult allow(String normalizedCommand) {
        return ValidationResult.builder()
                .action(ValidationAction.ALLOW)
                .normalizedCommand(normalizedCommand)
                .build();
    }

    public static ValidationResult deny(String reason, String category, String matchedPattern) {
        return deny(reason, category, matchedPattern, null);
    }

    public static ValidationResult deny(String reason, String category, String matchedPattern,
            String normalizedCommand) {
        return flagged(ValidationAction.DENY, reason, category, matchedPattern, normalizedCommand);
    }

    public static ValidationResult ask(String reason, String category, String matchedPattern,
            String normalizedCommand) {
        return flagged(ValidationAction.ASK, reason, category, matchedPattern, normalizedCommand);
    }

    private static ValidationResult flagged(ValidationAction action, String reason, String category,
            String matchedPattern, String normalizedCommand) {
        return ValidationResult.builder()
                .action(action)
                .reason(Objects.requireNonNull(reason, "reason"))
                .category(Objects.requireNonNull(category, "category"))
                .matchedPattern(Objects.requireNonNull(matchedPattern, "matchedPattern"))
                .normalizedCommand(normalizedCommand)
                .build();
    }

    @JsonIgnore
    public boolean isAllowed() {
        return action == ValidationAction.ALLOW;
    }

    @JsonIgnore
    public boolean isDenied() {
        return action == ValidationAction.DENY;
    }

    @JsonIgnore
    public boolean requiresConfirmation() {
        return action == ValidationAction.ASK;
    }
}
