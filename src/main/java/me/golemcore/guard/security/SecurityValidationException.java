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

import me.golemcore.guard.domain.model.ValidationResult;

/**
 * Thrown by {@link ToolCallGuard#enforce} when a tool call is denied.
 */
public class SecurityValidationException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final String toolName;
    private final transient ValidationResult result;

    public SecurityValidationException(String toolName, ValidationResult result) {
        super("Security validation failed for '" + toolName + "': " + result.getReason());
        this.toolName = toolName;
        this.result = result;
    }

    public String getToolName() {
        return toolName;
    }

    public ValidationResult getResult() {
        return result;
    }
}
