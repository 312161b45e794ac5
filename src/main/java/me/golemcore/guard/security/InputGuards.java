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

import java.util.Optional;

/**
 * Shape checks applied to raw input before any matching.
 */
final class InputGuards {

    static final String MALFORMED_INPUT = "malformed-input";
    static final String NUL_BYTE = "nul-byte";
    static final int DEFAULT_MAX_INPUT_LENGTH = 32_768;

    private InputGuards() {
    }

    /**
     * Returns the reason the input is malformed, or empty when it is
     * well-formed text within {@code maxLength}.
     */
    static Optional<String> malformedReason(String input, int maxLength) {
        if (input == null) {
            return Optional.of("null-input");
        }
        if (input.length() > maxLength) {
            return Optional.of("input-too-long");
        }
        if (hasUnpairedSurrogate(input)) {
            return Optional.of("invalid-utf16");
        }
        return Optional.empty();
    }

    static boolean hasUnpairedSurrogate(String input) {
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= input.length() || !Character.isLowSurrogate(input.charAt(i + 1))) {
                    return true;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return true;
            }
        }
        return false;
    }
}
