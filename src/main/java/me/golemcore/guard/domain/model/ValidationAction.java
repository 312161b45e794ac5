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

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Outcome of a command or file validation.
 *
 * <ul>
 * <li>{@link #ALLOW} - proceed silently</li>
 * <li>{@link #ASK} - proceed, but annotate the interaction with a visible
 * warning. There is no interactive confirmation channel upstream, so callers
 * treat this as "allow with a warning"</li>
 * <li>{@link #DENY} - block execution and surface the reason</li>
 * </ul>
 */
public enum ValidationAction {

    ALLOW, ASK, DENY;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
