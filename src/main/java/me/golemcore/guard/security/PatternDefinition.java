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

/**
 * Uncompiled registry entry.
 *
 * @param kind
 *            registry the entry belongs to
 * @param category
 *            diagnostic label
 * @param expression
 *            regex for built-in entries, a prefixed pattern string for
 *            configured ones
 * @param configured
 *            true when the entry comes from configuration and uses the
 *            {@link PatternMatchers#parse} syntax
 */
public record PatternDefinition(PatternKind kind, String category, String expression, boolean configured) {

    public static PatternDefinition builtIn(PatternKind kind, String category, String regex) {
        return new PatternDefinition(kind, category, regex, false);
    }

    public static PatternDefinition configured(PatternKind kind, String expression) {
        return new PatternDefinition(kind, "custom", expression, true);
    }

    PatternMatcher compile() {
        return configured ? PatternMatchers.parse(kind, expression) : PatternMatchers.regex(expression);
    }
}
