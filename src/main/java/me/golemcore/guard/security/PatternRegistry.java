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
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable, ordered collections of compiled matchers, one per
 * {@link PatternKind}.
 *
 * <p>
 * Every pattern is compiled exactly once, in {@link Builder#build()}. Lookups
 * scan a registry in insertion order and return the first hit, so built-in
 * entries (added first by {@link Builder#withDefaults()}) win over configured
 * ones inside the same kind. Precedence between kinds is decided by the
 * validators, not here.
 *
 * <p>
 * Instances are read-only after construction and need no locking.
 *
 * @since 1.0
 */
@Slf4j
public final class PatternRegistry {

    private final Map<PatternKind, List<ValidationPattern>> patterns;

    private PatternRegistry(Map<PatternKind, List<ValidationPattern>> patterns) {
        this.patterns = patterns;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registry holding only the built-in patterns.
     */
    public static PatternRegistry defaults() {
        return builder().withDefaults().build();
    }

    /**
     * Unmodifiable view of the entries of one kind, in match order.
     */
    public List<ValidationPattern> patterns(PatternKind kind) {
        return patterns.get(kind);
    }

    public int size(PatternKind kind) {
        return patterns.get(kind).size();
    }

    /**
     * Find the first entry of {@code kind} matching {@code subject}. Leading and
     * trailing whitespace of the subject is ignored.
     */
    public Optional<ValidationPattern> findFirst(PatternKind kind, String subject) {
        if (subject == null) {
            return Optional.empty();
        }
        String trimmed = subject.strip();
        for (ValidationPattern pattern : patterns.get(kind)) {
            if (pattern.matches(trimmed)) {
                return Optional.of(pattern);
            }
        }
        return Optional.empty();
    }

    /**
     * Collects definitions and compiles them into a {@link PatternRegistry}.
     */
    public static final class Builder {

        private final List<PatternDefinition> definitions = new ArrayList<>();

        private Builder() {
        }

        public Builder withDefaults() {
            definitions.addAll(DefaultSecurityPatterns.definitions());
            return this;
        }

        public Builder add(PatternDefinition definition) {
            definitions.add(definition);
            return this;
        }

        /**
         * Add configured pattern strings ({@link PatternMatchers#parse} syntax)
         * to the given kind. A {@code null} collection is treated as empty.
         */
        public Builder addConfigured(PatternKind kind, Collection<String> expressions) {
            if (expressions == null) {
                return this;
            }
            for (String expression : expressions) {
                definitions.add(PatternDefinition.configured(kind, expression));
            }
            return this;
        }

        /**
         * Compile every definition.
         *
         * @throws InvalidPatternException
         *             listing every rejected entry, if at least one definition
         *             fails to compile or is unsafe
         */
        public PatternRegistry build() {
            Map<PatternKind, List<ValidationPattern>> compiled = new EnumMap<>(PatternKind.class);
            for (PatternKind kind : PatternKind.values()) {
                compiled.put(kind, new ArrayList<>());
            }

            List<String> problems = new ArrayList<>();
            Map<PatternKind, Integer> positions = new EnumMap<>(PatternKind.class);
            for (PatternDefinition definition : definitions) {
                int position = positions.merge(definition.kind(), 1, Integer::sum);
                try {
                    compiled.get(definition.kind()).add(
                            new ValidationPattern(definition.kind(), definition.category(), definition.compile()));
                } catch (InvalidPatternException e) {
                    problems.add(definition.kind().getLabel() + " #" + position + ": " + e.getMessage());
                }
            }

            if (!problems.isEmpty()) {
                log.error("[Security] Rejected {} pattern(s): {}", problems.size(), problems);
                throw new InvalidPatternException("Invalid security patterns: " + String.join("; ", problems));
            }

            Map<PatternKind, List<ValidationPattern>> frozen = new EnumMap<>(PatternKind.class);
            compiled.forEach((kind, list) -> frozen.put(kind, List.copyOf(list)));
            log.debug("[Security] Pattern registry built: {}", describe(frozen));
            return new PatternRegistry(Collections.unmodifiableMap(frozen));
        }

        private static String describe(Map<PatternKind, List<ValidationPattern>> registry) {
            StringBuilder sb = new StringBuilder();
            registry.forEach((kind, list) -> {
                if (sb.length() > 0) {
                    sb.append(", ");
                }
                sb.append(kind.getLabel()).append('=').append(list.size());
            });
            return sb.toString();
        }
    }
}
