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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * A compiled, case-insensitive text matcher. Instances are immutable and safe
 * to share between threads.
 *
 * @see PatternMatchers
 */
public interface PatternMatcher {

    /**
     * Check whether the subject contains (literal, regex) or is described by
     * (glob) this matcher.
     */
    boolean matches(String subject);

    /**
     * Source text of the matcher, reported as the matched pattern.
     */
    String source();

    /**
     * Regular expression with find semantics.
     */
    final class Regex implements PatternMatcher {

        private final Pattern pattern;

        Regex(Pattern pattern) {
            this.pattern = pattern;
        }

        @Override
        public boolean matches(String subject) {
            return pattern.matcher(subject).find();
        }

        @Override
        public String source() {
            return pattern.pattern();
        }
    }

    /**
     * Literal substring, compared in lower case. Runs in linear time.
     */
    final class Literal implements PatternMatcher {

        private final String needle;

        Literal(String needle) {
            this.needle = needle.toLowerCase(Locale.ROOT);
        }

        @Override
        public boolean matches(String subject) {
            return subject.toLowerCase(Locale.ROOT).contains(needle);
        }

        @Override
        public String source() {
            return needle;
        }
    }

    /**
     * Glob translated to an anchored regular expression.
     */
    final class Glob implements PatternMatcher {

        private final String glob;
        private final Pattern pattern;

        Glob(String glob, Pattern pattern) {
            this.glob = glob;
            this.pattern = pattern;
        }

        @Override
        public boolean matches(String subject) {
            return pattern.matcher(subject).matches();
        }

        @Override
        public String source() {
            return glob;
        }
    }
}
