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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for the validation engine, bound from
 * application.yml.
 *
 * <p>
 * All settings live under the {@code guard.*} prefix:
 * <ul>
 * <li>{@link SecurityProperties} - extra patterns and decoding/input bounds</li>
 * <li>{@link LogProperties} - log sanitizer defaults</li>
 * </ul>
 *
 * <p>
 * Pattern lists use the {@code regex:}, {@code glob:} and {@code literal:}
 * prefixes; an unprefixed entry is a literal, or a glob for file patterns
 * containing wildcards. Configured patterns are appended to the built-in ones,
 * they never replace them.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "guard")
@Data
public class GuardProperties {

    private SecurityProperties security = new SecurityProperties();
    private LogProperties log = new LogProperties();

    @Data
    public static class SecurityProperties {
        private List<String> blockedPatterns = new ArrayList<>();
        private List<String> warningPatterns = new ArrayList<>();
        private List<String> allowedPatterns = new ArrayList<>();
        private List<String> blockedFiles = new ArrayList<>();
        private List<String> blockedPaths = new ArrayList<>();
        private int maxDecodePasses = 5;
        private int maxInputLength = 32768;
        private boolean blockPathTraversal = true;
    }

    @Data
    public static class LogProperties {
        private int maxLength = 500;
    }
}
