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

import java.util.regex.Pattern;

/**
 * Makes arbitrary text safe to put into logs and user-facing messages.
 *
 * <p>
 * Two entry points:
 * <ul>
 * <li>{@link #sanitize(String, int)} - strips ANSI escape sequences and every
 * C0/C1 control character (DEL included), then truncates with a marker</li>
 * <li>{@link #sanitizeCommand(String)} - additionally masks URL credentials,
 * secret-like assignments and long base64 blobs, then truncates to
 * {@value #COMMAND_MAX_LENGTH} characters</li>
 * </ul>
 *
 * <p>
 * Pure functions, safe to share between threads.
 *
 * @since 1.0
 */
public class LogSanitizer {

    public static final int DEFAULT_MAX_LENGTH = 500;
    public static final int COMMAND_MAX_LENGTH = 200;
    public static final String TRUNCATION_MARKER = "... (truncated)";

    private static final Pattern ANSI_ESCAPE = Pattern.compile("\\u001B\\[[0-9;]{0,32}[a-zA-Z]");
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\u0000-\\u001F\\u007F-\\u009F]");

    private static final Pattern URL_CREDENTIALS = Pattern.compile("(://[^:/\\s@]{1,256}:)[^@\\s]{1,256}(@)");
    private static final Pattern SECRET_ASSIGNMENT = Pattern.compile(
            "((?:PASSWORD|PASSWD|SECRET|API_KEY|KEY|TOKEN|AUTH)[=:])\\S{1,1024}",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern BASE64_BLOB = Pattern.compile("[A-Za-z0-9+/]{40,}={0,2}");

    private final int defaultMaxLength;

    public LogSanitizer() {
        this(DEFAULT_MAX_LENGTH);
    }

    public LogSanitizer(int defaultMaxLength) {
        if (defaultMaxLength < 1) {
            throw new IllegalArgumentException("defaultMaxLength must be positive: " + defaultMaxLength);
        }
        this.defaultMaxLength = defaultMaxLength;
    }

    public int getDefaultMaxLength() {
        return defaultMaxLength;
    }

    public String sanitize(String text) {
        return sanitize(text, defaultMaxLength);
    }

    /**
     * Strip control characters and truncate. The result never exceeds
     * {@code maxLength} characters, marker included.
     */
    public String sanitize(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        String result = ANSI_ESCAPE.matcher(text).replaceAll("");
        result = CONTROL_CHARS.matcher(result).replaceAll("");
        return truncate(result, Math.max(0, maxLength));
    }

    /**
     * Render a command for a log line with credentials masked.
     */
    public String sanitizeCommand(String command) {
        if (command == null) {
            return "";
        }
        String result = URL_CREDENTIALS.matcher(command).replaceAll("$1***$2");
        result = SECRET_ASSIGNMENT.matcher(result).replaceAll("$1***");
        result = BASE64_BLOB.matcher(result).replaceAll("[BASE64_REDACTED]");
        return sanitize(result, COMMAND_MAX_LENGTH);
    }

    private static String truncate(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= TRUNCATION_MARKER.length()) {
            return text.substring(0, safeCut(text, maxLength));
        }
        int keep = safeCut(text, maxLength - TRUNCATION_MARKER.length());
        return text.substring(0, keep) + TRUNCATION_MARKER;
    }

    // never leave half of a surrogate pair at the cut
    private static int safeCut(String text, int index) {
        if (index > 0 && Character.isHighSurrogate(text.charAt(index - 1))) {
            return index - 1;
        }
        return index;
    }
}
