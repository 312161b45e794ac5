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

import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Factory for {@link PatternMatcher} instances.
 *
 * <p>
 * Configured pattern strings use a prefix to pick the matcher:
 * <ul>
 * <li>{@code regex:<expr>} - regular expression, find semantics</li>
 * <li>{@code glob:<expr>} - glob, whole-subject match</li>
 * <li>{@code literal:<text>} - literal substring</li>
 * <li>no prefix - literal substring, or a glob for file kinds when the text
 * contains {@code *}, {@code ?} or {@code [}</li>
 * </ul>
 * All matchers are case-insensitive.
 */
public final class PatternMatchers {

    public static final String REGEX_PREFIX = "regex:";
    public static final String GLOB_PREFIX = "glob:";
    public static final String LITERAL_PREFIX = "literal:";

    private PatternMatchers() {
    }

    /**
     * Parse a configured pattern string for the given registry kind.
     *
     * @throws InvalidPatternException
     *             if the pattern is empty, cannot be compiled or is prone to
     *             catastrophic backtracking
     */
    public static PatternMatcher parse(PatternKind kind, String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidPatternException("empty pattern");
        }
        String text = expression.strip();
        if (text.length() > PatternSafety.MAX_PATTERN_LENGTH) {
            throw new InvalidPatternException(
                    "pattern longer than " + PatternSafety.MAX_PATTERN_LENGTH + " characters");
        }

        if (text.startsWith(REGEX_PREFIX)) {
            return regex(requireBody(text, REGEX_PREFIX));
        }
        if (text.startsWith(GLOB_PREFIX)) {
            return glob(requireBody(text, GLOB_PREFIX), kind.isFileKind());
        }
        if (text.startsWith(LITERAL_PREFIX)) {
            return new PatternMatcher.Literal(requireBody(text, LITERAL_PREFIX));
        }
        if (kind.isFileKind() && hasGlobSyntax(text)) {
            return glob(text, true);
        }
        return new PatternMatcher.Literal(text);
    }

    /**
     * Compile a case-insensitive regular expression after screening it with
     * {@link PatternSafety}.
     */
    public static PatternMatcher regex(String expression) {
        Optional<String> hazard = PatternSafety.findHazard(expression);
        if (hazard.isPresent()) {
            throw new InvalidPatternException("unsafe regex '" + expression + "': " + hazard.get());
        }
        try {
            return new PatternMatcher.Regex(Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("invalid regex '" + expression + "': " + e.getDescription(), e);
        }
    }

    /**
     * Compile a glob. For paths, {@code *} and {@code ?} stay within one
     * segment, {@code **} crosses segments, and the glob may match any suffix
     * of the path that starts at a segment boundary.
     */
    public static PatternMatcher glob(String glob, boolean pathAware) {
        String body = globToRegex(glob, pathAware);
        String expression = pathAware ? "(?:[^\\n]*/)?" + body : body;
        Optional<String> hazard = PatternSafety.findHazard(expression);
        if (hazard.isPresent()) {
            throw new InvalidPatternException("unsafe glob '" + glob + "': " + hazard.get());
        }
        try {
            return new PatternMatcher.Glob(glob, Pattern.compile(expression, Pattern.CASE_INSENSITIVE));
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException("invalid glob '" + glob + "': " + e.getDescription(), e);
        }
    }

    static String globToRegex(String glob, boolean pathAware) {
        String anyRun = pathAware ? "[^/]*" : "[^\\n]*";
        String anyChar = pathAware ? "[^/]" : ".";
        StringBuilder regex = new StringBuilder(glob.length() * 2);
        boolean inBraces = false;
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            switch (c) {
            case '*' -> {
                if (i + 1 < glob.length() && glob.charAt(i + 1) == '*') {
                    if (pathAware && i + 2 < glob.length() && glob.charAt(i + 2) == '/') {
                        regex.append("(?:[^\\n]*/)?");
                        i += 3;
                    } else {
                        regex.append("[^\\n]*");
                        i += 2;
                    }
                    continue;
                }
                regex.append(anyRun);
            }
            case '?' -> regex.append(anyChar);
            case '[' -> {
                int close = glob.indexOf(']', i + 2);
                if (close < 0) {
                    regex.append("\\[");
                } else {
                    String body = glob.substring(i + 1, close);
                    if (body.startsWith("!")) {
                        body = "^" + body.substring(1);
                    }
                    regex.append('[').append(body.replace("\\", "\\\\").replace("[", "\\[")).append(']');
                    i = close;
                }
            }
            case '{' -> {
                inBraces = true;
                regex.append("(?:");
            }
            case '}' -> {
                if (inBraces) {
                    regex.append(')');
                    inBraces = false;
                } else {
                    regex.append("\\}");
                }
            }
            case ',' -> regex.append(inBraces ? "|" : ",");
            case '\\' -> {
                if (i + 1 < glob.length()) {
                    i++;
                    appendLiteral(regex, glob.charAt(i));
                }
            }
            default -> appendLiteral(regex, c);
            }
            i++;
        }
        if (inBraces) {
            throw new InvalidPatternException("unclosed '{' in glob '" + glob + "'");
        }
        return regex.toString();
    }

    private static void appendLiteral(StringBuilder regex, char c) {
        if (c < 128 && !Character.isLetterOrDigit(c) && c != '/' && c != ' ' && c != '_') {
            regex.append('\\');
        }
        regex.append(c);
    }

    private static boolean hasGlobSyntax(String text) {
        return text.indexOf('*') >= 0 || text.indexOf('?') >= 0 || text.indexOf('[') >= 0;
    }

    private static String requireBody(String text, String prefix) {
        String body = text.substring(prefix.length()).strip();
        if (body.isEmpty()) {
            throw new InvalidPatternException("empty pattern after '" + prefix + "'");
        }
        return body;
    }
}
