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

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Static screening of regular expressions for catastrophic backtracking.
 *
 * <p>
 * Rejects a group that contains an unbounded quantifier ({@code *}, {@code +},
 * {@code {n,}}) and is itself repeated by an unbounded quantifier, e.g.
 * {@code (a+)+}, {@code (\w*)*} or {@code (x|y+){2,}}. Bounded outer
 * repetition such as {@code (-\w+\s+){0,8}} is accepted. Escapes, quoted
 * sections and character classes are skipped, so quantifier characters inside
 * them are not counted.
 */
public final class PatternSafety {

    public static final int MAX_PATTERN_LENGTH = 1024;

    private PatternSafety() {
    }

    /**
     * Describe the first backtracking hazard found in {@code regex}, if any.
     */
    public static Optional<String> findHazard(String regex) {
        if (regex.length() > MAX_PATTERN_LENGTH) {
            return Optional.of("pattern longer than " + MAX_PATTERN_LENGTH + " characters");
        }

        // one flag per open group: does its body contain an unbounded quantifier
        Deque<boolean[]> groups = new ArrayDeque<>();
        boolean closedGroupUnbounded = false;
        boolean afterGroup = false;
        int length = regex.length();
        int i = 0;

        while (i < length) {
            char c = regex.charAt(i);

            if (c == '\\') {
                i = skipEscape(regex, i);
                afterGroup = false;
                continue;
            }
            if (c == '[') {
                i = skipCharClass(regex, i);
                afterGroup = false;
                continue;
            }
            if (c == '(') {
                groups.push(new boolean[1]);
                i = skipGroupPrefix(regex, i + 1);
                afterGroup = false;
                continue;
            }
            if (c == ')') {
                boolean inner = !groups.isEmpty() && groups.pop()[0];
                if (inner && !groups.isEmpty()) {
                    groups.peek()[0] = true;
                }
                closedGroupUnbounded = inner;
                afterGroup = true;
                i++;
                continue;
            }

            int quantifierEnd = quantifierEnd(regex, i);
            if (quantifierEnd > i) {
                boolean unbounded = isUnbounded(regex, i, quantifierEnd);
                if (unbounded && afterGroup && closedGroupUnbounded) {
                    return Optional.of("nested unbounded quantifier at index " + i);
                }
                if (unbounded && !groups.isEmpty()) {
                    groups.peek()[0] = true;
                }
                i = quantifierEnd;
                if (i < length && (regex.charAt(i) == '?' || regex.charAt(i) == '+')) {
                    i++; // lazy or possessive suffix
                }
                afterGroup = false;
                continue;
            }

            afterGroup = false;
            i++;
        }
        return Optional.empty();
    }

    private static int skipEscape(String regex, int index) {
        if (index + 1 < regex.length() && regex.charAt(index + 1) == 'Q') {
            int end = regex.indexOf("\\E", index + 2);
            return end < 0 ? regex.length() : end + 2;
        }
        return Math.min(index + 2, regex.length());
    }

    private static int skipCharClass(String regex, int index) {
        int depth = 0;
        int i = index;
        while (i < regex.length()) {
            char c = regex.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '[') {
                depth++;
            } else if (c == ']' && i > index + 1) {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
            i++;
        }
        return regex.length();
    }

    /**
     * Skip {@code ?:}, {@code ?=}, {@code ?<name>}, inline flags and friends so
     * the {@code ?} is not read as a quantifier.
     */
    private static int skipGroupPrefix(String regex, int index) {
        if (index >= regex.length() || regex.charAt(index) != '?') {
            return index;
        }
        int i = index + 1;
        if (i >= regex.length()) {
            return i;
        }
        char c = regex.charAt(i);
        if (c == '<') {
            if (i + 1 < regex.length() && (regex.charAt(i + 1) == '=' || regex.charAt(i + 1) == '!')) {
                return i + 2;
            }
            int close = regex.indexOf('>', i);
            return close < 0 ? regex.length() : close + 1;
        }
        if (c == ':' || c == '=' || c == '!' || c == '>') {
            return i + 1;
        }
        while (i < regex.length() && (Character.isLetter(regex.charAt(i)) || regex.charAt(i) == '-')) {
            i++;
        }
        if (i < regex.length() && regex.charAt(i) == ':') {
            i++;
        }
        return i;
    }

    private static int quantifierEnd(String regex, int index) {
        char c = regex.charAt(index);
        if (c == '*' || c == '+' || c == '?') {
            return index + 1;
        }
        if (c != '{') {
            return index;
        }
        int i = index + 1;
        int digitsStart = i;
        while (i < regex.length() && Character.isDigit(regex.charAt(i))) {
            i++;
        }
        if (i == digitsStart || i >= regex.length()) {
            return index;
        }
        if (regex.charAt(i) == ',') {
            i++;
            while (i < regex.length() && Character.isDigit(regex.charAt(i))) {
                i++;
            }
        }
        if (i < regex.length() && regex.charAt(i) == '}') {
            return i + 1;
        }
        return index;
    }

    private static boolean isUnbounded(String regex, int start, int end) {
        char c = regex.charAt(start);
        if (c == '*' || c == '+') {
            return true;
        }
        if (c == '?') {
            return false;
        }
        // {n,} is unbounded, {n} and {n,m} are not
        return regex.charAt(end - 2) == ',';
    }
}
