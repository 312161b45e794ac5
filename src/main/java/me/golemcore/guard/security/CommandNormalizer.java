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

import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayOutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic decode pipeline that turns a possibly obfuscated command into
 * its canonical form.
 *
 * <p>
 * Stages run in a fixed order, each seeing the output of the previous one:
 * <ol>
 * <li>Percent decoding ({@code %XX}), repeated until no escape is left or the
 * pass bound is reached</li>
 * <li>Hex escapes ({@code \xNN})</li>
 * <li>Octal escapes ({@code \NNN}, ASCII range only)</li>
 * <li>Quote stripping ({@code r'm'} becomes {@code rm})</li>
 * <li>Line continuations, trailing backslash and backslash before a letter or
 * dash</li>
 * <li>Zero-width and BiDi control removal</li>
 * <li>Cyrillic homoglyph folding</li>
 * </ol>
 *
 * <p>
 * The whole pipeline is re-run until it reaches a fixed point, so a converged
 * result satisfies {@code normalize(normalize(x)).value() == normalize(x).value()}.
 * Rounds and percent passes are both bounded by {@code maxDecodePasses}; when
 * either bound is hit the result is flagged {@link NormalizedCommand#unresolved()}
 * instead of looping further. Case is preserved and whitespace is not collapsed.
 *
 * <p>
 * Stateless and thread-safe.
 *
 * @since 1.0
 */
@Slf4j
public class CommandNormalizer {

    public static final int DEFAULT_MAX_DECODE_PASSES = 5;

    private static final Pattern PERCENT_ESCAPE = Pattern.compile("%[0-9A-Fa-f]{2}");
    private static final Pattern HEX_ESCAPE = Pattern.compile("\\\\x([0-9A-Fa-f]{2})");
    private static final Pattern OCTAL_ESCAPE = Pattern.compile("\\\\([0-7]{3})");
    private static final Pattern QUOTED_TOKEN = Pattern.compile("(['\"])([a-zA-Z0-9_\\-./]+)\\1");
    private static final Pattern QUOTED_CHAR = Pattern.compile("(['\"])(.)\\1");
    private static final Pattern EMPTY_QUOTES = Pattern.compile("''|\"\"");
    private static final Pattern LINE_CONTINUATION = Pattern.compile("\\\\\\r?\\n");
    private static final Pattern ESCAPED_LETTER = Pattern.compile("\\\\([a-zA-Z-])");
    private static final Pattern TRAILING_BACKSLASH = Pattern.compile("\\\\$");
    private static final Pattern INVISIBLE = Pattern.compile(
            "[\\u200B-\\u200F\\uFEFF\\u2060\\u00AD\\u061C\\u180E\\u202A-\\u202E\\u2066-\\u2069]");

    private static final int MAX_ASCII = 0x7F;

    private static final Map<Character, Character> HOMOGLYPHS = Map.ofEntries(
            Map.entry('а', 'a'), Map.entry('е', 'e'), Map.entry('о', 'o'),
            Map.entry('р', 'p'), Map.entry('с', 'c'), Map.entry('х', 'x'),
            Map.entry('у', 'y'), Map.entry('і', 'i'), Map.entry('ј', 'j'),
            Map.entry('ѕ', 's'), Map.entry('һ', 'h'), Map.entry('ԁ', 'd'),
            Map.entry('ԛ', 'q'), Map.entry('А', 'A'), Map.entry('Е', 'E'),
            Map.entry('О', 'O'), Map.entry('Р', 'P'), Map.entry('С', 'C'),
            Map.entry('Х', 'X'));

    private final int maxDecodePasses;

    public CommandNormalizer() {
        this(DEFAULT_MAX_DECODE_PASSES);
    }

    public CommandNormalizer(int maxDecodePasses) {
        if (maxDecodePasses < 1) {
            throw new IllegalArgumentException("maxDecodePasses must be positive: " + maxDecodePasses);
        }
        this.maxDecodePasses = maxDecodePasses;
    }

    public int getMaxDecodePasses() {
        return maxDecodePasses;
    }

    /**
     * Normalize a raw command.
     */
    public NormalizedCommand normalize(String raw) {
        Objects.requireNonNull(raw, "raw");
        Set<NormalizationStage> applied = EnumSet.noneOf(NormalizationStage.class);

        String current = raw;
        boolean converged = false;
        boolean percentExhausted = false;
        int rounds = 0;
        // one extra round confirms the fixed point after the last change
        while (rounds <= maxDecodePasses) {
            rounds++;
            RoundResult round = runRound(current, applied);
            boolean changed = !round.value().equals(current);
            current = round.value();
            if (round.percentExhausted()) {
                percentExhausted = true;
                break;
            }
            if (!changed) {
                converged = true;
                break;
            }
        }

        boolean unresolved = !converged;
        if (unresolved) {
            log.debug("[Security] Decoding unresolved after {} round(s) (percent bound hit: {})",
                    rounds, percentExhausted);
        } else {
            log.trace("[Security] Normalized in {} round(s), stages={}", rounds, applied);
        }
        return new NormalizedCommand(current, applied, unresolved);
    }

    private RoundResult runRound(String input, Set<NormalizationStage> applied) {
        PercentResult percent = percentDecode(input, maxDecodePasses);
        String value = track(input, percent.value(), NormalizationStage.PERCENT_DECODE, applied);
        value = track(value, decodeHexEscapes(value), NormalizationStage.HEX_DECODE, applied);
        value = track(value, decodeOctalEscapes(value), NormalizationStage.OCTAL_DECODE, applied);
        value = track(value, stripQuotes(value), NormalizationStage.QUOTE_STRIP, applied);
        value = track(value, stripLineContinuations(value), NormalizationStage.LINE_CONTINUATION, applied);
        value = track(value, stripInvisible(value), NormalizationStage.INVISIBLE_STRIP, applied);
        value = track(value, foldHomoglyphs(value), NormalizationStage.HOMOGLYPH_FOLD, applied);
        return new RoundResult(value, percent.exhausted());
    }

    private static String track(String before, String after, NormalizationStage stage,
            Set<NormalizationStage> applied) {
        if (!after.equals(before)) {
            applied.add(stage);
        }
        return after;
    }

    // ==================== STAGES ====================

    static PercentResult percentDecode(String input, int maxPasses) {
        String current = input;
        int passes = 0;
        while (passes < maxPasses && PERCENT_ESCAPE.matcher(current).find()) {
            current = percentDecodeOnce(current);
            passes++;
        }
        return new PercentResult(current, PERCENT_ESCAPE.matcher(current).find());
    }

    static String percentDecodeOnce(String input) {
        StringBuilder out = new StringBuilder(input.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < input.length()) {
            char c = input.charAt(i);
            if (c == '%' && i + 2 < input.length() && isHex(input.charAt(i + 1)) && isHex(input.charAt(i + 2))) {
                pending.write(Integer.parseInt(input.substring(i + 1, i + 3), 16));
                i += 3;
                continue;
            }
            flushBytes(pending, out);
            out.append(c);
            i++;
        }
        flushBytes(pending, out);
        return out.toString();
    }

    /**
     * Decode a run of percent-escaped bytes as UTF-8, or byte-per-char when the
     * run is not valid UTF-8.
     */
    private static void flushBytes(ByteArrayOutputStream pending, StringBuilder out) {
        if (pending.size() == 0) {
            return;
        }
        byte[] bytes = pending.toByteArray();
        pending.reset();
        try {
            out.append(StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes)));
        } catch (CharacterCodingException e) {
            out.append(new String(bytes, StandardCharsets.ISO_8859_1));
        }
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0 && c < 128;
    }

    static String decodeHexEscapes(String input) {
        if (input.indexOf('\\') < 0) {
            return input;
        }
        return HEX_ESCAPE.matcher(input).replaceAll(match -> Matcher.quoteReplacement(
                String.valueOf((char) Integer.parseInt(match.group(1), 16))));
    }

    static String decodeOctalEscapes(String input) {
        if (input.indexOf('\\') < 0) {
            return input;
        }
        return OCTAL_ESCAPE.matcher(input).replaceAll(match -> {
            int code = Integer.parseInt(match.group(1), 8);
            String replacement = code <= MAX_ASCII ? String.valueOf((char) code) : match.group();
            return Matcher.quoteReplacement(replacement);
        });
    }

    static String stripQuotes(String input) {
        if (input.indexOf('\'') < 0 && input.indexOf('"') < 0) {
            return input;
        }
        String result = QUOTED_TOKEN.matcher(input).replaceAll("$2");
        result = QUOTED_CHAR.matcher(result).replaceAll("$2");
        return EMPTY_QUOTES.matcher(result).replaceAll("");
    }

    static String stripLineContinuations(String input) {
        if (input.indexOf('\\') < 0) {
            return input;
        }
        String result = LINE_CONTINUATION.matcher(input).replaceAll("");
        result = ESCAPED_LETTER.matcher(result).replaceAll("$1");
        return TRAILING_BACKSLASH.matcher(result).replaceAll("");
    }

    static String stripInvisible(String input) {
        return INVISIBLE.matcher(input).replaceAll("");
    }

    static String foldHomoglyphs(String input) {
        StringBuilder out = null;
        for (int i = 0; i < input.length(); i++) {
            Character ascii = HOMOGLYPHS.get(input.charAt(i));
            if (ascii != null) {
                if (out == null) {
                    out = new StringBuilder(input);
                }
                out.setCharAt(i, ascii);
            }
        }
        return out == null ? input : out.toString();
    }

    record PercentResult(String value, boolean exhausted) {
    }

    private record RoundResult(String value, boolean percentExhausted) {
    }
}
