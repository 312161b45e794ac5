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

/**
 * Stages of the command normalization pipeline, in execution order.
 */
public enum NormalizationStage {

    PERCENT_DECODE(true),
    HEX_DECODE(true),
    OCTAL_DECODE(true),
    QUOTE_STRIP(false),
    LINE_CONTINUATION(false),
    INVISIBLE_STRIP(true),
    HOMOGLYPH_FOLD(true);

    private final boolean encoding;

    NormalizationStage(boolean encoding) {
        this.encoding = encoding;
    }

    /**
     * True for stages that reverse a character encoding. Quote and
     * continuation stripping also fire on ordinary shell syntax, so they do not
     * count as an obfuscation signal by themselves.
     */
    public boolean isEncoding() {
        return encoding;
    }
}
