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

import java.util.Set;

/**
 * Output of {@link CommandNormalizer#normalize(String)}.
 *
 * @param value
 *            canonical command text
 * @param transformations
 *            stages that changed the text at least once
 * @param unresolved
 *            true when decoding hit its pass bound, so the value may still
 *            hide an encoded payload
 */
public record NormalizedCommand(String value, Set<NormalizationStage> transformations, boolean unresolved) {

    public NormalizedCommand {
        transformations = Set.copyOf(transformations);
    }

    /**
     * True when an encoding stage fired or decoding did not resolve.
     */
    public boolean isObfuscated() {
        return unresolved || transformations.stream().anyMatch(NormalizationStage::isEncoding);
    }
}
