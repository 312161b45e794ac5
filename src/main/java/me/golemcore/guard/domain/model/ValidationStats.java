package me.golemcore.guard.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Point-in-time snapshot of validation statistics.
 *
 * <p>
 * Contains quantitative metrics only:
 * <ul>
 * <li>Commands validated, blocked and warned</li>
 * <li>Files validated and blocked</li>
 * <li>Commands in which an encoding obfuscation was detected</li>
 * <li>Average validation time over all samples</li>
 * </ul>
 *
 * <p>
 * Counters are read independently, so a snapshot taken while validations are
 * running may be slightly inconsistent across fields.
 *
 * @since 1.0
 */
@Value
@Builder
public class ValidationStats {

    long commandsValidated;
    long commandsBlocked;
    long commandsWarned;
    long filesValidated;
    long filesBlocked;
    long obfuscationDetected;
    long samples;
    double avgValidationTimeMs;

    public static ValidationStats empty() {
        return ValidationStats.builder().build();
    }
}
