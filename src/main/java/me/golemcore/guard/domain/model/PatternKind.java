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

/**
 * The registry a pattern belongs to. Command kinds are matched against the
 * normalized command, file kinds against the file name or the full path.
 */
public enum PatternKind {

    COMMAND_DENY("command-deny", false),
    COMMAND_WARN("command-warn", false),
    /** Overrides that may relax a warn-class match, never a deny-class one. */
    COMMAND_ALLOW("command-allow", false),
    FILE_BLOCKED("file-blocked", true),
    PATH_BLOCKED("path-blocked", true);

    private final String label;
    private final boolean fileKind;

    PatternKind(String label, boolean fileKind) {
        this.label = label;
        this.fileKind = fileKind;
    }

    public String getLabel() {
        return label;
    }

    public boolean isFileKind() {
        return fileKind;
    }
}
