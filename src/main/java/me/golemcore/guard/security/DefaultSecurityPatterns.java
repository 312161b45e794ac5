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

import java.util.List;

import static me.golemcore.guard.domain.model.PatternKind.COMMAND_DENY;
import static me.golemcore.guard.domain.model.PatternKind.COMMAND_WARN;
import static me.golemcore.guard.domain.model.PatternKind.FILE_BLOCKED;
import static me.golemcore.guard.domain.model.PatternKind.PATH_BLOCKED;

/**
 * Built-in security patterns, the single definition every registry is derived
 * from.
 *
 * <p>
 * Command patterns run against the normalized command, file patterns against
 * the last path segment, path patterns against the whole normalized path
 * ({@code /} separators). Every expression is compiled case-insensitive and
 * uses bounded repetition wherever the span is attacker-controlled.
 *
 * @since 1.0
 */
public final class DefaultSecurityPatterns {

    // End of a shell word, including the closing quote or paren of a wrapper such as bash -c '...'
    private static final String TARGET_END = "(?=$|[\\s;&|'\"`)])";

    private static final String RM_OPTION = "(?:-{1,2}[a-z-]{0,32}\\s{1,8}){0,8}";

    private static final List<PatternDefinition> DEFINITIONS = List.of(
            // Destructive deletes of /, ~ or everything in the current directory
            deny("destructive-delete", "\\brm\\s{1,8}" + RM_OPTION
                    + "(?:-[a-z]{0,16}r[a-z]{0,16}|--recursive)\\s{1,8}" + RM_OPTION
                    + "(?:/\\*?|~/?|\\*)" + TARGET_END),

            // Filesystem destruction
            deny("filesystem-destruction", "\\bmkfs(?:\\.[a-z0-9]{1,16})?\\b"),
            deny("filesystem-destruction", "\\bdd\\s[^;&|\\n]{0,512}\\bif=/dev/(?:zero|random|urandom)\\b"),
            deny("filesystem-destruction",
                    "\\bdd\\s[^;&|\\n]{0,512}\\bof=/dev/(?:sd[a-z]|hd[a-z]|nvme|disk|mmcblk)"),
            deny("filesystem-destruction", ">\\s{0,8}/dev/(?:sd[a-z]|hd[a-z]|nvme|disk|mmcblk)"),

            // Fork bombs
            deny("fork-bomb", ":\\(\\)\\s{0,8}\\{\\s{0,8}:\\s{0,8}\\|\\s{0,8}:\\s{0,8}&\\s{0,8}\\}\\s{0,8};?\\s{0,8}:"),
            deny("fork-bomb", "\\.\\s{0,8}\\|\\s{0,8}\\."),
            deny("fork-bomb", "\\bwhile\\s{0,8}\\(\\s{0,8}true\\s{0,8}\\)[^\\n]{0,256}\\bfork\\b"),

            // Remote code execution
            deny("remote-code-execution",
                    "\\b(?:curl|wget)\\s[^|]{0,2048}\\|\\s{0,8}(?:sudo\\s{1,8})?(?:ba|z|da)?sh\\b"),
            deny("remote-code-execution",
                    "\\b(?:curl|wget)\\s[^|]{0,2048}\\|\\s{0,8}(?:sudo\\s{1,8})?python[0-9.]{0,4}\\b"),
            deny("remote-code-execution", "\\bcurl\\s[^>]{0,2048}>\\s{0,8}[^&]{0,512}\\.sh\\s{0,8}&&"),
            deny("remote-code-execution",
                    "\\bbase64\\s{1,8}(?:-d|--decode)\\b[^|]{0,1024}\\|\\s{0,8}(?:ba|z)?sh\\b"),

            // Privilege escalation
            deny("privilege-escalation", "\\bsudo\\s{1,8}su\\b\\s{0,8}(?:-|" + TARGET_END + ")"),
            deny("privilege-escalation", "\\bsudo\\s{1,8}-i" + TARGET_END),
            deny("privilege-escalation", "\\bsudo\\s{1,8}passwd\\s{1,8}root\\b"),

            // Dangerous permission changes
            deny("dangerous-permissions", "\\bchmod\\s{1,8}(?:-[a-z]{1,16}\\s{1,8}){0,4}777\\s{1,8}~?/"),
            deny("dangerous-permissions", "\\bchmod\\s{1,8}(?:-[a-z]{1,16}\\s{1,8}){0,4}(?:u\\+s|\\b4[0-7]{3}\\b)"),
            deny("dangerous-permissions", "\\bchown\\s{1,8}(?:-[a-z]{1,16}\\s{1,8}){0,4}root[:\\s]"),

            // System file overwrite
            deny("system-file-write", ">\\s{0,8}/etc/(?:passwd|shadow|sudoers)\\b"),

            // Firewall
            deny("firewall-tampering", "\\biptables\\s{1,8}-F\\b"),
            deny("firewall-tampering", "\\bufw\\s{1,8}disable\\b"),

            // Covering tracks
            deny("history-tampering", "\\bhistory\\s{1,8}-c\\b"),
            deny("history-tampering", ">\\s{0,8}~/\\.(?:bash|zsh)_history\\b"),
            deny("history-tampering", "\\bexport\\s{1,8}HISTSIZE=0\\b"),
            deny("history-tampering", "\\bunset\\s{1,8}HISTFILE\\b"),

            // Kernel and pseudo-filesystems
            deny("kernel-manipulation", "\\binsmod\\b"),
            deny("kernel-manipulation", "\\bmodprobe\\s"),
            deny("kernel-manipulation", "\\becho\\s[^>]{0,2048}>\\s{0,8}/proc/"),
            deny("kernel-manipulation", "\\becho\\s[^>]{0,2048}>\\s{0,8}/sys/"),

            // Power control, only in command position
            deny("power-control", "(?:^|[;&|]\\s{0,8}|\\bsudo\\s{1,8})(?:shutdown|reboot|halt|poweroff)\\b"),

            // Reverse shells
            deny("reverse-shell", "/dev/(?:tcp|udp)/"),
            deny("reverse-shell", "\\b(?:nc|ncat|netcat)\\s[^;&|\\n]{0,256}\\s-[a-z]{0,8}e\\s{0,8}/bin/(?:ba|z)?sh\\b"),

            // ==================== WARN ====================

            warn("elevated-privileges", "\\bsudo\\b"),
            warn("elevated-privileges", "\\bsu(?:\\s{1,8}-)?\\s{0,8}$"),
            warn("elevated-privileges", "\\bdoas\\b"),

            warn("permission-change", "\\bchmod\\b"),
            warn("permission-change", "\\bchown\\b"),
            warn("permission-change", "\\bchgrp\\b"),

            warn("git-destructive", "\\bgit\\s{1,8}push\\b[^;&|\\n]{0,512}\\s--force\\b"),
            warn("git-destructive", "\\bgit\\s{1,8}push\\b[^;&|\\n]{0,512}\\s-f\\b"),
            warn("git-destructive", "\\bgit\\s{1,8}reset\\s{1,8}--hard\\b"),
            warn("git-destructive", "\\bgit\\s{1,8}clean\\s{1,8}-[a-z]{0,8}f"),
            warn("git-destructive", "\\bgit\\s{1,8}checkout\\s{1,8}--\\s{1,8}\\."),

            warn("package-publish", "\\bnpm\\s{1,8}publish\\b"),
            warn("package-publish", "\\byarn\\s{1,8}publish\\b"),
            warn("package-publish", "\\bpip\\s[^;&|\\n]{0,256}\\bupload\\b"),
            warn("package-publish", "\\btwine\\s{1,8}upload\\b"),
            warn("package-publish", "\\bcargo\\s{1,8}publish\\b"),

            warn("container-destructive", "\\bdocker\\s{1,8}rm\\s{1,8}-f\\b"),
            warn("container-destructive", "\\bdocker\\s{1,8}system\\s{1,8}prune\\b"),
            warn("container-destructive", "\\bkubectl\\s{1,8}delete\\b"),

            warn("database-destructive", "\\bdrop\\s{1,8}(?:database|table|schema)\\b"),
            warn("database-destructive", "\\btruncate\\s{1,8}table\\b"),
            warn("database-destructive", "\\bdelete\\s{1,8}from\\s{1,8}\\w{1,128}\\s{0,8}(?:$|;|where\\s{1,8}1\\b)"),

            warn("service-control", "\\bsystemctl\\s{1,8}(?:stop|disable|mask)\\b"),
            warn("service-control", "\\bservice\\s{1,8}\\S{1,128}\\s{1,8}stop\\b"),

            warn("environment-change", "\\bexport\\s{1,8}PATH="),
            warn("environment-change", "\\.(?:bashrc|zshrc|profile)\\b"),

            // ==================== FILE NAMES ====================

            file("env-file", "\\.env(?:$|\\.)"),
            file("secret-file", "secrets?\\."),
            file("secret-file", "credentials?\\."),
            file("secret-file", "\\.secret$"),
            file("secret-file", "\\.password"),
            file("secret-file", "master\\.key$"),

            file("crypto-key", "\\.pem$"),
            file("crypto-key", "\\.key$"),
            file("crypto-key", "\\.p12$"),
            file("crypto-key", "\\.pfx$"),
            file("crypto-key", "\\.crt$"),

            file("ssh-key", "id_rsa"),
            file("ssh-key", "id_dsa"),
            file("ssh-key", "id_ecdsa"),
            file("ssh-key", "id_ed25519"),
            file("ssh-key", "authorized_keys"),
            file("ssh-key", "known_hosts"),

            file("package-credentials", "^\\.npmrc$"),
            file("package-credentials", "^\\.pypirc$"),

            file("cloud-credentials", "kubeconfig"),

            file("database-credentials", "^\\.pgpass$"),
            file("database-credentials", "^\\.my\\.cnf$"),
            file("database-credentials", "^\\.netrc$"),

            // ==================== PATHS ====================

            path("ssh-directory", "(?:^|/)\\.ssh(?:/|$)"),
            path("ssh-directory", "^/etc/ssh/"),

            path("cloud-credentials", "(?:^|/)\\.aws(?:/|$)"),
            path("cloud-credentials", "(?:^|/)\\.kube(?:/|$)"),
            path("cloud-credentials", "(?:^|/)\\.gcloud(?:/|$)"),
            path("cloud-credentials", "(?:^|/)\\.azure(?:/|$)"),
            path("cloud-credentials", "gcloud/[^\\n]{0,256}credentials"),

            path("package-credentials", "(?:^|/)\\.gem/credentials$"),
            path("package-credentials", "(?:^|/)\\.docker/config\\.json$"),

            path("system-identity", "^/etc/passwd$"),
            path("system-identity", "^/etc/shadow$"),
            path("system-identity", "^/etc/sudoers"),

            path("gpg-directory", "(?:^|/)\\.gnupg(?:/|$)"),

            path("browser-data", "(?:^|/)\\.?mozilla/firefox/[^\\n]{0,256}logins"),
            path("browser-data", "(?:^|/)\\.?config/google-chrome/[^\\n]{0,256}login"));

    private DefaultSecurityPatterns() {
    }

    public static List<PatternDefinition> definitions() {
        return DEFINITIONS;
    }

    public static List<PatternDefinition> definitions(PatternKind kind) {
        return DEFINITIONS.stream().filter(definition -> definition.kind() == kind).toList();
    }

    private static PatternDefinition deny(String category, String regex) {
        return PatternDefinition.builtIn(COMMAND_DENY, category, regex);
    }

    private static PatternDefinition warn(String category, String regex) {
        return PatternDefinition.builtIn(COMMAND_WARN, category, regex);
    }

    private static PatternDefinition file(String category, String regex) {
        return PatternDefinition.builtIn(FILE_BLOCKED, category, regex);
    }

    private static PatternDefinition path(String category, String regex) {
        return PatternDefinition.builtIn(PATH_BLOCKED, category, regex);
    }
}
