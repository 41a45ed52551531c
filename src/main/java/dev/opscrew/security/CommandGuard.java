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

package dev.opscrew.security;

import dev.opscrew.infrastructure.config.CrewProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Deny-list checks for side-effecting tools.
 *
 * <p>
 * A shell command is rejected when it contains:
 * <ul>
 * <li>one of the configured forbidden substrings
 * ({@code crew.tools.shell.forbidden-patterns})</li>
 * <li>a blocked system command (shutdown, mkfs, fork bomb...)</li>
 * <li>a blocked pattern or command-injection signature</li>
 * </ul>
 *
 * <p>
 * Stateless after construction and thread-safe.
 */
@Component
@Slf4j
public class CommandGuard {

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*",
            "mkfs", "dd if=/dev",
            ":(){ :|:& };:", // Fork bomb
            "shutdown", "reboot", "halt", "poweroff",
            "passwd", "useradd", "userdel", "usermod",
            "chmod 777 /", "chown -r",
            "sudo", "su -",
            "nc -l", "ncat -l");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("rm\\s+(-[rf]+\\s+)?/(?!tmp)"),
            Pattern.compile("curl.*\\|.*sh"),
            Pattern.compile("wget.*\\|.*sh"),
            Pattern.compile("eval\\s*\\$"),
            Pattern.compile("base64\\s*-d.*\\|.*(sh|bash)"),
            Pattern.compile("/etc/passwd"),
            Pattern.compile("/etc/shadow"));

    private static final List<Pattern> COMMAND_INJECTION_PATTERNS = List.of(
            Pattern.compile(";\\s*(rm|del|format|dd|mkfs)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\|\\s*(sh|bash|cmd|powershell)", Pattern.CASE_INSENSITIVE),
            Pattern.compile("`[^`]+`"),
            Pattern.compile("\\$\\([^)]+\\)"),
            Pattern.compile("\\$\\{[^}]+\\}"));

    private static final List<Pattern> PATH_TRAVERSAL_PATTERNS = List.of(
            Pattern.compile("\\.\\./"),
            Pattern.compile("\\.\\.\\\\"),
            Pattern.compile("%2e%2e%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e/", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\.\\.%2f", Pattern.CASE_INSENSITIVE),
            Pattern.compile("%2e%2e%5c", Pattern.CASE_INSENSITIVE),
            Pattern.compile("/etc/passwd", Pattern.CASE_INSENSITIVE));

    private final List<String> forbiddenSubstrings;

    @Autowired
    public CommandGuard(CrewProperties properties) {
        this(properties.getTools().getShell().getForbiddenPatterns());
    }

    public CommandGuard(List<String> forbiddenSubstrings) {
        this.forbiddenSubstrings = forbiddenSubstrings != null
                ? forbiddenSubstrings.stream().filter(s -> s != null && !s.isEmpty()).toList()
                : List.of();
    }

    /**
     * Returns the first deny-list entry the command matches, if any.
     */
    public Optional<String> findForbidden(String command) {
        if (command == null || command.isBlank()) {
            return Optional.empty();
        }

        for (String forbidden : forbiddenSubstrings) {
            if (command.contains(forbidden)) {
                return reject(command, forbidden);
            }
        }

        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                return reject(command, blocked);
            }
        }

        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return reject(command, pattern.pattern());
            }
        }

        for (Pattern pattern : COMMAND_INJECTION_PATTERNS) {
            if (pattern.matcher(command).find()) {
                return reject(command, pattern.pattern());
            }
        }
        return Optional.empty();
    }

    /**
     * Detect path traversal attempts.
     */
    public boolean detectPathTraversal(String input) {
        if (input == null || input.isBlank()) {
            return false;
        }

        for (Pattern pattern : PATH_TRAVERSAL_PATTERNS) {
            if (pattern.matcher(input).find()) {
                log.warn("[Security] Path traversal detected: pattern={}", pattern.pattern());
                return true;
            }
        }
        return false;
    }

    private Optional<String> reject(String command, String matched) {
        log.warn("[Security] Blocked command: '{}' (matched '{}')", command, matched);
        return Optional.of(matched);
    }
}
