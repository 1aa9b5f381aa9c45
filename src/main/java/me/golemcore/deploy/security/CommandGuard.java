package me.golemcore.deploy.security;

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
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rejects build and install commands that could damage the host or pipe
 * remote content into a shell.
 */
@Component
@Slf4j
public class CommandGuard {

    private static final Set<String> BLOCKED_COMMANDS = Set.of(
            "rm -rf /", "rm -rf /*",
            "mkfs", "dd if=/dev",
            ":(){ :|:& };:",
            "shutdown", "reboot", "halt", "poweroff",
            "passwd", "useradd", "userdel", "usermod",
            "chmod 777 /", "chown -r",
            "sudo", "su -",
            "nc -l", "ncat -l",
            "> /dev/sda");

    private static final List<Pattern> BLOCKED_PATTERNS = List.of(
            Pattern.compile("rm\\s+(-[rf]+\\s+)?/(?!tmp)"),
            Pattern.compile(">(\\s*)/dev/"),
            Pattern.compile("\\|\\s*(bash|sh|zsh)\\b"),
            Pattern.compile("curl.*\\|.*sh"),
            Pattern.compile("wget.*\\|.*sh"),
            Pattern.compile("eval\\s*\\$"),
            Pattern.compile("base64\\s*-d.*\\|.*(sh|bash)"),
            Pattern.compile("/etc/passwd"),
            Pattern.compile("/etc/shadow"),
            Pattern.compile("[;&`]|\\$\\("));

    /**
     * @return the reason the command is blocked, or null when it may run
     */
    public String check(String command) {
        if (command == null || command.isBlank()) {
            return "Command is empty";
        }
        String normalized = command.toLowerCase(Locale.ROOT).trim();
        for (String blocked : BLOCKED_COMMANDS) {
            if (normalized.contains(blocked)) {
                log.warn("[Security] Blocked command attempt: {}", command);
                return "Command blocked for security reasons";
            }
        }
        for (Pattern pattern : BLOCKED_PATTERNS) {
            if (pattern.matcher(command).find()) {
                log.warn("[Security] Blocked pattern in command: {}", command);
                return "Command blocked for security reasons";
            }
        }
        return null;
    }
}
