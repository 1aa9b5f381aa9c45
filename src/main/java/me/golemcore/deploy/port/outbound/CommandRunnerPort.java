package me.golemcore.deploy.port.outbound;

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

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Port for running local processes (build checks, dependency installs, git).
 */
public interface CommandRunnerPort {

    /**
     * Run a command and wait for it, killing it when {@code timeout} elapses.
     */
    CommandResult run(List<String> command, Path workDir, Duration timeout);

    record CommandResult(int exitCode, String output, long durationMs, boolean timedOut) {

        public boolean isSuccess() {
            return !timedOut && exitCode == 0;
        }
    }
}
