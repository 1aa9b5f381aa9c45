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

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the local workspace. Provides
 * text file operations organized by directory (deployments, credentials, audit,
 * escalations) with support for append-only (JSONL) and atomic writes.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     *
     * @param directory
     *            subdirectory (e.g., "deployments", "audit")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, or {@code null} when absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    CompletableFuture<Boolean> exists(String directory, String path);

    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Append text to a file (for logs, JSONL).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Atomically write text content to file: temp file with fsync, then rename.
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content);

    CompletableFuture<Void> ensureDirectory(String directory);
}
