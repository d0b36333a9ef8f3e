package me.golemcore.presence.port.outbound;

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
 * Port for file storage within the local workspace. Files are organized by
 * directory ({@code presence}, {@code sleep}) and written append-only as JSON
 * Lines.
 */
public interface StoragePort {

    /**
     * Append text to a file, creating it if needed.
     *
     * @param directory
     *            subdirectory (e.g., "presence", "sleep")
     * @param path
     *            relative path within directory
     * @param content
     *            text to append, including its trailing newline
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Read text content from file, or null if it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);
}
