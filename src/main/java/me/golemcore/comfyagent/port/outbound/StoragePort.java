package me.golemcore.comfyagent.port.outbound;

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
 * Port for persistent storage within the local workspace. Files are organized by
 * directory ({@code sessions}, {@code experiences}).
 */
public interface StoragePort {

    /**
     * Write text content to file.
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, or {@code null} when it does not exist.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Delete a file.
     */
    CompletableFuture<Void> deleteObject(String directory, String path);

    /**
     * List files by prefix, relative to the directory.
     */
    CompletableFuture<List<String>> listObjects(String directory, String prefix);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * Content is written to a {@code .tmp} sibling, synced, optionally backed up
     * as {@code .bak}, and then renamed over the target, so readers never see a
     * partially written file.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
