package me.golemcore.comfyagent.adapter.outbound.storage;

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

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.comfyagent.infrastructure.config.AgentProperties;
import me.golemcore.comfyagent.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/**
 * Local filesystem implementation of StoragePort.
 *
 * <p>
 * Everything lives under one workspace directory:
 * <ul>
 * <li>sessions/ - one JSON document per conversation session
 * <li>experiences/ - synthesized Gherkin feature files
 * </ul>
 *
 * <p>
 * Base path configured via {@code agent.storage.base-path}, defaults to
 * {@code ${user.home}/.comfy-agent/workspace}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LocalStorageAdapter implements StoragePort {

    private final AgentProperties properties;

    private Path basePath;

    @PostConstruct
    public void init() {
        AgentProperties.StorageProperties storage = properties.getStorage();
        this.basePath = Paths.get(storage.getBasePath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();

        try {
            Files.createDirectories(basePath);
            for (String dir : List.of(storage.getSessionsDirectory(), storage.getExperiencesDirectory())) {
                Files.createDirectories(basePath.resolve(dir));
            }
            log.info("[Storage] Local storage initialized at: {}", basePath);
        } catch (IOException e) {
            log.error("[Storage] Failed to create storage directory {}", basePath, e);
        }
    }

    @Override
    public CompletableFuture<Void> putText(String directory, String path, String content) {
        return CompletableFuture.runAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                createParent(filePath);
                Files.writeString(filePath, content, StandardCharsets.UTF_8,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to write file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<String> getText(String directory, String path) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                Path filePath = resolvePath(directory, path);
                if (!Files.exists(filePath)) {
                    return null;
                }
                return Files.readString(filePath, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> deleteObject(String directory, String path) {
        return CompletableFuture.runAsync(() -> {
            try {
                Files.deleteIfExists(resolvePath(directory, path));
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to delete file: " + directory + "/" + path, e);
            }
        });
    }

    @Override
    public CompletableFuture<List<String>> listObjects(String directory, String prefix) {
        return CompletableFuture.supplyAsync(() -> {
            Path dirPath = resolveDirectory(directory);
            if (!Files.exists(dirPath)) {
                return Collections.emptyList();
            }

            Path prefixPath = prefix != null && !prefix.isEmpty() ? dirPath.resolve(prefix) : dirPath;
            if (!Files.exists(prefixPath)) {
                return Collections.emptyList();
            }

            try (Stream<Path> paths = Files.walk(prefixPath)) {
                return paths
                        .filter(Files::isRegularFile)
                        .map(p -> dirPath.relativize(p).toString())
                        .sorted()
                        .toList();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to list files: " + directory + "/" + prefix, e);
            }
        });
    }

    @Override
    public CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup) {
        return CompletableFuture.runAsync(() -> {
            Path targetPath = resolvePath(directory, path);
            Path tempPath = targetPath.resolveSibling(targetPath.getFileName() + ".tmp");
            Path backupPath = targetPath.resolveSibling(targetPath.getFileName() + ".bak");

            try {
                createParent(targetPath);

                byte[] bytes = content.getBytes(StandardCharsets.UTF_8);
                try (OutputStream os = Files.newOutputStream(tempPath,
                        StandardOpenOption.CREATE,
                        StandardOpenOption.TRUNCATE_EXISTING,
                        StandardOpenOption.SYNC);
                        FileChannel channel = FileChannel.open(tempPath, StandardOpenOption.WRITE)) {
                    os.write(bytes);
                    os.flush();
                    channel.force(true);
                }

                if (Files.size(tempPath) != bytes.length) {
                    throw new IOException("Verification failed: size mismatch");
                }

                if (backup && Files.exists(targetPath)) {
                    Files.copy(targetPath, backupPath, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("[Storage] Created backup: {}", backupPath);
                }

                try {
                    Files.move(tempPath, targetPath,
                            StandardCopyOption.REPLACE_EXISTING,
                            StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    log.warn("[Storage] Atomic move not supported, using regular move");
                    Files.move(tempPath, targetPath, StandardCopyOption.REPLACE_EXISTING);
                }

                log.debug("[Storage] Atomic write completed: {}/{}", directory, path);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(tempPath);
                } catch (IOException cleanupEx) {
                    log.warn("[Storage] Failed to cleanup temp file: {}", tempPath);
                }
                throw new UncheckedIOException("Atomic write failed: " + directory + "/" + path, e);
            }
        });
    }

    private static void createParent(Path filePath) throws IOException {
        Path parent = filePath.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private Path resolveDirectory(String directory) {
        Path resolved = basePath.resolve(directory).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory);
        }
        return resolved;
    }

    private Path resolvePath(String directory, String path) {
        Path resolved = basePath.resolve(directory).resolve(path).normalize();
        if (!resolved.startsWith(basePath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + directory + "/" + path);
        }
        return resolved;
    }
}
