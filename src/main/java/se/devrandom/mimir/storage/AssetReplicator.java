/*
 * Mimir - CRM Backup and Restore
 * Copyright (C) 2025 Johan Karlsteen
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <https://www.gnu.org/licenses/>.
 */
package se.devrandom.mimir.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;

/**
 * Mirrors the uploaded-file tree between the live uploads directory and a snapshot.
 */
@Component
public class AssetReplicator {
    private static final Logger log = LoggerFactory.getLogger(AssetReplicator.class);

    public enum CopyMode {
        /** Always replace the destination file. Used when taking a snapshot. */
        OVERWRITE,
        /** Copy only when the destination is missing or older. Used when restoring. */
        IF_NEWER
    }

    /**
     * Recursively copy {@code source} into {@code destination}, keeping modification times.
     * Per-file failures are logged and counted, never thrown.
     */
    public AssetCopyResult copy(Path source, Path destination, CopyMode mode) {
        if (!Files.isDirectory(source)) {
            log.info("No asset directory at {}, nothing to copy", source);
            return AssetCopyResult.empty();
        }

        Counter counter = new Counter();
        try {
            Files.walkFileTree(source, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    Path target = destination.resolve(source.relativize(dir).toString());
                    try {
                        Files.createDirectories(target);
                        return FileVisitResult.CONTINUE;
                    } catch (IOException e) {
                        log.warn("Could not create directory {}: {}", target, e.getMessage());
                        counter.failed++;
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    Path target = destination.resolve(source.relativize(file).toString());
                    try {
                        if (mode == CopyMode.IF_NEWER && !isNewer(attrs.lastModifiedTime(), target)) {
                            counter.skipped++;
                            return FileVisitResult.CONTINUE;
                        }
                        Files.copy(file, target, StandardCopyOption.REPLACE_EXISTING,
                                StandardCopyOption.COPY_ATTRIBUTES);
                        counter.copied++;
                        counter.bytes += attrs.size();
                    } catch (IOException e) {
                        log.warn("Failed to copy {} to {}: {}", file, target, e.getMessage());
                        counter.failed++;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException e) {
                    log.warn("Could not read {}: {}", file, e.getMessage());
                    counter.failed++;
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            log.warn("Asset copy from {} stopped early: {}", source, e.getMessage());
            counter.failed++;
        }

        AssetCopyResult result = new AssetCopyResult(counter.copied, counter.skipped, counter.failed, counter.bytes);
        log.info("Copied assets {} -> {} ({}): {} copied, {} skipped, {} failed, {} bytes",
                source, destination, mode, result.copied(), result.skipped(), result.failed(), result.bytes());
        return result;
    }

    private static boolean isNewer(FileTime sourceTime, Path target) throws IOException {
        if (!Files.exists(target)) {
            return true;
        }
        return sourceTime.compareTo(Files.getLastModifiedTime(target)) > 0;
    }

    private static final class Counter {
        int copied;
        int skipped;
        int failed;
        long bytes;
    }
}
