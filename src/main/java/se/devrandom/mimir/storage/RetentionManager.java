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
import org.springframework.util.FileSystemUtils;
import se.devrandom.mimir.backup.RetentionClass;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Keeps the N most recent snapshot folders of a retention class.
 */
@Component
public class RetentionManager {
    private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

    private final SnapshotStore snapshotStore;

    public RetentionManager(SnapshotStore snapshotStore) {
        this.snapshotStore = snapshotStore;
    }

    /**
     * Delete every folder of the class directory beyond the {@code keepCount} most recently
     * modified ones. Manifests are not consulted, so incomplete folders age out as well.
     *
     * @return number of folders deleted
     */
    public int prune(RetentionClass retentionClass, int keepCount) {
        if (keepCount < 0) {
            throw new IllegalArgumentException("keepCount must not be negative: " + keepCount);
        }
        Path classDir = snapshotStore.classDirectory(retentionClass);
        if (!Files.isDirectory(classDir)) {
            return 0;
        }

        List<Path> folders;
        try (Stream<Path> stream = Files.list(classDir)) {
            folders = stream.filter(Files::isDirectory)
                    .sorted(Comparator.comparing(RetentionManager::modifiedTime).reversed())
                    .collect(Collectors.toCollection(ArrayList::new));
        } catch (IOException e) {
            log.error("Could not list {} for retention: {}", classDir, e.getMessage());
            return 0;
        }

        int deleted = 0;
        for (Path folder : folders.subList(Math.min(keepCount, folders.size()), folders.size())) {
            try {
                if (FileSystemUtils.deleteRecursively(folder)) {
                    deleted++;
                    log.info("Retention: deleted {} snapshot {}", retentionClass.directory(), folder.getFileName());
                }
            } catch (IOException e) {
                log.warn("Retention: failed to delete {}: {}", folder, e.getMessage());
            }
        }
        if (deleted > 0) {
            log.info("Retention for {}: kept {}, deleted {}", retentionClass.directory(),
                    Math.min(keepCount, folders.size()), deleted);
        }
        return deleted;
    }

    private static FileTime modifiedTime(Path folder) {
        try {
            return Files.getLastModifiedTime(folder);
        } catch (IOException e) {
            log.warn("Could not read modification time of {}: {}", folder, e.getMessage());
            return FileTime.fromMillis(0);
        }
    }
}
