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
package se.devrandom.mimir.backup;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.config.BackupProperties;
import se.devrandom.mimir.storage.AssetCopyResult;
import se.devrandom.mimir.storage.AssetReplicator;
import se.devrandom.mimir.storage.S3Service;
import se.devrandom.mimir.storage.SnapshotStore;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Creates one complete snapshot: dump of every entity table, copy of the uploads tree,
 * manifest, and optionally an offsite copy.
 */
@Service
public class SnapshotService {
    private static final Logger log = LoggerFactory.getLogger(SnapshotService.class);

    private final EntityExporter exporter;
    private final SnapshotWriter writer;
    private final SnapshotStore snapshotStore;
    private final AssetReplicator assetReplicator;
    private final Optional<S3Service> s3Service;
    private final Path uploadsDir;
    private final Clock clock;

    public SnapshotService(EntityExporter exporter,
                           SnapshotWriter writer,
                           SnapshotStore snapshotStore,
                           AssetReplicator assetReplicator,
                           Optional<S3Service> s3Service,
                           BackupProperties properties,
                           Clock clock) {
        this.exporter = exporter;
        this.writer = writer;
        this.snapshotStore = snapshotStore;
        this.assetReplicator = assetReplicator;
        this.s3Service = s3Service;
        this.uploadsDir = Paths.get(properties.getUploadsDir()).toAbsolutePath().normalize();
        this.clock = clock;
    }

    public Path getUploadsDir() {
        return uploadsDir;
    }

    /**
     * @return the folder of the completed snapshot
     * @throws SnapshotException if the dump or manifest could not be written
     */
    public Path createSnapshot(RetentionClass retentionClass) {
        long start = System.currentTimeMillis();
        String name = retentionClass.folderName(clock);
        log.info("Creating {} snapshot {}", retentionClass.value(), name);

        Path folder = snapshotStore.prepareFolder(retentionClass, name);
        Map<String, List<Map<String, Object>>> data = exporter.exportAll();

        AssetCopyResult assets = assetReplicator.copy(uploadsDir, folder.resolve(SnapshotStore.FILES_DIR),
                AssetReplicator.CopyMode.OVERWRITE);
        if (assets.failed() > 0) {
            log.warn("{} asset files could not be copied into snapshot {}", assets.failed(), name);
        }

        SnapshotManifest manifest = writer.write(folder, retentionClass, data);

        s3Service.ifPresent(s3 -> {
            try {
                s3.uploadSnapshot(folder, retentionClass.directory());
            } catch (Exception e) {
                log.warn("Offsite copy of snapshot {} failed: {}", folder, e.getMessage());
            }
        });

        int total = manifest.getRecordCounts().values().stream().mapToInt(Integer::intValue).sum();
        log.info("Snapshot {} complete: {} records, {} files, {} ms", folder, total, assets.copied(),
                System.currentTimeMillis() - start);
        return folder;
    }
}
