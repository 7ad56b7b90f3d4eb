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
package se.devrandom.mimir.restore;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.backup.RetentionClass;
import se.devrandom.mimir.backup.SnapshotService;
import se.devrandom.mimir.schema.CrmSchema;
import se.devrandom.mimir.schema.EntityDescriptor;
import se.devrandom.mimir.storage.AssetCopyResult;
import se.devrandom.mimir.storage.AssetReplicator;
import se.devrandom.mimir.storage.EntityStore;
import se.devrandom.mimir.storage.SnapshotStore;
import se.devrandom.mimir.util.Timestamps;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Non-destructive restore of a snapshot into the live CRM database.
 *
 * <p>Missing records are inserted, existing timestamped records are updated only when the
 * snapshot copy is strictly newer, and nothing is ever deleted. Entity types are merged in
 * registry (dependency) order, one record at a time on an autocommit connection, so a failing
 * record only affects itself.</p>
 */
@Service
public class MergeRestoreEngine {
    private static final Logger log = LoggerFactory.getLogger(MergeRestoreEngine.class);

    static final String REASON_CURRENT_NEWER = "Current data is newer";
    static final String REASON_NO_TIMESTAMP = "No timestamp available for comparison";
    static final String REASON_UNKNOWN_TYPE = "Unknown entity type";

    private final DataSource dataSource;
    private final CrmSchema schema;
    private final EntityStore entityStore;
    private final SnapshotStore snapshotStore;
    private final SnapshotService snapshotService;
    private final ReferenceRepairPass referenceRepairPass;
    private final AssetReplicator assetReplicator;

    public MergeRestoreEngine(DataSource dataSource,
                              CrmSchema schema,
                              EntityStore entityStore,
                              SnapshotStore snapshotStore,
                              SnapshotService snapshotService,
                              ReferenceRepairPass referenceRepairPass,
                              AssetReplicator assetReplicator) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.entityStore = entityStore;
        this.snapshotStore = snapshotStore;
        this.snapshotService = snapshotService;
        this.referenceRepairPass = referenceRepairPass;
        this.assetReplicator = assetReplicator;
    }

    public RestoreResult restore(Path snapshotPath) {
        return restore(snapshotPath, RestoreProgressListener.NONE);
    }

    /**
     * Merge the snapshot at {@code snapshotPath} into the live database.
     *
     * @throws RestoreException if the safety snapshot, the load or any other top-level step
     *                          fails; the partial result is attached
     */
    public RestoreResult restore(Path snapshotPath, RestoreProgressListener listener) {
        RestoreProgressListener progress = listener != null ? listener : RestoreProgressListener.NONE;
        long start = System.currentTimeMillis();
        RestoreResult result = new RestoreResult();
        result.setSnapshotPath(snapshotPath.toString());
        log.info("Starting merge restore from {}", snapshotPath);

        try {
            progress.onProgress("Creating safety backup", 10);
            result.setSafetyBackupPath(createSafetyBackup(result).toString());

            progress.onProgress("Loading backup data", 20);
            Map<String, List<Map<String, Object>>> dump = snapshotStore.loadDump(snapshotPath);

            progress.onProgress("Performing smart merge", 30);
            try (Connection conn = dataSource.getConnection()) {
                conn.setAutoCommit(true);
                merge(conn, dump, result, progress);

                progress.onProgress("Repairing references", 85);
                result.setRepairedReferences(referenceRepairPass.repair(conn, dump));
            }

            progress.onProgress("Restoring files", 90);
            restoreFiles(snapshotPath);

            result.setSuccess(true);
            result.setDurationMillis(System.currentTimeMillis() - start);
            progress.onProgress("Restore completed", 100);
            log.info("Restore from {} completed in {} ms: {} inserted, {} updated, {} skipped, {} conflicts",
                    snapshotPath, result.getDurationMillis(), result.getTotalInserted(),
                    result.getTotalUpdated(), result.getTotalSkipped(), result.getTotalConflicts());
            return result;
        } catch (RestoreException e) {
            fail(result, start, e.getMessage());
            throw e;
        } catch (Exception e) {
            fail(result, start, e.getMessage());
            log.error("Restore from {} failed", snapshotPath, e);
            throw new RestoreException("Restore failed: " + e.getMessage(), result, e);
        }
    }

    private Path createSafetyBackup(RestoreResult result) {
        try {
            Path safety = snapshotService.createSnapshot(RetentionClass.MANUAL);
            log.info("Safety backup created at {}", safety);
            return safety;
        } catch (RuntimeException e) {
            log.error("Safety backup failed, refusing to restore", e);
            throw new RestoreException("Safety backup failed, refusing to restore without a safety snapshot: "
                    + e.getMessage(), result, e);
        }
    }

    private void fail(RestoreResult result, long start, String message) {
        result.setSuccess(false);
        result.setError(message);
        result.setDurationMillis(System.currentTimeMillis() - start);
    }

    private void merge(Connection conn, Map<String, List<Map<String, Object>>> dump, RestoreResult result,
                       RestoreProgressListener progress) {
        for (String type : dump.keySet()) {
            if (schema.find(type).isEmpty()) {
                List<Map<String, Object>> records = dump.get(type);
                int count = records != null ? records.size() : 0;
                log.warn("Skipping {} records of unknown entity type {}", count, type);
                RestoreReport report = result.reportFor(type);
                for (int i = 0; i < count; i++) {
                    report.recordSkipped();
                }
                report.addConflict(RestoreConflict.of(null, REASON_UNKNOWN_TYPE + ": " + type));
            }
        }

        List<EntityDescriptor> entities = schema.entities();
        int processed = 0;
        for (EntityDescriptor descriptor : entities) {
            processed++;
            List<Map<String, Object>> records = dump.get(descriptor.getName());
            if (records == null) {
                continue;
            }
            progress.onProgress("Merging " + descriptor.getName(), 30 + (processed * 50) / entities.size());
            log.info("Merging {} ({} records)", descriptor.getName(), records.size());

            RestoreReport report = result.reportFor(descriptor.getName());
            if (descriptor.isSelfReferential()) {
                mergeSelfReferential(conn, descriptor, records, report);
            } else {
                for (Map<String, Object> record : records) {
                    mergeRecord(conn, descriptor, record, report);
                }
            }
            log.info("{}", report);
        }
    }

    /**
     * General per-record merge: insert when missing, newer-wins update when timestamped,
     * otherwise leave the live row alone.
     */
    void mergeRecord(Connection conn, EntityDescriptor descriptor, Map<String, Object> record, RestoreReport report) {
        String id = EntityDescriptor.idOf(record);
        if (id == null) {
            report.addConflict(RestoreConflict.of(null, "Error: record has no id"));
            return;
        }
        try {
            Map<String, Object> live = entityStore.findById(conn, descriptor, id);
            if (live == null) {
                insert(conn, descriptor, record, descriptor.getForwardReferences(), report);
                return;
            }
            if (!descriptor.isTimestamped()) {
                report.recordSkipped();
                log.debug("Skipped {} {} (exists, no timestamp)", descriptor.getName(), id);
                return;
            }

            String field = descriptor.getTimestampField();
            Instant backupTime = Timestamps.parse(record.get(field));
            Instant currentTime = Timestamps.parse(live.get(field));
            if (backupTime == null || currentTime == null) {
                report.recordSkipped();
                report.addConflict(RestoreConflict.of(id, REASON_NO_TIMESTAMP));
                return;
            }

            int comparison = backupTime.compareTo(currentTime);
            if (comparison > 0) {
                update(conn, descriptor, record, id, report);
            } else {
                report.recordSkipped();
                if (comparison < 0) {
                    report.addConflict(new RestoreConflict(id, REASON_CURRENT_NEWER,
                            backupTime.toString(), currentTime.toString()));
                }
            }
        } catch (SQLException | RuntimeException e) {
            log.error("Error restoring {} record {}: {}", descriptor.getName(), id, e.getMessage());
            report.addConflict(RestoreConflict.of(id, "Error: " + e.getMessage()));
        }
    }

    /**
     * Two passes for entity types that reference their own rows. Pass 1 fills gaps with the
     * self-reference removed and never updates; pass 2 restores the self-reference wherever
     * the target now exists and the live value is still null.
     */
    private void mergeSelfReferential(Connection conn, EntityDescriptor descriptor,
                                      List<Map<String, Object>> records, RestoreReport report) {
        String selfField = descriptor.getSelfReferenceField();
        Set<String> nulled = new HashSet<>(descriptor.getForwardReferences());
        nulled.add(selfField);

        for (Map<String, Object> record : records) {
            String id = EntityDescriptor.idOf(record);
            if (id == null) {
                report.addConflict(RestoreConflict.of(null, "Error: record has no id"));
                continue;
            }
            try {
                if (entityStore.exists(conn, descriptor, id)) {
                    report.recordSkipped();
                } else {
                    insert(conn, descriptor, record, nulled, report);
                }
            } catch (SQLException | RuntimeException e) {
                log.error("Error restoring {} record {}: {}", descriptor.getName(), id, e.getMessage());
                report.addConflict(RestoreConflict.of(id, "Error: " + e.getMessage()));
            }
        }

        int linked = 0;
        for (Map<String, Object> record : records) {
            String id = EntityDescriptor.idOf(record);
            if (id == null) {
                continue;
            }
            Object target = record.get(selfField);
            if (target == null) {
                continue;
            }
            try {
                if (entityStore.exists(conn, descriptor, String.valueOf(target))
                        && entityStore.backfill(conn, descriptor, id, selfField, target)) {
                    linked++;
                }
            } catch (SQLException | RuntimeException e) {
                log.warn("Could not restore {} of {} {}: {}", selfField, descriptor.getName(), id, e.getMessage());
            }
        }
        log.info("{}: {} {} links restored", descriptor.getName(), linked, selfField);
    }

    private void insert(Connection conn, EntityDescriptor descriptor, Map<String, Object> record,
                        Set<String> nulledFields, RestoreReport report) {
        String id = EntityDescriptor.idOf(record);
        try {
            entityStore.insert(conn, descriptor, record, nulledFields);
            report.recordInserted();
            log.debug("Inserted {} record {}", descriptor.getName(), id);
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to insert {} record {}: {}", descriptor.getName(), id, e.getMessage());
            report.addConflict(RestoreConflict.of(id, "Insert failed: " + e.getMessage()));
        }
    }

    private void update(Connection conn, EntityDescriptor descriptor, Map<String, Object> record, String id,
                        RestoreReport report) {
        try {
            if (entityStore.update(conn, descriptor, record) > 0) {
                report.recordUpdated();
                log.debug("Updated {} record {}", descriptor.getName(), id);
            } else {
                report.recordSkipped();
                report.addConflict(RestoreConflict.of(id, "Update failed: row no longer exists"));
            }
        } catch (SQLException | RuntimeException e) {
            log.error("Failed to update {} record {}: {}", descriptor.getName(), id, e.getMessage());
            report.recordSkipped();
            report.addConflict(RestoreConflict.of(id, "Update failed: " + e.getMessage()));
        }
    }

    private void restoreFiles(Path snapshotPath) {
        Path files = snapshotPath.resolve(SnapshotStore.FILES_DIR);
        if (!Files.isDirectory(files)) {
            log.info("Snapshot {} has no files to restore", snapshotPath);
            return;
        }
        AssetCopyResult copied = assetReplicator.copy(files, snapshotService.getUploadsDir(),
                AssetReplicator.CopyMode.IF_NEWER);
        if (copied.failed() > 0) {
            log.warn("{} files could not be restored", copied.failed());
        }
    }
}
