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
import se.devrandom.mimir.restore.MergeRestoreEngine;
import se.devrandom.mimir.restore.RestoreProgressListener;
import se.devrandom.mimir.restore.RestoreResult;
import se.devrandom.mimir.storage.RetentionManager;
import se.devrandom.mimir.storage.SnapshotStore;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Entry point for the scheduler job and the admin API.
 */
@Service
public class BackupService {
    private static final Logger log = LoggerFactory.getLogger(BackupService.class);

    private final SnapshotService snapshotService;
    private final MergeRestoreEngine restoreEngine;
    private final SnapshotStore snapshotStore;
    private final RetentionManager retentionManager;
    private final BackupSettingsProvider settingsProvider;

    public BackupService(SnapshotService snapshotService,
                         MergeRestoreEngine restoreEngine,
                         SnapshotStore snapshotStore,
                         RetentionManager retentionManager,
                         BackupSettingsProvider settingsProvider) {
        this.snapshotService = snapshotService;
        this.restoreEngine = restoreEngine;
        this.snapshotStore = snapshotStore;
        this.retentionManager = retentionManager;
        this.settingsProvider = settingsProvider;
    }

    public Path createSnapshot(RetentionClass retentionClass) {
        return snapshotService.createSnapshot(retentionClass);
    }

    public RestoreResult restoreSnapshot(Path snapshotPath, RestoreProgressListener listener) {
        return restoreEngine.restore(snapshotPath, listener);
    }

    public List<SnapshotInfo> listSnapshots() {
        return snapshotStore.listSnapshots();
    }

    public boolean deleteSnapshot(Path snapshotPath) {
        return snapshotStore.delete(snapshotPath);
    }

    public Path resolveSnapshot(String type, String name) {
        return snapshotStore.resolve(type, name);
    }

    /**
     * Apply the configured retention to every class. Yearly snapshots are kept forever
     * when the yearly count is zero or less.
     *
     * @return folders deleted per class directory
     */
    public Map<String, Integer> pruneRetention() {
        BackupSettings settings = settingsProvider.load();
        Map<String, Integer> deleted = new LinkedHashMap<>();
        deleted.put(RetentionClass.DAILY.directory(),
                retentionManager.prune(RetentionClass.DAILY, Math.max(0, settings.getRetentionDays())));
        deleted.put(RetentionClass.MONTHLY.directory(),
                retentionManager.prune(RetentionClass.MONTHLY, Math.max(0, settings.getRetentionMonths())));
        if (settings.getRetentionYears() > 0) {
            deleted.put(RetentionClass.YEARLY.directory(),
                    retentionManager.prune(RetentionClass.YEARLY, settings.getRetentionYears()));
        } else {
            log.info("Yearly retention disabled, keeping all yearly snapshots");
        }
        return deleted;
    }

    public BackupSettings getSettings() {
        return settingsProvider.load();
    }

    public BackupSettings saveSettings(BackupSettings settings) {
        return settingsProvider.save(settings);
    }

    public void recordLastBackup(RetentionClass retentionClass, String timestamp) {
        settingsProvider.recordLastBackup(retentionClass, timestamp);
    }
}
