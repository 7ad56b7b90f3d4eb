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
package se.devrandom.mimir.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import se.devrandom.mimir.backup.BackupService;
import se.devrandom.mimir.backup.BackupSettings;
import se.devrandom.mimir.backup.RetentionClass;
import se.devrandom.mimir.backup.SnapshotException;
import se.devrandom.mimir.backup.SnapshotInfo;
import se.devrandom.mimir.storage.SnapshotStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/backup")
public class BackupController {
    private static final Logger log = LoggerFactory.getLogger(BackupController.class);

    private static final int HISTORY_SIZE = 50;

    private final BackupService backupService;
    private final RestoreJobRunner restoreJobRunner;

    public BackupController(BackupService backupService, RestoreJobRunner restoreJobRunner) {
        this.backupService = backupService;
        this.restoreJobRunner = restoreJobRunner;
    }

    @GetMapping("/health")
    public String health() {
        return "OK";
    }

    @GetMapping("/list")
    public Map<String, Object> list() {
        return Map.of("backups", backupService.listSnapshots());
    }

    @PostMapping("/create")
    public ResponseEntity<?> create() {
        try {
            Path folder = backupService.createSnapshot(RetentionClass.MANUAL);
            return ResponseEntity.ok(Map.of(
                    "success", true,
                    "message", "Backup created successfully",
                    "backupPath", folder.toString()));
        } catch (SnapshotException e) {
            log.error("Manual backup failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Backup failed: " + e.getMessage()));
        }
    }

    @GetMapping("/settings")
    public Map<String, Object> getSettings() {
        return Map.of("settings", backupService.getSettings());
    }

    @PutMapping("/settings")
    public ResponseEntity<?> updateSettings(@RequestBody BackupSettings request) {
        if (request.getRetentionDays() < 0 || request.getRetentionMonths() < 0 || request.getRetentionYears() < 0) {
            return ResponseEntity.badRequest().body(Map.of("error", "Retention counts must not be negative"));
        }
        BackupSettings current = backupService.getSettings();
        BackupSettings settings = BackupSettings.defaults();
        settings.setEnabled(request.isEnabled());
        if (request.getDailyTime() != null && !request.getDailyTime().isBlank()) {
            settings.setDailyTime(request.getDailyTime());
        }
        if (request.getRetentionDays() > 0) {
            settings.setRetentionDays(request.getRetentionDays());
        }
        if (request.getRetentionMonths() > 0) {
            settings.setRetentionMonths(request.getRetentionMonths());
        }
        if (request.getRetentionYears() > 0) {
            settings.setRetentionYears(request.getRetentionYears());
        }
        settings.setLastBackup(current.getLastBackup());
        settings.setLastBackupType(current.getLastBackupType());

        BackupSettings saved = backupService.saveSettings(settings);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Backup settings updated successfully",
                "settings", saved));
    }

    @DeleteMapping("/{type}/{name}")
    public ResponseEntity<?> delete(@PathVariable("type") String type, @PathVariable("name") String name) {
        Path folder;
        try {
            folder = backupService.resolveSnapshot(type, name);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!Files.isDirectory(folder)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Backup not found"));
        }
        if (!backupService.deleteSnapshot(folder)) {
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("error", "Backup could not be deleted"));
        }
        return ResponseEntity.ok(Map.of(
                "success", true,
                "message", "Backup deleted successfully"));
    }

    @PostMapping("/restore/{type}/{name}")
    public ResponseEntity<?> restore(@PathVariable("type") String type, @PathVariable("name") String name) {
        Path folder;
        try {
            folder = backupService.resolveSnapshot(type, name);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
        if (!Files.isRegularFile(folder.resolve(SnapshotStore.DUMP_FILE))) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Backup not found"));
        }

        String jobId = restoreJobRunner.submit(folder);
        return ResponseEntity.ok(Map.of(
                "success", true,
                "jobId", jobId,
                "message", "Restore started. Use /api/backup/restore-status/" + jobId + " to check progress."));
    }

    @GetMapping("/restore-status/{jobId}")
    public ResponseEntity<?> restoreStatus(@PathVariable("jobId") String jobId) {
        return restoreJobRunner.getStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", "Job not found")));
    }

    @GetMapping("/history")
    public Map<String, Object> history() {
        List<SnapshotInfo> snapshots = backupService.listSnapshots();
        List<Map<String, Object>> history = snapshots.stream()
                .limit(HISTORY_SIZE)
                .map(BackupController::historyEntry)
                .toList();
        return Map.of("history", history);
    }

    private static Map<String, Object> historyEntry(SnapshotInfo snapshot) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", snapshot.type());
        entry.put("name", snapshot.name());
        entry.put("timestamp", snapshot.manifest().getTimestamp());
        entry.put("size", snapshot.manifest().getSize());
        entry.put("recordCounts", snapshot.manifest().getRecordCounts());
        return entry;
    }
}
