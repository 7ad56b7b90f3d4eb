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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregated outcome of one restore. Totals are derived from the per-type reports.
 */
public class RestoreResult {
    private boolean success;
    private String snapshotPath;
    private String safetyBackupPath;
    private final Map<String, RestoreReport> reports = new LinkedHashMap<>();
    private Map<String, Integer> repairedReferences = new LinkedHashMap<>();
    private long durationMillis;
    private String error;

    public RestoreReport reportFor(String entityType) {
        return reports.computeIfAbsent(entityType, RestoreReport::new);
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getSnapshotPath() {
        return snapshotPath;
    }

    public void setSnapshotPath(String snapshotPath) {
        this.snapshotPath = snapshotPath;
    }

    public String getSafetyBackupPath() {
        return safetyBackupPath;
    }

    public void setSafetyBackupPath(String safetyBackupPath) {
        this.safetyBackupPath = safetyBackupPath;
    }

    public Map<String, RestoreReport> getReports() {
        return reports;
    }

    public Map<String, Integer> getRepairedReferences() {
        return repairedReferences;
    }

    public void setRepairedReferences(Map<String, Integer> repairedReferences) {
        this.repairedReferences = repairedReferences;
    }

    public long getDurationMillis() {
        return durationMillis;
    }

    public void setDurationMillis(long durationMillis) {
        this.durationMillis = durationMillis;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }

    public int getTotalInserted() {
        return reports.values().stream().mapToInt(RestoreReport::getInserted).sum();
    }

    public int getTotalUpdated() {
        return reports.values().stream().mapToInt(RestoreReport::getUpdated).sum();
    }

    public int getTotalSkipped() {
        return reports.values().stream().mapToInt(RestoreReport::getSkipped).sum();
    }

    public int getTotalConflicts() {
        return reports.values().stream().mapToInt(r -> r.getConflicts().size()).sum();
    }
}
