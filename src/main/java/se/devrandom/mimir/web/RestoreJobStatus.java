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

import com.fasterxml.jackson.annotation.JsonInclude;
import se.devrandom.mimir.restore.RestoreResult;

import java.time.Instant;

/**
 * Progress of one asynchronous restore, polled through the restore-status endpoint.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RestoreJobStatus {

    public enum State {
        running, completed, failed
    }

    private final String jobId;
    private final String snapshot;
    private final Instant startedAt;
    private volatile State status = State.running;
    private volatile String message = "Starting smart merge restore...";
    private volatile int progress;
    private volatile String currentStep = "Initializing";
    private volatile Instant completedAt;
    private volatile String safetyBackup;
    private volatile String error;
    private volatile RestoreResult result;

    public RestoreJobStatus(String jobId, String snapshot, Instant startedAt) {
        this.jobId = jobId;
        this.snapshot = snapshot;
        this.startedAt = startedAt;
    }

    void progress(String step, int percent) {
        this.currentStep = step;
        this.message = step;
        this.progress = percent;
    }

    void complete(RestoreResult result, Instant now) {
        this.result = result;
        this.safetyBackup = result.getSafetyBackupPath();
        this.message = String.format("Restore completed! %d inserted, %d updated, %d skipped",
                result.getTotalInserted(), result.getTotalUpdated(), result.getTotalSkipped());
        this.currentStep = "Completed";
        this.progress = 100;
        this.completedAt = now;
        this.status = State.completed;
    }

    void fail(String error, RestoreResult partial, Instant now) {
        this.error = error;
        this.result = partial;
        this.safetyBackup = partial != null ? partial.getSafetyBackupPath() : null;
        this.message = "Restore failed: " + error;
        this.currentStep = "Failed";
        this.progress = 0;
        this.completedAt = now;
        this.status = State.failed;
    }

    public String getJobId() {
        return jobId;
    }

    public String getSnapshot() {
        return snapshot;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public State getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public int getProgress() {
        return progress;
    }

    public String getCurrentStep() {
        return currentStep;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public String getSafetyBackup() {
        return safetyBackup;
    }

    public String getError() {
        return error;
    }

    public RestoreResult getResult() {
        return result;
    }
}
