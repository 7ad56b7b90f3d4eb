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

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.backup.BackupService;
import se.devrandom.mimir.restore.RestoreException;
import se.devrandom.mimir.restore.RestoreResult;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs restores in the background, one at a time, and keeps their status for polling.
 */
@Component
public class RestoreJobRunner {
    private static final Logger log = LoggerFactory.getLogger(RestoreJobRunner.class);

    private final BackupService backupService;
    private final Clock clock;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread thread = new Thread(r, "mimir-restore");
        thread.setDaemon(true);
        return thread;
    });
    private final Map<String, RestoreJobStatus> jobs = new ConcurrentHashMap<>();
    private final AtomicLong counter = new AtomicLong();

    public RestoreJobRunner(BackupService backupService, Clock clock) {
        this.backupService = backupService;
        this.clock = clock;
    }

    /**
     * Queue a restore of {@code snapshotPath}.
     *
     * @return the job id to poll
     */
    public String submit(Path snapshotPath) {
        String jobId = "restore_" + clock.millis() + "_" + counter.incrementAndGet();
        RestoreJobStatus status = new RestoreJobStatus(jobId, snapshotPath.toString(), Instant.now(clock));
        jobs.put(jobId, status);
        log.info("Queued restore job {} for {}", jobId, snapshotPath);

        executor.submit(() -> run(status, snapshotPath));
        return jobId;
    }

    private void run(RestoreJobStatus status, Path snapshotPath) {
        try {
            RestoreResult result = backupService.restoreSnapshot(snapshotPath, status::progress);
            status.complete(result, Instant.now(clock));
            log.info("Restore job {} completed", status.getJobId());
        } catch (RestoreException e) {
            log.error("Restore job {} failed: {}", status.getJobId(), e.getMessage());
            status.fail(e.getMessage(), e.getResult(), Instant.now(clock));
        } catch (RuntimeException e) {
            log.error("Restore job {} failed", status.getJobId(), e);
            status.fail(e.getMessage(), null, Instant.now(clock));
        }
    }

    public Optional<RestoreJobStatus> getStatus(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Restore still running at shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
