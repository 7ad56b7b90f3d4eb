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
package se.devrandom.mimir.batchprocessing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.StepExecution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;
import se.devrandom.mimir.backup.BackupService;
import se.devrandom.mimir.backup.BackupSettings;
import se.devrandom.mimir.backup.RetentionClass;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Takes one snapshot of the class given by the {@code retentionClass} job parameter.
 * Scheduled snapshots are skipped while backups are disabled; manual ones always run.
 */
public class SnapshotTasklet implements Tasklet {
    private static final Logger log = LoggerFactory.getLogger(SnapshotTasklet.class);

    public static final String RETENTION_CLASS_PARAMETER = "retentionClass";
    public static final String SNAPSHOT_PATH_KEY = "snapshotPath";

    private final BackupService backupService;
    private final Clock clock;

    public SnapshotTasklet(BackupService backupService, Clock clock) {
        this.backupService = backupService;
        this.clock = clock;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        StepExecution stepExecution = chunkContext.getStepContext().getStepExecution();
        String requested = stepExecution.getJobParameters()
                .getString(RETENTION_CLASS_PARAMETER, RetentionClass.DAILY.value());
        RetentionClass retentionClass = RetentionClass.fromValue(requested);

        BackupSettings settings = backupService.getSettings();
        if (!settings.isEnabled() && retentionClass != RetentionClass.MANUAL) {
            log.info("Backups are disabled, skipping {} snapshot", retentionClass.value());
            return RepeatStatus.FINISHED;
        }

        Path folder = backupService.createSnapshot(retentionClass);
        backupService.recordLastBackup(retentionClass, Instant.now(clock).toString());

        stepExecution.getJobExecution().getExecutionContext().putString(SNAPSHOT_PATH_KEY, folder.toString());
        contribution.incrementWriteCount(1);
        log.info("{} snapshot written to {}", retentionClass.value(), folder);
        return RepeatStatus.FINISHED;
    }
}
