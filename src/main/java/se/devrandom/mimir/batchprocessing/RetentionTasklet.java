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
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.item.ExecutionContext;
import org.springframework.batch.repeat.RepeatStatus;
import se.devrandom.mimir.backup.BackupService;

import java.util.Map;

/**
 * Prunes old snapshots after a snapshot was taken in the same job run.
 */
public class RetentionTasklet implements Tasklet {
    private static final Logger log = LoggerFactory.getLogger(RetentionTasklet.class);

    private final BackupService backupService;

    public RetentionTasklet(BackupService backupService) {
        this.backupService = backupService;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) {
        ExecutionContext jobContext = chunkContext.getStepContext().getStepExecution()
                .getJobExecution().getExecutionContext();
        if (!jobContext.containsKey(SnapshotTasklet.SNAPSHOT_PATH_KEY)) {
            log.info("No snapshot taken in this run, skipping retention");
            return RepeatStatus.FINISHED;
        }

        Map<String, Integer> deleted = backupService.pruneRetention();
        int total = deleted.values().stream().mapToInt(Integer::intValue).sum();
        contribution.incrementWriteCount(total);
        log.info("Retention pass deleted {} snapshot folders {}", total, deleted);
        return RepeatStatus.FINISHED;
    }
}
