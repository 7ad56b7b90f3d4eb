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

import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.support.RunIdIncrementer;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import se.devrandom.mimir.backup.BackupService;

import java.time.Clock;

/**
 * The job an external scheduler starts: take a snapshot, then apply retention.
 * Run with {@code retentionClass=daily|monthly|yearly|manual}.
 */
@Configuration
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class SnapshotJobConfiguration {

    private final BackupService backupService;
    private final Clock clock;

    public SnapshotJobConfiguration(BackupService backupService, Clock clock) {
        this.backupService = backupService;
        this.clock = clock;
    }

    @Bean
    public Job snapshotJob(JobRepository jobRepository,
                           JobCompletionNotificationListener listener,
                           Step snapshotStep,
                           Step retentionStep) {
        return new JobBuilder("snapshotJob", jobRepository)
                .incrementer(new RunIdIncrementer())
                .listener(listener)
                .start(snapshotStep)
                .next(retentionStep)
                .build();
    }

    // Tasklets manage their own connections, so steps run without a database transaction
    @Bean
    public Step snapshotStep(JobRepository jobRepository) {
        return new StepBuilder("snapshotStep", jobRepository)
                .tasklet(new SnapshotTasklet(backupService, clock), new ResourcelessTransactionManager())
                .build();
    }

    @Bean
    public Step retentionStep(JobRepository jobRepository) {
        return new StepBuilder("retentionStep", jobRepository)
                .tasklet(new RetentionTasklet(backupService), new ResourcelessTransactionManager())
                .build();
    }
}
