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

import org.junit.jupiter.api.Test;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.StepExecution;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;

class JobCompletionNotificationListenerTest {

    @Test
    void summaryListsSnapshotStepsAndFailures() {
        StepExecution snapshotStep = SnapshotTaskletTest.stepExecution("monthly");
        JobExecution jobExecution = snapshotStep.getJobExecution();
        snapshotStep.setStatus(BatchStatus.FAILED);
        jobExecution.setStatus(BatchStatus.FAILED);
        jobExecution.setStartTime(LocalDateTime.of(2024, 3, 1, 4, 0, 0));
        jobExecution.setEndTime(LocalDateTime.of(2024, 3, 1, 4, 0, 2));
        jobExecution.addFailureException(new IllegalStateException("disk full"));

        String summary = JobCompletionNotificationListener.summary(jobExecution);

        assertThat(summary).contains("Status: FAILED")
                .contains("Retention class: monthly")
                .contains("Snapshot: -")
                .contains("snapshotStep")
                .contains("Duration: 2000 ms")
                .contains("Failure: disk full");
    }
}
