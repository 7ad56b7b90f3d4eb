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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.devrandom.mimir.backup.BackupService;
import se.devrandom.mimir.restore.RestoreException;
import se.devrandom.mimir.restore.RestoreProgressListener;
import se.devrandom.mimir.restore.RestoreResult;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RestoreJobRunnerTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-01T10:00:00Z"), ZoneOffset.UTC);
    private final Path snapshot = Path.of("/backups/daily/2024-02-29");

    @Mock
    private BackupService backupService;

    private RestoreJobRunner runner;

    @BeforeEach
    void setUp() {
        runner = new RestoreJobRunner(backupService, clock);
    }

    @AfterEach
    void tearDown() {
        runner.shutdown();
    }

    @Test
    void completedJobCarriesResultAndTotals() {
        RestoreResult result = new RestoreResult();
        result.setSuccess(true);
        result.setSafetyBackupPath("/backups/daily/manual-2024-03-01T10-00-00Z");
        result.reportFor("leads").recordInserted();
        result.reportFor("leads").recordSkipped();
        when(backupService.restoreSnapshot(eq(snapshot), any(RestoreProgressListener.class))).thenAnswer(invocation -> {
            RestoreProgressListener listener = invocation.getArgument(1);
            listener.onProgress("Performing smart merge", 30);
            return result;
        });

        String jobId = runner.submit(snapshot);
        runner.shutdown();

        RestoreJobStatus status = runner.getStatus(jobId).orElseThrow();
        assertThat(jobId).startsWith("restore_" + clock.millis() + "_");
        assertThat(status.getStatus()).isEqualTo(RestoreJobStatus.State.completed);
        assertThat(status.getProgress()).isEqualTo(100);
        assertThat(status.getMessage()).isEqualTo("Restore completed! 1 inserted, 0 updated, 1 skipped");
        assertThat(status.getSafetyBackup()).isEqualTo("/backups/daily/manual-2024-03-01T10-00-00Z");
        assertThat(status.getCompletedAt()).isEqualTo(clock.instant());
    }

    @Test
    void failedJobKeepsErrorAndPartialResult() {
        RestoreResult partial = new RestoreResult();
        partial.setSafetyBackupPath("/backups/daily/manual-2024-03-01T10-00-00Z");
        when(backupService.restoreSnapshot(eq(snapshot), any(RestoreProgressListener.class)))
                .thenThrow(new RestoreException("Restore failed: connection refused", partial, null));

        String jobId = runner.submit(snapshot);
        runner.shutdown();

        RestoreJobStatus status = runner.getStatus(jobId).orElseThrow();
        assertThat(status.getStatus()).isEqualTo(RestoreJobStatus.State.failed);
        assertThat(status.getError()).isEqualTo("Restore failed: connection refused");
        assertThat(status.getSafetyBackup()).isEqualTo("/backups/daily/manual-2024-03-01T10-00-00Z");
        assertThat(status.getResult()).isSameAs(partial);
    }

    @Test
    void jobIdsAreUniqueAndUnknownIdsAreEmpty() {
        when(backupService.restoreSnapshot(eq(snapshot), any(RestoreProgressListener.class)))
                .thenReturn(new RestoreResult());

        String first = runner.submit(snapshot);
        String second = runner.submit(snapshot);
        runner.shutdown();

        assertThat(first).isNotEqualTo(second);
        assertThat(runner.getStatus("restore_0_0")).isEmpty();
    }
}
