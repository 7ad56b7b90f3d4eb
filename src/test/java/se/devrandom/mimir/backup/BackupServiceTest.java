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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import se.devrandom.mimir.restore.MergeRestoreEngine;
import se.devrandom.mimir.storage.RetentionManager;
import se.devrandom.mimir.storage.SnapshotStore;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class BackupServiceTest {

    @Mock
    private SnapshotService snapshotService;
    @Mock
    private MergeRestoreEngine restoreEngine;
    @Mock
    private SnapshotStore snapshotStore;
    @Mock
    private RetentionManager retentionManager;
    @Mock
    private BackupSettingsProvider settingsProvider;

    private BackupService backupService;

    @BeforeEach
    void setUp() {
        backupService = new BackupService(snapshotService, restoreEngine, snapshotStore, retentionManager,
                settingsProvider);
    }

    @Test
    void prunesEachClassWithItsConfiguredCount() {
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionDays(7);
        settings.setRetentionMonths(3);
        settings.setRetentionYears(2);
        when(settingsProvider.load()).thenReturn(settings);
        when(retentionManager.prune(RetentionClass.DAILY, 7)).thenReturn(4);
        when(retentionManager.prune(RetentionClass.MONTHLY, 3)).thenReturn(1);
        when(retentionManager.prune(RetentionClass.YEARLY, 2)).thenReturn(0);

        Map<String, Integer> deleted = backupService.pruneRetention();

        assertThat(deleted).containsExactly(Map.entry("daily", 4), Map.entry("monthly", 1), Map.entry("yearly", 0));
    }

    @Test
    void zeroYearlyRetentionKeepsYearlySnapshotsForever() {
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionYears(0);
        when(settingsProvider.load()).thenReturn(settings);

        Map<String, Integer> deleted = backupService.pruneRetention();

        assertThat(deleted).doesNotContainKey("yearly");
        verify(retentionManager, never()).prune(eq(RetentionClass.YEARLY), anyInt());
    }

    @Test
    void negativeDailyRetentionIsTreatedAsZero() {
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionDays(-5);
        when(settingsProvider.load()).thenReturn(settings);

        backupService.pruneRetention();

        verify(retentionManager).prune(RetentionClass.DAILY, 0);
    }

    @Test
    void recordLastBackupDelegatesToProvider() {
        backupService.recordLastBackup(RetentionClass.DAILY, "2024-01-01T04:00:00Z");

        verify(settingsProvider).recordLastBackup(RetentionClass.DAILY, "2024-01-01T04:00:00Z");
        verify(snapshotService, never()).createSnapshot(any());
    }
}
