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

import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import se.devrandom.mimir.TestDatabase;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SystemSettingsBackupSettingsProviderTest {

    private final Clock clock = Clock.fixed(Instant.parse("2024-06-01T04:00:00Z"), ZoneOffset.UTC);

    private JdbcTemplate jdbc;
    private SystemSettingsBackupSettingsProvider provider;

    @BeforeEach
    void setUp() {
        DataSource dataSource = TestDatabase.create();
        jdbc = new JdbcTemplate(dataSource);
        provider = new SystemSettingsBackupSettingsProvider(dataSource, clock);
    }

    @Test
    void missingRowYieldsDefaults() {
        BackupSettings settings = provider.load();

        assertThat(settings.isEnabled()).isTrue();
        assertThat(settings.getDailyTime()).isEqualTo("04:00");
        assertThat(settings.getRetentionDays()).isEqualTo(30);
        assertThat(settings.getRetentionMonths()).isEqualTo(12);
        assertThat(settings.getRetentionYears()).isEqualTo(5);
        assertThat(settings.getLastBackup()).isNull();
    }

    @Test
    void partialJsonFillsInDefaults() {
        jdbc.update("INSERT INTO system_settings (id, setting_key, category, setting_value) VALUES (?, ?, ?, ?)",
                "S1", "backup_settings", "backup", "{\"enabled\":false,\"retentionDays\":7}");

        BackupSettings settings = provider.load();

        assertThat(settings.isEnabled()).isFalse();
        assertThat(settings.getRetentionDays()).isEqualTo(7);
        assertThat(settings.getRetentionMonths()).isEqualTo(12);
    }

    @Test
    void malformedJsonYieldsDefaults() {
        jdbc.update("INSERT INTO system_settings (id, setting_key, setting_value) VALUES (?, ?, ?)",
                "S1", "backup_settings", "not json");

        assertThat(provider.load().getRetentionDays()).isEqualTo(BackupSettings.DEFAULT_RETENTION_DAYS);
    }

    @Test
    void saveInsertsThenUpdatesTheSameRow() {
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionDays(14);
        provider.save(settings);

        settings.setRetentionYears(0);
        provider.save(settings);

        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM system_settings WHERE setting_key = 'backup_settings'",
                Integer.class)).isEqualTo(1);
        assertThat(jdbc.queryForObject("SELECT category FROM system_settings WHERE setting_key = 'backup_settings'",
                String.class)).isEqualTo("backup");
        BackupSettings loaded = provider.load();
        assertThat(loaded.getRetentionDays()).isEqualTo(14);
        assertThat(loaded.getRetentionYears()).isZero();
    }

    @Test
    void recordLastBackupKeepsOtherSettings() {
        BackupSettings settings = BackupSettings.defaults();
        settings.setRetentionMonths(6);
        provider.save(settings);

        provider.recordLastBackup(RetentionClass.MONTHLY, "2024-06-01T04:00:00Z");

        BackupSettings loaded = provider.load();
        assertThat(loaded.getRetentionMonths()).isEqualTo(6);
        assertThat(loaded.getLastBackup()).isEqualTo("2024-06-01T04:00:00Z");
        assertThat(loaded.getLastBackupType()).isEqualTo("monthly");
    }

    @Test
    void jsonOmitsUnsetLastBackup() {
        JSONObject json = SystemSettingsBackupSettingsProvider.toJson(BackupSettings.defaults());

        assertThat(json.has("lastBackup")).isFalse();
        assertThat(json.getInt("retentionYears")).isEqualTo(5);
    }
}
