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

import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Reads and writes the {@code backup_settings} row of the CRM {@code system_settings} table.
 * The row's value is a JSON object; missing keys take their default.
 */
@Service
public class SystemSettingsBackupSettingsProvider implements BackupSettingsProvider {
    private static final Logger log = LoggerFactory.getLogger(SystemSettingsBackupSettingsProvider.class);

    static final String SETTINGS_KEY = "backup_settings";
    static final String SETTINGS_CATEGORY = "backup";

    private final DataSource dataSource;
    private final Clock clock;

    public SystemSettingsBackupSettingsProvider(DataSource dataSource, Clock clock) {
        this.dataSource = dataSource;
        this.clock = clock;
    }

    @Override
    public BackupSettings load() {
        try (Connection conn = dataSource.getConnection()) {
            String value = readValue(conn);
            if (value == null) {
                return BackupSettings.defaults();
            }
            return fromJson(new JSONObject(value));
        } catch (SQLException | JSONException e) {
            log.error("Could not read backup settings, using defaults: {}", e.getMessage());
            return BackupSettings.defaults();
        }
    }

    @Override
    public BackupSettings save(BackupSettings settings) {
        try (Connection conn = dataSource.getConnection()) {
            write(conn, toJson(settings).toString());
            log.info("Backup settings updated: enabled={}, retention {}d/{}m/{}y", settings.isEnabled(),
                    settings.getRetentionDays(), settings.getRetentionMonths(), settings.getRetentionYears());
            return settings;
        } catch (SQLException e) {
            throw new IllegalStateException("Could not save backup settings: " + e.getMessage(), e);
        }
    }

    @Override
    public void recordLastBackup(RetentionClass retentionClass, String timestamp) {
        BackupSettings settings = load();
        settings.setLastBackup(timestamp);
        settings.setLastBackupType(retentionClass.value());
        try {
            save(settings);
        } catch (IllegalStateException e) {
            log.warn("Could not record last backup time: {}", e.getMessage());
        }
    }

    private String readValue(Connection conn) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT setting_value FROM system_settings WHERE setting_key = ?")) {
            stmt.setString(1, SETTINGS_KEY);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? rs.getString(1) : null;
            }
        }
    }

    private void write(Connection conn, String json) throws SQLException {
        LocalDateTime now = LocalDateTime.now(clock.withZone(ZoneOffset.UTC));
        try (PreparedStatement update = conn.prepareStatement("""
                UPDATE system_settings
                SET setting_value = ?, updated_at = ?
                WHERE setting_key = ?
                """)) {
            update.setString(1, json);
            update.setObject(2, now);
            update.setString(3, SETTINGS_KEY);
            if (update.executeUpdate() > 0) {
                return;
            }
        }
        try (PreparedStatement insert = conn.prepareStatement("""
                INSERT INTO system_settings (id, setting_key, category, setting_value, created_at, updated_at)
                VALUES (?, ?, ?, ?, ?, ?)
                """)) {
            insert.setString(1, UUID.randomUUID().toString());
            insert.setString(2, SETTINGS_KEY);
            insert.setString(3, SETTINGS_CATEGORY);
            insert.setString(4, json);
            insert.setObject(5, now);
            insert.setObject(6, now);
            insert.executeUpdate();
        }
    }

    static BackupSettings fromJson(JSONObject json) {
        BackupSettings settings = BackupSettings.defaults();
        settings.setEnabled(json.optBoolean("enabled", BackupSettings.DEFAULT_ENABLED));
        settings.setDailyTime(json.optString("dailyTime", BackupSettings.DEFAULT_DAILY_TIME));
        settings.setRetentionDays(json.optInt("retentionDays", BackupSettings.DEFAULT_RETENTION_DAYS));
        settings.setRetentionMonths(json.optInt("retentionMonths", BackupSettings.DEFAULT_RETENTION_MONTHS));
        settings.setRetentionYears(json.optInt("retentionYears", BackupSettings.DEFAULT_RETENTION_YEARS));
        settings.setLastBackup(json.optString("lastBackup", null));
        settings.setLastBackupType(json.optString("lastBackupType", null));
        return settings;
    }

    static JSONObject toJson(BackupSettings settings) {
        JSONObject json = new JSONObject();
        json.put("enabled", settings.isEnabled());
        json.put("dailyTime", settings.getDailyTime());
        json.put("retentionDays", settings.getRetentionDays());
        json.put("retentionMonths", settings.getRetentionMonths());
        json.put("retentionYears", settings.getRetentionYears());
        if (settings.getLastBackup() != null) {
            json.put("lastBackup", settings.getLastBackup());
        }
        if (settings.getLastBackupType() != null) {
            json.put("lastBackupType", settings.getLastBackupType());
        }
        return json;
    }
}
