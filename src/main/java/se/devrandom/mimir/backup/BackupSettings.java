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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Backup schedule and retention settings, stored as the {@code backup_settings} row of the
 * CRM's system settings.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class BackupSettings {
    public static final boolean DEFAULT_ENABLED = true;
    public static final String DEFAULT_DAILY_TIME = "04:00";
    public static final int DEFAULT_RETENTION_DAYS = 30;
    public static final int DEFAULT_RETENTION_MONTHS = 12;
    public static final int DEFAULT_RETENTION_YEARS = 5;

    private boolean enabled = DEFAULT_ENABLED;
    // Informational, read by the external scheduler
    private String dailyTime = DEFAULT_DAILY_TIME;
    private int retentionDays = DEFAULT_RETENTION_DAYS;
    private int retentionMonths = DEFAULT_RETENTION_MONTHS;
    private int retentionYears = DEFAULT_RETENTION_YEARS;
    private String lastBackup;
    private String lastBackupType;

    public static BackupSettings defaults() {
        return new BackupSettings();
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getDailyTime() {
        return dailyTime;
    }

    public void setDailyTime(String dailyTime) {
        this.dailyTime = dailyTime;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }

    public int getRetentionMonths() {
        return retentionMonths;
    }

    public void setRetentionMonths(int retentionMonths) {
        this.retentionMonths = retentionMonths;
    }

    public int getRetentionYears() {
        return retentionYears;
    }

    public void setRetentionYears(int retentionYears) {
        this.retentionYears = retentionYears;
    }

    public String getLastBackup() {
        return lastBackup;
    }

    public void setLastBackup(String lastBackup) {
        this.lastBackup = lastBackup;
    }

    public String getLastBackupType() {
        return lastBackupType;
    }

    public void setLastBackupType(String lastBackupType) {
        this.lastBackupType = lastBackupType;
    }
}
