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

/**
 * Source of the backup settings. Implementations never fail a read: when the stored
 * settings can not be loaded, the defaults are returned.
 */
public interface BackupSettingsProvider {

    BackupSettings load();

    BackupSettings save(BackupSettings settings);

    void recordLastBackup(RetentionClass retentionClass, String timestamp);
}
