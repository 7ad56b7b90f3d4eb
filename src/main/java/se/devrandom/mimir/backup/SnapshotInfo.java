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
 * A complete snapshot found on disk.
 *
 * @param path     absolute folder path
 * @param type     class directory the folder lives in (daily, monthly or yearly)
 * @param name     folder name, e.g. "2025-03-14" or "manual-2025-03-14T10-00-00-000Z"
 * @param manifest parsed {@code metadata.json}
 */
public record SnapshotInfo(String path, String type, String name, SnapshotManifest manifest) {
}
