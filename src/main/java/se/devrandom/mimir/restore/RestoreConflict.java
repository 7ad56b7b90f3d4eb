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
package se.devrandom.mimir.restore;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A record the merge declined to write, with the reason.
 *
 * @param id               primary identifier of the snapshot record
 * @param reason           human-readable reason
 * @param backupTimestamp  the snapshot's updatedAt, when compared
 * @param currentTimestamp the live row's updatedAt, when compared
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RestoreConflict(String id, String reason, String backupTimestamp, String currentTimestamp) {

    public static RestoreConflict of(String id, String reason) {
        return new RestoreConflict(id, reason, null, null);
    }
}
