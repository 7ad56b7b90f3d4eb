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

/**
 * A restore stopped before completing. The partial result is attached for diagnostics.
 */
public class RestoreException extends RuntimeException {
    private final transient RestoreResult result;

    public RestoreException(String message, RestoreResult result, Throwable cause) {
        super(message, cause);
        this.result = result;
    }

    public RestoreResult getResult() {
        return result;
    }
}
