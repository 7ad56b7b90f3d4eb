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
package se.devrandom.mimir.schema;

/**
 * Storage type of a declared column. Decides how a value is read from a
 * {@link java.sql.ResultSet}, how it is represented in a snapshot dump and how it is
 * bound back into a statement on restore.
 */
public enum ColumnType {
    STRING,
    INTEGER,
    DECIMAL,
    BOOLEAN,
    /** Stored as a UTC timestamp, dumped as an ISO-8601 instant. */
    TIMESTAMP,
    /** Stored as JSON text, dumped as nested JSON. */
    JSON
}
