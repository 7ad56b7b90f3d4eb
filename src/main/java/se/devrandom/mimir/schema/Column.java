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

import java.util.regex.Pattern;

/**
 * One declared column of an entity table.
 *
 * @param field  key used in snapshot dumps (camelCase, as the CRM application names it)
 * @param column column name in the database
 * @param type   storage type
 */
public record Column(String field, String column, ColumnType type) {

    private static final Pattern LOWER_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_END = Pattern.compile("([A-Z])([A-Z][a-z])");

    public static Column of(String field, ColumnType type) {
        return new Column(field, toColumnName(field), type);
    }

    /**
     * Convert a camelCase field name to its snake_case column name.
     * "assignedITId" -> "assigned_it_id", "qcUserId" -> "qc_user_id"
     */
    static String toColumnName(String field) {
        String snake = ACRONYM_END.matcher(field).replaceAll("$1_$2");
        snake = LOWER_UPPER.matcher(snake).replaceAll("$1_$2");
        return snake.toLowerCase();
    }
}
