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
 * A nullable foreign key whose target may be deleted (set null on delete) and later
 * restored. Checked by the reference repair pass after a merge.
 *
 * @param entity dump key of the referencing entity type
 * @param field  field holding the reference
 */
public record ReferenceLink(String entity, String field) {

    @Override
    public String toString() {
        return entity + "." + field;
    }
}
