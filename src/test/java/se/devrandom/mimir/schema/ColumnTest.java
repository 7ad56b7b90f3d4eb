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

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ColumnTest {

    @Test
    void convertsCamelCaseToSnakeCase() {
        assertThat(Column.toColumnName("id")).isEqualTo("id");
        assertThat(Column.toColumnName("updatedAt")).isEqualTo("updated_at");
        assertThat(Column.toColumnName("qcUserId")).isEqualTo("qc_user_id");
        assertThat(Column.toColumnName("teamLeaderUserId")).isEqualTo("team_leader_user_id");
    }

    @Test
    void keepsAcronymsTogether() {
        assertThat(Column.toColumnName("assignedITId")).isEqualTo("assigned_it_id");
    }

    @Test
    void ofDerivesColumnName() {
        Column column = Column.of("passwordHash", ColumnType.STRING);

        assertThat(column.field()).isEqualTo("passwordHash");
        assertThat(column.column()).isEqualTo("password_hash");
        assertThat(column.type()).isEqualTo(ColumnType.STRING);
    }
}
