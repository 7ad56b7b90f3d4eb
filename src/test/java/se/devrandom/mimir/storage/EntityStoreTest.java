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
package se.devrandom.mimir.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;
import se.devrandom.mimir.TestDatabase;
import se.devrandom.mimir.schema.CrmSchema;
import se.devrandom.mimir.schema.EntityDescriptor;

import javax.sql.DataSource;
import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EntityStoreTest {

    private final CrmSchema schema = new CrmSchema();
    private final EntityStore store = new EntityStore(new ObjectMapper());

    private JdbcTemplate jdbc;
    private Connection conn;

    @BeforeEach
    void setUp() throws SQLException {
        DataSource dataSource = TestDatabase.create();
        jdbc = new JdbcTemplate(dataSource);
        conn = dataSource.getConnection();
    }

    @AfterEach
    void tearDown() throws SQLException {
        conn.close();
    }

    @Test
    void insertThenFindByIdRoundTripsTypedValues() throws SQLException {
        EntityDescriptor leads = schema.require("leads");
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", "L1");
        record.put("serialNumber", "S-0001");
        record.put("status", "new");
        record.put("dealValue", new BigDecimal("1250.50"));
        record.put("customFields", Map.of("source", "web", "score", 7));
        record.put("createdAt", "2024-01-01T10:00:00.000Z");
        record.put("updatedAt", "2024-01-02T10:00:00Z");
        record.put("notAColumn", "ignored");

        store.insert(conn, leads, record, Set.of());
        Map<String, Object> live = store.findById(conn, leads, "L1");

        assertThat(live).containsEntry("serialNumber", "S-0001")
                .containsEntry("dealValue", new BigDecimal("1250.50"))
                .containsEntry("createdAt", "2024-01-01T10:00:00Z")
                .containsEntry("updatedAt", "2024-01-02T10:00:00Z")
                .containsEntry("campaignId", null)
                .doesNotContainKey("notAColumn");
        assertThat(live.get("customFields")).isInstanceOf(JsonNode.class);
        assertThat(((JsonNode) live.get("customFields")).get("score").asInt()).isEqualTo(7);
    }

    @Test
    void integersAndBooleansComeBackTyped() throws SQLException {
        EntityDescriptor stages = schema.require("pipelineStages");
        store.insert(conn, stages, Map.of("id", "P1", "name", "New", "position", "3", "isActive", true),
                Set.of());

        Map<String, Object> live = store.findById(conn, stages, "P1");

        assertThat(live).containsEntry("position", 3L)
                .containsEntry("isActive", true)
                .containsEntry("color", null);
    }

    @Test
    void nulledFieldsAreWrittenAsNull() throws SQLException {
        jdbc.update("INSERT INTO users (id, email) VALUES ('U2', 'b@example.com')");
        EntityDescriptor users = schema.require("users");
        Map<String, Object> record = new HashMap<>();
        record.put("id", "U1");
        record.put("email", "a@example.com");
        record.put("accountManagerId", "U2");
        record.put("teamId", "T-missing");

        store.insert(conn, users, record, Set.of("accountManagerId", "teamId"));

        Map<String, Object> row = jdbc.queryForMap("SELECT team_id, account_manager_id FROM users WHERE id = 'U1'");
        assertThat(row.get("team_id")).isNull();
        assertThat(row.get("account_manager_id")).isNull();
    }

    @Test
    void updateWritesOnlyTheFieldsTheRecordCarries() throws SQLException {
        jdbc.update("INSERT INTO pipeline_stages (id, name, color, position, is_active) VALUES ('P1', 'Old', 'red', 1, TRUE)");
        EntityDescriptor stages = schema.require("pipelineStages");
        Map<String, Object> record = new HashMap<>();
        record.put("id", "P1");
        record.put("name", "Renamed");
        record.put("position", 2);
        record.put("isActive", null);

        assertThat(store.update(conn, stages, record)).isEqualTo(1);
        assertThat(jdbc.queryForMap("SELECT name, color, position, is_active FROM pipeline_stages WHERE id = 'P1'"))
                .containsEntry("name", "Renamed")
                .containsEntry("color", "red")
                .containsEntry("position", 2)
                .containsEntry("is_active", null);
        assertThat(store.update(conn, stages, Map.of("id", "missing", "name", "x"))).isZero();
    }

    @Test
    void updateWithOnlyAnIdLeavesTheRowAlone() throws SQLException {
        jdbc.update("INSERT INTO teams (id, name) VALUES ('T1', 'Alpha')");
        EntityDescriptor teams = schema.require("teams");

        assertThat(store.update(conn, teams, Map.of("id", "T1"))).isEqualTo(1);
        assertThat(store.update(conn, teams, Map.of("id", "T2"))).isZero();
        assertThat(jdbc.queryForObject("SELECT name FROM teams WHERE id = 'T1'", String.class)).isEqualTo("Alpha");
    }

    @Test
    void insertLeavesOmittedColumnsToTheirDefault() throws SQLException {
        jdbc.execute("ALTER TABLE pipeline_stages ALTER COLUMN color SET DEFAULT 'grey'");
        jdbc.execute("ALTER TABLE pipeline_stages ALTER COLUMN color SET NOT NULL");
        EntityDescriptor stages = schema.require("pipelineStages");

        store.insert(conn, stages, Map.of("id", "P1", "name", "New"), Set.of());

        assertThat(jdbc.queryForObject("SELECT color FROM pipeline_stages WHERE id = 'P1'", String.class))
                .isEqualTo("grey");
    }

    @Test
    void backfillOnlyFillsNullColumns() throws SQLException {
        jdbc.update("INSERT INTO users (id, email) VALUES ('U1', 'a@example.com')");
        jdbc.update("INSERT INTO users (id, email) VALUES ('U2', 'b@example.com')");
        jdbc.update("INSERT INTO users (id, email, account_manager_id) VALUES ('U3', 'c@example.com', 'U1')");
        EntityDescriptor users = schema.require("users");

        assertThat(store.backfill(conn, users, "U2", "accountManagerId", "U1")).isTrue();
        assertThat(store.backfill(conn, users, "U3", "accountManagerId", "U2")).isFalse();

        assertThat(jdbc.queryForObject("SELECT account_manager_id FROM users WHERE id = 'U3'", String.class))
                .isEqualTo("U1");
    }

    @Test
    void findAllOrdersById() throws SQLException {
        jdbc.update("INSERT INTO teams (id, name) VALUES ('T2', 'Beta')");
        jdbc.update("INSERT INTO teams (id, name) VALUES ('T1', 'Alpha')");

        List<Map<String, Object>> rows = store.findAll(conn, schema.require("teams"));

        assertThat(rows).extracting(r -> r.get("id")).containsExactly("T1", "T2");
        assertThat(store.exists(conn, schema.require("teams"), "T1")).isTrue();
        assertThat(store.exists(conn, schema.require("teams"), "T3")).isFalse();
        assertThat(store.findById(conn, schema.require("teams"), "T3")).isNull();
    }

    @Test
    void settingsValueIsStoredAsJsonText() throws SQLException {
        EntityDescriptor settings = schema.require("systemSettings");
        store.insert(conn, settings, Map.of("id", "S1", "key", "theme", "value", "dark"), Set.of());

        assertThat(jdbc.queryForObject("SELECT setting_value FROM system_settings WHERE id = 'S1'", String.class))
                .isEqualTo("\"dark\"");
        assertThat(((JsonNode) store.findById(conn, settings, "S1").get("value")).asText()).isEqualTo("dark");
    }

    @Test
    void unparseableTimestampIsRejected() {
        EntityDescriptor teams = schema.require("teams");

        assertThatThrownBy(() -> store.insert(conn, teams,
                Map.of("id", "T1", "name", "A", "createdAt", "yesterday"), Set.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("createdAt");
    }
}
