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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.schema.Column;
import se.devrandom.mimir.schema.EntityDescriptor;
import se.devrandom.mimir.util.Timestamps;

import java.math.BigDecimal;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Schema-aware JDBC access to the CRM entity tables.
 *
 * <p>Rows are represented as ordered maps keyed by field name, holding dump-ready values:
 * strings, numbers, booleans, ISO-8601 instants for timestamps and Jackson trees for JSON
 * columns. Every statement is built from the {@link EntityDescriptor}, so a record can only
 * ever touch declared columns.</p>
 *
 * <p>The caller owns the connection and its transaction mode.</p>
 */
@Component
public class EntityStore {

    private final ObjectMapper objectMapper;

    public EntityStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public List<Map<String, Object>> findAll(Connection conn, EntityDescriptor descriptor) throws SQLException {
        List<Map<String, Object>> rows = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.selectAllSql());
             ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                rows.add(readRow(rs, descriptor));
            }
        }
        return rows;
    }

    /**
     * @return the live row, or null if no row has this id
     */
    public Map<String, Object> findById(Connection conn, EntityDescriptor descriptor, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.selectByIdSql())) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? readRow(rs, descriptor) : null;
            }
        }
    }

    public boolean exists(Connection conn, EntityDescriptor descriptor, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.existsSql())) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Insert a snapshot record. Only declared fields the record carries are written, so
     * columns it omits take their column default. Fields named in {@code nulledFields} are
     * written as NULL. Undeclared keys are ignored.
     */
    public void insert(Connection conn, EntityDescriptor descriptor, Map<String, Object> record,
                       Set<String> nulledFields) throws SQLException {
        List<Column> target = descriptor.columnsPresentIn(record);
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.insertSql(target))) {
            int index = 1;
            for (Column column : target) {
                Object value = nulledFields.contains(column.field()) ? null : record.get(column.field());
                bind(stmt, index++, column, value);
            }
            stmt.executeUpdate();
        }
    }

    /**
     * Overwrite the non-id columns the snapshot record carries. Columns the record omits
     * keep their live value.
     *
     * @return number of rows changed (0 when the row disappeared in between)
     */
    public int update(Connection conn, EntityDescriptor descriptor, Map<String, Object> record) throws SQLException {
        String id = EntityDescriptor.idOf(record);
        List<Column> target = new ArrayList<>(descriptor.columnsPresentIn(record));
        target.removeIf(column -> EntityDescriptor.ID_FIELD.equals(column.field()));
        if (target.isEmpty()) {
            // Nothing to write
            return exists(conn, descriptor, id) ? 1 : 0;
        }
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.updateSql(target))) {
            int index = 1;
            for (Column column : target) {
                bind(stmt, index++, column, record.get(column.field()));
            }
            stmt.setString(index, id);
            return stmt.executeUpdate();
        }
    }

    /**
     * Set one column of one row, only if that column is currently null.
     *
     * @return true if the row was changed
     */
    public boolean backfill(Connection conn, EntityDescriptor descriptor, String id, String field,
                            Object value) throws SQLException {
        Column column = descriptor.requireColumn(field);
        try (PreparedStatement stmt = conn.prepareStatement(descriptor.backfillSql(field))) {
            bind(stmt, 1, column, value);
            stmt.setString(2, id);
            return stmt.executeUpdate() > 0;
        }
    }

    private Map<String, Object> readRow(ResultSet rs, EntityDescriptor descriptor) throws SQLException {
        Map<String, Object> row = new LinkedHashMap<>();
        for (Column column : descriptor.getColumns()) {
            row.put(column.field(), readValue(rs, column));
        }
        return row;
    }

    private Object readValue(ResultSet rs, Column column) throws SQLException {
        String name = column.column();
        switch (column.type()) {
            case INTEGER: {
                long value = rs.getLong(name);
                return rs.wasNull() ? null : value;
            }
            case DECIMAL:
                return rs.getBigDecimal(name);
            case BOOLEAN: {
                boolean value = rs.getBoolean(name);
                return rs.wasNull() ? null : value;
            }
            case TIMESTAMP: {
                LocalDateTime value = rs.getObject(name, LocalDateTime.class);
                return value != null ? value.toInstant(ZoneOffset.UTC).toString() : null;
            }
            case JSON: {
                String text = rs.getString(name);
                if (text == null) {
                    return null;
                }
                try {
                    return objectMapper.readTree(text);
                } catch (JsonProcessingException e) {
                    throw new SQLException("Column " + column.column() + " holds invalid JSON: "
                            + e.getOriginalMessage(), e);
                }
            }
            case STRING:
            default:
                return rs.getString(name);
        }
    }

    private void bind(PreparedStatement stmt, int index, Column column, Object value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, sqlType(column));
            return;
        }
        switch (column.type()) {
            case INTEGER:
                if (value instanceof Number number) {
                    stmt.setLong(index, number.longValue());
                } else {
                    stmt.setLong(index, Long.parseLong(value.toString().trim()));
                }
                break;
            case DECIMAL:
                stmt.setBigDecimal(index, value instanceof BigDecimal decimal
                        ? decimal
                        : new BigDecimal(value.toString().trim()));
                break;
            case BOOLEAN:
                stmt.setBoolean(index, value instanceof Boolean bool
                        ? bool
                        : Boolean.parseBoolean(value.toString().trim()));
                break;
            case TIMESTAMP: {
                Instant instant = Timestamps.parse(value);
                if (instant == null) {
                    throw new IllegalArgumentException("Unparseable timestamp for " + column.field() + ": " + value);
                }
                stmt.setObject(index, LocalDateTime.ofInstant(instant, ZoneOffset.UTC));
                break;
            }
            case JSON:
                stmt.setString(index, toJsonText(value));
                break;
            case STRING:
            default:
                stmt.setString(index, value.toString());
                break;
        }
    }

    private String toJsonText(Object value) throws SQLException {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new SQLException("Could not serialize JSON value: " + e.getMessage(), e);
        }
    }

    private static int sqlType(Column column) {
        return switch (column.type()) {
            case INTEGER -> Types.BIGINT;
            case DECIMAL -> Types.NUMERIC;
            case BOOLEAN -> Types.BOOLEAN;
            case TIMESTAMP -> Types.TIMESTAMP;
            case JSON, STRING -> Types.VARCHAR;
        };
    }
}
