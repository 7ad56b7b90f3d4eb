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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Typed description of one CRM entity table.
 *
 * <p>All SQL used against the table is generated here, once, from the declared columns.
 * Snapshot records are bound column by column against this declaration; keys a record
 * carries that are not declared never reach a statement.</p>
 */
public final class EntityDescriptor {

    public static final String ID_FIELD = "id";
    public static final String UPDATED_AT_FIELD = "updatedAt";

    private final String name;
    private final String table;
    private final List<Column> columns;
    private final Map<String, Column> columnsByField;
    private final String timestampField;
    private final String selfReferenceField;
    private final Set<String> forwardReferences;

    private final String selectAllSql;
    private final String selectByIdSql;
    private final String existsSql;

    private EntityDescriptor(Builder builder) {
        this.name = builder.name;
        this.table = builder.table;
        this.columns = List.copyOf(builder.columns);
        Map<String, Column> byField = new LinkedHashMap<>();
        for (Column c : columns) {
            byField.put(c.field(), c);
        }
        this.columnsByField = Collections.unmodifiableMap(byField);
        this.timestampField = builder.timestampField;
        this.selfReferenceField = builder.selfReferenceField;
        this.forwardReferences = Collections.unmodifiableSet(new LinkedHashSet<>(builder.forwardReferences));

        String columnList = columnList(columns);

        this.selectAllSql = "SELECT " + columnList + " FROM " + table + " ORDER BY id";
        this.selectByIdSql = "SELECT " + columnList + " FROM " + table + " WHERE id = ?";
        this.existsSql = "SELECT 1 FROM " + table + " WHERE id = ?";
    }

    private static String columnList(List<Column> columns) {
        return columns.stream().map(Column::column).collect(Collectors.joining(", "));
    }

    public static Builder builder(String name, String table) {
        return new Builder(name, table);
    }

    /** Dump key, e.g. "leads". */
    public String getName() {
        return name;
    }

    public String getTable() {
        return table;
    }

    public List<Column> getColumns() {
        return columns;
    }

    public Optional<Column> column(String field) {
        return Optional.ofNullable(columnsByField.get(field));
    }

    public Column requireColumn(String field) {
        return column(field).orElseThrow(() ->
                new IllegalArgumentException("Unknown field '" + field + "' on " + name));
    }

    /** All columns except the primary key, in declaration order. */
    public List<Column> updatableColumns() {
        List<Column> result = new ArrayList<>(columns.size());
        for (Column c : columns) {
            if (!ID_FIELD.equals(c.field())) {
                result.add(c);
            }
        }
        return result;
    }

    /**
     * Declared columns the record carries a key for, in declaration order. A key mapped to
     * null counts as present; a missing key does not.
     */
    public List<Column> columnsPresentIn(Map<String, Object> record) {
        List<Column> result = new ArrayList<>(columns.size());
        for (Column c : columns) {
            if (record.containsKey(c.field())) {
                result.add(c);
            }
        }
        return result;
    }

    public boolean isTimestamped() {
        return timestampField != null;
    }

    public String getTimestampField() {
        return timestampField;
    }

    public boolean isSelfReferential() {
        return selfReferenceField != null;
    }

    public String getSelfReferenceField() {
        return selfReferenceField;
    }

    /**
     * Nullable references to entity types that come later in dependency order.
     * They are written as null on insert and restored by the reference repair pass.
     */
    public Set<String> getForwardReferences() {
        return forwardReferences;
    }

    public String selectAllSql() {
        return selectAllSql;
    }

    public String selectByIdSql() {
        return selectByIdSql;
    }

    public String existsSql() {
        return existsSql;
    }

    public String insertSql() {
        return insertSql(columns);
    }

    /** INSERT naming only the given columns; the rest take their column default. */
    public String insertSql(List<Column> target) {
        String placeholders = target.stream().map(c -> "?").collect(Collectors.joining(", "));
        return "INSERT INTO " + table + " (" + columnList(target) + ") VALUES (" + placeholders + ")";
    }

    public String updateSql() {
        return updateSql(updatableColumns());
    }

    /** UPDATE of only the given columns; the id column is never assigned. */
    public String updateSql(List<Column> target) {
        String assignments = target.stream()
                .filter(c -> !ID_FIELD.equals(c.field()))
                .map(c -> c.column() + " = ?")
                .collect(Collectors.joining(", "));
        if (assignments.isEmpty()) {
            throw new IllegalArgumentException("No columns to update on " + name);
        }
        return "UPDATE " + table + " SET " + assignments + " WHERE id = ?";
    }

    /**
     * Sets a single column only where it is currently null. Never overwrites a value.
     */
    public String backfillSql(String field) {
        Column c = requireColumn(field);
        return "UPDATE " + table + " SET " + c.column() + " = ? WHERE id = ? AND " + c.column() + " IS NULL";
    }

    /**
     * Extract the primary identifier of a dump record, or null when it has none. A null
     * record (a JSON null array element) has no id.
     */
    public static String idOf(Map<String, Object> record) {
        if (record == null) {
            return null;
        }
        Object id = record.get(ID_FIELD);
        return id != null ? String.valueOf(id) : null;
    }

    @Override
    public String toString() {
        return name + "(" + table + ")";
    }

    public static final class Builder {
        private final String name;
        private final String table;
        private final List<Column> columns = new ArrayList<>();
        private final Set<String> forwardReferences = new LinkedHashSet<>();
        private String timestampField;
        private String selfReferenceField;

        private Builder(String name, String table) {
            this.name = name;
            this.table = table;
            columns.add(Column.of(ID_FIELD, ColumnType.STRING));
        }

        public Builder string(String... fields) {
            return add(ColumnType.STRING, fields);
        }

        public Builder integer(String... fields) {
            return add(ColumnType.INTEGER, fields);
        }

        public Builder decimal(String... fields) {
            return add(ColumnType.DECIMAL, fields);
        }

        public Builder bool(String... fields) {
            return add(ColumnType.BOOLEAN, fields);
        }

        public Builder timestamp(String... fields) {
            return add(ColumnType.TIMESTAMP, fields);
        }

        public Builder json(String... fields) {
            return add(ColumnType.JSON, fields);
        }

        /** Column whose name does not follow the snake_case convention. */
        public Builder column(String field, String column, ColumnType type) {
            columns.add(new Column(field, column, type));
            return this;
        }

        /** Declares the "updatedAt" column and marks the entity as timestamped. */
        public Builder updatedAt() {
            columns.add(Column.of(UPDATED_AT_FIELD, ColumnType.TIMESTAMP));
            this.timestampField = UPDATED_AT_FIELD;
            return this;
        }

        /** Declares a nullable reference to another row of the same table. */
        public Builder selfReference(String field) {
            string(field);
            this.selfReferenceField = field;
            return this;
        }

        /** Declares a nullable reference to a table later in dependency order. */
        public Builder forwardReference(String field) {
            string(field);
            forwardReferences.add(field);
            return this;
        }

        private Builder add(ColumnType type, String... fields) {
            for (String field : fields) {
                columns.add(Column.of(field, type));
            }
            return this;
        }

        public EntityDescriptor build() {
            return new EntityDescriptor(this);
        }
    }
}
