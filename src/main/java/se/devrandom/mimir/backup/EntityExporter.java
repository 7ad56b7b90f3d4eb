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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.schema.CrmSchema;
import se.devrandom.mimir.schema.EntityDescriptor;
import se.devrandom.mimir.storage.EntityStore;
import se.devrandom.mimir.util.RetryUtil;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads every CRM entity table, in dependency order, into one snapshot document.
 */
@Component
public class EntityExporter {
    private static final Logger log = LoggerFactory.getLogger(EntityExporter.class);

    private static final int MAX_ATTEMPTS = 3;
    private static final long INITIAL_DELAY_MS = 1000;

    private final DataSource dataSource;
    private final CrmSchema schema;
    private final EntityStore entityStore;

    public EntityExporter(DataSource dataSource, CrmSchema schema, EntityStore entityStore) {
        this.dataSource = dataSource;
        this.schema = schema;
        this.entityStore = entityStore;
    }

    /**
     * Export all entity types. Rows of each type are ordered by id.
     * The whole read is retried on transient failures, since a failed statement
     * invalidates the surrounding transaction.
     *
     * @return entity type name to rows, in registry order
     * @throws SnapshotException if the export could not be completed
     */
    public Map<String, List<Map<String, Object>>> exportAll() {
        try {
            return RetryUtil.executeWithRetry(this::readConsistentView, MAX_ATTEMPTS, INITIAL_DELAY_MS,
                    "CRM export");
        } catch (SnapshotException e) {
            throw e;
        } catch (Exception e) {
            throw new SnapshotException("Export of CRM data failed: " + e.getMessage(), e);
        }
    }

    private Map<String, List<Map<String, Object>>> readConsistentView() throws SQLException {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            int isolation = conn.getTransactionIsolation();
            conn.setAutoCommit(false);
            conn.setTransactionIsolation(Connection.TRANSACTION_REPEATABLE_READ);
            conn.setReadOnly(true);
            boolean committed = false;
            try {
                for (EntityDescriptor descriptor : schema.entities()) {
                    List<Map<String, Object>> rows = entityStore.findAll(conn, descriptor);
                    data.put(descriptor.getName(), rows);
                    log.debug("Exported {} {} records", rows.size(), descriptor.getName());
                }
                conn.commit();
                committed = true;
            } finally {
                if (!committed) {
                    conn.rollback();
                }
                conn.setReadOnly(false);
                conn.setTransactionIsolation(isolation);
                conn.setAutoCommit(autoCommit);
            }
        }
        int total = data.values().stream().mapToInt(List::size).sum();
        log.info("Exported {} records across {} entity types", total, data.size());
        return data;
    }
}
