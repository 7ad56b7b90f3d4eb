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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.schema.CrmSchema;
import se.devrandom.mimir.schema.EntityDescriptor;
import se.devrandom.mimir.schema.ReferenceLink;
import se.devrandom.mimir.storage.EntityStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Restores foreign keys that were set to null when their target was deleted, once the
 * target has been brought back by a merge. A live non-null value is never overwritten.
 */
@Component
public class ReferenceRepairPass {
    private static final Logger log = LoggerFactory.getLogger(ReferenceRepairPass.class);

    private final CrmSchema schema;
    private final EntityStore entityStore;

    public ReferenceRepairPass(CrmSchema schema, EntityStore entityStore) {
        this.schema = schema;
        this.entityStore = entityStore;
    }

    /**
     * @return number of references restored per link ("entity.field")
     */
    public Map<String, Integer> repair(Connection conn, Map<String, List<Map<String, Object>>> dump) {
        Map<String, Integer> repaired = new LinkedHashMap<>();
        for (ReferenceLink link : schema.referenceLinks()) {
            List<Map<String, Object>> records = dump.get(link.entity());
            if (records == null || records.isEmpty()) {
                continue;
            }
            EntityDescriptor descriptor = schema.require(link.entity());
            int count = 0;
            for (Map<String, Object> record : records) {
                String id = EntityDescriptor.idOf(record);
                if (id == null) {
                    continue;
                }
                Object value = record.get(link.field());
                if (value == null) {
                    continue;
                }
                try {
                    if (entityStore.backfill(conn, descriptor, id, link.field(), value)) {
                        count++;
                    }
                } catch (SQLException | RuntimeException e) {
                    log.warn("Could not repair {} on {}: {}", link, id, e.getMessage());
                }
            }
            if (count > 0) {
                log.info("Repaired {} {} references", count, link);
            }
            repaired.put(link.toString(), count);
        }
        return repaired;
    }
}
