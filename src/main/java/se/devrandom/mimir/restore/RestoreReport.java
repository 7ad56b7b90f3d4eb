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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Merge outcome for one entity type.
 */
public class RestoreReport {
    private final String entityType;
    private int inserted;
    private int updated;
    private int skipped;
    private final List<RestoreConflict> conflicts = new ArrayList<>();

    public RestoreReport(String entityType) {
        this.entityType = entityType;
    }

    public void recordInserted() {
        inserted++;
    }

    public void recordUpdated() {
        updated++;
    }

    public void recordSkipped() {
        skipped++;
    }

    public void addConflict(RestoreConflict conflict) {
        conflicts.add(conflict);
    }

    public String getEntityType() {
        return entityType;
    }

    public int getInserted() {
        return inserted;
    }

    public int getUpdated() {
        return updated;
    }

    public int getSkipped() {
        return skipped;
    }

    public List<RestoreConflict> getConflicts() {
        return Collections.unmodifiableList(conflicts);
    }

    @Override
    public String toString() {
        return entityType + ": " + inserted + " inserted, " + updated + " updated, " + skipped
                + " skipped, " + conflicts.size() + " conflicts";
    }
}
