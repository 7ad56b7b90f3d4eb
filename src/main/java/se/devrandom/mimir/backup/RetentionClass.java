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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Retention class of a snapshot. Decides the class directory and the folder name.
 * Manual snapshots are stored under {@code daily} and count towards daily retention.
 */
public enum RetentionClass {
    DAILY("daily", "daily"),
    MONTHLY("monthly", "monthly"),
    YEARLY("yearly", "yearly"),
    MANUAL("manual", "daily");

    private static final DateTimeFormatter MONTH_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    private final String value;
    private final String directory;

    RetentionClass(String value, String directory) {
        this.value = value;
        this.directory = directory;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public String directory() {
        return directory;
    }

    /**
     * Folder name for a snapshot taken now: YYYY-MM-DD, YYYY-MM, YYYY or
     * manual-&lt;ISO timestamp with ':' and '.' replaced by '-'&gt;.
     */
    public String folderName(Clock clock) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        return switch (this) {
            case DAILY -> today.toString();
            case MONTHLY -> today.format(MONTH_FORMAT);
            case YEARLY -> String.valueOf(today.getYear());
            case MANUAL -> "manual-" + Instant.now(clock).toString().replace(':', '-').replace('.', '-');
        };
    }

    @JsonCreator
    public static RetentionClass fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Retention class is required");
        }
        for (RetentionClass c : values()) {
            if (c.value.equalsIgnoreCase(value.trim())) {
                return c;
            }
        }
        throw new IllegalArgumentException("Unknown retention class: " + value);
    }

    /**
     * Whether {@code directory} is one of the class directories on disk.
     */
    public static boolean isDirectory(String directory) {
        return "daily".equals(directory) || "monthly".equals(directory) || "yearly".equals(directory);
    }
}
