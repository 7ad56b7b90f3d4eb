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
package se.devrandom.mimir.util;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;

class TimestampsTest {

    @Test
    void parsesIsoInstant() {
        assertThat(Timestamps.parse("2024-06-01T10:15:30.123Z"))
                .isEqualTo(Instant.parse("2024-06-01T10:15:30.123Z"));
    }

    @Test
    void parsesOffsetDateTime() {
        assertThat(Timestamps.parse("2024-06-01T12:15:30+02:00"))
                .isEqualTo(Instant.parse("2024-06-01T10:15:30Z"));
    }

    @Test
    void readsLocalDateTimeAsUtc() {
        assertThat(Timestamps.parse("2024-06-01T10:15:30"))
                .isEqualTo(Instant.parse("2024-06-01T10:15:30Z"));
    }

    @Test
    void readsPlainDateAsStartOfDayUtc() {
        assertThat(Timestamps.parse("2024-01-01")).isEqualTo(Instant.parse("2024-01-01T00:00:00Z"));
    }

    @Test
    void acceptsTemporalObjectsAndEpochMillis() {
        Instant instant = Instant.parse("2024-03-03T03:03:03Z");

        assertThat(Timestamps.parse(instant)).isEqualTo(instant);
        assertThat(Timestamps.parse(Date.from(instant))).isEqualTo(instant);
        assertThat(Timestamps.parse(instant.toEpochMilli())).isEqualTo(instant);
    }

    @Test
    void unparseableValuesAreAbsent() {
        assertThat(Timestamps.parse(null)).isNull();
        assertThat(Timestamps.parse("")).isNull();
        assertThat(Timestamps.parse("yesterday")).isNull();
        assertThat(Timestamps.parse("2024-13-45")).isNull();
    }
}
