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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.devrandom.mimir.storage.SnapshotStore;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SnapshotWriterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final SnapshotWriter writer = new SnapshotWriter(objectMapper,
            Clock.fixed(Instant.parse("2024-01-01T04:00:00Z"), ZoneOffset.UTC));

    @TempDir
    Path tempDir;

    @Test
    void writesDumpAndMatchingManifest() throws IOException {
        Map<String, List<Map<String, Object>>> data = new LinkedHashMap<>();
        data.put("users", List.of(Map.of("id", "U1"), Map.of("id", "U2")));
        data.put("teams", List.of());

        SnapshotManifest manifest = writer.write(tempDir, RetentionClass.DAILY, data);

        byte[] dump = Files.readAllBytes(tempDir.resolve(SnapshotStore.DUMP_FILE));
        assertThat(manifest.getChecksum()).isEqualTo(SnapshotStore.sha256(dump));
        assertThat(manifest.getSize()).isEqualTo(dump.length);
        assertThat(manifest.getRecordCounts()).containsExactly(Map.entry("users", 2), Map.entry("teams", 0));
        assertThat(manifest.getTimestamp()).isEqualTo("2024-01-01T04:00:00Z");

        JsonNode written = objectMapper.readTree(tempDir.resolve(SnapshotStore.MANIFEST_FILE).toFile());
        assertThat(written.get("type").asText()).isEqualTo("daily");
        assertThat(written.get("version").asText()).isEqualTo("3.0.0");
        assertThat(written.get("method").asText()).isEqualTo("jdbc");
        assertThat(tempDir.resolve(SnapshotStore.MANIFEST_FILE + ".tmp")).doesNotExist();
    }

    @Test
    void manualSnapshotsAreTypedManual() {
        SnapshotManifest manifest = writer.write(tempDir, RetentionClass.MANUAL, Map.of());

        assertThat(manifest.getType()).isEqualTo("manual");
    }

    @Test
    void failedWriteLeavesNoManifest() {
        Path missing = tempDir.resolve("does-not-exist");

        assertThatThrownBy(() -> writer.write(missing, RetentionClass.DAILY, Map.of()))
                .isInstanceOf(SnapshotException.class);
        assertThat(missing.resolve(SnapshotStore.MANIFEST_FILE)).doesNotExist();
    }
}
