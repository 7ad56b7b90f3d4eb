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

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import se.devrandom.mimir.storage.SnapshotStore;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the dump and then the manifest of a snapshot folder.
 */
@Component
public class SnapshotWriter {
    private static final Logger log = LoggerFactory.getLogger(SnapshotWriter.class);

    private final ObjectMapper objectMapper;
    private final Clock clock;

    public SnapshotWriter(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.clock = clock;
    }

    /**
     * Serialize {@code data} to {@code database.json} and write {@code metadata.json} last,
     * via a temporary file and a move, so the manifest only appears once the dump is complete.
     *
     * @throws SnapshotException on any write failure; the folder is left without a manifest
     */
    public SnapshotManifest write(Path folder, RetentionClass retentionClass,
                                  Map<String, List<Map<String, Object>>> data) {
        Path dumpFile = folder.resolve(SnapshotStore.DUMP_FILE);
        Path manifestFile = folder.resolve(SnapshotStore.MANIFEST_FILE);
        try {
            byte[] bytes = objectMapper.writeValueAsBytes(data);
            Files.write(dumpFile, bytes);

            Map<String, Integer> counts = new LinkedHashMap<>();
            data.forEach((type, rows) -> counts.put(type, rows.size()));

            SnapshotManifest manifest = new SnapshotManifest();
            manifest.setTimestamp(Instant.now(clock).toString());
            manifest.setType(retentionClass.value());
            manifest.setSize(bytes.length);
            manifest.setChecksum(SnapshotStore.sha256(bytes));
            manifest.setRecordCounts(counts);

            Path tmp = folder.resolve(SnapshotStore.MANIFEST_FILE + ".tmp");
            objectMapper.writeValue(tmp.toFile(), manifest);
            moveIntoPlace(tmp, manifestFile);

            log.info("Wrote snapshot {} ({} bytes, sha256 {})", folder, bytes.length, manifest.getChecksum());
            return manifest;
        } catch (IOException e) {
            throw new SnapshotException("Could not write snapshot " + folder + ": " + e.getMessage(), e);
        }
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
