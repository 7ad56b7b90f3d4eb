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

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.FileSystemUtils;
import se.devrandom.mimir.backup.RetentionClass;
import se.devrandom.mimir.backup.SnapshotException;
import se.devrandom.mimir.backup.SnapshotInfo;
import se.devrandom.mimir.backup.SnapshotManifest;
import se.devrandom.mimir.config.BackupProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * On-disk layout of snapshots: {@code <base>/<daily|monthly|yearly>/<name>/} holding
 * {@code database.json}, {@code metadata.json} and a {@code files/} tree.
 */
@Component
public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    public static final String DUMP_FILE = "database.json";
    public static final String MANIFEST_FILE = "metadata.json";
    public static final String FILES_DIR = "files";

    private static final List<String> CLASS_DIRECTORIES = List.of("daily", "monthly", "yearly");
    private static final TypeReference<LinkedHashMap<String, List<Map<String, Object>>>> DUMP_TYPE =
            new TypeReference<>() {};

    private final Path baseDir;
    private final ObjectMapper objectMapper;
    private final ObjectMapper dumpReader;

    public SnapshotStore(BackupProperties properties, ObjectMapper objectMapper) {
        this.baseDir = Paths.get(properties.getBaseDir()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        this.dumpReader = objectMapper.copy()
                .enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        log.info("Snapshot store at {}", baseDir);
    }

    public Path getBaseDir() {
        return baseDir;
    }

    public Path classDirectory(RetentionClass retentionClass) {
        return baseDir.resolve(retentionClass.directory());
    }

    /**
     * Resolve a snapshot folder from its class directory and folder name.
     *
     * @throws IllegalArgumentException if the type is not a class directory or the name
     *                                  could escape it
     */
    public Path resolve(String type, String name) {
        if (!RetentionClass.isDirectory(type)) {
            throw new IllegalArgumentException("Invalid backup type: " + type);
        }
        if (name == null || name.isBlank() || name.contains("..") || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Invalid backup name: " + name);
        }
        return baseDir.resolve(type).resolve(name);
    }

    /**
     * Create (or reuse) the folder for a new snapshot. A manifest left over from an earlier
     * run of the same day is removed first, so the folder reads as incomplete until rewritten.
     */
    public Path prepareFolder(RetentionClass retentionClass, String name) {
        Path folder = resolve(retentionClass.directory(), name);
        try {
            Files.createDirectories(folder);
            if (Files.deleteIfExists(folder.resolve(MANIFEST_FILE))) {
                log.info("Replacing existing snapshot {}", folder);
            }
            return folder;
        } catch (IOException e) {
            throw new SnapshotException("Could not prepare snapshot folder " + folder + ": " + e.getMessage(), e);
        }
    }

    /**
     * All complete snapshots (folders with a readable manifest), newest manifest timestamp first.
     */
    public List<SnapshotInfo> listSnapshots() {
        List<SnapshotInfo> snapshots = new ArrayList<>();
        for (String type : CLASS_DIRECTORIES) {
            Path classDir = baseDir.resolve(type);
            if (!Files.isDirectory(classDir)) {
                continue;
            }
            try (Stream<Path> folders = Files.list(classDir)) {
                folders.filter(Files::isDirectory).forEach(folder ->
                        readManifest(folder).ifPresent(manifest -> snapshots.add(new SnapshotInfo(
                                folder.toString(), type, folder.getFileName().toString(), manifest))));
            } catch (IOException e) {
                log.warn("Could not list {}: {}", classDir, e.getMessage());
            }
        }
        snapshots.sort(Comparator.comparing(
                (SnapshotInfo s) -> s.manifest().getTimestamp(),
                Comparator.nullsLast(Comparator.reverseOrder())));
        return snapshots;
    }

    /**
     * @return the manifest, or empty if the folder is incomplete or the manifest unreadable
     */
    public Optional<SnapshotManifest> readManifest(Path folder) {
        Path manifestFile = folder.resolve(MANIFEST_FILE);
        if (!Files.isRegularFile(manifestFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(manifestFile.toFile(), SnapshotManifest.class));
        } catch (IOException e) {
            log.warn("Ignoring snapshot {} with unreadable manifest: {}", folder, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Load the dump of a snapshot. The manifest checksum is verified when present;
     * a mismatch is logged but the dump is still returned.
     *
     * @throws SnapshotException if the dump is missing or can not be parsed
     */
    public Map<String, List<Map<String, Object>>> loadDump(Path folder) {
        Path dumpFile = folder.resolve(DUMP_FILE);
        if (!Files.isRegularFile(dumpFile)) {
            throw new SnapshotException("Snapshot dump not found: " + dumpFile);
        }
        try {
            byte[] bytes = Files.readAllBytes(dumpFile);
            readManifest(folder).ifPresent(manifest -> verifyChecksum(folder, manifest, bytes));
            Map<String, List<Map<String, Object>>> dump = dumpReader.readValue(bytes, DUMP_TYPE);
            log.info("Loaded snapshot dump {} ({} bytes, {} entity types)", dumpFile, bytes.length, dump.size());
            return dump;
        } catch (IOException e) {
            throw new SnapshotException("Could not read snapshot dump " + dumpFile + ": " + e.getMessage(), e);
        }
    }

    private void verifyChecksum(Path folder, SnapshotManifest manifest, byte[] bytes) {
        if (manifest.getChecksum() == null) {
            return;
        }
        String actual = sha256(bytes);
        if (!actual.equalsIgnoreCase(manifest.getChecksum())) {
            log.warn("Checksum mismatch for snapshot {}: manifest {} but dump hashes to {}",
                    folder, manifest.getChecksum(), actual);
        }
    }

    /**
     * Delete a snapshot folder. Paths outside the base directory are refused.
     *
     * @return true if a folder was deleted
     */
    public boolean delete(Path folder) {
        Path normalized = folder.toAbsolutePath().normalize();
        if (!normalized.startsWith(baseDir) || normalized.getParent() == null
                || normalized.getParent().equals(baseDir) || normalized.equals(baseDir)) {
            log.warn("Refusing to delete {} outside the snapshot store", folder);
            return false;
        }
        try {
            boolean deleted = FileSystemUtils.deleteRecursively(normalized);
            if (deleted) {
                log.info("Deleted snapshot {}", normalized);
            }
            return deleted;
        } catch (IOException e) {
            log.error("Failed to delete snapshot {}: {}", normalized, e.getMessage());
            return false;
        }
    }

    public static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
