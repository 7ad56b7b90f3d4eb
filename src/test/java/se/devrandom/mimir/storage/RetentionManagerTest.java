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

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import se.devrandom.mimir.backup.RetentionClass;
import se.devrandom.mimir.config.BackupProperties;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetentionManagerTest {

    @TempDir
    Path tempDir;

    private RetentionManager retentionManager;
    private Path dailyDir;

    @BeforeEach
    void setUp() {
        BackupProperties properties = new BackupProperties();
        properties.setBaseDir(tempDir.toString());
        retentionManager = new RetentionManager(new SnapshotStore(properties, new ObjectMapper()));
        dailyDir = tempDir.resolve("daily");
    }

    @Test
    void keepsTheThreeNewestOfFourDailyFolders() throws IOException {
        folder(dailyDir, "2024-01-01", "2024-01-01T04:00:00Z");
        folder(dailyDir, "2024-01-02", "2024-01-02T04:00:00Z");
        folder(dailyDir, "2024-01-03", "2024-01-03T04:00:00Z");
        folder(dailyDir, "2024-01-04", "2024-01-04T04:00:00Z");

        int deleted = retentionManager.prune(RetentionClass.DAILY, 3);

        assertThat(deleted).isEqualTo(1);
        assertThat(names(dailyDir)).containsExactlyInAnyOrder("2024-01-02", "2024-01-03", "2024-01-04");
    }

    @Test
    void ordersByModificationTimeNotName() throws IOException {
        folder(dailyDir, "manual-2024-01-05T10-00-00-000Z", "2024-01-05T10:00:00Z");
        folder(dailyDir, "2024-01-06", "2024-01-06T04:00:00Z");
        folder(dailyDir, "2024-01-01", "2024-01-07T04:00:00Z");

        retentionManager.prune(RetentionClass.DAILY, 2);

        assertThat(names(dailyDir)).containsExactlyInAnyOrder("2024-01-06", "2024-01-01");
    }

    @Test
    void isIdempotent() throws IOException {
        folder(dailyDir, "2024-01-01", "2024-01-01T04:00:00Z");
        folder(dailyDir, "2024-01-02", "2024-01-02T04:00:00Z");

        assertThat(retentionManager.prune(RetentionClass.DAILY, 1)).isEqualTo(1);
        assertThat(retentionManager.prune(RetentionClass.DAILY, 1)).isZero();
        assertThat(names(dailyDir)).containsExactly("2024-01-02");
    }

    @Test
    void prunesOnlyTheRequestedClass() throws IOException {
        folder(tempDir.resolve("monthly"), "2024-01", "2024-02-01T04:00:00Z");
        folder(tempDir.resolve("monthly"), "2024-02", "2024-03-01T04:00:00Z");
        folder(dailyDir, "2024-01-01", "2024-01-01T04:00:00Z");

        retentionManager.prune(RetentionClass.MONTHLY, 1);

        assertThat(names(tempDir.resolve("monthly"))).containsExactly("2024-02");
        assertThat(names(dailyDir)).containsExactly("2024-01-01");
    }

    @Test
    void missingClassDirectoryIsNotAnError() {
        assertThat(retentionManager.prune(RetentionClass.YEARLY, 5)).isZero();
    }

    @Test
    void rejectsNegativeKeepCount() {
        assertThatThrownBy(() -> retentionManager.prune(RetentionClass.DAILY, -1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void folder(Path classDir, String name, String modified) throws IOException {
        Path folder = classDir.resolve(name);
        Files.createDirectories(folder);
        Files.writeString(folder.resolve(SnapshotStore.DUMP_FILE), "{}");
        Files.setLastModifiedTime(folder, FileTime.from(Instant.parse(modified)));
    }

    private static List<String> names(Path dir) throws IOException {
        try (Stream<Path> folders = Files.list(dir)) {
            return folders.map(p -> p.getFileName().toString()).toList();
        }
    }
}
