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

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.stereotype.Service;
import se.devrandom.mimir.config.BackupProperties;
import se.devrandom.mimir.util.RetryUtil;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.core.client.config.ClientOverrideConfiguration;
import software.amazon.awssdk.core.retry.RetryPolicy;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Offsite copy of completed snapshot folders. Only created when a bucket is configured.
 */
@Service
@ConditionalOnExpression("!'${aws.s3.bucket-name:}'.isEmpty()")
public class S3Service {
    private static final Logger log = LoggerFactory.getLogger(S3Service.class);

    private final S3Client s3Client;
    private final String bucketName;
    private final String prefix;

    @Autowired
    public S3Service(
            @Value("${aws.s3.bucket-name}") String bucketName,
            @Value("${aws.s3.region:eu-north-1}") String region,
            BackupProperties properties) {
        this(S3Client.builder()
                        .region(Region.of(region))
                        .credentialsProvider(DefaultCredentialsProvider.create())
                        .overrideConfiguration(ClientOverrideConfiguration.builder()
                                .apiCallTimeout(Duration.ofMinutes(5))          // Total timeout for API call (includes retries)
                                .apiCallAttemptTimeout(Duration.ofMinutes(3))   // Timeout per retry attempt
                                .retryPolicy(RetryPolicy.builder()
                                        .numRetries(2)
                                        .build())
                                .build())
                        .build(),
                bucketName, properties.getS3Prefix());
        log.info("S3Service initialized with bucket: {} in region: {} (5min timeout, 2 retries)", bucketName, region);
    }

    S3Service(S3Client s3Client, String bucketName, String prefix) {
        this.s3Client = s3Client;
        this.bucketName = bucketName;
        this.prefix = prefix;
    }

    /**
     * Upload every file of a snapshot folder to
     * {@code <prefix>/<classDir>/<name>/<relative path>}. The manifest goes last so a
     * partially uploaded snapshot never looks complete.
     *
     * @return number of objects uploaded
     */
    public int uploadSnapshot(Path folder, String classDir) throws IOException {
        String name = folder.getFileName().toString();
        List<Path> files;
        try (Stream<Path> walk = Files.walk(folder)) {
            files = walk.filter(Files::isRegularFile).collect(Collectors.toCollection(ArrayList::new));
        }
        Path manifest = folder.resolve(SnapshotStore.MANIFEST_FILE);
        files.remove(manifest);
        if (Files.isRegularFile(manifest)) {
            files.add(manifest);
        }

        int uploaded = 0;
        for (Path file : files) {
            String relative = folder.relativize(file).toString().replace('\\', '/');
            String key = buildKey(prefix, classDir, name, relative);
            uploadFile(file, key);
            uploaded++;
        }
        log.info("Uploaded snapshot {}/{} to s3://{}/{} ({} objects)", classDir, name, bucketName,
                buildKey(prefix, classDir, name, ""), uploaded);
        return uploaded;
    }

    private void uploadFile(Path file, String key) throws IOException {
        try {
            RetryUtil.executeWithRetry(() -> {
                PutObjectRequest putObjectRequest = PutObjectRequest.builder()
                        .bucket(bucketName)
                        .key(key)
                        .contentType(getContentType(file.getFileName().toString()))
                        .metadata(Map.of("source", "mimir"))
                        .build();
                s3Client.putObject(putObjectRequest, RequestBody.fromFile(file));
                log.debug("Uploaded {} to S3: {}", file, key);
                return key;
            }, 3, 1000, "S3 upload " + key);
        } catch (IOException e) {
            throw e;
        } catch (Exception e) {
            throw new IOException("S3 upload failed: " + e.getMessage(), e);
        }
    }

    static String buildKey(String prefix, String classDir, String name, String relative) {
        StringBuilder key = new StringBuilder();
        if (prefix != null && !prefix.isBlank()) {
            key.append(prefix.replaceAll("^/+|/+$", "")).append('/');
        }
        key.append(classDir).append('/').append(name).append('/');
        key.append(relative);
        return key.toString();
    }

    /**
     * Determine MIME type based on file extension
     */
    static String getContentType(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return "application/octet-stream";
        }

        return switch (fileName.substring(dot + 1).toLowerCase()) {
            case "json" -> "application/json";
            case "pdf" -> "application/pdf";
            case "jpg", "jpeg" -> "image/jpeg";
            case "png" -> "image/png";
            case "gif" -> "image/gif";
            case "webm" -> "audio/webm";
            case "mp3" -> "audio/mpeg";
            case "wav" -> "audio/wav";
            case "doc" -> "application/msword";
            case "docx" -> "application/vnd.openxmlformats-officedocument.wordprocessingml.document";
            case "xls" -> "application/vnd.ms-excel";
            case "xlsx" -> "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet";
            case "txt" -> "text/plain";
            case "csv" -> "text/csv";
            case "zip" -> "application/zip";
            default -> "application/octet-stream";
        };
    }

    public String getBucketName() {
        return bucketName;
    }

    @PreDestroy
    public void close() {
        if (s3Client != null) {
            s3Client.close();
            log.info("S3Client closed");
        }
    }
}
