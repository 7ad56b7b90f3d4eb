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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.IOException;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientException;
import java.util.concurrent.Callable;

/**
 * Utility class for executing operations with retry logic and exponential backoff.
 * Only retries transient errors (I/O failures, transient or recoverable SQL errors, S3 throttling).
 * Does not retry constraint violations, syntax errors or other application-level failures.
 */
public class RetryUtil {
    private static final Logger log = LoggerFactory.getLogger(RetryUtil.class);

    private RetryUtil() {
    }

    /**
     * Executes the given operation with retry logic and exponential backoff.
     *
     * @param operation      The operation to execute
     * @param maxAttempts    Maximum number of attempts (e.g., 3)
     * @param initialDelayMs Initial delay in milliseconds (e.g., 1000 for 1 second)
     * @param operationName  Name of the operation for logging purposes
     * @param <T>            Return type of the operation
     * @return The result from the operation
     * @throws Exception if all retry attempts are exhausted or a non-retryable error occurs
     */
    public static <T> T executeWithRetry(
            Callable<T> operation,
            int maxAttempts,
            long initialDelayMs,
            String operationName) throws Exception {

        Exception lastException = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.call();
            } catch (Exception e) {
                lastException = e;

                if (attempt == maxAttempts) {
                    log.error("{} failed after {} attempts", operationName, maxAttempts, e);
                    throw e;
                }

                if (!isRetryable(e)) {
                    log.error("{} failed with non-retryable error: {}",
                        operationName, e.getClass().getSimpleName(), e);
                    throw e;
                }

                // 1s, 2s, 4s, ...
                long delayMs = initialDelayMs * (1L << (attempt - 1));

                log.warn("{} attempt {}/{} failed, retrying in {}ms: {}",
                    operationName, attempt, maxAttempts, delayMs, e.getMessage());

                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new RuntimeException("Retry interrupted", ie);
                }
            }
        }

        throw lastException;
    }

    /**
     * Determines if an exception is retryable (transient error) or not.
     *
     * Retryable errors:
     * - IOException (disk or network hiccups)
     * - SQLTransientException / SQLRecoverableException (lost connection, lock timeout)
     * - SQLException with SQLState class 08 (connection exception, as PostgreSQL reports it)
     * - S3Exception with a throttling or temporary error code
     *
     * @param e The exception to check
     * @return true if the error is retryable, false otherwise
     */
    static boolean isRetryable(Exception e) {
        if (e instanceof IOException) {
            return true;
        }

        if (e instanceof SQLTransientException || e instanceof SQLRecoverableException) {
            return true;
        }

        if (e instanceof SQLException sqlEx && isConnectionException(sqlEx)) {
            return true;
        }

        if (e instanceof S3Exception s3Ex) {
            String errorCode = s3Ex.awsErrorDetails() != null
                ? s3Ex.awsErrorDetails().errorCode()
                : null;

            if ("SlowDown".equals(errorCode) ||
                "RequestTimeout".equals(errorCode) ||
                "ServiceUnavailable".equals(errorCode) ||
                "InternalError".equals(errorCode)) {
                return true;
            }

            // AccessDenied, NoSuchBucket, ...
            log.debug("Non-retryable S3 error: {} ({})", errorCode, s3Ex.getMessage());
            return false;
        }

        if (e instanceof RuntimeException && e.getCause() instanceof Exception cause) {
            if (cause instanceof IOException ||
                cause instanceof SQLException ||
                cause instanceof S3Exception) {
                return isRetryable(cause);
            }
        }

        log.debug("Non-retryable exception type: {}", e.getClass().getName());
        return false;
    }

    private static boolean isConnectionException(SQLException e) {
        String state = e.getSQLState();
        return state != null && state.startsWith("08");
    }
}
