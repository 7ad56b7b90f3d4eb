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
package se.devrandom.mimir.batchprocessing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.batch.core.StepExecution;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Arrays;

@Component
@ConditionalOnProperty(name = "spring.batch.job.enabled", havingValue = "true", matchIfMissing = true)
public class JobCompletionNotificationListener implements JobExecutionListener {
    private static final Logger log = LoggerFactory.getLogger(JobCompletionNotificationListener.class);

    private final ApplicationContext applicationContext;
    private final Environment environment;

    public JobCompletionNotificationListener(ApplicationContext applicationContext,
                                             Environment environment) {
        this.applicationContext = applicationContext;
        this.environment = environment;
    }

    private boolean isWebMode() {
        return Arrays.asList(environment.getActiveProfiles()).contains("web");
    }

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("Starting {} with parameters {}", jobExecution.getJobInstance().getJobName(),
                jobExecution.getJobParameters());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        boolean completed = jobExecution.getStatus() == BatchStatus.COMPLETED;
        if (!completed && jobExecution.getStatus() != BatchStatus.FAILED) {
            return;
        }

        log.info("\n" + "=".repeat(80));
        log.info(completed ? "SNAPSHOT JOB SUMMARY" : "SNAPSHOT JOB SUMMARY (FAILED)");
        log.info("=".repeat(80));
        log.info(summary(jobExecution));
        log.info("=".repeat(80));

        if (!completed) {
            log.error("!!! JOB FAILED! Check logs for errors");
        }

        if (isWebMode()) {
            log.info("Web mode active - keeping server running for the backup API");
            return;
        }

        int exitStatus = completed ? 0 : 1;
        // Schedule shutdown after Spring Batch has finished updating job metadata
        new Thread(() -> {
            try {
                Thread.sleep(1000);
                log.info("Shutting down application...");
                int exitCode = SpringApplication.exit(applicationContext, () -> exitStatus);
                System.exit(exitCode);
            } catch (InterruptedException e) {
                log.error("Shutdown interrupted", e);
                Thread.currentThread().interrupt();
            }
        }).start();
    }

    static String summary(JobExecution jobExecution) {
        StringBuilder summary = new StringBuilder();
        summary.append("Status: ").append(jobExecution.getStatus()).append('\n');
        summary.append("Retention class: ")
                .append(jobExecution.getJobParameters().getString(SnapshotTasklet.RETENTION_CLASS_PARAMETER, "daily"))
                .append('\n');
        String snapshotPath = jobExecution.getExecutionContext().getString(SnapshotTasklet.SNAPSHOT_PATH_KEY, "-");
        summary.append("Snapshot: ").append(snapshotPath).append('\n');
        for (StepExecution step : jobExecution.getStepExecutions()) {
            summary.append(String.format("  %-15s %-10s writes=%d%n", step.getStepName(), step.getStatus(),
                    step.getWriteCount()));
        }
        LocalDateTime start = jobExecution.getStartTime();
        LocalDateTime end = jobExecution.getEndTime();
        if (start != null && end != null) {
            summary.append("Duration: ").append(Duration.between(start, end).toMillis()).append(" ms\n");
        }
        for (Throwable failure : jobExecution.getAllFailureExceptions()) {
            summary.append("Failure: ").append(failure.getMessage()).append('\n');
        }
        return summary.toString();
    }
}
