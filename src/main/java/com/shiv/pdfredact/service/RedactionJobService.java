package com.shiv.pdfredact.service;

import com.shiv.pdfredact.config.RedactionProperties;
import com.shiv.pdfredact.dto.JobStatus;
import com.shiv.pdfredact.dto.JobStatusResponse;
import com.shiv.pdfredact.dto.ProgressEvent;
import com.shiv.pdfredact.dto.RedactResponse;
import com.shiv.pdfredact.dto.RedactionReport;
import com.shiv.pdfredact.exception.JobNotFoundException;
import com.shiv.pdfredact.exception.RedactionCancelledException;
import com.shiv.pdfredact.util.Literals;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

/**
 * Accepts uploads and runs them through the {@link RedactionPipeline} on the redaction executor.
 * Each run gets its own directory under the work dir and its own cancellation token. Finished
 * runs are forgotten, directory included, once they are older than the configured retention.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RedactionJobService {

    static final String OUTPUT_PREFIX = "redacted_";

    private final RedactionPipeline pipeline;
    private final CancellationRegistry cancellations;
    private final ExecutorService redactionExecutor;
    private final RedactionProperties properties;

    private final Map<String, Job> jobs = new ConcurrentHashMap<>();

    @Data
    static class Job {
        private final String runId;
        private final String clientId;
        private final Path input;
        private final Path output;
        private volatile JobStatus status = JobStatus.RUNNING;
        private volatile ProgressEvent lastEvent = new ProgressEvent(0, "Queued");
        private volatile RedactionReport report;
        private volatile Instant finishedAt;
    }

    public RedactResponse submit(MultipartFile file, String words, String clientId) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("No file uploaded.");
        }
        String fileName = checkFileName(file.getOriginalFilename());
        List<String> literals = Literals.fromCsv(words);
        if (literals.isEmpty()) {
            throw new IllegalArgumentException("No words to redact.");
        }

        String runId = UUID.randomUUID().toString();
        Path dir = Paths.get(properties.getWorkDir(), runId);
        Files.createDirectories(dir);
        Path input = dir.resolve(fileName);
        file.transferTo(input);

        Job job = new Job(runId, clientId, input, dir.resolve(OUTPUT_PREFIX + fileName));
        CancellationToken token = cancellations.register(runId);
        jobs.put(runId, job);
        try {
            redactionExecutor.submit(() -> execute(job, literals, token));
        } catch (RejectedExecutionException e) {
            jobs.remove(runId);
            cancellations.remove(runId);
            throw new IllegalStateException("Redaction queue is not accepting work", e);
        }
        log.info("Run {} queued for client {}: {} ({} literal(s))", runId, clientId, fileName, literals.size());

        return RedactResponse.builder()
                .runId(runId)
                .status(job.getStatus())
                .fileName(fileName)
                .build();
    }

    void execute(Job job, List<String> literals, CancellationToken token) {
        String runId = job.getRunId();
        try {
            RedactionReport report = pipeline.run(job.getInput(), job.getOutput(), literals, job::setLastEvent, token);
            job.setReport(report);
            job.setStatus(JobStatus.DONE);
        } catch (RedactionCancelledException e) {
            log.info("Run {} cancelled: {}", runId, e.getMessage());
            job.setLastEvent(new ProgressEvent(job.getLastEvent().getPercentage(), "Cancelled"));
            job.setStatus(JobStatus.CANCELLED);
            discardOutput(job);
        } catch (Exception e) {
            log.error("Run {} failed", runId, e);
            job.setLastEvent(new ProgressEvent(job.getLastEvent().getPercentage(), "Failed: " + e.getMessage()));
            job.setStatus(JobStatus.FAILED);
            discardOutput(job);
        } finally {
            cancellations.remove(runId);
            job.setFinishedAt(Instant.now());
        }
    }

    public JobStatusResponse status(String runId) {
        Job job = find(runId);
        RedactionReport report = job.getReport();
        ProgressEvent event = job.getLastEvent();
        JobStatusResponse.JobStatusResponseBuilder out = JobStatusResponse.builder()
                .runId(runId)
                .status(job.getStatus())
                .percentage(event.getPercentage())
                .message(event.getMessage());
        if (job.getStatus() == JobStatus.DONE && report != null) {
            out.fileName(job.getOutput().getFileName().toString())
                    .burnedRects(report.getBurnedRects())
                    .ocrOutcome(report.getOcrOutcome().name());
        }
        return out.build();
    }

    // finished jobs are reported unchanged
    public JobStatusResponse cancel(String runId) {
        find(runId);
        if (cancellations.cancel(runId)) {
            log.info("Cancellation requested for run {}", runId);
        }
        return status(runId);
    }

    public Path output(String runId) {
        Job job = find(runId);
        if (job.getStatus() != JobStatus.DONE) {
            throw new IllegalStateException("Run " + runId + " is " + job.getStatus());
        }
        return job.getOutput();
    }

    @Scheduled(fixedDelayString = "${app.redact.jobs.sweep-interval:PT5M}")
    public void evictExpired() {
        evictExpired(Instant.now());
    }

    int evictExpired(Instant now) {
        Duration retention = properties.getJobs().getRetention();
        int evicted = 0;
        for (Job job : jobs.values()) {
            Instant finishedAt = job.getFinishedAt();
            if (finishedAt == null || finishedAt.plus(retention).isAfter(now)) continue;
            if (jobs.remove(job.getRunId(), job)) {
                deleteRunDir(job);
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} finished run(s) older than {}", evicted, retention);
        }
        return evicted;
    }

    private Job find(String runId) {
        Job job = jobs.get(runId);
        if (job == null) throw new JobNotFoundException(runId);
        return job;
    }

    private static void discardOutput(Job job) {
        try {
            Files.deleteIfExists(job.getOutput());
        } catch (IOException e) {
            log.warn("Could not remove partial output {}: {}", job.getOutput(), e.getMessage());
        }
    }

    private static void deleteRunDir(Job job) {
        Path dir = job.getInput().getParent();
        try {
            FileSystemUtils.deleteRecursively(dir);
        } catch (IOException e) {
            log.warn("Could not remove run directory {}: {}", dir, e.getMessage());
        }
    }

    static String checkFileName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Missing file name.");
        }
        if (name.contains("..") || name.contains("/") || name.contains("\\")) {
            throw new IllegalArgumentException("Invalid file name.");
        }
        if (!name.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
            throw new IllegalArgumentException("Only PDF files are accepted.");
        }
        return name;
    }
}
