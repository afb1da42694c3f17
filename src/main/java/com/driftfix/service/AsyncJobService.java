package com.driftfix.service;

import com.driftfix.domain.FixStage;
import com.driftfix.dto.AsyncJobResponse;
import com.driftfix.dto.AsyncJobStatus;
import com.driftfix.exception.DriftFixException;
import com.driftfix.exception.JobNotFoundException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.function.Function;

@Slf4j
@Service
public class AsyncJobService {

    @Value("${jobs.pool-size:4}")
    private int poolSize;

    @Value("${jobs.max-retained:1000}")
    private int maxRetained;

    private ExecutorService executor;
    private final ConcurrentHashMap<UUID, JobState> jobs = new ConcurrentHashMap<>();

    @PostConstruct
    void init() {
        executor = Executors.newFixedThreadPool(Math.max(2, poolSize));
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public UUID submit(String jobType, String modelId, String requestId, Function<Consumer<FixStage>, Object> task) {
        UUID jobId = UUID.randomUUID();
        JobState state = new JobState(jobId, jobType, modelId, requestId, Instant.now());
        jobs.put(jobId, state);
        evictFinished();

        CompletableFuture.runAsync(() -> execute(state, task), executor);
        log.info("Job queued | jobId={} | type={} | modelId={} | requestId={}", jobId, jobType, modelId, requestId);
        return jobId;
    }

    public AsyncJobResponse getJob(UUID jobId) {
        JobState state = jobs.get(jobId);
        if (state == null) {
            throw new JobNotFoundException(jobId);
        }
        return state.toResponse();
    }

    private void execute(JobState state, Function<Consumer<FixStage>, Object> task) {
        state.markRunning();
        try {
            Object result = task.apply(state::advance);
            state.markCompleted(result);
            log.info("Job completed | jobId={} | type={} | modelId={}", state.jobId, state.jobType, state.modelId);
        } catch (DriftFixException ex) {
            state.markFailed(ex.getErrorCode(), ex.getMessage());
            log.warn("Job failed | jobId={} | errorCode={} | reason={}", state.jobId, ex.getErrorCode(), ex.getMessage());
        } catch (Exception ex) {
            String reason = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
            state.markFailed("INTERNAL_ERROR", reason);
            log.error("Job failed | jobId={} | type={} | reason={}", state.jobId, state.jobType, reason, ex);
        }
    }

    private void evictFinished() {
        if (jobs.size() <= maxRetained) {
            return;
        }
        jobs.entrySet().stream()
            .filter(e -> e.getValue().isFinished())
            .sorted(Comparator.comparing(e -> e.getValue().createdAt))
            .limit(Math.max(1, jobs.size() - maxRetained))
            .map(Map.Entry::getKey)
            .forEach(jobs::remove);
    }

    private static final class JobState {
        private final UUID jobId;
        private final String jobType;
        private final String modelId;
        private final String requestId;
        private final Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private AsyncJobStatus status = AsyncJobStatus.QUEUED;
        private int progressPercent;
        private String message = "Queued";
        private String errorCode;
        private Object result;

        private JobState(UUID jobId, String jobType, String modelId, String requestId, Instant createdAt) {
            this.jobId = jobId;
            this.jobType = jobType;
            this.modelId = modelId;
            this.requestId = requestId;
            this.createdAt = createdAt;
        }

        private synchronized void markRunning() {
            startedAt = Instant.now();
            status = AsyncJobStatus.RUNNING;
            message = "Started";
            progressPercent = 5;
        }

        private synchronized void advance(FixStage stage) {
            if (status != AsyncJobStatus.RUNNING) {
                return;
            }
            message = stage.message();
            progressPercent = stage.progressPercent();
            log.debug("Job progress | jobId={} | stage={} | progress={}", jobId, stage, progressPercent);
        }

        private synchronized void markCompleted(Object result) {
            completedAt = Instant.now();
            status = AsyncJobStatus.COMPLETED;
            this.result = result;
            message = "Job completed";
            progressPercent = 100;
        }

        private synchronized void markFailed(String errorCode, String message) {
            completedAt = Instant.now();
            status = AsyncJobStatus.FAILED;
            this.errorCode = errorCode;
            this.message = message;
            progressPercent = 100;
        }

        private synchronized boolean isFinished() {
            return status == AsyncJobStatus.COMPLETED || status == AsyncJobStatus.FAILED;
        }

        private synchronized AsyncJobResponse toResponse() {
            return AsyncJobResponse.builder()
                .jobId(jobId)
                .jobType(jobType)
                .modelId(modelId)
                .status(status)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .progressPercent(progressPercent)
                .message(message)
                .errorCode(errorCode)
                .result(result)
                .requestId(requestId)
                .build();
        }
    }
}
