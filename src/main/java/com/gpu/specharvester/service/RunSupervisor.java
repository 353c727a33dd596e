package com.gpu.specharvester.service;

import com.gpu.specharvester.dto.RunStartResult;
import com.gpu.specharvester.dto.RunStatus;
import com.gpu.specharvester.dto.RunSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Single-flight owner of harvest runs.
 * <p>
 * The supervisor is the only writer of run state. A start request is accepted only while no run is
 * active; the run itself executes on the run driver thread and always ends with a summary, also when
 * it fails.
 */
@Service
@Slf4j
public class RunSupervisor {

    private final HarvestPipeline pipeline;
    private final ReviewReconciliationService reconciliation;
    private final SpecCategoryRegistry categoryRegistry;
    private final CompletionNotifier notifier;
    private final ExecutorService runDriver;
    private final Clock clock;

    private final ReentrantLock stateLock = new ReentrantLock();
    private RunState state = RunState.IDLE;
    private RunMode currentMode;
    private RunStatistics currentStats;
    private RunSummary lastSummary;

    public RunSupervisor(HarvestPipeline pipeline,
                         ReviewReconciliationService reconciliation,
                         SpecCategoryRegistry categoryRegistry,
                         CompletionNotifier notifier,
                         @Qualifier("runDriverExecutor") ExecutorService runDriver,
                         Clock clock) {
        this.pipeline = pipeline;
        this.reconciliation = reconciliation;
        this.categoryRegistry = categoryRegistry;
        this.notifier = notifier;
        this.runDriver = runDriver;
        this.clock = clock;
    }

    /**
     * Start a run in the background
     *
     * @param gpuName optional GPU name, only used by {@link RunMode#DEFAULT}
     */
    public RunStartResult start(RunMode mode, String gpuName) {
        RunStatistics stats = new RunStatistics();
        LocalDateTime startedAt = LocalDateTime.now(clock);
        String target = mode == RunMode.DEFAULT && gpuName != null && !gpuName.isBlank() ? gpuName.trim() : null;

        stateLock.lock();
        try {
            if (state == RunState.RUNNING) {
                log.warn("Rejected {} run: a {} run is already in progress", mode.label(), currentMode.label());
                return RunStartResult.rejected("A " + currentMode.label() + " run is already in progress");
            }
            state = RunState.RUNNING;
            currentMode = mode;
            currentStats = stats;
        } finally {
            stateLock.unlock();
        }

        try {
            runDriver.execute(() -> drive(mode, target, stats, startedAt));
        } catch (RejectedExecutionException e) {
            log.error("Run driver refused the {} run: {}", mode.label(), e.getMessage());
            finish(RunSummary.builder()
                    .mode(mode)
                    .target(target)
                    .startedAt(startedAt)
                    .completedAt(startedAt)
                    .success(false)
                    .error("Run driver unavailable")
                    .build());
            return RunStartResult.rejected("Run driver unavailable");
        }

        log.info("Started {} run{}", mode.label(), target != null ? " for GPU '" + target + "'" : "");
        return RunStartResult.accepted("Started " + mode.label() + " run");
    }

    public RunStatus status() {
        stateLock.lock();
        try {
            boolean running = state == RunState.RUNNING;
            return new RunStatus(
                    state,
                    running,
                    currentMode,
                    running ? currentStats.getPhase() : null,
                    running ? currentStats.getProgress() : (lastSummary != null ? 100 : 0),
                    lastSummary);
        } finally {
            stateLock.unlock();
        }
    }

    public boolean isRunning() {
        return status().running();
    }

    private void drive(RunMode mode, String target, RunStatistics stats, LocalDateTime startedAt) {
        categoryRegistry.reset();
        String error = null;
        VirtualMachineError fatal = null;
        try {
            switch (mode) {
                case DEFAULT -> pipeline.run(stats, target);
                case FULL -> logWritten(mode, reconciliation.fullUpdate(stats), stats);
                case INCREMENTAL -> logWritten(mode, reconciliation.incrementalUpdate(stats), stats);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "Run interrupted";
            log.warn("{} run interrupted", mode.label());
        } catch (Throwable e) {
            error = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            log.error("{} run failed: {}", mode.label(), error, e);
            if (e instanceof VirtualMachineError) {
                fatal = (VirtualMachineError) e;
            }
        }

        LocalDateTime completedAt = LocalDateTime.now(clock);
        RunSummary summary = RunSummary.builder()
                .mode(mode)
                .target(target)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .elapsedSeconds(Duration.between(startedAt, completedAt).toMillis() / 1000.0)
                .products(stats.getProducts())
                .boards(stats.getBoards())
                .specs(stats.getSpecs())
                .reviews(stats.getReviews())
                .updatedReviews(stats.getUpdatedReviews())
                .errors(stats.getErrors())
                .success(error == null)
                .error(error)
                .build();
        finish(summary);
        if (fatal != null) {
            throw fatal;
        }
    }

    private static void logWritten(RunMode mode, int written, RunStatistics stats) {
        if (written != stats.getUpdatedReviews()) {
            log.warn("{} run wrote {} review(s) but counted {}", mode.label(), written, stats.getUpdatedReviews());
        } else {
            log.info("{} run wrote {} review(s)", mode.label(), written);
        }
    }

    private void finish(RunSummary summary) {
        stateLock.lock();
        try {
            lastSummary = summary;
            state = summary.isSuccess() ? RunState.COMPLETED : RunState.FAILED;
        } finally {
            stateLock.unlock();
        }
        log.info("{} run {} in {}s: {} products, {} boards, {} specs, {} reviews, {} updated reviews, {} errors",
                summary.getMode().label(), summary.isSuccess() ? "completed" : "failed", summary.getElapsedSeconds(),
                summary.getProducts(), summary.getBoards(), summary.getSpecs(), summary.getReviews(),
                summary.getUpdatedReviews(), summary.getErrors());

        try {
            notifier.runCompleted(summary);
        } catch (RuntimeException e) {
            log.error("Completion notification failed: {}", e.getMessage(), e);
        }
    }
}
