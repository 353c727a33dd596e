package com.gpu.specharvester.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed set of worker threads draining one {@link TaskQueue}.
 * <p>
 * A failing task is logged and acknowledged, the worker keeps looping. Cancellation interrupts
 * workers blocked on an empty queue; a task already in flight runs to completion first.
 */
@Slf4j
public class QueueWorkerPool<T> {

    @FunctionalInterface
    public interface TaskHandler<T> {
        void handle(T task) throws Exception;
    }

    private final TaskQueue<T> queue;
    private final TaskHandler<T> handler;
    private final ExecutorService executor;
    private final int workers;

    public QueueWorkerPool(TaskQueue<T> queue, int workers, TaskHandler<T> handler) {
        if (workers < 1) {
            throw new IllegalArgumentException("Queue " + queue.getName() + " needs at least one worker");
        }
        this.queue = queue;
        this.handler = handler;
        this.workers = workers;
        this.executor = Executors.newFixedThreadPool(workers,
                new CustomizableThreadFactory(queue.getName() + "-worker-"));
    }

    public void start() {
        for (int i = 0; i < workers; i++) {
            executor.execute(this::workLoop);
        }
        log.info("Started {} worker(s) on queue {}", workers, queue.getName());
    }

    /**
     * Stop all workers and wait for them to leave their loop
     */
    public void cancel() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Workers of queue {} did not stop within 30s", queue.getName());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        log.info("Cancelled workers of queue {}", queue.getName());
    }

    private void workLoop() {
        while (!Thread.currentThread().isInterrupted()) {
            T task;
            try {
                task = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            try {
                handler.handle(task);
            } catch (InterruptedException e) {
                log.warn("Task on queue {} interrupted: {}", queue.getName(), task);
                Thread.currentThread().interrupt();
            } catch (VirtualMachineError e) {
                log.error("Worker on queue {} stopping on {}", queue.getName(), e.toString());
                throw e;
            } catch (Throwable e) {
                log.warn("Task on queue {} failed, continuing: {} - {}", queue.getName(), task, e.getMessage(), e);
            } finally {
                queue.taskDone();
            }
        }
    }
}
