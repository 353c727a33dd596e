package com.gpu.specharvester.service;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live counters of one run, written by worker threads and read by status requests
 */
public class RunStatistics {

    private final AtomicInteger products = new AtomicInteger();
    private final AtomicInteger boards = new AtomicInteger();
    private final AtomicInteger specs = new AtomicInteger();
    private final AtomicInteger reviews = new AtomicInteger();
    private final AtomicInteger updatedReviews = new AtomicInteger();
    private final AtomicInteger errors = new AtomicInteger();
    private final AtomicInteger progress = new AtomicInteger();
    private volatile String phase = "idle";

    public void productStored(int specCount) {
        products.incrementAndGet();
        specs.addAndGet(specCount);
    }

    public void boardStored(int specCount) {
        boards.incrementAndGet();
        specs.addAndGet(specCount);
    }

    public void reviewStored(int specCount) {
        reviews.incrementAndGet();
        specs.addAndGet(specCount);
    }

    public void reviewUpdated(int specCount) {
        updatedReviews.incrementAndGet();
        specs.addAndGet(specCount);
    }

    public void error() {
        errors.incrementAndGet();
    }

    public void phase(String phase, int progressPercent) {
        this.phase = phase;
        this.progress.set(Math.max(0, Math.min(100, progressPercent)));
    }

    public String getPhase() {
        return phase;
    }

    public int getProgress() {
        return progress.get();
    }

    public int getProducts() {
        return products.get();
    }

    public int getBoards() {
        return boards.get();
    }

    public int getSpecs() {
        return specs.get();
    }

    public int getReviews() {
        return reviews.get();
    }

    public int getUpdatedReviews() {
        return updatedReviews.get();
    }

    public int getErrors() {
        return errors.get();
    }
}
