package com.gpu.specharvester.service;

import java.util.Optional;

/**
 * Outcome of a polite fetch. Only {@link Status#SUCCESS} carries a body; every other status means
 * "skip this unit of work and continue the run".
 */
public final class FetchResult {

    public enum Status {
        SUCCESS,
        /** URL was already fetched in this run and dedup was requested */
        DUPLICATE,
        /** Every attempt failed and the retry table ran out */
        EXHAUSTED,
        /** The waiting thread was interrupted, the run is being cancelled */
        INTERRUPTED
    }

    private final String url;
    private final Status status;
    private final String body;
    private final int attempts;
    private final String error;

    private FetchResult(String url, Status status, String body, int attempts, String error) {
        this.url = url;
        this.status = status;
        this.body = body;
        this.attempts = attempts;
        this.error = error;
    }

    public static FetchResult success(String url, String body, int attempts) {
        return new FetchResult(url, Status.SUCCESS, body, attempts, null);
    }

    public static FetchResult duplicate(String url) {
        return new FetchResult(url, Status.DUPLICATE, null, 0, null);
    }

    public static FetchResult exhausted(String url, int attempts, String error) {
        return new FetchResult(url, Status.EXHAUSTED, null, attempts, error);
    }

    public static FetchResult interrupted(String url, int attempts) {
        return new FetchResult(url, Status.INTERRUPTED, null, attempts, "interrupted");
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    public Optional<String> body() {
        return Optional.ofNullable(body);
    }

    public String url() {
        return url;
    }

    public Status status() {
        return status;
    }

    public int attempts() {
        return attempts;
    }

    public String error() {
        return error;
    }

    @Override
    public String toString() {
        return "FetchResult{" + status + ", url=" + url + ", attempts=" + attempts
                + (error != null ? ", error=" + error : "") + "}";
    }
}
