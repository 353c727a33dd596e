package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Rate-limited fetcher bound to one harvest run.
 * <p>
 * Every successful GET is followed by a randomized politeness delay and recorded in the run's
 * processed-URL set. Failed attempts walk a tiered retry table whose waits grow from minutes to a
 * full day, so a temporary block by the source site is outlasted rather than retried into.
 * Exhausting the table yields an {@link FetchResult.Status#EXHAUSTED} result, never an exception.
 */
@Slf4j
public class PoliteFetcher {

    private final PageClient pageClient;
    private final HarvesterProperties properties;
    private final Sleeper sleeper;
    private final Set<String> processedUrls = ConcurrentHashMap.newKeySet();

    public PoliteFetcher(PageClient pageClient, HarvesterProperties properties, Sleeper sleeper) {
        this.pageClient = pageClient;
        this.properties = properties;
        this.sleeper = sleeper;
    }

    /**
     * Fetch a page, see {@link FetchMode} for resolution and dedup behaviour
     */
    public FetchResult fetch(String url, FetchMode mode) {
        String target = mode.isSiteRelative() ? resolve(url) : url;

        if (mode.isDeduplicated() && processedUrls.contains(target)) {
            log.info("Skipping already processed URL: {}", target);
            return FetchResult.duplicate(target);
        }

        List<Duration> retryDelays = properties.getRetryDelays();
        int maxAttempts = retryDelays.size() + 1;
        int attempt = 0;

        while (true) {
            String body;
            try {
                log.info("Fetching (attempt {}/{}): {}", attempt + 1, maxAttempts, target);
                body = pageClient.get(target, buildHeaders(), properties.getRequestTimeout());
            } catch (MalformedURLException | IllegalArgumentException e) {
                log.error("Invalid URL, not retrying: {} - {}", target, e.getMessage());
                return FetchResult.exhausted(target, attempt + 1, e.getMessage());
            } catch (IOException e) {
                if (attempt >= retryDelays.size()) {
                    log.error("Retry table exhausted after {} attempts, giving up on {}: {}",
                            attempt + 1, target, e.getMessage());
                    return FetchResult.exhausted(target, attempt + 1, e.getMessage());
                }
                Duration delay = retryDelays.get(attempt);
                log.warn("Fetch failed ({}), retrying in {}s (attempt {}/{}): {}",
                        e.getMessage(), delay.toSeconds(), attempt + 1, maxAttempts, target);
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    return FetchResult.interrupted(target, attempt + 1);
                }
                attempt++;
                continue;
            }

            try {
                Duration delay = politenessDelay();
                log.debug("Waiting {} ms after fetching {}", delay.toMillis(), target);
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
            processedUrls.add(target);
            return FetchResult.success(target, body, attempt + 1);
        }
    }

    /**
     * Resolve a site-relative URL against the configured base URL. Absolute URLs pass through.
     */
    public String resolve(String url) {
        try {
            return new URL(new URL(properties.getBaseUrl()), url).toString();
        } catch (MalformedURLException e) {
            log.warn("Cannot resolve {} against {}: {}", url, properties.getBaseUrl(), e.getMessage());
            return url;
        }
    }

    public boolean isProcessed(String resolvedUrl) {
        return processedUrls.contains(resolvedUrl);
    }

    public int processedCount() {
        return processedUrls.size();
    }

    Duration politenessDelay() {
        long min = properties.getMinDelay().toMillis();
        long max = properties.getMaxDelay().toMillis();
        if (max <= min) {
            return Duration.ofMillis(Math.max(min, 0));
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    Map<String, String> buildHeaders() {
        List<String> agents = properties.getUserAgents();
        Map<String, String> headers = new LinkedHashMap<>();
        if (!agents.isEmpty()) {
            headers.put("User-Agent", agents.get(ThreadLocalRandom.current().nextInt(agents.size())));
        }
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", properties.getAcceptLanguage());
        headers.put("Connection", "keep-alive");
        headers.put("Referer", properties.getBaseUrl() + "/");
        headers.put("Upgrade-Insecure-Requests", "1");
        headers.put("Cache-Control", "max-age=0");
        return headers;
    }
}
