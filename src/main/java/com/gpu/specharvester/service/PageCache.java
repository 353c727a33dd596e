package com.gpu.specharvester.service;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * URL to body memo shared by the phases of one reconciliation run.
 * Fetches through it bypass the dedup set, the cache itself prevents the second request.
 */
@Slf4j
public class PageCache {

    private final PoliteFetcher fetcher;
    private final Map<String, String> bodies = new ConcurrentHashMap<>();

    public PageCache(PoliteFetcher fetcher) {
        this.fetcher = fetcher;
    }

    /**
     * Cached body if present, otherwise a fresh fetch whose body is remembered
     */
    public Optional<String> get(String url) {
        String cached = bodies.get(url);
        if (cached != null) {
            log.debug("Page cache hit: {}", url);
            return Optional.of(cached);
        }
        FetchResult result = fetcher.fetch(url, FetchMode.REFRESH);
        if (!result.isSuccess()) {
            log.warn("Could not fetch {}: {}", url, result);
            return Optional.empty();
        }
        String body = result.body().orElse("");
        bodies.put(url, body);
        return Optional.of(body);
    }

    /**
     * Fetch and remember a page ahead of its use
     */
    public boolean prefetch(String url) {
        return get(url).isPresent();
    }

    public boolean contains(String url) {
        return bodies.containsKey(url);
    }

    public int size() {
        return bodies.size();
    }
}
