package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Hands out one {@link PoliteFetcher} per run so the processed-URL set never outlives its run
 */
@Component
@RequiredArgsConstructor
public class PoliteFetcherFactory {

    private final PageClient pageClient;
    private final HarvesterProperties properties;

    public PoliteFetcher openSession() {
        return new PoliteFetcher(pageClient, properties, Sleeper.THREAD);
    }
}
