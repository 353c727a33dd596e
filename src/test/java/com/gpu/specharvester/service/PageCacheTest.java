package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.support.StubPageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PageCacheTest {

    private static final String MAIN = "http://catalog.test/review/acme-x1/";

    private StubPageClient client;
    private PageCache cache;

    @BeforeEach
    void setUp() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setBaseUrl("http://catalog.test");
        properties.setMinDelay(Duration.ZERO);
        properties.setMaxDelay(Duration.ZERO);
        properties.setRetryDelays(List.of());
        client = new StubPageClient();
        cache = new PageCache(new PoliteFetcher(client, properties, delay -> { }));
    }

    @Test
    void testSecondReadComesFromCache() {
        client.serve(MAIN, "<html>review</html>");

        assertTrue(cache.prefetch(MAIN));
        assertEquals("<html>review</html>", cache.get(MAIN).orElseThrow());
        assertEquals(1, client.requestCount(MAIN));
        assertTrue(cache.contains(MAIN));
    }

    @Test
    void testFailedFetchIsNotCached() {
        assertTrue(cache.get(MAIN).isEmpty());
        assertFalse(cache.contains(MAIN));
        assertEquals(0, cache.size());
    }
}
