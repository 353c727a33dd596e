package com.gpu.specharvester.service;

import com.gpu.specharvester.config.HarvesterProperties;
import com.gpu.specharvester.support.StubPageClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.MalformedURLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PoliteFetcherTest {

    private static final String PAGE = "http://catalog.test/gpu-specs/acme-x1.c1";

    private HarvesterProperties properties;
    private StubPageClient client;
    private List<Duration> sleeps;
    private PoliteFetcher fetcher;

    @BeforeEach
    void setUp() {
        properties = new HarvesterProperties();
        properties.setBaseUrl("http://catalog.test");
        properties.setMinDelay(Duration.ZERO);
        properties.setMaxDelay(Duration.ZERO);
        properties.setRetryDelays(List.of(Duration.ofMinutes(10), Duration.ofMinutes(15), Duration.ofHours(1)));
        client = new StubPageClient();
        sleeps = new ArrayList<>();
        fetcher = new PoliteFetcher(client, properties, sleeps::add);
    }

    @Test
    void testRetryTableExhaustion() {
        FetchResult result = fetcher.fetch(PAGE, FetchMode.ABSOLUTE);

        assertEquals(FetchResult.Status.EXHAUSTED, result.status());
        assertFalse(result.isSuccess());
        assertTrue(result.body().isEmpty());
        assertEquals(4, result.attempts());
        assertEquals(4, client.requestCount(PAGE));
        assertEquals(List.of(Duration.ofMinutes(10), Duration.ofMinutes(15), Duration.ofHours(1)), sleeps);
        assertFalse(fetcher.isProcessed(PAGE));
    }

    @Test
    void testRecoversAfterTransientFailure() {
        PageClient flaky = new PageClient() {
            private int calls;

            @Override
            public String get(String url, Map<String, String> headers, Duration timeout) throws IOException {
                if (calls++ < 2) {
                    throw new IOException("connection reset");
                }
                return "<html>ok</html>";
            }
        };
        fetcher = new PoliteFetcher(flaky, properties, sleeps::add);

        FetchResult result = fetcher.fetch(PAGE, FetchMode.ABSOLUTE);

        assertTrue(result.isSuccess());
        assertEquals("<html>ok</html>", result.body().orElseThrow());
        assertEquals(3, result.attempts());
        // two retry waits, then the politeness delay after the success
        assertEquals(List.of(Duration.ofMinutes(10), Duration.ofMinutes(15), Duration.ZERO), sleeps);
    }

    @Test
    void testMalformedUrlIsNotRetried() {
        PageClient broken = (url, headers, timeout) -> {
            throw new MalformedURLException("no protocol: " + url);
        };
        fetcher = new PoliteFetcher(broken, properties, sleeps::add);

        FetchResult result = fetcher.fetch("not a url", FetchMode.ABSOLUTE);

        assertEquals(FetchResult.Status.EXHAUSTED, result.status());
        assertEquals(1, result.attempts());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    void testDuplicateFetchIssuesOneRequest() {
        client.serve(PAGE, "<html>x1</html>");

        FetchResult first = fetcher.fetch(PAGE, FetchMode.ABSOLUTE);
        FetchResult second = fetcher.fetch(PAGE, FetchMode.ABSOLUTE);

        assertTrue(first.isSuccess());
        assertEquals(FetchResult.Status.DUPLICATE, second.status());
        assertEquals(1, client.requestCount(PAGE));
        assertTrue(fetcher.isProcessed(PAGE));
        assertEquals(1, fetcher.processedCount());
    }

    @Test
    void testRefreshBypassesDedup() {
        client.serve(PAGE, "<html>x1</html>");

        fetcher.fetch(PAGE, FetchMode.ABSOLUTE);
        FetchResult refreshed = fetcher.fetch(PAGE, FetchMode.REFRESH);

        assertTrue(refreshed.isSuccess());
        assertEquals(2, client.requestCount(PAGE));
    }

    @Test
    void testSiteRelativeResolution() {
        client.serve(PAGE, "<html>x1</html>");

        FetchResult result = fetcher.fetch("/gpu-specs/acme-x1.c1", FetchMode.SITE_RELATIVE);

        assertTrue(result.isSuccess());
        assertEquals(PAGE, result.url());
        assertEquals(FetchResult.Status.DUPLICATE, fetcher.fetch(PAGE, FetchMode.SITE_RELATIVE).status());
        assertEquals("https://other.test/a", fetcher.resolve("https://other.test/a"));
    }

    @Test
    void testPolitenessDelayStaysWithinBounds() {
        properties.setMinDelay(Duration.ofSeconds(30));
        properties.setMaxDelay(Duration.ofSeconds(60));

        for (int i = 0; i < 50; i++) {
            Duration delay = fetcher.politenessDelay();
            assertTrue(delay.compareTo(Duration.ofSeconds(30)) >= 0);
            assertTrue(delay.compareTo(Duration.ofSeconds(60)) <= 0);
        }
    }

    @Test
    void testHeadersCarryConfiguredAgent() {
        properties.setUserAgents(List.of("TestAgent/1.0"));

        Map<String, String> headers = fetcher.buildHeaders();

        assertEquals("TestAgent/1.0", headers.get("User-Agent"));
        assertEquals("http://catalog.test/", headers.get("Referer"));
    }
}
