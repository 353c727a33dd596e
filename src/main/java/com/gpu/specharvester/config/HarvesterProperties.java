package com.gpu.specharvester.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Configuration
@ConfigurationProperties(prefix = "harvester")
public class HarvesterProperties {

    private String baseUrl = "https://www.techpowerup.com";
    private String listingPath = "/gpu-specs/";

    private List<String> userAgents = new ArrayList<>(List.of(
            "Mozilla/5.0 (Linux; Android 13; SM-S901B) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/112.0.0.0 Mobile Safari/537.36"
    ));
    private String acceptLanguage = "en-US,en;q=0.9";

    private Duration requestTimeout = Duration.ofSeconds(200);

    /**
     * Politeness delay bounds, a uniform value in [minDelay, maxDelay] is slept after every successful fetch
     */
    private Duration minDelay = Duration.ofSeconds(30);
    private Duration maxDelay = Duration.ofSeconds(60);

    /**
     * Tiered retry table: attempt N waits retryDelays[N] before the next attempt.
     * Once the table is exhausted the URL is given up for this run.
     */
    private List<Duration> retryDelays = new ArrayList<>(List.of(
            Duration.ofMinutes(10), Duration.ofMinutes(15), Duration.ofMinutes(20), Duration.ofMinutes(30),
            Duration.ofMinutes(40), Duration.ofHours(1), Duration.ofMinutes(80), Duration.ofHours(2),
            Duration.ofHours(3), Duration.ofHours(4), Duration.ofHours(6), Duration.ofHours(8),
            Duration.ofHours(12), Duration.ofHours(16), Duration.ofHours(24)
    ));

    private int productWorkers = 1;
    private int reviewWorkers = 3;

    private String specDomainTag = "GPU Specs";
    private String relationCategory = "Relations";
    private String parentSpecName = "Parent GPU ID";
    private String boardCategory = "Board";

    /**
     * Review type keyword -> page option keywords accepted for it
     */
    private Map<String, List<String>> reviewTypeRules = defaultReviewTypeRules();

    private Scheduler scheduler = new Scheduler();
    private Notification notification = new Notification();

    private static Map<String, List<String>> defaultReviewTypeRules() {
        Map<String, List<String>> rules = new LinkedHashMap<>();
        rules.put("pictures", List.of("pictures", "teardown", "cooler"));
        rules.put("temperatures", List.of("temperatures", "fan noise", "noise"));
        rules.put("overclocking", List.of("overclocking", "power limits"));
        rules.put("circuit board", List.of("circuit", "pcb", "board analysis"));
        return rules;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = false;
        private String incrementalCron = "0 0 3 * * *";
    }

    @Data
    public static class Notification {
        private List<String> recipients = new ArrayList<>();
        private String sender = "harvester@localhost";
    }
}
