package com.gpu.specharvester.config;

import com.gpu.specharvester.service.JsoupPageClient;
import com.gpu.specharvester.service.PageClient;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Harvester infrastructure beans
 */
@Configuration
public class HarvesterConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public PageClient pageClient() {
        return new JsoupPageClient();
    }

    /**
     * Single background thread that drives harvest runs started through the API or scheduler
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService runDriverExecutor() {
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("harvest-run-"));
    }
}
