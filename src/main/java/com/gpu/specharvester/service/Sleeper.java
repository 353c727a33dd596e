package com.gpu.specharvester.service;

import java.time.Duration;

/**
 * Suspension point for politeness and retry waits
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
