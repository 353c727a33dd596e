package com.gpu.specharvester.service;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Issues a single HTTP GET. Network errors, timeouts and non-2xx responses surface as {@link IOException}.
 */
public interface PageClient {

    String get(String url, Map<String, String> headers, Duration timeout) throws IOException;
}
