package com.gpu.specharvester.service;

import org.jsoup.Connection;
import org.jsoup.Jsoup;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * {@link PageClient} backed by Jsoup's connection API. Jsoup raises
 * {@link org.jsoup.HttpStatusException} for non-2xx status codes.
 */
public class JsoupPageClient implements PageClient {

    @Override
    public String get(String url, Map<String, String> headers, Duration timeout) throws IOException {
        Connection.Response response = Jsoup.connect(url)
                .headers(headers)
                .timeout((int) timeout.toMillis())
                .followRedirects(true)
                .maxBodySize(0)
                .execute();
        return response.body();
    }
}
