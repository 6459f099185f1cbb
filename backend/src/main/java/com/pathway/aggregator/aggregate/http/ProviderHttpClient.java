package com.pathway.aggregator.aggregate.http;

import com.pathway.aggregator.aggregate.model.HttpFetchResult;
import com.pathway.aggregator.aggregate.util.ProviderFailureReasons;
import com.pathway.aggregator.config.AggregatorProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.StringJoiner;
import java.util.concurrent.ExecutorService;

@Service
public class ProviderHttpClient {
    private static final String JSON_ACCEPT = "application/json,*/*;q=0.8";

    private final AggregatorProperties properties;
    private final HttpClient client;

    public ProviderHttpClient(
        AggregatorProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getProviderTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public HttpFetchResult getJson(String url, Map<String, String> queryParams, Map<String, String> headers) {
        return getJson(withQuery(url, queryParams), headers);
    }

    public HttpFetchResult getJson(String url, Map<String, String> headers) {
        Instant startedAt = Instant.now();
        URI uri = toUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, ProviderFailureReasons.INVALID_URL, "URL missing host or malformed");
        }
        try {
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(Duration.ofSeconds(properties.getProviderTimeoutSeconds()))
                .header("User-Agent", properties.getUserAgent())
                .header("Accept", JSON_ACCEPT)
                .header("Accept-Language", "en-US,en;q=0.8");
            if (headers != null) {
                headers.forEach((name, value) -> {
                    if (value != null) {
                        builder.header(name, value);
                    }
                });
            }
            HttpResponse<String> response = client.send(
                builder.GET().build(),
                HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8)
            );
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Content-Type").orElse(null),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, ProviderFailureReasons.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, ProviderFailureReasons.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, ProviderFailureReasons.INTERRUPTED, e.getMessage());
        } catch (Exception e) {
            return errorResult(url, startedAt, ProviderFailureReasons.UNEXPECTED_ERROR, e.getMessage());
        }
    }

    static String withQuery(String url, Map<String, String> queryParams) {
        if (url == null || queryParams == null || queryParams.isEmpty()) {
            return url;
        }
        StringJoiner joiner = new StringJoiner("&");
        queryParams.forEach((name, value) -> {
            if (value != null && !value.isBlank()) {
                joiner.add(encode(name) + "=" + encode(value));
            }
        });
        if (joiner.length() == 0) {
            return url;
        }
        return url + (url.contains("?") ? "&" : "?") + joiner;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI toUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
