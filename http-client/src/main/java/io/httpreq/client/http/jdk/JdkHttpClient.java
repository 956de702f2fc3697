package io.httpreq.client.http.jdk;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse.BodyHandlers;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import io.httpreq.client.http.Headers;
import io.httpreq.client.http.HttpClient;
import io.httpreq.client.http.HttpRequest;
import io.httpreq.client.http.HttpResponse;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HttpClient} backed by {@link java.net.http.HttpClient}.
 *
 * <p>The JDK applies the request timeout until the response headers arrive; reading the
 * body is bounded by the response expiry that {@link io.httpreq.client.http.RequestBuilder}
 * arms. The body is handed back unread as an {@link InputStream}.
 */
class JdkHttpClient implements HttpClient {

    private static final Logger LOGGER = LoggerFactory.getLogger(JdkHttpClient.class);

    private final java.net.http.HttpClient httpClient;
    private final Duration timeout;

    JdkHttpClient(java.net.http.HttpClient httpClient, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
    }

    java.net.http.HttpClient getHttpClient() {
        return httpClient;
    }

    @Override
    public Duration timeout() {
        return timeout;
    }

    @Override
    public HttpResponse send(HttpRequest request) throws IOException, InterruptedException {
        java.net.http.HttpRequest jdkRequest = toJdkRequest(request);
        java.net.http.HttpResponse<InputStream> response = httpClient.send(jdkRequest, BodyHandlers.ofInputStream());
        LOGGER.debug("{} {} -> {} ({})", request.method(), request.uri(), response.statusCode(), response.version());
        return new HttpResponse(response.statusCode(), toHeaders(response.headers()), response.body());
    }

    private static java.net.http.HttpRequest toJdkRequest(HttpRequest request) throws IOException {
        try {
            java.net.http.HttpRequest.Builder builder = java.net.http.HttpRequest.newBuilder(request.uri())
                    .timeout(request.timeout())
                    .method(request.method(), publisher(request.body()));
            for (Map.Entry<String, List<String>> header : request.headers().asMap().entrySet()) {
                for (String value : header.getValue()) {
                    builder.header(header.getKey(), value);
                }
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Request rejected by the JDK HTTP client: " + e.getMessage(), e);
        }
    }

    private static BodyPublisher publisher(@Nullable InputStream body) {
        if (body == null) {
            return BodyPublishers.noBody();
        }
        return BodyPublishers.ofInputStream(() -> body);
    }

    private static Headers toHeaders(HttpHeaders httpHeaders) {
        Headers headers = new Headers();
        for (Map.Entry<String, List<String>> header : httpHeaders.map().entrySet()) {
            // HTTP/2 pseudo headers
            if (header.getKey().startsWith(":")) {
                continue;
            }
            for (String value : header.getValue()) {
                headers.add(header.getKey(), value);
            }
        }
        return headers;
    }
}
