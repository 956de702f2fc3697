package io.httpreq.client.http;

import java.time.Duration;
import java.time.format.DateTimeParseException;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Holder of the process-wide default client, created on first use.
 */
final class DefaultHttpClient {

    /** System property holding an ISO-8601 duration that replaces the one-minute default. */
    static final String TIMEOUT_PROPERTY = "httpreq.client.default-timeout";

    private static final Logger LOGGER = LoggerFactory.getLogger(DefaultHttpClient.class);

    private DefaultHttpClient() {
    }

    static HttpClient get() {
        return Holder.INSTANCE;
    }

    static Duration parseTimeout(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return HttpClient.DEFAULT_TIMEOUT;
        }
        try {
            Duration timeout = Duration.parse(value.trim());
            if (timeout.isZero() || timeout.isNegative()) {
                LOGGER.warn("Ignoring non-positive {}={}, using {}", TIMEOUT_PROPERTY, value, HttpClient.DEFAULT_TIMEOUT);
                return HttpClient.DEFAULT_TIMEOUT;
            }
            return timeout;
        } catch (DateTimeParseException e) {
            LOGGER.warn("Ignoring unparseable {}={}, using {}", TIMEOUT_PROPERTY, value, HttpClient.DEFAULT_TIMEOUT);
            return HttpClient.DEFAULT_TIMEOUT;
        }
    }

    private static final class Holder {
        static final HttpClient INSTANCE = HttpClientBuilder.newBuilder()
                .timeout(parseTimeout(System.getProperty(TIMEOUT_PROPERTY)))
                .create();
    }
}
