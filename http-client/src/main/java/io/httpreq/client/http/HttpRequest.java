package io.httpreq.client.http;

import java.io.InputStream;
import java.net.URI;
import java.time.Duration;

import org.jspecify.annotations.Nullable;

/**
 * A fully formed request handed to an {@link HttpClient}.
 *
 * @param method the request method, e.g. {@code POST}
 * @param uri the absolute target URI
 * @param headers the request headers, a copy owned by this request
 * @param body the body stream, or {@code null} for a request without a body
 * @param timeout the time allowed for the exchange
 */
public record HttpRequest(String method, URI uri, Headers headers, @Nullable InputStream body, Duration timeout) {
}
