package io.httpreq.client.http;

import java.io.IOException;
import java.time.Duration;

/**
 * Transport used by {@link RequestBuilder} to exchange a request for a response.
 *
 * <p>Implementations must not read or close the response body. A client instance is
 * never mutated by the request builder, so one instance can be shared by concurrent
 * senders with different timeouts.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // A transport that echoes the request body, useful in tests
 * HttpClient echo = request -> new HttpResponse(200, new Headers(), request.body());
 * RequestContext context = RequestContext.background().attachClient(echo);
 * }</pre>
 */
@FunctionalInterface
public interface HttpClient {

    /** Timeout of the default client. */
    Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);

    /** HTTP Content-Type header name. */
    String CONTENT_TYPE = "Content-Type";
    /** HTTP Accept header name. */
    String ACCEPT = "Accept";
    /** HTTP Authorization header name. */
    String AUTHORIZATION = "Authorization";
    /** JSON content type value. */
    String APPLICATION_JSON = "application/json";
    /** XML content type value. */
    String APPLICATION_XML = "application/xml";

    /**
     * Sends a request and returns as soon as the response headers are available.
     *
     * @param request the request to send
     * @return the response, body unread
     * @throws IOException if the exchange fails, including timeouts
     * @throws InterruptedException if the calling thread is interrupted
     */
    HttpResponse send(HttpRequest request) throws IOException, InterruptedException;

    /**
     * @return the timeout used when a request does not override it
     */
    default Duration timeout() {
        return DEFAULT_TIMEOUT;
    }

    /**
     * @return the process-wide client used when no client is attached to a {@link RequestContext}
     */
    static HttpClient defaultClient() {
        return DefaultHttpClient.get();
    }
}
