package io.httpreq.client.http;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import org.jspecify.annotations.Nullable;

/**
 * Request-scoped execution context passed to every terminal send.
 *
 * <p>A context may carry an {@link HttpClient} to use instead of the default one, which is
 * how tests inject a stub transport, a deadline bounding the whole exchange, and
 * string-keyed attributes for caller-defined state.
 * Contexts are immutable; every {@code with*} method returns a derived context.
 *
 * <p>Cancellation follows the usual Java convention: interrupting the sending thread
 * aborts the exchange with an {@link InterruptedException}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RequestContext context = RequestContext.background()
 *     .attachClient(myClient)
 *     .withTimeout(Duration.ofSeconds(5));
 * HttpResponse response = new RequestBuilder().send(context, "GET", "http://localhost:8080/");
 * }</pre>
 */
public final class RequestContext {

    private static final RequestContext BACKGROUND = new RequestContext(null, null, Map.of());

    private final @Nullable HttpClient client;
    private final @Nullable Instant deadline;
    private final Map<String, Object> attributes;

    private RequestContext(@Nullable HttpClient client, @Nullable Instant deadline,
                           Map<String, Object> attributes) {
        this.client = client;
        this.deadline = deadline;
        this.attributes = attributes;
    }

    /**
     * @return the empty context: no attached client and no deadline
     */
    public static RequestContext background() {
        return BACKGROUND;
    }

    /**
     * @param client the client senders should use
     * @return a context carrying {@code client}, replacing any client attached before
     */
    public RequestContext attachClient(HttpClient client) {
        return new RequestContext(checkNotNullParam("client", client), deadline, attributes);
    }

    /**
     * Derives a context with the given deadline. A deadline already present on this
     * context is kept if it is earlier.
     *
     * @param deadline the instant by which the exchange must complete
     * @return the derived context
     */
    public RequestContext withDeadline(Instant deadline) {
        checkNotNullParam("deadline", deadline);
        if (this.deadline != null && this.deadline.isBefore(deadline)) {
            return this;
        }
        return new RequestContext(client, deadline, attributes);
    }

    public RequestContext withTimeout(Duration timeout) {
        checkNotNullParam("timeout", timeout);
        return withDeadline(Instant.now().plus(timeout));
    }

    /**
     * @param key the attribute name
     * @param value the attribute value
     * @return a context carrying the attribute, replacing an earlier value under {@code key}
     */
    public RequestContext withAttribute(String key, Object value) {
        checkNotNullParam("key", key);
        checkNotNullParam("value", value);
        Map<String, Object> copy = new HashMap<>(attributes);
        copy.put(key, value);
        return new RequestContext(client, deadline, Collections.unmodifiableMap(copy));
    }

    public Optional<Object> attribute(String key) {
        return Optional.ofNullable(attributes.get(checkNotNullParam("key", key)));
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public Optional<HttpClient> client() {
        return Optional.ofNullable(client);
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * @param context the context to resolve from
     * @return the client attached to {@code context}, or {@link HttpClient#defaultClient()}
     */
    public static HttpClient clientFrom(RequestContext context) {
        HttpClient attached = checkNotNullParam("context", context).client;
        return attached != null ? attached : HttpClient.defaultClient();
    }
}
