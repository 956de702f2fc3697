package io.httpreq.client.http;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import io.httpreq.client.http.codec.BodyCodec;
import io.httpreq.client.http.codec.BodyEncoder;
import io.httpreq.common.HttpReqErrorMessages;
import io.httpreq.common.InvalidRequestException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fluent builder for a single outbound HTTP request.
 *
 * <p>Configuration methods mutate this builder and return it for chaining. The terminal
 * {@link #send(RequestContext, String, String)} returns the raw response; the
 * {@code with*Result} methods wrap the builder in a {@link ResultWrapper} that also reads
 * and optionally decodes the response body.
 *
 * <p>Builders are meant to be used once by a single thread. A second send re-encodes a
 * JSON or XML body; a body given as an {@link InputStream} can only be sent once.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Greeting greeting = new RequestBuilder()
 *     .timeout(Duration.ofSeconds(10))
 *     .bearerAuth(token)
 *     .jsonBody(new Greeting("hi"))
 *     .withJsonResult(Greeting.class)
 *     .send(context, "POST", "http://localhost:8080/greetings")
 *     .value();
 * }</pre>
 */
public class RequestBuilder {

    private static final Logger LOGGER = LoggerFactory.getLogger(RequestBuilder.class);

    private final Headers headers = new Headers();
    private @Nullable Duration timeout;
    private @Nullable BodySource body;

    public RequestBuilder() {
    }

    /**
     * Overrides the timeout of the resolved client for this request only. The client
     * itself is left untouched.
     *
     * @param timeout a positive duration
     * @return this builder
     */
    public RequestBuilder timeout(Duration timeout) {
        checkNotNullParam("timeout", timeout);
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Parameter 'timeout' must be positive");
        }
        this.timeout = timeout;
        return this;
    }

    /**
     * Sets the body to an arbitrary stream. Content-Type is not changed.
     *
     * @param body the body stream, read once by the transport and closed with the response
     * @return this builder
     */
    public RequestBuilder body(InputStream body) {
        this.body = new StreamBody(checkNotNullParam("body", body));
        return this;
    }

    /**
     * Sets the body to the JSON representation of {@code value} and Content-Type to
     * {@code application/json}. Serialization happens while the request is sent; a
     * serialization failure surfaces as an {@link IOException} from the send.
     *
     * @param value the value to serialize
     * @return this builder
     */
    public RequestBuilder jsonBody(Object value) {
        return encodedBody(BodyCodec.JSON, value);
    }

    /**
     * Sets the body to the XML representation of {@code value} and Content-Type to
     * {@code application/xml}. Same streaming behaviour as {@link #jsonBody(Object)}.
     *
     * @param value the value to serialize
     * @return this builder
     */
    public RequestBuilder xmlBody(Object value) {
        return encodedBody(BodyCodec.XML, value);
    }

    private RequestBuilder encodedBody(BodyCodec codec, Object value) {
        this.body = new EncodedBody(codec, checkNotNullParam("value", value));
        headers.set(HttpClient.CONTENT_TYPE, codec.mediaType());
        return this;
    }

    /**
     * Replaces every value of header {@code key} with {@code value}.
     *
     * @param key the header name, case-insensitive
     * @param value the header value
     * @return this builder
     */
    public RequestBuilder header(String key, String value) {
        headers.set(key, value);
        return this;
    }

    /**
     * Appends {@code value} to the values of header {@code key}.
     *
     * @param key the header name, case-insensitive
     * @param value the header value
     * @return this builder
     */
    public RequestBuilder addHeader(String key, String value) {
        headers.add(key, value);
        return this;
    }

    public RequestBuilder contentType(String contentType) {
        return header(HttpClient.CONTENT_TYPE, contentType);
    }

    public RequestBuilder accept(String accept) {
        return header(HttpClient.ACCEPT, accept);
    }

    /**
     * Sets the Authorization header to HTTP Basic credentials. The credentials are
     * joined as {@code username:password}, UTF-8 encoded and base64 encoded.
     *
     * @param username the user name
     * @param password the password
     * @return this builder
     */
    public RequestBuilder basicAuth(String username, String password) {
        checkNotNullParam("username", username);
        checkNotNullParam("password", password);
        String credentials = username + ":" + password;
        return header(HttpClient.AUTHORIZATION,
                "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8)));
    }

    /**
     * Sets the Authorization header to {@code Bearer <token>}, token passed verbatim.
     *
     * @param token the bearer token
     * @return this builder
     */
    public RequestBuilder bearerAuth(String token) {
        return header(HttpClient.AUTHORIZATION, "Bearer " + checkNotNullParam("token", token));
    }

    /**
     * @return the headers accumulated so far, live view
     */
    public Headers headers() {
        return headers;
    }

    public Optional<Duration> timeout() {
        return Optional.ofNullable(timeout);
    }

    /**
     * @return a wrapper whose send returns the response together with its body bytes
     */
    public ResultWrapper<Void> withResult() {
        return new ResultWrapper<>(this, null);
    }

    /**
     * Sets Accept to {@code application/json} unless an Accept header is already present
     * and returns a wrapper that decodes the response body as JSON.
     *
     * @param type the type to decode into
     * @param <T> the decoded type
     * @return the wrapper
     */
    public <T> ResultWrapper<T> withJsonResult(Class<T> type) {
        acceptIfAbsent(BodyCodec.JSON);
        return new ResultWrapper<>(this, BodyCodec.JSON.decoder(type));
    }

    public <T> ResultWrapper<T> withJsonResult(TypeReference<T> type) {
        acceptIfAbsent(BodyCodec.JSON);
        return new ResultWrapper<>(this, BodyCodec.JSON.decoder(type));
    }

    /**
     * Sets Accept to {@code application/xml} unless an Accept header is already present
     * and returns a wrapper that decodes the response body as XML.
     *
     * @param type the type to decode into
     * @param <T> the decoded type
     * @return the wrapper
     */
    public <T> ResultWrapper<T> withXmlResult(Class<T> type) {
        acceptIfAbsent(BodyCodec.XML);
        return new ResultWrapper<>(this, BodyCodec.XML.decoder(type));
    }

    public <T> ResultWrapper<T> withXmlResult(TypeReference<T> type) {
        acceptIfAbsent(BodyCodec.XML);
        return new ResultWrapper<>(this, BodyCodec.XML.decoder(type));
    }

    private void acceptIfAbsent(BodyCodec codec) {
        String accept = headers.get(HttpClient.ACCEPT);
        if (accept == null || accept.isEmpty()) {
            headers.set(HttpClient.ACCEPT, codec.mediaType());
        }
    }

    /**
     * Sends the request using the client attached to {@code context}, or the default
     * client when none is attached.
     *
     * <p>The response body is not read; the caller must close the returned response.
     * The timeout covers the whole exchange: once it runs out, the response is closed
     * and reading its body fails with an {@link HttpTimeoutException}. Closing the
     * response also closes the request body.
     *
     * @param context the execution context
     * @param method the request method
     * @param url the absolute request URL
     * @return the response
     * @throws InvalidRequestException if the method or URL is invalid, or the body stream was
     *         already consumed by an earlier send; nothing is sent in that case
     * @throws IOException if the transport fails, including timeouts and body encoding failures
     * @throws InterruptedException if the calling thread is interrupted
     */
    public HttpResponse send(RequestContext context, String method, String url)
            throws InvalidRequestException, IOException, InterruptedException {
        checkNotNullParam("context", context);
        checkNotNullParam("method", method);
        checkNotNullParam("url", url);

        if (!Headers.isToken(method)) {
            throw new InvalidRequestException("request: invalid method \"" + method + "\"");
        }
        URI uri = parseUrl(url);

        HttpClient client = RequestContext.clientFrom(context);
        Duration effectiveTimeout = effectiveTimeout(context, client);
        Instant exchangeDeadline = Instant.now().plus(effectiveTimeout);

        InputStream bodyStream = body != null ? body.open() : null;
        HttpRequest request = new HttpRequest(method, uri, headers.copy(), bodyStream, effectiveTimeout);

        LOGGER.debug("Sending {} {} (timeout {})", method, uri, effectiveTimeout);
        HttpResponse response;
        try {
            response = client.send(request);
        } catch (IOException | InterruptedException | RuntimeException e) {
            closeAfterFailure(bodyStream, e);
            throw e;
        }
        LOGGER.debug("Received {} for {} {}", response.statusCode(), method, uri);
        if (bodyStream != null) {
            response.attach(bodyStream);
        }
        response.expireAt(exchangeDeadline);
        return response;
    }

    private static URI parseUrl(String url) throws InvalidRequestException {
        URI uri;
        try {
            uri = new URI(url);
        } catch (URISyntaxException e) {
            throw new InvalidRequestException("request: invalid URL \"" + url + "\": " + e.getMessage(), e);
        }
        if (!uri.isAbsolute() || uri.getHost() == null) {
            throw new InvalidRequestException("request: URL \"" + url + "\" is not absolute");
        }
        return uri;
    }

    private Duration effectiveTimeout(RequestContext context, HttpClient client) throws HttpTimeoutException {
        Duration effective = timeout != null ? timeout : client.timeout();
        Optional<Instant> deadline = context.deadline();
        if (deadline.isPresent()) {
            Duration left = Duration.between(Instant.now(), deadline.get());
            if (left.isZero() || left.isNegative()) {
                throw new HttpTimeoutException(HttpReqErrorMessages.DEADLINE_EXCEEDED);
            }
            if (left.compareTo(effective) < 0) {
                effective = left;
            }
        }
        return effective;
    }

    private static void closeAfterFailure(@Nullable InputStream bodyStream, Exception failure) {
        if (bodyStream == null) {
            return;
        }
        try {
            bodyStream.close();
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }

    private interface BodySource {
        InputStream open() throws InvalidRequestException;
    }

    private static final class StreamBody implements BodySource {
        private final InputStream stream;
        private boolean opened;

        StreamBody(InputStream stream) {
            this.stream = stream;
        }

        @Override
        public InputStream open() throws InvalidRequestException {
            if (opened) {
                throw new InvalidRequestException(HttpReqErrorMessages.BODY_ALREADY_CONSUMED);
            }
            opened = true;
            return stream;
        }
    }

    private record EncodedBody(BodyCodec codec, Object value) implements BodySource {
        @Override
        public InputStream open() {
            return BodyEncoder.encode(codec, value);
        }
    }
}
