/**
 * Fluent HTTP request builder with optional response decoding.
 *
 * <h2>Core Components</h2>
 * <ul>
 *   <li>{@link io.httpreq.client.http.RequestBuilder} - accumulates headers, timeout and body,
 *       sends the request and returns the raw response</li>
 *   <li>{@link io.httpreq.client.http.ResultWrapper} - reads and optionally decodes the
 *       response body, returning a {@link io.httpreq.client.http.SendOutcome}</li>
 *   <li>{@link io.httpreq.client.http.RequestContext} - carries the client to use and an
 *       optional deadline</li>
 *   <li>{@link io.httpreq.client.http.HttpClient} - the transport; the default implementation
 *       is backed by the JDK HTTP client</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * // Raw response, caller closes it
 * try (HttpResponse response = new RequestBuilder()
 *         .basicAuth("username", "password")
 *         .jsonBody(payload)
 *         .send(RequestContext.background(), "POST", "http://localhost:8080/messages")) {
 *     byte[] body = response.body().readAllBytes();
 * }
 *
 * // Decoded response
 * SendOutcome<Message> outcome = new RequestBuilder()
 *     .withJsonResult(Message.class)
 *     .send(RequestContext.background(), "GET", "http://localhost:8080/messages/1");
 * Message message = outcome.value();
 * }</pre>
 *
 * <h2>Testing</h2>
 * <p>Attach a stub client to the context to avoid real network traffic:
 * <pre>{@code
 * RequestContext context = RequestContext.background()
 *     .attachClient(request -> new HttpResponse(200, new Headers(), request.body()));
 * }</pre>
 */
@NullMarked
package io.httpreq.client.http;

import org.jspecify.annotations.NullMarked;
