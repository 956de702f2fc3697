package io.httpreq.client.http;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link ResultWrapper#send(RequestContext, String, String)}.
 *
 * @param response the response; its body has been read to completion and closed, so
 *                 reading it again fails. Use {@code rawData} instead
 * @param rawData every byte of the response body
 * @param value the decoded body, or {@code null} when the wrapper has no decoder
 * @param <T> the decoded type
 */
public record SendOutcome<T>(HttpResponse response, byte[] rawData, @Nullable T value) {
}
