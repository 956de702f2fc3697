/**
 * Structured body formats and the streaming encoder used for request bodies.
 *
 * <p>Request bodies set through {@code jsonBody} or {@code xmlBody} are never buffered
 * whole: {@link io.httpreq.client.http.codec.BodyEncoder} serializes them on a producer
 * thread into a bounded {@link io.httpreq.client.http.codec.BodyPipe} that the transport
 * drains.
 */
@NullMarked
package io.httpreq.client.http.codec;

import org.jspecify.annotations.NullMarked;
