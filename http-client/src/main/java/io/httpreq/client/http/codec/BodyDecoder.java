package io.httpreq.client.http.codec;

import io.httpreq.common.DecodeException;

/**
 * Turns a fully read response body into a value.
 *
 * @param <T> the decoded type
 */
@FunctionalInterface
public interface BodyDecoder<T> {

    T decode(byte[] data) throws DecodeException;
}
