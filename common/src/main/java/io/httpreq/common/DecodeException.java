package io.httpreq.common;

/**
 * Thrown when a fully read response body does not decode into the expected type.
 */
public class DecodeException extends RequestException {

    public DecodeException(final String msg, final Throwable cause) {
        super(msg + ": " + cause.getMessage(), cause);
    }
}
