package io.httpreq.common;

/**
 * Thrown when the method, URL or body of a request cannot be turned into a request.
 * Nothing has been sent when this is thrown.
 */
public class InvalidRequestException extends RequestException {

    public InvalidRequestException(final String msg) {
        super(msg);
    }

    public InvalidRequestException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
