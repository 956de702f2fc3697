package io.httpreq.common;

/**
 * Base exception for failures raised by the request builder and the result wrapper.
 * <p>
 * Each subclass identifies the stage that failed:
 * <ul>
 *   <li>{@link InvalidRequestException} - the request could not be constructed</li>
 *   <li>{@link BodyReadException} - the response body could not be read</li>
 *   <li>{@link DecodeException} - the response body could not be decoded</li>
 * </ul>
 * Transport failures are not wrapped; they surface as the {@link java.io.IOException}
 * or {@link InterruptedException} raised by the transport.
 */
public class RequestException extends Exception {

    public RequestException() {
        super();
    }

    public RequestException(final String msg) {
        super(msg);
    }

    public RequestException(final Throwable cause) {
        super(cause);
    }

    public RequestException(final String msg, final Throwable cause) {
        super(msg, cause);
    }
}
