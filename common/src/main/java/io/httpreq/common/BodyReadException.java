package io.httpreq.common;

import java.io.IOException;

/**
 * Thrown when a response arrived but its body could not be read to completion.
 */
public class BodyReadException extends RequestException {

    public BodyReadException(final String msg, final IOException cause) {
        super(msg + ": " + cause.getMessage(), cause);
    }
}
