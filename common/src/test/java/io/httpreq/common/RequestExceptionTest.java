package io.httpreq.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.io.IOException;

import org.junit.jupiter.api.Test;

/**
 * Unit tests for the {@link RequestException} hierarchy.
 */
class RequestExceptionTest {

    // ========== Constructor Tests ==========

    @Test
    void testConstructor_noArgs() {
        RequestException exception = new RequestException();
        assertNull(exception.getMessage());
        assertNull(exception.getCause());
    }

    @Test
    void testConstructor_messageAndCause() {
        RuntimeException cause = new RuntimeException("underlying");
        RequestException exception = new RequestException("failed", cause);

        assertEquals("failed", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testConstructor_causeOnly() {
        RuntimeException cause = new RuntimeException("underlying");
        RequestException exception = new RequestException(cause);

        assertSame(cause, exception.getCause());
        assert exception.getMessage().contains("RuntimeException");
    }

    // ========== Stage Tests ==========

    @Test
    void testInvalidRequestException() {
        InvalidRequestException exception = new InvalidRequestException(HttpReqErrorMessages.MISSING_REQUEST);

        assertEquals("request: missing request", exception.getMessage());
        assertInstanceOf(RequestException.class, exception);
    }

    @Test
    void testBodyReadExceptionMessageIncludesCause() {
        IOException cause = new IOException("connection reset");
        BodyReadException exception = new BodyReadException(HttpReqErrorMessages.READ_RESPONSE_BODY, cause);

        assertEquals("request: read response body: connection reset", exception.getMessage());
        assertSame(cause, exception.getCause());
    }

    @Test
    void testDecodeExceptionMessageIncludesCause() {
        IOException cause = new IOException("Unexpected end-of-input");
        DecodeException exception = new DecodeException(HttpReqErrorMessages.UNMARSHAL_JSON, cause);

        assertEquals("request: unmarshal JSON: Unexpected end-of-input", exception.getMessage());
        assertSame(cause, exception.getCause());
        assertInstanceOf(RequestException.class, exception);
    }
}
