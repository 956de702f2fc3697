package io.httpreq.common;

/**
 * Error messages shared by the request builder and the result wrapper.
 */
public final class HttpReqErrorMessages {

    public static final String MISSING_REQUEST = "request: missing request";
    public static final String READ_RESPONSE_BODY = "request: read response body";
    public static final String UNMARSHAL_JSON = "request: unmarshal JSON";
    public static final String UNMARSHAL_XML = "request: unmarshal XML";
    public static final String BODY_ALREADY_CONSUMED =
            "request: body stream was consumed by a previous send, builders are single-use";
    public static final String DEADLINE_EXCEEDED = "request: context deadline exceeded";
    public static final String RESPONSE_DEADLINE_EXCEEDED =
            "request: timeout exceeded while reading response body";

    private HttpReqErrorMessages() {
        // Utility class
    }
}
