package io.httpreq.client.http;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

import java.time.Duration;

import org.junit.jupiter.api.Test;

public class DefaultHttpClientTest {

    @Test
    public void testDefaultTimeoutIsOneMinute() {
        assertEquals(Duration.ofMinutes(1), HttpClient.DEFAULT_TIMEOUT);
        assertEquals(HttpClient.DEFAULT_TIMEOUT, DefaultHttpClient.parseTimeout(null));
        assertEquals(HttpClient.DEFAULT_TIMEOUT, DefaultHttpClient.parseTimeout("  "));
    }

    @Test
    public void testTimeoutProperty() {
        assertEquals(Duration.ofSeconds(30), DefaultHttpClient.parseTimeout("PT30S"));
        assertEquals(Duration.ofMinutes(2), DefaultHttpClient.parseTimeout(" PT2M "));
    }

    @Test
    public void testInvalidTimeoutPropertyFallsBack() {
        assertEquals(HttpClient.DEFAULT_TIMEOUT, DefaultHttpClient.parseTimeout("thirty seconds"));
        assertEquals(HttpClient.DEFAULT_TIMEOUT, DefaultHttpClient.parseTimeout("PT0S"));
        assertEquals(HttpClient.DEFAULT_TIMEOUT, DefaultHttpClient.parseTimeout("-PT5S"));
    }

    @Test
    public void testDefaultClientIsShared() {
        assertSame(HttpClient.defaultClient(), HttpClient.defaultClient());
        assertEquals(DefaultHttpClient.parseTimeout(System.getProperty(DefaultHttpClient.TIMEOUT_PROPERTY)),
                HttpClient.defaultClient().timeout());
    }
}
