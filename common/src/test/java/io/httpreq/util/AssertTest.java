package io.httpreq.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class AssertTest {

    @Test
    void testCheckNotNullParamReturnsValue() {
        Object value = new Object();
        assertSame(value, Assert.checkNotNullParam("value", value));
    }

    @Test
    void testCheckNotNullParamNamesParameter() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Assert.checkNotNullParam("url", null));
        assertEquals("Parameter 'url' may not be null", e.getMessage());
    }

    @Test
    void testCheckNotBlankParam() {
        assertEquals("GET", Assert.checkNotBlankParam("method", "GET"));

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> Assert.checkNotBlankParam("method", "  "));
        assertEquals("Parameter 'method' may not be blank", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> Assert.checkNotBlankParam("method", null));
    }
}
