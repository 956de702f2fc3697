package io.httpreq.client.http.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

public class BodyEncoderTest {

    public static class Counting {
        static final AtomicInteger SERIALIZED = new AtomicInteger();

        public String getName() {
            SERIALIZED.incrementAndGet();
            return "counted";
        }
    }

    @Test
    public void testEncodeReturnsBeforeSerializing() throws Exception {
        List<Runnable> scheduled = new ArrayList<>();
        int before = Counting.SERIALIZED.get();

        InputStream body = BodyEncoder.encode(BodyCodec.JSON, new Counting(), scheduled::add);

        assertEquals(before, Counting.SERIALIZED.get());
        assertEquals(1, scheduled.size());

        // producer only runs when scheduled, here on this thread before reading
        scheduled.get(0).run();
        assertEquals(before + 1, Counting.SERIALIZED.get());
        assertEquals("{\"name\":\"counted\"}", new String(body.readAllBytes(), StandardCharsets.UTF_8));
    }

    @Test
    public void testLargeBodyIsStreamed() throws Exception {
        Map<String, String> value = Map.of("data", "x".repeat(BodyEncoder.BUFFER_SIZE * 20));

        InputStream body = BodyEncoder.encode(BodyCodec.JSON, value);

        Map<?, ?> decoded = new ObjectMapper().readValue(body, Map.class);
        assertEquals(value, decoded);
    }

    @Test
    public void testXmlEncoding() throws Exception {
        InputStream body = BodyEncoder.encode(BodyCodec.XML, new Counting());

        String xml = new String(body.readAllBytes(), StandardCharsets.UTF_8);
        assertEquals("<Counting><name>counted</name></Counting>", xml);
    }

    @Test
    public void testUnserializableValueFailsOnRead() {
        InputStream body = BodyEncoder.encode(BodyCodec.JSON, new Object());

        IOException e = assertThrows(IOException.class, body::readAllBytes);
        assertTrue(e.getMessage().startsWith("Encoding request body failed"), e.getMessage());
    }

    @Test
    public void testNullValueRejected() {
        assertThrows(IllegalArgumentException.class, () -> BodyEncoder.encode(BodyCodec.JSON, null));
    }
}
