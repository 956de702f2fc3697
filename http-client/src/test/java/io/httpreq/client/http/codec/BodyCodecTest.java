package io.httpreq.client.http.codec;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import io.httpreq.common.DecodeException;
import io.httpreq.common.HttpReqErrorMessages;
import org.junit.jupiter.api.Test;

public class BodyCodecTest {

    public static class Item {
        public String id;
        public List<String> labels;
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    public void testMediaTypes() {
        assertEquals("application/json", BodyCodec.JSON.mediaType());
        assertEquals("application/xml", BodyCodec.XML.mediaType());
        assertEquals("JSON", BodyCodec.JSON.toString());
    }

    @Test
    public void testJsonDecodeIgnoresUnknownProperties() throws Exception {
        Item item = BodyCodec.JSON.decoder(Item.class)
                .decode(bytes("{\"id\":\"7\",\"labels\":[\"a\",\"b\"],\"unknown\":1}"));

        assertEquals("7", item.id);
        assertEquals(List.of("a", "b"), item.labels);
    }

    @Test
    public void testJsonDecodeWithTypeReference() throws Exception {
        List<Integer> numbers = BodyCodec.JSON.decoder(new TypeReference<List<Integer>>() {})
                .decode(bytes("[1,2,3]"));

        assertEquals(List.of(1, 2, 3), numbers);
    }

    @Test
    public void testXmlDecodeIgnoresUnknownProperties() throws Exception {
        Item item = BodyCodec.XML.decoder(Item.class)
                .decode(bytes("<Item><id>9</id><colour>red</colour></Item>"));

        assertEquals("9", item.id);
    }

    @Test
    public void testDecodeFailureIsWrapped() {
        BodyDecoder<Item> decoder = BodyCodec.JSON.decoder(Item.class);

        DecodeException e = assertThrows(DecodeException.class, () -> decoder.decode(bytes("[not json")));

        assertTrue(e.getMessage().startsWith(HttpReqErrorMessages.UNMARSHAL_JSON));
        assertTrue(e.getCause() instanceof IOException);
    }

    @Test
    public void testEncodeLeavesStreamOpen() throws Exception {
        class TrackingStream extends ByteArrayOutputStream {
            boolean closed;

            @Override
            public void close() throws IOException {
                closed = true;
                super.close();
            }
        }
        TrackingStream out = new TrackingStream();

        BodyCodec.JSON.encode(List.of("a"), out);

        assertEquals("[\"a\"]", out.toString(StandardCharsets.UTF_8));
        assertTrue(!out.closed);
    }

    @Test
    public void testEncodeFailurePropagates() {
        OutputStream out = new ByteArrayOutputStream();

        assertThrows(IOException.class, () -> BodyCodec.JSON.encode(new Object(), out));
    }
}
