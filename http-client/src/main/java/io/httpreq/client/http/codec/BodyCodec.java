package io.httpreq.client.http.codec;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.io.IOException;
import java.io.OutputStream;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import io.httpreq.client.http.HttpClient;
import io.httpreq.common.DecodeException;
import io.httpreq.common.HttpReqErrorMessages;

/**
 * Structured body format backed by a Jackson {@link ObjectMapper}.
 *
 * <p>Unknown properties are ignored when decoding, so a response may carry more
 * fields than the target type declares.
 */
public final class BodyCodec {

    public static final BodyCodec JSON = new BodyCodec("JSON", HttpClient.APPLICATION_JSON,
            new ObjectMapper(), HttpReqErrorMessages.UNMARSHAL_JSON);

    public static final BodyCodec XML = new BodyCodec("XML", HttpClient.APPLICATION_XML,
            new XmlMapper(), HttpReqErrorMessages.UNMARSHAL_XML);

    private final String name;
    private final String mediaType;
    private final ObjectMapper mapper;
    private final String decodeErrorMessage;

    private BodyCodec(String name, String mediaType, ObjectMapper mapper, String decodeErrorMessage) {
        this.name = name;
        this.mediaType = mediaType;
        this.mapper = mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.decodeErrorMessage = decodeErrorMessage;
    }

    public String name() {
        return name;
    }

    public String mediaType() {
        return mediaType;
    }

    /**
     * Writes {@code value} to {@code out}. The stream is flushed but left open.
     *
     * @param value the value to serialize
     * @param out the destination
     * @throws IOException if serialization or writing fails
     */
    public void encode(Object value, OutputStream out) throws IOException {
        mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, value);
        out.flush();
    }

    public <T> BodyDecoder<T> decoder(Class<T> type) {
        return decoder(mapper.constructType(checkNotNullParam("type", type)));
    }

    public <T> BodyDecoder<T> decoder(TypeReference<T> type) {
        return decoder(mapper.getTypeFactory().constructType(checkNotNullParam("type", type)));
    }

    private <T> BodyDecoder<T> decoder(JavaType type) {
        return data -> {
            try {
                return mapper.readValue(data, type);
            } catch (IOException e) {
                throw new DecodeException(decodeErrorMessage, e);
            }
        };
    }

    @Override
    public String toString() {
        return name;
    }
}
