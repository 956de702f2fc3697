package io.httpreq.client.http;

import java.io.IOException;

import io.httpreq.client.http.codec.BodyDecoder;
import io.httpreq.common.BodyReadException;
import io.httpreq.common.HttpReqErrorMessages;
import io.httpreq.common.InvalidRequestException;
import io.httpreq.common.RequestException;
import org.jspecify.annotations.Nullable;

/**
 * Second stage of a {@link RequestBuilder}: sends the request, reads the whole response
 * body, closes it and optionally decodes it.
 *
 * <p>Obtained from {@link RequestBuilder#withResult()}, {@link RequestBuilder#withJsonResult(Class)}
 * or {@link RequestBuilder#withXmlResult(Class)}. The wrapper uses the builder's state as it is
 * when {@code send} is called.
 *
 * @param <T> the decoded type, {@link Void} when nothing is decoded
 */
public final class ResultWrapper<T> {

    private final @Nullable RequestBuilder request;
    private final @Nullable BodyDecoder<T> decoder;

    ResultWrapper(@Nullable RequestBuilder request, @Nullable BodyDecoder<T> decoder) {
        this.request = request;
        this.decoder = decoder;
    }

    /**
     * Sends the request and returns the response with its body bytes and decoded value.
     *
     * @param context the execution context
     * @param method the request method
     * @param url the absolute request URL
     * @return the outcome; never partially populated
     * @throws InvalidRequestException if there is no request to send or it is invalid
     * @throws io.httpreq.common.BodyReadException if the response body cannot be read
     * @throws io.httpreq.common.DecodeException if the response body does not decode
     * @throws IOException if the transport fails
     * @throws InterruptedException if the calling thread is interrupted
     */
    public SendOutcome<T> send(RequestContext context, String method, String url)
            throws RequestException, IOException, InterruptedException {
        if (request == null) {
            throw new InvalidRequestException(HttpReqErrorMessages.MISSING_REQUEST);
        }

        HttpResponse response = request.send(context, method, url);

        byte[] data;
        try (response) {
            data = response.body().readAllBytes();
        } catch (IOException e) {
            throw new BodyReadException(HttpReqErrorMessages.READ_RESPONSE_BODY, e);
        }

        T value = null;
        if (decoder != null) {
            value = decoder.decode(data);
        }
        return new SendOutcome<>(response, data, value);
    }
}
