package io.httpreq.client.http.codec;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.io.BufferedOutputStream;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encodes request bodies on a background thread while the transport reads them.
 *
 * <p>{@link #encode(BodyCodec, Object)} returns immediately with the read end of a
 * {@link BodyPipe}; serialization happens on a daemon producer thread. A serialization
 * failure is reported to the reader as an {@link java.io.IOException}.
 */
public final class BodyEncoder {

    private static final Logger LOGGER = LoggerFactory.getLogger(BodyEncoder.class);

    static final int BUFFER_SIZE = 8192;

    private static final ExecutorService PRODUCERS = Executors.newCachedThreadPool(new ProducerThreadFactory());

    private BodyEncoder() {
    }

    /**
     * @param codec the body format
     * @param value the value to serialize
     * @return a stream yielding the serialized value
     */
    public static InputStream encode(BodyCodec codec, Object value) {
        return encode(codec, value, PRODUCERS);
    }

    static InputStream encode(BodyCodec codec, Object value, Executor executor) {
        checkNotNullParam("codec", codec);
        checkNotNullParam("value", value);
        BodyPipe pipe = new BodyPipe();
        executor.execute(() -> produce(codec, value, pipe.sink()));
        return pipe.source();
    }

    private static void produce(BodyCodec codec, Object value, BodyPipe.Sink sink) {
        try {
            OutputStream out = new BufferedOutputStream(sink, BUFFER_SIZE);
            codec.encode(value, out);
            sink.complete();
        } catch (Exception e) {
            LOGGER.debug("Encoding {} request body of type {} aborted", codec, value.getClass().getName(), e);
            sink.fail(e);
        } catch (Error e) {
            sink.fail(e);
            throw e;
        }
    }

    private static final class ProducerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "httpreq-body-encoder-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
