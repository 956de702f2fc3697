package io.httpreq.client.http;

import static io.httpreq.util.Assert.checkNotNullParam;

import java.io.Closeable;
import java.io.FilterInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

import io.httpreq.common.HttpReqErrorMessages;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The response to an {@link HttpRequest}: status, headers and a body stream.
 *
 * <p>The body is not read by the transport. Whoever receives the response is responsible
 * for closing it. Once closed, any further read of {@link #body()} fails with an
 * {@link IOException}.
 *
 * <p>A response returned by {@link RequestBuilder#send(RequestContext, String, String)} is
 * bound to the request timeout: when it runs out before the response is closed, the body is
 * closed and reads fail with an {@link HttpTimeoutException}. Closing the response also closes
 * the body of the request that produced it.
 */
public final class HttpResponse implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpResponse.class);

    private final int statusCode;
    private final Headers headers;
    private final ClosableBody body;
    private final List<Closeable> attachments = new CopyOnWriteArrayList<>();
    private volatile @Nullable ScheduledFuture<?> expiry;

    public HttpResponse(int statusCode, Headers headers, @Nullable InputStream body) {
        this.statusCode = statusCode;
        this.headers = checkNotNullParam("headers", headers);
        this.body = new ClosableBody(body == null ? InputStream.nullInputStream() : body);
    }

    public int statusCode() {
        return statusCode;
    }

    public boolean success() {
        return statusCode >= 200 && statusCode < 300;
    }

    public Headers headers() {
        return headers;
    }

    public InputStream body() {
        return body;
    }

    public boolean isClosed() {
        return body.closed.get();
    }

    /**
     * Registers a resource closed together with this response.
     */
    void attach(Closeable resource) {
        attachments.add(checkNotNullParam("resource", resource));
    }

    /**
     * Expires this response at {@code deadline} unless it is closed before.
     */
    void expireAt(Instant deadline) {
        Duration left = Duration.between(Instant.now(), deadline);
        if (left.isZero() || left.isNegative()) {
            expire();
            return;
        }
        expiry = ResponseDeadlines.schedule(this::expire, left);
    }

    private void expire() {
        if (isClosed()) {
            return;
        }
        LOGGER.debug("Timeout exceeded before {} was closed, closing it", this);
        body.expired = true;
        try {
            close();
        } catch (IOException e) {
            LOGGER.debug("Closing expired response failed", e);
        }
    }

    @Override
    public void close() throws IOException {
        ScheduledFuture<?> pending = expiry;
        if (pending != null) {
            pending.cancel(false);
        }
        IOException failure = null;
        try {
            body.close();
        } catch (IOException e) {
            failure = e;
        }
        for (Closeable attachment : attachments) {
            try {
                attachment.close();
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    @Override
    public String toString() {
        return "HttpResponse{statusCode=" + statusCode + ", headers=" + headers + '}';
    }

    private static final class ClosableBody extends FilterInputStream {
        private final AtomicBoolean closed = new AtomicBoolean();
        private volatile boolean expired;

        ClosableBody(InputStream in) {
            super(in);
        }

        @Override
        public int read() throws IOException {
            ensureOpen();
            try {
                return checkNotExpired(super.read());
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            ensureOpen();
            try {
                return checkNotExpired(super.read(b, off, len));
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public long skip(long n) throws IOException {
            ensureOpen();
            try {
                long skipped = super.skip(n);
                checkNotExpired(0);
                return skipped;
            } catch (IOException e) {
                throw translate(e);
            }
        }

        @Override
        public int available() throws IOException {
            ensureOpen();
            return super.available();
        }

        @Override
        public void close() throws IOException {
            if (closed.compareAndSet(false, true)) {
                super.close();
            }
        }

        private void ensureOpen() throws IOException {
            if (expired) {
                throw timeout(null);
            }
            if (closed.get()) {
                throw new IOException("Response body is closed");
            }
        }

        // a read unblocked by the expiry may report end of stream
        private int checkNotExpired(int result) throws IOException {
            if (expired) {
                throw timeout(null);
            }
            return result;
        }

        private IOException translate(IOException e) {
            if (expired && !(e instanceof HttpTimeoutException)) {
                return timeout(e);
            }
            return e;
        }

        private static HttpTimeoutException timeout(@Nullable Throwable cause) {
            HttpTimeoutException e = new HttpTimeoutException(HttpReqErrorMessages.RESPONSE_DEADLINE_EXCEEDED);
            if (cause != null) {
                e.initCause(cause);
            }
            return e;
        }
    }
}
