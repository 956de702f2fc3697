package io.httpreq.client.http.codec;

import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.util.Arrays;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

import org.jspecify.annotations.Nullable;

/**
 * Bounded in-memory pipe between one producer thread and one consumer thread.
 *
 * <p>The producer writes to {@link #sink()} and finishes with {@link Sink#complete()} or
 * {@link Sink#fail(Throwable)}. The consumer reads from {@link #source()}. At most
 * {@code capacity} chunks are in flight, so a fast producer blocks until the consumer
 * catches up and a reader blocks until data or the end of the stream arrives.
 *
 * <p>A failure reported by the producer is raised from the consumer's next read, after
 * every chunk written before it has been read. Closing the source makes the producer's
 * next write fail. The source may be closed from a thread other than the reader's.
 */
public final class BodyPipe {

    static final int DEFAULT_CAPACITY = 4;

    private static final long OFFER_INTERVAL_MILLIS = 100;

    private final BlockingQueue<Chunk> chunks;
    private final Source source = new Source();
    private final Sink sink = new Sink();
    private volatile boolean sourceClosed;

    public BodyPipe() {
        this(DEFAULT_CAPACITY);
    }

    BodyPipe(int capacity) {
        this.chunks = new ArrayBlockingQueue<>(capacity);
    }

    public InputStream source() {
        return source;
    }

    public Sink sink() {
        return sink;
    }

    private record Chunk(byte @Nullable [] data, @Nullable Throwable failure) {

        static final Chunk END = new Chunk(null, null);

        boolean terminal() {
            return data == null;
        }
    }

    /**
     * Producer end. {@link #close()} only marks the stream as no longer writable; the end of
     * the body is signalled by {@link #complete()} or {@link #fail(Throwable)}.
     */
    public final class Sink extends OutputStream {

        private volatile boolean finished;

        private Sink() {
        }

        @Override
        public void write(int b) throws IOException {
            write(new byte[] {(byte) b}, 0, 1);
        }

        @Override
        public void write(byte[] b, int off, int len) throws IOException {
            if (finished) {
                throw new IOException("Pipe sink already finished");
            }
            if (len == 0) {
                return;
            }
            put(new Chunk(Arrays.copyOfRange(b, off, off + len), null));
        }

        /**
         * Ends the stream normally; the consumer reads end-of-stream after the pending chunks.
         */
        public void complete() {
            finish(Chunk.END);
        }

        /**
         * Ends the stream with a failure; the consumer's read after the pending chunks throws.
         *
         * @param failure the cause reported to the consumer
         */
        public void fail(Throwable failure) {
            finish(new Chunk(null, failure));
        }

        @Override
        public void close() {
            // the stream stays open until complete() or fail() is called
        }

        private void finish(Chunk terminal) {
            if (finished) {
                return;
            }
            finished = true;
            try {
                while (!sourceClosed) {
                    if (chunks.offer(terminal, OFFER_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                        return;
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private void put(Chunk chunk) throws IOException {
            try {
                while (!sourceClosed) {
                    if (chunks.offer(chunk, OFFER_INTERVAL_MILLIS, TimeUnit.MILLISECONDS)) {
                        return;
                    }
                }
                throw new IOException("Pipe closed by reader");
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while writing to pipe");
            }
        }
    }

    private final class Source extends InputStream {

        private byte @Nullable [] current;
        private int position;
        private @Nullable Chunk terminal;
        private volatile boolean closed;

        @Override
        public int read() throws IOException {
            byte[] single = new byte[1];
            int n = read(single, 0, 1);
            return n == -1 ? -1 : single[0] & 0xFF;
        }

        @Override
        public int read(byte[] b, int off, int len) throws IOException {
            if (closed) {
                throw new IOException("Stream closed");
            }
            if (len == 0) {
                return 0;
            }
            byte[] data = current;
            while (data == null || position == data.length) {
                if (terminal != null) {
                    return endOfStream(terminal);
                }
                Chunk next = take();
                if (closed) {
                    throw new IOException("Stream closed");
                }
                if (next.terminal()) {
                    terminal = next;
                    current = null;
                } else {
                    current = next.data();
                    position = 0;
                }
                data = current;
            }
            int n = Math.min(len, data.length - position);
            System.arraycopy(data, position, b, off, n);
            position += n;
            return n;
        }

        @Override
        public int available() throws IOException {
            if (closed) {
                throw new IOException("Stream closed");
            }
            byte[] data = current;
            return data == null ? 0 : data.length - position;
        }

        @Override
        public void close() {
            closed = true;
            sourceClosed = true;
            current = null;
            chunks.clear();
            // wakes a reader blocked on another thread
            chunks.offer(Chunk.END);
        }

        private Chunk take() throws IOException {
            try {
                return chunks.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new InterruptedIOException("Interrupted while reading from pipe");
            }
        }

        private int endOfStream(Chunk end) throws IOException {
            Throwable failure = end.failure();
            if (failure != null) {
                throw new IOException("Encoding request body failed: " + failure.getMessage(), failure);
            }
            return -1;
        }
    }
}
