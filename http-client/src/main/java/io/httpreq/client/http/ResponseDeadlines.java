package io.httpreq.client.http;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared timer that expires responses whose exchange outlived its timeout.
 */
final class ResponseDeadlines {

    private static final ScheduledThreadPoolExecutor TIMER = createTimer();

    private ResponseDeadlines() {
    }

    static ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return TIMER.schedule(task, delay.toNanos(), TimeUnit.NANOSECONDS);
    }

    private static ScheduledThreadPoolExecutor createTimer() {
        ScheduledThreadPoolExecutor timer = new ScheduledThreadPoolExecutor(1, new TimerThreadFactory());
        // cancelled deadlines are the common case
        timer.setRemoveOnCancelPolicy(true);
        return timer;
    }

    private static final class TimerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "httpreq-response-deadline-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
