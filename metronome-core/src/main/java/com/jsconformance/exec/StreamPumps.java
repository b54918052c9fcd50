package com.jsconformance.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Background pumping of child process pipes and the timeout watchdog.
 */
final class StreamPumps {

    private static final Logger log = LoggerFactory.getLogger(StreamPumps.class);

    private static final ExecutorService IO = Executors.newCachedThreadPool(daemonThreads("executor-io"));
    private static final ScheduledExecutorService WATCHDOG =
        Executors.newSingleThreadScheduledExecutor(daemonThreads("executor-watchdog"));

    private StreamPumps() {
    }

    /**
     * Writes {@code data} and closes the stream. A child that exits before reading all
     * of its input is not an error here; the caller learns about it from the exit status.
     */
    static CompletableFuture<Void> feed(OutputStream stream, byte[] data) {
        return CompletableFuture.runAsync(() -> {
            try (OutputStream out = stream) {
                out.write(data);
                out.flush();
            } catch (IOException e) {
                log.debug("Executor closed its input early: {}", e.getMessage());
            }
        }, IO);
    }

    /**
     * Reads the stream to its end, decoding invalid UTF-8 leniently.
     */
    static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, IO);
    }

    static ScheduledFuture<?> schedule(Runnable action, Duration delay) {
        return WATCHDOG.schedule(action, delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Result of a drain, or whatever could be said about the failure.
     */
    static String join(CompletableFuture<String> future, Duration timeout) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return "";
        } catch (Exception e) {
            future.cancel(true);
            return "<unable to read stream: " + e + ">";
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
