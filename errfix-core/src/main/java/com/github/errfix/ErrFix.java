package com.github.errfix;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Iterator;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Runs every file supplied by a {@link SourceReader} through a {@link Processor} and
 * hands the result to a {@link SourceWriter}.
 * <p>
 * At most {@code concurrency} files are processed at the same time. The first failure
 * stops the scheduling of further files; files already being processed run to
 * completion and {@link #process()} then throws that first failure. Later failures
 * are logged and otherwise ignored.
 */
public class ErrFix {

    private static final Logger LOG = LoggerFactory.getLogger(ErrFix.class);

    public static final int DEFAULT_CONCURRENCY = 8;

    private final SourceReader reader;
    private final Processor processor;
    private final SourceWriter writer;
    private final int concurrency;

    public ErrFix(SourceReader reader, Processor processor, SourceWriter writer) {
        this(reader, processor, writer, DEFAULT_CONCURRENCY);
    }

    public ErrFix(SourceReader reader, Processor processor, SourceWriter writer, int concurrency) {
        if (concurrency < 1) {
            throw new IllegalArgumentException("concurrency must be at least 1, was " + concurrency);
        }
        this.reader = reader;
        this.processor = processor;
        this.writer = writer;
        this.concurrency = concurrency;
    }

    /**
     * Processes all files.
     *
     * @return the number of files processed
     * @throws ErrFixException the first failure of any file
     */
    public int process() throws ErrFixException {
        AtomicReference<ErrFixException> firstError = new AtomicReference<>();
        AtomicInteger processed = new AtomicInteger();
        Semaphore slots = new Semaphore(concurrency);
        ExecutorService executor = Executors.newFixedThreadPool(concurrency, workerThreads());

        try (Stream<SourceFile> files = reader.read()) {
            Iterator<SourceFile> it = files.iterator();
            while (firstError.get() == null && it.hasNext()) {
                SourceFile file = it.next();
                slots.acquire();
                if (firstError.get() != null) {
                    slots.release();
                    break;
                }
                executor.execute(() -> {
                    try {
                        processOne(file);
                        processed.incrementAndGet();
                    } catch (ErrFixException e) {
                        fail(firstError, e);
                    } catch (RuntimeException e) {
                        fail(firstError, new ErrFixException(
                                "error while processing " + file.getName() + ", " + e.getMessage(), e));
                    } catch (Error e) {
                        // StackOverflowError on deeply nested source
                        fail(firstError, new ErrFixException(
                                "error while processing " + file.getName() + ", " + e, e));
                    } finally {
                        slots.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail(firstError, new ErrFixException("interrupted while scheduling files", e));
        } finally {
            join(executor, firstError);
        }

        ErrFixException error = firstError.get();
        if (error != null) {
            throw error;
        }
        return processed.get();
    }

    private void processOne(SourceFile file) throws ErrFixException {
        if (file.getError() != null) {
            throw new ErrFixException(
                    "error while reading from " + file.getName() + ", " + file.getError().getMessage(),
                    file.getError());
        }
        LOG.debug("processing {}", file.getName());
        SourceFile result = processor.process(file);
        try {
            writer.write(file, result);
        } catch (IOException e) {
            throw new ErrFixException("error while writing " + file.getName() + ", " + e.getMessage(), e);
        }
    }

    private static void fail(AtomicReference<ErrFixException> firstError, ErrFixException error) {
        if (!firstError.compareAndSet(null, error)) {
            LOG.debug("ignoring error after the first failure: {}", error.getMessage());
        }
    }

    private static void join(ExecutorService executor, AtomicReference<ErrFixException> firstError) {
        executor.shutdown();
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                LOG.debug("waiting for files in progress");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
            fail(firstError, new ErrFixException("interrupted while waiting for files in progress", e));
        }
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger count = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "errfix-worker-" + count.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
