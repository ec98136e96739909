package com.stagehand.orchestrator.store;

import io.github.resilience4j.retry.Retry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.transaction.support.TransactionTemplate;

import java.nio.file.Path;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * One SQLite database file plus the FIFO queue that serializes every
 * operation against it.
 *
 * All work runs on a single dedicated thread, so at most one statement is in
 * flight per file. Work submitted from that thread (a repository calling
 * another repository inside {@link #inTransaction}) runs inline instead of
 * deadlocking on its own queue.
 *
 * Lock contention from other processes holding the file is retried with
 * bounded backoff; everything else propagates as a {@link StoreException}.
 */
public class ProjectStore implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProjectStore.class);

    private final String                     name;
    private final Path                       file;
    private final SingleConnectionDataSource dataSource;
    private final JdbcTemplate               jdbc;
    private final TransactionTemplate        tx;
    private final Retry                      busyRetry;
    private final ExecutorService            queue;
    private volatile Thread                  queueThread;

    public ProjectStore(String name, Path file, Retry busyRetry) {
        this.name       = name;
        this.file       = file;
        this.busyRetry  = busyRetry;
        this.dataSource = new SingleConnectionDataSource("jdbc:sqlite:" + file, true);
        this.dataSource.setAutoCommit(true);
        this.jdbc       = new JdbcTemplate(dataSource);
        this.tx         = new TransactionTemplate(new DataSourceTransactionManager(dataSource));
        this.queue      = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "store-" + name);
            t.setDaemon(true);
            queueThread = t;
            return t;
        });
    }

    public String name() { return name; }
    public Path   file() { return file; }

    // ------------------------------------------------------------------
    // Queued access
    // ------------------------------------------------------------------

    /** Run {@code work} on the queue and return its result. */
    public <T> T call(Function<JdbcOperations, T> work) {
        if (Thread.currentThread() == queueThread) {
            return withBusyRetry(work);
        }
        Future<T> future = queue.submit(() -> withBusyRetry(work));
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException("Interrupted waiting for store '" + name + "'", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new StoreException("Store operation failed on '" + name + "'", cause);
        }
    }

    public void run(Consumer<JdbcOperations> work) {
        call(db -> {
            work.accept(db);
            return null;
        });
    }

    /**
     * Run {@code work} as one transaction on the queue. Nested calls join the
     * outer transaction; any exception rolls the whole unit back.
     */
    public <T> T inTransaction(Function<JdbcOperations, T> work) {
        return call(db -> tx.execute(status -> work.apply(db)));
    }

    private <T> T withBusyRetry(Function<JdbcOperations, T> work) {
        return Retry.decorateSupplier(busyRetry, () -> {
            try {
                return work.apply(jdbc);
            } catch (RuntimeException e) {
                if (StoreException.isBusyError(e) && !(e instanceof StoreException)) {
                    throw new StoreException("Database '" + name + "' is locked", e);
                }
                throw e;
            }
        }).get();
    }

    // ------------------------------------------------------------------
    // Lifecycle
    // ------------------------------------------------------------------

    @Override
    public void close() {
        queue.shutdown();
        try {
            if (!queue.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Store '{}' queue did not drain within 5s; closing anyway", name);
                queue.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            queue.shutdownNow();
        }
        dataSource.destroy();
        log.info("Closed store '{}' ({})", name, file);
    }
}
