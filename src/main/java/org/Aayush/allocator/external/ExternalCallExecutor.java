package org.Aayush.allocator.external;

import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.allocator.error.AllocatorException;
import org.Aayush.allocator.error.ExternalServiceException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Bounded-concurrency runner for external service calls of one invocation.
 *
 * <p>At most {@code maxConcurrentRequests} calls are in flight. Each call is wrapped in a
 * resilience4j {@link Retry} built from the {@link RetryPolicy}; only transient
 * {@link ExternalServiceException}s are retried. The first unrecoverable failure cancels
 * all outstanding calls and is rethrown as-is.</p>
 *
 * <p>Instances own a thread pool and must be closed.</p>
 */
@Slf4j
public final class ExternalCallExecutor implements AutoCloseable {
    public static final String REASON_INTERRUPTED = "EXT_INTERRUPTED";
    public static final String REASON_CALL_FAILED = "EXT_CALL_FAILED";

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private final String service;
    private final Retry retry;
    private final ExecutorService pool;

    public ExternalCallExecutor(String service, int maxConcurrentRequests, RetryPolicy retryPolicy) {
        if (maxConcurrentRequests <= 0) {
            throw new IllegalArgumentException("maxConcurrentRequests must be positive");
        }
        this.service = Objects.requireNonNull(service, "service");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.retry = Retry.of(service, retryPolicy.toRetryConfig());
        this.retry.getEventPublisher().onRetry(event -> log.warn(
                "{}: attempt {}/{} failed transiently ({}), retrying in {} ms",
                service,
                event.getNumberOfRetryAttempts(),
                retryPolicy.getMaxAttempts(),
                describe(event.getLastThrowable()),
                event.getWaitInterval().toMillis()
        ));
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        this.pool = Executors.newFixedThreadPool(maxConcurrentRequests, runnable -> {
            Thread thread = new Thread(runnable, "allocator-" + service + "-" + poolId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs one call on the caller thread with retry.
     */
    public <T> T call(Supplier<T> call) {
        return callWithRetry(Objects.requireNonNull(call, "call"));
    }

    /**
     * Runs all calls on the bounded pool and returns results in submission order.
     *
     * @throws AllocatorException the first unrecoverable failure, after cancelling the rest.
     */
    public <T> List<T> invokeAll(List<? extends Supplier<T>> calls) {
        int count = calls.size();
        if (count == 0) {
            return List.of();
        }
        ExecutorCompletionService<T> completion = new ExecutorCompletionService<>(pool);
        List<Future<T>> futures = new ArrayList<>(count);
        Map<Future<T>, Integer> positions = new IdentityHashMap<>();
        for (int i = 0; i < count; i++) {
            Supplier<T> call = Objects.requireNonNull(calls.get(i), "call");
            Future<T> future = completion.submit(() -> callWithRetry(call));
            futures.add(future);
            positions.put(future, i);
        }

        List<T> results = new ArrayList<>(Collections.nCopies(count, null));
        try {
            for (int done = 0; done < count; done++) {
                Future<T> future = completion.take();
                results.set(positions.get(future), future.get());
            }
        } catch (ExecutionException ex) {
            cancelAll(futures);
            throw unwrap(ex.getCause());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            cancelAll(futures);
            throw new ExternalServiceException(REASON_INTERRUPTED, service, "interrupted while awaiting calls", false, ex);
        }
        log.info("{}: completed {} external requests", service, count);
        return results;
    }

    @Override
    public void close() {
        pool.shutdownNow();
    }

    private <T> T callWithRetry(Supplier<T> call) {
        return Retry.decorateSupplier(retry, call).get();
    }

    private AllocatorException unwrap(Throwable cause) {
        if (cause instanceof AllocatorException allocatorException) {
            return allocatorException;
        }
        return new ExternalServiceException(
                REASON_CALL_FAILED,
                service,
                "external call failed: " + cause,
                false,
                cause
        );
    }

    /**
     * Retry state and metrics for this executor's service.
     */
    public Retry retry() {
        return retry;
    }

    private static String describe(Throwable failure) {
        if (failure instanceof AllocatorException allocatorException) {
            return allocatorException.reasonCode();
        }
        return String.valueOf(failure);
    }

    private static <T> void cancelAll(List<Future<T>> futures) {
        for (Future<T> future : futures) {
            future.cancel(true);
        }
    }
}
