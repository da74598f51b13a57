package fr.lapetina.xplorer.dispatch;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.BusySpinWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.SleepingWaitStrategy;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.WaitStrategy;
import com.lmax.disruptor.YieldingWaitStrategy;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import fr.lapetina.xplorer.domain.model.Request;
import fr.lapetina.xplorer.domain.model.Response;
import fr.lapetina.xplorer.infrastructure.config.XplorerConfig;
import fr.lapetina.xplorer.infrastructure.metrics.XplorerMetrics;
import fr.lapetina.xplorer.routing.RouteEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread-affinity dispatcher.
 *
 * AFFINITY THREAD:
 *
 * Affinity calls are published into a Disruptor ring buffer drained by a single
 * event handler thread ({@code xplorer-affinity}). That thread is the only one that
 * ever runs affinity handlers, so handlers may touch state confined to it.
 *
 * WORKER POOL:
 *
 * Handlers that do not need the affinity thread run on an unbounded cached pool
 * ({@code xplorer-worker-N}) so blocking I/O never stalls the affinity thread.
 *
 * In both cases the calling transport thread blocks on a {@link CompletableFuture}
 * until the handler completed. Publishing uses the blocking claim, so a full ring
 * buffer back-pressures the transports.
 *
 * DEADLOCK RULES:
 *
 * - An affinity handler dispatched from the affinity thread is rejected with
 *   {@link AffinityReentryException}; it could never be drained.
 * - A non-affinity handler dispatched from the affinity thread runs inline.
 * - Worker threads may dispatch affinity handlers; the affinity thread never waits on workers.
 */
public final class AffinityDispatcher implements HandlerDispatcher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AffinityDispatcher.class);

    public static final String AFFINITY_THREAD_NAME = "xplorer-affinity";

    private final Disruptor<DispatchEvent> disruptor;
    private final RingBuffer<DispatchEvent> ringBuffer;
    private final AffinityThreadFactory affinityThreadFactory;
    private final ExecutorService workerPool;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final long timeoutMs;
    private final XplorerMetrics metrics;

    private AffinityDispatcher(Builder builder) {
        this.timeoutMs = builder.timeoutMs;
        this.metrics = builder.metrics != null ? builder.metrics : XplorerMetrics.disabled();
        this.affinityThreadFactory = new AffinityThreadFactory();

        this.disruptor = new Disruptor<>(
                new DispatchEventFactory(),
                builder.ringBufferSize,
                affinityThreadFactory,
                ProducerType.MULTI, // every transport thread publishes
                createWaitStrategy(builder.waitStrategy)
        );
        disruptor.handleEventsWith(new AffinityEventHandler());
        disruptor.setDefaultExceptionHandler(new DispatchExceptionHandler());
        this.ringBuffer = disruptor.getRingBuffer();

        this.workerPool = Executors.newCachedThreadPool(new WorkerThreadFactory("xplorer-worker"));

        log.info("AffinityDispatcher created: ringBufferSize={}, waitStrategy={}, timeoutMs={}",
                builder.ringBufferSize, builder.waitStrategy, timeoutMs);
    }

    /**
     * Starts the affinity thread.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            disruptor.start();
            log.info("AffinityDispatcher started");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Returns whether the current thread is the affinity thread.
     */
    public boolean isAffinityThread() {
        return Thread.currentThread() == affinityThreadFactory.thread;
    }

    @Override
    public Response dispatch(RouteEntry entry, Request request) throws InterruptedException {
        if (!running.get()) {
            throw new IllegalStateException("AffinityDispatcher not running");
        }

        long start = System.nanoTime();
        try {
            if (isAffinityThread()) {
                if (entry.runsOnAffinityThread()) {
                    throw new AffinityReentryException(entry.path());
                }
                return HandlerInvocation.invoke(entry, request);
            }

            CompletableFuture<Response> future = new CompletableFuture<>();
            if (entry.runsOnAffinityThread()) {
                long sequence = ringBuffer.next();
                try {
                    ringBuffer.get(sequence).initialize(entry, request, future);
                } finally {
                    ringBuffer.publish(sequence);
                }
                log.debug("Affinity call published: path={}, sequence={}", entry.path(), sequence);
            } else {
                workerPool.execute(() -> HandlerInvocation.complete(future, entry, request));
            }
            return await(entry, future);
        } finally {
            metrics.recordDispatch(entry.runsOnAffinityThread(), System.nanoTime() - start);
        }
    }

    private Response await(RouteEntry entry, CompletableFuture<Response> future) throws InterruptedException {
        try {
            return timeoutMs > 0
                    ? future.get(timeoutMs, TimeUnit.MILLISECONDS)
                    : future.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new CompletionException(cause);
        } catch (java.util.concurrent.TimeoutException e) {
            throw new DispatchTimeoutException(entry.path(), timeoutMs);
        }
    }

    /**
     * Returns current ring buffer remaining capacity.
     */
    public long getRemainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains pending affinity calls, then stops the affinity thread and the worker pool.
     */
    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            log.info("Shutting down AffinityDispatcher...");
            try {
                disruptor.shutdown(10, TimeUnit.SECONDS);
            } catch (TimeoutException e) {
                log.warn("AffinityDispatcher shutdown timed out, halting...");
                disruptor.halt();
            }
            workerPool.shutdown();
            try {
                if (!workerPool.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warn("Worker pool did not terminate, interrupting handlers");
                    workerPool.shutdownNow();
                }
            } catch (InterruptedException e) {
                workerPool.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("AffinityDispatcher shut down");
        }
    }

    private static WaitStrategy createWaitStrategy(String name) {
        return switch (name.toLowerCase(Locale.ROOT)) {
            case "blocking" -> new BlockingWaitStrategy();
            case "yielding" -> new YieldingWaitStrategy();
            case "busy-spin" -> new BusySpinWaitStrategy();
            case "sleeping" -> new SleepingWaitStrategy();
            default -> {
                log.warn("Unknown wait strategy '{}', using BlockingWaitStrategy", name);
                yield new BlockingWaitStrategy();
            }
        };
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs affinity calls; the only consumer of the ring buffer.
     */
    private static final class AffinityEventHandler implements EventHandler<DispatchEvent> {

        @Override
        public void onEvent(DispatchEvent event, long sequence, boolean endOfBatch) {
            try {
                HandlerInvocation.complete(event.getResultFuture(), event.getEntry(), event.getRequest());
            } finally {
                event.clear();
            }
        }
    }

    /**
     * Creates the single affinity thread and remembers it.
     */
    private static final class AffinityThreadFactory implements ThreadFactory {
        private volatile Thread thread;

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, AFFINITY_THREAD_NAME);
            t.setDaemon(true);
            thread = t;
            return t;
        }
    }

    /**
     * Thread factory for the worker pool.
     */
    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }

    /**
     * Exception handler for the Disruptor.
     */
    private static final class DispatchExceptionHandler implements ExceptionHandler<DispatchEvent> {

        private static final Logger log = LoggerFactory.getLogger(DispatchExceptionHandler.class);

        @Override
        public void handleEventException(Throwable ex, long sequence, DispatchEvent event) {
            log.error("Exception on affinity thread: sequence={}, event={}", sequence, event, ex);

            if (event.getResultFuture() != null && !event.getResultFuture().isDone()) {
                event.getResultFuture().completeExceptionally(ex);
            }
        }

        @Override
        public void handleOnStartException(Throwable ex) {
            log.error("Exception during affinity thread start", ex);
        }

        @Override
        public void handleOnShutdownException(Throwable ex) {
            log.error("Exception during affinity thread shutdown", ex);
        }
    }

    /**
     * Builder for AffinityDispatcher.
     */
    public static final class Builder {
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";
        private long timeoutMs = 0;
        private XplorerMetrics metrics;

        public Builder ringBufferSize(int size) {
            // Must be power of 2
            if (size <= 0 || Integer.bitCount(size) != 1) {
                throw new IllegalArgumentException("Ring buffer size must be power of 2");
            }
            this.ringBufferSize = size;
            return this;
        }

        public Builder waitStrategy(String strategy) {
            this.waitStrategy = strategy;
            return this;
        }

        /**
         * Maximum time a caller waits for a handler; 0 waits forever.
         */
        public Builder timeoutMs(long timeoutMs) {
            if (timeoutMs < 0) {
                throw new IllegalArgumentException("Dispatch timeout must not be negative");
            }
            this.timeoutMs = timeoutMs;
            return this;
        }

        public Builder metrics(XplorerMetrics metrics) {
            this.metrics = metrics;
            return this;
        }

        public Builder fromConfig(XplorerConfig.DispatchConfig config) {
            ringBufferSize(config.getRingBufferSize());
            waitStrategy(config.getWaitStrategy());
            timeoutMs(config.getTimeoutMs());
            return this;
        }

        public AffinityDispatcher build() {
            return new AffinityDispatcher(this);
        }
    }
}
