package io.lattice.core.execution;

import io.lattice.core.concurrent.CancellationToken;
import io.lattice.core.diagnostics.DiagnosticEvents;
import io.lattice.core.error.DefaultErrorHandler;
import io.lattice.core.error.ErrorFilter;
import io.lattice.core.error.ErrorFilterAggregator;
import io.lattice.core.error.ErrorHandler;
import io.lattice.core.exception.BuildCancelledException;
import io.lattice.core.exception.ResolverDisposedException;
import io.lattice.core.execution.pipeline.PipelineAssembler;
import io.lattice.core.execution.pipeline.RequestDelegate;
import io.lattice.core.options.ExecutorFactoryOptions;
import io.lattice.core.options.ExecutorOptions;
import io.lattice.core.options.ExecutorOptionsAssembler;
import io.lattice.core.options.FactoryOptionsMonitor;
import io.lattice.core.schema.Schema;
import io.lattice.core.schema.SchemaAssembler;
import io.lattice.core.service.Activator;
import io.lattice.core.service.DefaultActivator;
import io.lattice.core.service.ServiceProvider;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Default {@link RequestExecutorResolver} with a lock-free read path and a single build lock.
 *
 * <h3>Resolution</h3>
 *
 * <ol>
 *   <li>Cache hit: returned without locking.
 *   <li>Cache miss: the caller acquires the process-wide build lock, checks the cache again (a
 *       concurrent caller may have built the executor meanwhile) and builds.
 *   <li>Build: factory options → executor options → schema → error filters and error handler
 *       → pipeline → {@link DefaultRequestExecutor}.
 *   <li>The executor is cached, the lock released, then diagnostics and listeners are
 *       notified.
 * </ol>
 *
 * <p>Every eviction bumps a per-name generation. A build that observes a newer generation
 * when it finishes was made from superseded options; it is discarded and built again.
 *
 * <p>One lock guards all names, so builds never overlap, even for different names. Builds are
 * rare (one per name until evicted); the fast path never touches the lock.
 *
 * <p>The resolver subscribes to its {@link FactoryOptionsMonitor}; a configuration change
 * evicts the affected executor, and the next lookup rebuilds it.
 *
 * @implNote Thread-safe. Executors are kept in a {@link ConcurrentHashMap} mutated only while
 *     holding the build lock (inserts) or by atomic removal (evictions). Waiting for the lock
 *     polls {@link ReentrantLock#tryLock(long, TimeUnit)} so a cancellation request is seen
 *     within one poll interval.
 */
public class DefaultRequestExecutorResolver implements RequestExecutorResolver {

    private static final Logger logger =
            Logger.getLogger(DefaultRequestExecutorResolver.class.getName());

    public static final Duration DEFAULT_LOCK_POLL_INTERVAL = Duration.ofMillis(25);

    private final ReentrantLock buildLock = new ReentrantLock();
    private final Map<ExecutorName, RequestExecutor> executors = new ConcurrentHashMap<>();
    private final Map<ExecutorName, Long> generations = new ConcurrentHashMap<>();
    private final List<RequestExecutorListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean disposed = new AtomicBoolean();

    private final FactoryOptionsMonitor optionsMonitor;
    private final ServiceProvider services;
    private final DiagnosticEvents diagnosticEvents;
    private final Executor asyncExecutor;
    private final Duration lockPollInterval;
    private final SchemaAssembler schemaAssembler;
    private final FactoryOptionsMonitor.Subscription subscription;

    /**
     * Creates a resolver using the common fork-join pool for asynchronous lookups.
     *
     * @param optionsMonitor source of per-name options and change notifications, not null
     * @param services service provider forwarded to builds, not null
     * @param diagnosticEvents lifecycle sink, not null
     */
    public DefaultRequestExecutorResolver(
            FactoryOptionsMonitor optionsMonitor,
            ServiceProvider services,
            DiagnosticEvents diagnosticEvents) {
        this(
                optionsMonitor,
                services,
                diagnosticEvents,
                ForkJoinPool.commonPool(),
                DEFAULT_LOCK_POLL_INTERVAL);
    }

    /**
     * Creates a resolver.
     *
     * @apiNote <b>Side effects</b>: subscribes to {@code optionsMonitor} change notifications
     *     until {@link #close()}.
     * @param optionsMonitor source of per-name options and change notifications, not null
     * @param services service provider forwarded to builds, not null
     * @param diagnosticEvents lifecycle sink, not null
     * @param asyncExecutor runs builds started by {@link #getRequestExecutorAsync}, not null
     * @param lockPollInterval how often a waiting caller re-checks its cancellation token,
     *     positive
     */
    public DefaultRequestExecutorResolver(
            FactoryOptionsMonitor optionsMonitor,
            ServiceProvider services,
            DiagnosticEvents diagnosticEvents,
            Executor asyncExecutor,
            Duration lockPollInterval) {
        this.optionsMonitor = Objects.requireNonNull(optionsMonitor, "optionsMonitor");
        this.services = Objects.requireNonNull(services, "services");
        this.diagnosticEvents = Objects.requireNonNull(diagnosticEvents, "diagnosticEvents");
        this.asyncExecutor = Objects.requireNonNull(asyncExecutor, "asyncExecutor");
        this.lockPollInterval = Objects.requireNonNull(lockPollInterval, "lockPollInterval");
        if (lockPollInterval.isZero() || lockPollInterval.isNegative()) {
            throw new IllegalArgumentException("lockPollInterval must be positive");
        }
        this.schemaAssembler = new SchemaAssembler(services);
        this.subscription = optionsMonitor.onChange(this::onConfigurationChanged);
    }

    @Override
    public RequestExecutor getRequestExecutor(ExecutorName name, CancellationToken token) {
        ensureNotDisposed();
        Objects.requireNonNull(token, "token");
        ExecutorName key = ExecutorName.orDefault(name);

        RequestExecutor executor = executors.get(key);
        if (executor != null) {
            return executor;
        }

        if (buildLock.isHeldByCurrentThread()) {
            throw new IllegalStateException(
                    "Recursive resolution of executor `" + key + "` while another build runs");
        }

        acquireBuildLock(token);
        boolean created = false;
        try {
            executor = executors.get(key);
            while (executor == null) {
                long generation = generationOf(key);
                RequestExecutor built = createRequestExecutor(key, token);
                ensureNotDisposed();
                if (generation != generationOf(key)) {
                    logger.fine(
                            "Configuration of " + key + " changed during build, rebuilding");
                    continue;
                }
                executors.put(key, built);
                executor = built;
                created = true;
            }
        } catch (BuildCancelledException e) {
            logger.fine("Build of request executor " + key + " was cancelled");
            throw e;
        } catch (ResolverDisposedException e) {
            logger.fine("Resolver closed while building request executor " + key);
            throw e;
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Failed to build request executor: " + key, e);
            throw e;
        } finally {
            buildLock.unlock();
        }

        if (created) {
            publish(key, executor, true);
        }
        return executor;
    }

    @Override
    public CompletableFuture<RequestExecutor> getRequestExecutorAsync(
            ExecutorName name, CancellationToken token) {
        ensureNotDisposed();
        ExecutorName key = ExecutorName.orDefault(name);

        RequestExecutor cached = executors.get(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return CompletableFuture.supplyAsync(() -> getRequestExecutor(key, token), asyncExecutor);
    }

    @Override
    public boolean evictRequestExecutor(ExecutorName name) {
        ensureNotDisposed();
        ExecutorName key = ExecutorName.orDefault(name);

        generations.merge(key, 1L, Long::sum);
        RequestExecutor removed = executors.remove(key);
        if (removed == null) {
            return false;
        }
        publish(key, removed, false);
        return true;
    }

    /**
     * Handles a configuration change notification for {@code name}.
     *
     * <p>Evicts the cached executor, if any; it is rebuilt lazily by the next lookup. A build of
     * {@code name} running concurrently is rebuilt before it is cached.
     *
     * @param name the executor whose configuration changed; null means {@link
     *     ExecutorName#DEFAULT}
     */
    public void onConfigurationChanged(ExecutorName name) {
        if (disposed.get()) {
            return;
        }
        if (evictRequestExecutor(name)) {
            logger.fine("Configuration of " + ExecutorName.orDefault(name) + " changed");
        }
    }

    @Override
    public void addListener(RequestExecutorListener listener) {
        ensureNotDisposed();
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeListener(RequestExecutorListener listener) {
        listeners.remove(listener);
    }

    /**
     * Returns the names of all cached executors.
     *
     * @return snapshot of cached names, never null
     */
    public Set<ExecutorName> getCachedExecutorNames() {
        return Set.copyOf(executors.keySet());
    }

    /**
     * Returns whether {@link #close()} has been called.
     *
     * @return {@code true} once closed
     */
    public boolean isClosed() {
        return disposed.get();
    }

    @Override
    public void close() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        subscription.close();

        buildLock.lock();
        try {
            int count = executors.size();
            executors.clear();
            logger.info("Request executor resolver closed, dropped " + count + " executors");
        } finally {
            buildLock.unlock();
        }
        listeners.clear();
    }

    private RequestExecutor createRequestExecutor(ExecutorName name, CancellationToken token) {
        logger.fine("Building request executor: " + name);

        ExecutorFactoryOptions options = optionsMonitor.get(name);

        ExecutorOptions executorOptions = ExecutorOptionsAssembler.resolve(options, token);
        Schema schema = schemaAssembler.resolve(name, options, token);

        List<ErrorFilter> errorFilters =
                ErrorFilterAggregator.collect(options, executorOptions, services);
        ErrorHandler errorHandler = new DefaultErrorHandler(errorFilters, executorOptions);
        Activator activator = new DefaultActivator(services);

        RequestDelegate pipeline =
                PipelineAssembler.compose(
                        name,
                        options.getPipeline(),
                        services,
                        activator,
                        errorHandler,
                        executorOptions);

        token.throwIfCancellationRequested();
        return new DefaultRequestExecutor(
                schema,
                services,
                errorHandler,
                activator,
                diagnosticEvents,
                executorOptions,
                pipeline);
    }

    private void acquireBuildLock(CancellationToken token) {
        token.throwIfCancellationRequested();
        try {
            while (!buildLock.tryLock(lockPollInterval.toMillis(), TimeUnit.MILLISECONDS)) {
                token.throwIfCancellationRequested();
                ensureNotDisposed();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildCancelledException("Interrupted while waiting for the build lock", e);
        }

        if (token.isCancellationRequested() || disposed.get()) {
            buildLock.unlock();
            token.throwIfCancellationRequested();
            ensureNotDisposed();
        }
    }

    private void publish(ExecutorName name, RequestExecutor executor, boolean created) {
        String event = created ? "created" : "evicted";
        notifySafely(
                "diagnostics",
                () -> {
                    if (created) {
                        diagnosticEvents.executorCreated(name, executor);
                    } else {
                        diagnosticEvents.executorEvicted(name, executor);
                    }
                },
                event,
                name);
        for (RequestExecutorListener listener : listeners) {
            notifySafely(
                    listener.getClass().getName(),
                    () -> {
                        if (created) {
                            listener.onExecutorCreated(name, executor);
                        } else {
                            listener.onExecutorEvicted(name, executor);
                        }
                    },
                    event,
                    name);
        }
    }

    private static void notifySafely(
            String target, Runnable notification, String event, ExecutorName name) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            logger.log(
                    Level.WARNING,
                    "Listener " + target + " failed on executor " + event + " for " + name,
                    e);
        }
    }

    private long generationOf(ExecutorName name) {
        return generations.getOrDefault(name, 0L);
    }

    private void ensureNotDisposed() {
        if (disposed.get()) {
            throw new ResolverDisposedException("The request executor resolver has been closed");
        }
    }
}
