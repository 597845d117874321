package com.acme.cow;

import com.acme.cow.memory.Cell;
import com.acme.cow.memory.CellReadHandle;
import com.acme.cow.memory.Publication;
import com.acme.cow.memory.ReadHandle;
import com.acme.cow.memory.ValueDisposer;
import com.acme.cow.telemetry.AtomicCowMetrics;
import com.acme.cow.telemetry.CowMetrics;
import com.acme.cow.telemetry.PeriodicMetricsReporter;
import com.acme.cow.write.WriteLock;
import com.acme.cow.write.WriteResult;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds one value that readers see without ever blocking and writers replace as a whole.
 *
 * <p>Reads return a {@link ReadHandle} on the value published at that instant; the handle
 * keeps reporting that value however many writes follow. Writes are serialized by a
 * non-reentrant lock. Each one checks a verifier against the published value, builds a
 * replacement (a copy of the current value, or a fresh one), lets a modifier change the
 * still-private replacement, publishes it, waits for readers caught mid-lookup, and then
 * releases the container's reference to the prior value.</p>
 *
 * <p>Every write returns {@code true} only when it published a value. A rejecting verifier,
 * a factory or copier returning {@code null}, or (for the {@code try} variants) a busy
 * lock leave the container untouched. Exceptions from verifiers, factories, copiers and
 * modifiers propagate after the unpublished candidate has been disposed.</p>
 *
 * <p>A modifier or verifier must not call a blocking write on its own container: the
 * lock is not reentrant and the call never returns. {@link #tryEdit} and {@link #tryReset}
 * return {@code false} instead.</p>
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * CopyOnWrite<Settings> settings = new CopyOnWrite<>(new Settings(3), Settings::new);
 * settings.edit(s -> s.retries = 4, s -> s.retries == 3);
 * try (ReadHandle<Settings> view = settings.read()) {
 *     int retries = view.get().retries;
 * }
 * }</pre>
 */
public final class CopyOnWrite<T> implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(CopyOnWrite.class.getName());

    private static final WriteResult VERIFIER_REJECTED = new WriteResult.VerifierRejected();
    private static final WriteResult LOCK_BUSY = new WriteResult.LockBusy();

    private final String name;
    private final UnaryOperator<T> copier;
    private final Supplier<? extends T> defaultFactory;
    private final ValueDisposer<T> disposer;
    private final CowMetrics metrics;
    private final WriteLock writeLock = new WriteLock();
    private final Publication<T> publication;
    private final PeriodicMetricsReporter reporter;
    private volatile boolean closed;

    /**
     * @param initial first published value
     * @param copier  returns an independent copy of a value; used by the edit variants
     */
    public CopyOnWrite(T initial, UnaryOperator<T> copier) {
        this(initial, copier, CopyOnWriteOptions.defaults());
    }

    public CopyOnWrite(T initial, UnaryOperator<T> copier, CopyOnWriteOptions<T> options) {
        Objects.requireNonNull(initial, "initial");
        Objects.requireNonNull(options, "options");
        this.copier = Objects.requireNonNull(copier, "copier");
        this.name = options.name();
        this.defaultFactory = options.defaultFactory();
        this.metrics = options.metrics();
        ValueDisposer<? super T> valueDisposer = options.disposer();
        CowMetrics sink = this.metrics;
        this.disposer = value -> {
            sink.incCellsDisposed(1);
            valueDisposer.dispose(value);
        };
        this.publication = new Publication<>(new Cell<>(initial, disposer), options.drainPolicy());

        if (options.metricsReportIntervalSeconds() > 0 && metrics instanceof AtomicCowMetrics atomicMetrics) {
            this.reporter = new PeriodicMetricsReporter(name, atomicMetrics, options.metricsReportIntervalSeconds());
            this.reporter.start();
        } else {
            this.reporter = null;
        }
    }

    public static <T> Predicate<T> alwaysPass() {
        return value -> true;
    }

    public String name() {
        return name;
    }

    // ---- Read ----

    /**
     * Returns a handle on the currently published value. Never waits for writers.
     *
     * @throws IllegalStateException if the container is closed
     */
    public ReadHandle<T> read() {
        Cell<T> cell = publication.acquire();
        metrics.incReads(1);
        return new CellReadHandle<>(cell);
    }

    /** Applies {@code reader} to the current value and releases it before returning. */
    public <R> R readWith(Function<? super T, ? extends R> reader) {
        Objects.requireNonNull(reader, "reader");
        try (ReadHandle<T> handle = read()) {
            return reader.apply(handle.get());
        }
    }

    // ---- Fresh replace ----

    /** Publishes the value built by {@code factory}, unconditionally. */
    public boolean emplace(Supplier<? extends T> factory) {
        return emplaceOutcome(factory).isApplied();
    }

    public WriteResult emplaceOutcome(Supplier<? extends T> factory) {
        Objects.requireNonNull(factory, "factory");
        return locked(() -> replace(alwaysPass(), current -> factory.get(), null));
    }

    /** Builds a fresh value with the default factory, modifies it and publishes it. */
    public boolean reset(Consumer<? super T> modifier) {
        return reset(modifier, alwaysPass());
    }

    public boolean reset(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        return reset(modifier, verifier, requireDefaultFactory());
    }

    /**
     * Builds a fresh value with {@code factory}, modifies it and publishes it, provided
     * {@code verifier} accepts the value currently published. No field of the prior value
     * carries over.
     */
    public boolean reset(Consumer<? super T> modifier, Predicate<? super T> verifier, Supplier<? extends T> factory) {
        return resetOutcome(modifier, verifier, factory).isApplied();
    }

    public WriteResult resetOutcome(Consumer<? super T> modifier,
                                    Predicate<? super T> verifier,
                                    Supplier<? extends T> factory) {
        requireWriteArguments(modifier, verifier);
        Objects.requireNonNull(factory, "factory");
        return locked(() -> replace(verifier, current -> factory.get(), modifier));
    }

    public boolean tryReset(Consumer<? super T> modifier) {
        return tryReset(modifier, alwaysPass());
    }

    public boolean tryReset(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        return tryReset(modifier, verifier, requireDefaultFactory());
    }

    /**
     * Same as {@link #reset(Consumer, Predicate, Supplier)}, except that it returns
     * {@code false} at once, running nothing, when another write holds the lock.
     */
    public boolean tryReset(Consumer<? super T> modifier, Predicate<? super T> verifier, Supplier<? extends T> factory) {
        return tryResetOutcome(modifier, verifier, factory).isApplied();
    }

    public WriteResult tryResetOutcome(Consumer<? super T> modifier,
                                       Predicate<? super T> verifier,
                                       Supplier<? extends T> factory) {
        requireWriteArguments(modifier, verifier);
        Objects.requireNonNull(factory, "factory");
        return tryLocked(() -> replace(verifier, current -> factory.get(), modifier));
    }

    // ---- Copy then modify ----

    public boolean edit(Consumer<? super T> modifier) {
        return edit(modifier, alwaysPass());
    }

    /**
     * Copies the published value, modifies the copy and publishes it, provided
     * {@code verifier} accepts the value currently published. Fields the modifier does
     * not touch keep their prior values.
     */
    public boolean edit(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        return editOutcome(modifier, verifier).isApplied();
    }

    public WriteResult editOutcome(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        requireWriteArguments(modifier, verifier);
        return locked(() -> replace(verifier, copier, modifier));
    }

    public boolean tryEdit(Consumer<? super T> modifier) {
        return tryEdit(modifier, alwaysPass());
    }

    /**
     * Same as {@link #edit(Consumer, Predicate)}, except that it returns {@code false}
     * at once, running nothing, when another write holds the lock.
     */
    public boolean tryEdit(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        return tryEditOutcome(modifier, verifier).isApplied();
    }

    public WriteResult tryEditOutcome(Consumer<? super T> modifier, Predicate<? super T> verifier) {
        requireWriteArguments(modifier, verifier);
        return tryLocked(() -> replace(verifier, copier, modifier));
    }

    // ---- Lifecycle ----

    public boolean isClosed() {
        return closed;
    }

    /**
     * Stops publishing. Later reads and writes fail with {@link IllegalStateException};
     * handles obtained earlier stay valid until closed. Idempotent.
     */
    @Override
    public void close() {
        boolean closedNow = false;
        writeLock.lock();
        try {
            if (!closed) {
                closed = true;
                closedNow = true;
                metrics.observeDrainIterations(publication.retire());
            }
        } finally {
            writeLock.unlock();
        }
        if (closedNow) {
            if (reporter != null) {
                reporter.close();
            }
            LOG.fine(() -> name + ": closed");
        }
    }

    @Override
    public String toString() {
        return "CopyOnWrite{name=" + name + ", closed=" + closed + '}';
    }

    // ---- Write sequence ----

    private WriteResult locked(Supplier<WriteResult> sequence) {
        ensureOpen();
        writeLock.lock();
        try {
            return run(sequence);
        } finally {
            writeLock.unlock();
        }
    }

    private WriteResult tryLocked(Supplier<WriteResult> sequence) {
        ensureOpen();
        if (!writeLock.tryLock()) {
            metrics.onWrite(LOCK_BUSY);
            return LOCK_BUSY;
        }
        try {
            return run(sequence);
        } finally {
            writeLock.unlock();
        }
    }

    private WriteResult run(Supplier<WriteResult> sequence) {
        ensureOpen();
        WriteResult result;
        try {
            result = sequence.get();
        } catch (RuntimeException | Error e) {
            metrics.incWriteErrors(1);
            throw e;
        }
        metrics.onWrite(result);
        if (result instanceof WriteResult.Applied applied) {
            metrics.observeDrainIterations(applied.drainIterations());
        } else if (LOG.isLoggable(Level.FINE)) {
            LOG.fine(name + ": write not applied, " + result);
        }
        return result;
    }

    /**
     * Verify, build, modify, publish. Caller holds the write lock.
     *
     * @param modifier may be {@code null}
     */
    private WriteResult replace(Predicate<? super T> verifier,
                                Function<? super T, ? extends T> builder,
                                Consumer<? super T> modifier) {
        Cell<T> original = publication.current();
        if (!verifier.test(original.value())) {
            return VERIFIER_REJECTED;
        }

        T candidate = builder.apply(original.value());
        if (candidate == null) {
            return new WriteResult.ConstructionFailed("builder returned null");
        }
        if (candidate == original.value()) {
            throw new IllegalStateException("Candidate is the published instance; copier and factory must return new objects");
        }

        Cell<T> replacement = new Cell<>(candidate, disposer);
        if (modifier != null) {
            try {
                modifier.accept(candidate);
            } catch (RuntimeException | Error e) {
                replacement.release();
                throw e;
            }
        }
        return new WriteResult.Applied(publication.publish(replacement));
    }

    private Supplier<? extends T> requireDefaultFactory() {
        if (defaultFactory == null) {
            throw new IllegalStateException(name + ": no default factory configured; pass a factory to reset");
        }
        return defaultFactory;
    }

    private static void requireWriteArguments(Object modifier, Object verifier) {
        Objects.requireNonNull(modifier, "modifier");
        Objects.requireNonNull(verifier, "verifier");
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException(name + ": container is closed");
        }
    }
}
