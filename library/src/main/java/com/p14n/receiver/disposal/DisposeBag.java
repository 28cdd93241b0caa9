package com.p14n.receiver.disposal;

import java.lang.ref.Cleaner;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Collects {@link Disposable}s and disposes them together.
 *
 * <p>
 * Use it with try-with-resources to tie a group of subscriptions to a scope;
 * every exit path, including exceptions, disposes the contents:
 * </p>
 *
 * <pre>{@code
 * try (DisposeBag bag = new DisposeBag()) {
 *     channel.listen(value -> ...).disposedBy(bag);
 *     other.listen(value -> ...).disposedBy(bag);
 *     ...
 * }
 * }</pre>
 *
 * <p>
 * A bag that becomes unreachable without being closed still disposes its
 * contents, once the garbage collector notices. The bag stays usable after
 * {@link #disposeAll()}.
 * </p>
 */
public final class DisposeBag implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DisposeBag.class);

    private static final Cleaner CLEANER = Cleaner.create(
            new ThreadFactoryBuilder()
                    .setNameFormat("receiver-dispose-bag-cleaner-%d")
                    .setDaemon(true)
                    .build());

    private final Contents contents = new Contents();

    public DisposeBag() {
        CLEANER.register(this, contents);
    }

    /**
     * Adds a disposable to the bag.
     *
     * @param disposable The disposable to hold
     */
    public void add(Disposable disposable) {
        Objects.requireNonNull(disposable, "disposable");
        contents.add(disposable);
    }

    /**
     * Disposes every held disposable exactly once and empties the bag.
     * All disposables are disposed even if some throw; the first failure is
     * rethrown afterwards with the others attached as suppressed.
     */
    public void disposeAll() {
        contents.disposeAll();
    }

    /**
     * Same as {@link #disposeAll()}.
     */
    @Override
    public void close() {
        disposeAll();
    }

    public int size() {
        return contents.size();
    }

    // Must not reference the bag, or the cleaner would keep it reachable.
    private static final class Contents implements Runnable {

        private final List<Disposable> disposables = new ArrayList<>();

        synchronized void add(Disposable disposable) {
            disposables.add(disposable);
        }

        synchronized int size() {
            return disposables.size();
        }

        void disposeAll() {
            List<Disposable> held;
            synchronized (this) {
                if (disposables.isEmpty()) {
                    return;
                }
                held = new ArrayList<>(disposables);
                disposables.clear();
            }
            logger.atDebug().log(() -> "Disposing " + held.size() + " subscriptions");

            RuntimeException failure = null;
            for (Disposable disposable : held) {
                try {
                    disposable.dispose();
                } catch (RuntimeException e) {
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
        public void run() {
            try {
                disposeAll();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Error disposing subscriptions of an unreachable bag");
            }
        }
    }
}
