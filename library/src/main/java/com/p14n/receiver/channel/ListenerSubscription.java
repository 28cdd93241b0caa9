package com.p14n.receiver.channel;

import java.lang.ref.WeakReference;
import java.util.concurrent.atomic.AtomicBoolean;

import com.p14n.receiver.disposal.Disposable;

/**
 * Handle returned by {@link Channel#listen}. References the channel weakly so
 * an outstanding subscription never keeps a channel alive; disposing after
 * the channel is gone does nothing.
 */
final class ListenerSubscription implements Disposable {

    private final WeakReference<Channel<?>> channel;
    private final long token;
    private final AtomicBoolean disposed = new AtomicBoolean(false);

    ListenerSubscription(Channel<?> channel, long token) {
        this.channel = new WeakReference<>(channel);
        this.token = token;
    }

    @Override
    public void dispose() {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }
        Channel<?> target = channel.get();
        if (target != null) {
            target.remove(token);
        }
    }

    @Override
    public boolean isDisposed() {
        return disposed.get();
    }

    @Override
    public String toString() {
        return "ListenerSubscription[token=" + token + ", disposed=" + disposed.get() + "]";
    }
}
