package com.p14n.receiver.disposal;

/**
 * Handle for a registration that can be cancelled.
 * Disposal is idempotent: only the first call has an effect.
 */
public interface Disposable {

    /**
     * Cancels the registration. Calling it again has no effect.
     */
    void dispose();

    /**
     * @return true once {@link #dispose()} has run
     */
    boolean isDisposed();

    /**
     * Hands this disposable to a bag, which disposes it together with the
     * bag's other contents.
     *
     * @param bag The bag to add this disposable to
     * @return this disposable
     */
    default Disposable disposedBy(DisposeBag bag) {
        bag.add(this);
        return this;
    }
}
