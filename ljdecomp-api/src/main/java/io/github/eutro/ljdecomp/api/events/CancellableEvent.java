package io.github.eutro.ljdecomp.api.events;

/**
 * An event that can be cancelled, preventing other listeners from receiving it.
 */
public interface CancellableEvent {
    boolean isCancelled();

    void cancel();
}
