package io.github.eutro.qasm2py.api.events;

/**
 * Base class for events that a listener can cancel.
 * <p>
 * Once cancelled, an event is not passed to any further listeners, and whatever fired it
 * skips the action it announced.
 */
public abstract class CancellableEvent {
    private boolean cancelled;

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Cancel this event. Cancelling twice has no further effect.
     */
    public void cancel() {
        cancelled = true;
    }
}
