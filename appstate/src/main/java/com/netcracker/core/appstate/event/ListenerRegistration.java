package com.netcracker.core.appstate.event;

/**
 * Handle of a listener subscribed to a {@link ChangeNotifier}.
 * <p>
 * The handle does not own the notifier; dropping it keeps the listener subscribed.
 */
public interface ListenerRegistration {

    /**
     * Unsubscribes the listener. Events fired after this call are not delivered to it.
     * Calling it again has no effect.
     */
    void cancel();

    /**
     * @return true if this registration has been cancelled
     */
    boolean isCancelled();
}
