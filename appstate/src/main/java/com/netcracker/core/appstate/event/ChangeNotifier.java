package com.netcracker.core.appstate.event;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Synchronous observer list for dynamic variable changes.
 * <p>
 * Listeners run in registration order on the caller's thread. Delivery works on a copy of the list,
 * so subscribing or cancelling from inside a listener takes effect with the next event.
 * Not thread-safe; callers serialize access together with the variable store.
 */
@Slf4j
public class ChangeNotifier {

    private final List<Subscription> subscriptions = new ArrayList<>();
    private final ListenerFailurePolicy failurePolicy;

    public ChangeNotifier() {
        this(ListenerFailurePolicy.LOG_AND_CONTINUE);
    }

    public ChangeNotifier(ListenerFailurePolicy failurePolicy) {
        this.failurePolicy = Objects.requireNonNull(failurePolicy, "failurePolicy");
    }

    public ListenerRegistration subscribe(VariableChangeListener listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = new Subscription(listener);
        subscriptions.add(subscription);
        return subscription;
    }

    /**
     * Subscribes a listener to one kind of change only.
     */
    public ListenerRegistration subscribe(VariableChangeType type, VariableChangeListener listener) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(listener, "listener");
        return subscribe(event -> {
            if (event.getType() == type) {
                listener.onVariableChanged(event);
            }
        });
    }

    public int listenerCount() {
        return subscriptions.size();
    }

    public ListenerFailurePolicy getFailurePolicy() {
        return failurePolicy;
    }

    public void fire(VariableChangeEvent event) {
        Objects.requireNonNull(event, "event");
        for (Subscription subscription : List.copyOf(subscriptions)) {
            if (subscription.isCancelled()) {
                continue;
            }
            try {
                subscription.listener.onVariableChanged(event);
            } catch (RuntimeException e) {
                if (failurePolicy == ListenerFailurePolicy.PROPAGATE) {
                    log.warn("Listener failed on {} of variable '{}', propagating", event.getType(), event.getVariableName(), e);
                    throw e;
                }
                log.error("Listener failed on {} of variable '{}', continuing with the next listener",
                        event.getType(), event.getVariableName(), e);
            }
        }
    }

    private final class Subscription implements ListenerRegistration {
        private final VariableChangeListener listener;
        private boolean cancelled;

        private Subscription(VariableChangeListener listener) {
            this.listener = listener;
        }

        @Override
        public void cancel() {
            if (!cancelled) {
                cancelled = true;
                subscriptions.remove(this);
            }
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }
    }
}
