package com.netcracker.core.appstate.event;

/**
 * What {@link ChangeNotifier} does when a listener throws.
 * The variable change is committed before delivery in both cases.
 */
public enum ListenerFailurePolicy {
    /**
     * Log the failure and deliver the event to the remaining listeners.
     */
    LOG_AND_CONTINUE,
    /**
     * Stop delivery and rethrow the failure to the caller that changed the variable.
     */
    PROPAGATE
}
