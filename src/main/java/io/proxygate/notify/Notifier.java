package io.proxygate.notify;

import io.proxygate.model.Notification;

/**
 * Outbound messages to channel members and the operator. Delivery failures are reported to the
 * caller but never undo a credential transition.
 */
public interface Notifier {
    void notify(String userId, Notification notification) throws NotificationException;

    /**
     * Sends an operator alert. Implementations without a configured admin drop it silently.
     */
    void notifyAdmin(String detail) throws NotificationException;
}
