package com.releasewatch.service.notify;

import com.releasewatch.core.model.RoutedEvent;

/**
 * Delivers one routed event to its channel. Implementations must either deliver or throw; the
 * caller keeps the event pending on failure.
 */
public interface Notifier {
    void deliver(RoutedEvent routed) throws DeliveryException;
}
