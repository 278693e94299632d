package com.releasewatch.service.notify;

import com.releasewatch.core.model.RoutedEvent;

import java.util.logging.Logger;

/**
 * Writes messages to the log instead of posting them. Used when no webhook is configured.
 */
public class LoggingNotifier implements Notifier {
    private static final Logger LOGGER = Logger.getLogger(LoggingNotifier.class.getName());

    @Override
    public void deliver(RoutedEvent routed) {
        LOGGER.info(() -> "#" + routed.channel() + " " + MessageFormatter.format(routed));
    }
}
