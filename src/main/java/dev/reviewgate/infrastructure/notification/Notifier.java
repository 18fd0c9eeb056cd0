package dev.reviewgate.infrastructure.notification;

import java.util.Collection;

/**
 * Delivery boundary. Implementations are best-effort and must not throw on delivery failure.
 *
 * @return true when the message was handed to the transport
 */
public interface Notifier {
    boolean send(Collection<String> recipients, String subject, String body);
}
