package net.eventmail.core.spi;

/**
 * Outbound alert channel. {@code toExpression} is passed through untouched; resolving aliases or
 * splitting delimiter-separated lists is up to the implementation.
 *
 * @throws net.eventmail.core.error.NotificationException when the message could not be handed off
 */
public interface Notifier {
    void send(String toExpression, String subject, String htmlBody);
}
