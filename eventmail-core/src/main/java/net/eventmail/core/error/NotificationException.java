package net.eventmail.core.error;

public class NotificationException extends EventMailException {
    public NotificationException(String message, Throwable cause) { super(message, cause); }
}
