package net.eventmail.core.error;

/** Root of the engine's own failures. Everything below is unchecked. */
public class EventMailException extends RuntimeException {
    public EventMailException(String message) { super(message); }
    public EventMailException(String message, Throwable cause) { super(message, cause); }
}
