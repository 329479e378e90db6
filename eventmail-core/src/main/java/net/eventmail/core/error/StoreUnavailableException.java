package net.eventmail.core.error;

/** The backing store could not be reached. The tick is aborted and retried on the next one. */
public class StoreUnavailableException extends EventMailException {
    public StoreUnavailableException(String message, Throwable cause) { super(message, cause); }
}
