package net.eventmail.core.error;

public class ActionExecutionException extends EventMailException {
    public ActionExecutionException(String message) { super(message); }
    public ActionExecutionException(String message, Throwable cause) { super(message, cause); }
}
