package ru.panic.orderautomationbot.exception;

/**
 * Thrown when the support site rejects the session (401/403) or the session/CSRF token cannot be obtained.
 * The only failure a ticket submission is retried on.
 */
public class SupportAuthorizationException extends RuntimeException {

    public SupportAuthorizationException(String message) {
        super(message);
    }

    public SupportAuthorizationException(String message, Throwable cause) {
        super(message, cause);
    }
}
