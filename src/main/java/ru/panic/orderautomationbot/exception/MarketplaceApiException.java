package ru.panic.orderautomationbot.exception;

/**
 * Thrown when a marketplace request fails or its response cannot be parsed.
 */
public class MarketplaceApiException extends RuntimeException {

    public MarketplaceApiException(String message) {
        super(message);
    }

    public MarketplaceApiException(String message, Throwable cause) {
        super(message, cause);
    }
}
