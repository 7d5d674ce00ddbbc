package com.creatorradar.api.validation;

/**
 * A worker message that cannot be processed as delivered. Redelivery would not help, so it maps to 400.
 */
public class MessageValidationException extends RuntimeException {

    public MessageValidationException(String message) {
        super(message);
    }

    public MessageValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
