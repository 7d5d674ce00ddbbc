package com.creatorradar.api.controller;

import com.creatorradar.api.dto.ErrorBody;
import com.creatorradar.api.validation.MessageValidationException;
import com.creatorradar.discovery.queue.QueuePublishException;
import com.creatorradar.discovery.queue.QueueSignatureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps request failures to ErrorBody (error, message, timestamp): @Valid and worker message failures to 400,
 * bad queue signatures to 401, and a queue that refuses a new job's messages to 503.
 */
@RestControllerAdvice
@Slf4j
public class ValidationExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = userFacingMessage(error, ex);
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(MessageValidationException.class)
    public ResponseEntity<ErrorBody> handleInvalidMessage(MessageValidationException ex) {
        log.warn("Rejected worker message: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_MESSAGE", ex.getMessage()));
    }

    @ExceptionHandler(QueueSignatureException.class)
    public ResponseEntity<ErrorBody> handleSignature(QueueSignatureException ex) {
        log.warn("Rejected worker delivery: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED).body(ErrorBody.of("INVALID_SIGNATURE", ex.getMessage()));
    }

    @ExceptionHandler(QueuePublishException.class)
    public ResponseEntity<ErrorBody> handlePublish(QueuePublishException ex) {
        log.error("Queue unavailable", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("QUEUE_UNAVAILABLE", "Could not dispatch workers, try again later"));
    }

    private static String userFacingMessage(String errorCode, WebExchangeBindException ex) {
        return switch (errorCode) {
            case "INVALID_OWNER" -> "ownerId is required";
            case "INVALID_PLATFORM" -> "Invalid platform. Must be one of: tiktok, instagram, youtube";
            case "INVALID_KEYWORDS" -> "Provide 1 to 50 keywords of 2 to 100 characters";
            case "INVALID_TARGET" -> "targetResults must be between 1 and 1000";
            default -> ex.getFieldErrors().stream()
                    .findFirst()
                    .map(e -> e.getField() + ": " + e.getDefaultMessage())
                    .orElse("Validation failed");
        };
    }
}
