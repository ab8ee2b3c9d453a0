package me.internalizable.cricketscore.controller;

import me.internalizable.cricketscore.dto.ApiMessage;
import me.internalizable.cricketscore.exception.InvalidSubmissionException;
import me.internalizable.cricketscore.exception.RateLimitExceededException;
import me.internalizable.cricketscore.exception.StoreException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps scoring failures to HTTP responses. Validation and rate-limit errors are JSON,
 * malformed bodies and store failures are short plain-text messages.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String INVALID_INPUT = "Invalid input";

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<String> handleUnreadableBody(Exception e) {
        logger.info("Rejected unreadable request body: {}", e.getMessage());
        return plainText(HttpStatus.BAD_REQUEST, INVALID_INPUT);
    }

    @ExceptionHandler(InvalidSubmissionException.class)
    public ResponseEntity<ApiMessage> handleInvalidSubmission(InvalidSubmissionException e) {
        logger.debug("Rejected shot: {}", e.getMessage());
        return ResponseEntity.badRequest().body(ApiMessage.error(e.getMessage()));
    }

    @ExceptionHandler(RateLimitExceededException.class)
    public ResponseEntity<ApiMessage> handleRateLimit(RateLimitExceededException e) {
        logger.debug("Rate limited roll number {}", e.getRollNumber());
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(ApiMessage.error(e.getMessage()));
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<String> handleStoreFailure(StoreException e) {
        logger.error("{}", e.getMessage(), e.getCause());
        return plainText(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private ResponseEntity<String> plainText(HttpStatus status, String body) {
        return ResponseEntity.status(status)
                .contentType(MediaType.TEXT_PLAIN)
                .body(body);
    }
}
