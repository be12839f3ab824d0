package com.baskettecase.mongostudio.api;

import com.baskettecase.mongostudio.exception.ConnectionFailedException;
import com.baskettecase.mongostudio.exception.DriverException;
import com.baskettecase.mongostudio.exception.InvalidQueryShapeException;
import com.baskettecase.mongostudio.exception.NotFoundException;
import com.baskettecase.mongostudio.exception.PersistenceException;
import com.baskettecase.mongostudio.exception.QueryParseException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the error taxonomy to HTTP statuses with a {@code {error, message}} body
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "NotFound", e.getMessage());
    }

    @ExceptionHandler(QueryParseException.class)
    public ResponseEntity<ErrorResponse> handleParseError(QueryParseException e) {
        return respond(HttpStatus.BAD_REQUEST, "ParseError", e.getMessage());
    }

    @ExceptionHandler(InvalidQueryShapeException.class)
    public ResponseEntity<ErrorResponse> handleInvalidShape(InvalidQueryShapeException e) {
        return respond(HttpStatus.BAD_REQUEST, "InvalidQueryShape", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException e) {
        return respond(HttpStatus.BAD_REQUEST, "BadRequest", "Request body is missing or malformed");
    }

    @ExceptionHandler(ConnectionFailedException.class)
    public ResponseEntity<ErrorResponse> handleConnectionFailed(ConnectionFailedException e) {
        return respond(HttpStatus.BAD_GATEWAY, "ConnectionFailed", e.getMessage());
    }

    @ExceptionHandler(DriverException.class)
    public ResponseEntity<ErrorResponse> handleDriverError(DriverException e) {
        return respond(HttpStatus.BAD_GATEWAY, "DriverError", e.getMessage());
    }

    @ExceptionHandler(PersistenceException.class)
    public ResponseEntity<ErrorResponse> handlePersistenceError(PersistenceException e) {
        log.error("❌ Storage failure", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "PersistenceError", e.getMessage());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }

    public record ErrorResponse(String error, String message) {}
}
