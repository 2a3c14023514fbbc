package com.flairbit.calls.exceptions;

import com.flairbit.calls.dto.Error;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParticipantsException.class)
    public ResponseEntity<Error> invalidParticipants(InvalidParticipantsException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, "invalid_participants", e.getMessage());
    }

    @ExceptionHandler(SessionClosedException.class)
    public ResponseEntity<Error> sessionClosed(SessionClosedException e) {
        return error(HttpStatus.CONFLICT, "session_closed", e.getMessage());
    }

    @ExceptionHandler(InvalidStateTransitionException.class)
    public ResponseEntity<Error> invalidTransition(InvalidStateTransitionException e) {
        return error(HttpStatus.CONFLICT, "invalid_state_transition", e.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Error> unauthorized(UnauthorizedException e) {
        return error(HttpStatus.FORBIDDEN, "unauthorized", e.getMessage());
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<Error> notFound(NotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(RateLimitException.class)
    public ResponseEntity<Error> rateLimited(RateLimitException e) {
        return error(HttpStatus.TOO_MANY_REQUESTS, "rate_limited", e.getMessage());
    }

    @ExceptionHandler(StorageUnavailableException.class)
    public ResponseEntity<Error> storageUnavailable(StorageUnavailableException e) {
        log.warn("Storage unavailable: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "storage_unavailable", e.getMessage());
    }

    @ExceptionHandler(UploadExhaustedException.class)
    public ResponseEntity<Error> uploadExhausted(UploadExhaustedException e) {
        return error(HttpStatus.SERVICE_UNAVAILABLE, "upload_exhausted", e.getMessage());
    }

    @ExceptionHandler(ConsentRequiredException.class)
    public ResponseEntity<Error> consentRequired(ConsentRequiredException e) {
        return error(HttpStatus.PRECONDITION_FAILED, "consent_required", e.getMessage());
    }

    @ExceptionHandler(RejectedExecutionException.class)
    public ResponseEntity<Error> busy(RejectedExecutionException e) {
        log.warn("Work rejected: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, "busy", "Server is busy, retry shortly");
    }

    @ExceptionHandler(BadRequestException.class)
    public ResponseEntity<Error> badRequest(BadRequestException e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Error> invalidBody(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return error(HttpStatus.BAD_REQUEST, "validation_failed", message);
    }

    @ExceptionHandler({ConstraintViolationException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, IllegalArgumentException.class})
    public ResponseEntity<Error> malformed(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "bad_request", e.getMessage());
    }

    private ResponseEntity<Error> error(HttpStatus status, String code, String message) {
        return ResponseEntity.status(status).body(Error.builder()
                .status(status.value())
                .code(code)
                .message(message)
                .timestamp(Instant.now())
                .build());
    }
}
