package com.gbskill.engine.api;

import com.gbskill.engine.api.dto.ErrorResponse;
import com.gbskill.engine.benchmark.BenchmarkException;
import com.gbskill.engine.dsl.DslValidationException;
import com.gbskill.engine.service.DuplicateResourceException;
import com.gbskill.engine.service.ResourceNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to HTTP statuses with an {@link ErrorResponse} body.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(ResourceNotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, "not_found", e.getMessage());
    }

    @ExceptionHandler(DuplicateResourceException.class)
    public ResponseEntity<ErrorResponse> duplicate(DuplicateResourceException e) {
        return respond(HttpStatus.CONFLICT, "duplicate", e.getMessage());
    }

    @ExceptionHandler(BenchmarkException.class)
    public ResponseEntity<ErrorResponse> benchmark(BenchmarkException e) {
        HttpStatus status = e.getKind() == BenchmarkException.Kind.DATASET_EMPTY
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.CONFLICT;
        return respond(status, e.getKind().name().toLowerCase(Locale.ROOT), e.getMessage());
    }

    @ExceptionHandler(DslValidationException.class)
    public ResponseEntity<ErrorResponse> invalidDsl(DslValidationException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("invalid_dsl", e.getMessage(),
                        e.getProblems().isEmpty() ? null : e.getProblems()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> invalidRequest(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(f -> f.getField() + " " + f.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<ErrorResponse> badRequest(Exception e) {
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", rootMessage(e));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> status(ResponseStatusException e) {
        HttpStatus status = HttpStatus.valueOf(e.getStatusCode().value());
        return respond(status, status.name().toLowerCase(Locale.ROOT), e.getReason());
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String message) {
        log.debug("{} {}: {}", status.value(), error, message);
        return ResponseEntity.status(status).body(new ErrorResponse(error, message));
    }

    /** Jackson wraps record-constructor failures; the innermost message is the useful one. */
    private static String rootMessage(Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) t = t.getCause();
        return t.getMessage();
    }
}
