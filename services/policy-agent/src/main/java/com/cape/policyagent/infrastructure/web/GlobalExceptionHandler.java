package com.cape.policyagent.infrastructure.web;

import com.cape.label.IdentifierConflictException;
import com.cape.label.LabelNotFoundException;
import com.cape.observability.CorrelationContextHolder;
import java.net.URI;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses:
 *
 * <pre>
 * {
 *   "type": "https://cape.dev/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "group 'clearance' not found",
 *   "entity": "group",
 *   "timestamp": "2026-10-19T10:30:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Constraint violations and broken label-store preconditions are server faults and map to 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://cape.dev/errors/";

    @ExceptionHandler(LabelNotFoundException.class)
    public ProblemDetail handleNotFound(LabelNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.NOT_FOUND, "not-found", ex.getMessage());
        problem.setProperty("entity", ex.entity());
        return problem;
    }

    @ExceptionHandler(IdentifierConflictException.class)
    public ProblemDetail handleConflict(IdentifierConflictException ex) {
        log.warn("Conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "conflict", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, "validation", detail);
        problem.setTitle("Validation Error");
        return problem;
    }

    @ExceptionHandler({
        HttpMessageNotReadableException.class,
        MethodArgumentTypeMismatchException.class
    })
    public ProblemDetail handleUnreadable(Exception ex) {
        log.warn("Malformed request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "bad-request", "Malformed request");
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ProblemDetail handleNoResource(NoResourceFoundException ex) {
        return problem(HttpStatus.NOT_FOUND, "not-found", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(
                HttpStatus.INTERNAL_SERVER_ERROR, "internal", "An unexpected error occurred");
    }

    private ProblemDetail problem(HttpStatus status, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(status.getReasonPhrase());
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }
}
