package dev.reviewgate.exception;

import dev.reviewgate.infrastructure.kantata.KantataApiException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.net.URI;
import java.time.Instant;

/**
 * Global exception handler using RFC 7807 Problem Details.
 *
 * <p>Guard rejections keep their HTTP meaning: illegal move 409, role/ownership 403, incomplete
 * review or bad status value 400. Storage failures are 500: the local database is the system of
 * record, so a failed write must never look like success. Internal exception messages from storage
 * and unexpected errors are logged server-side only.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);
    private static final String ERROR_BASE = "https://reviewgate.dev/errors/";

    @ExceptionHandler(InvalidStatusException.class)
    public ProblemDetail handleInvalidStatus(InvalidStatusException ex) {
        log.warn("Invalid status: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "invalid-status", "Invalid Status");
        problem.setProperty("field", ex.getField());
        return problem;
    }

    @ExceptionHandler(IncompleteReviewException.class)
    public ProblemDetail handleIncomplete(IncompleteReviewException ex) {
        log.warn("Incomplete review: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, ex.getMessage(), "incomplete-review", "Incomplete Review");
        problem.setProperty("code", ex.getError());
        problem.setProperty("fields", ex.getMissingFields());
        return problem;
    }

    @ExceptionHandler(TransitionForbiddenException.class)
    public ProblemDetail handleForbidden(TransitionForbiddenException ex) {
        ProblemDetail problem = problem(HttpStatus.FORBIDDEN, ex.getMessage(), "forbidden-transition", "Forbidden");
        problem.setProperty("code", ex.getError());
        return problem;
    }

    @ExceptionHandler(ReviewAccessDeniedException.class)
    public ProblemDetail handleAccessDenied(ReviewAccessDeniedException ex) {
        return problem(HttpStatus.FORBIDDEN, ex.getMessage(), "forbidden", "Forbidden");
    }

    @ExceptionHandler(IllegalTransitionException.class)
    public ProblemDetail handleIllegalTransition(IllegalTransitionException ex) {
        log.warn("Illegal transition: {}", ex.getMessage());
        ProblemDetail problem = problem(HttpStatus.CONFLICT, ex.getMessage(), "illegal-transition", "Illegal Transition");
        problem.setProperty("code", ex.getError());
        return problem;
    }

    @ExceptionHandler(ReviewNotFoundException.class)
    public ProblemDetail handleNotFound(ReviewNotFoundException ex) {
        log.debug("Not found: {}", ex.getMessage());
        return problem(HttpStatus.NOT_FOUND, ex.getMessage(), "not-found", "Not Found");
    }

    @ExceptionHandler(ExternalProjectConflictException.class)
    public ProblemDetail handleProjectConflict(ExternalProjectConflictException ex) {
        log.warn("Project link conflict: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, ex.getMessage(), "project-already-linked", "Project Already Linked");
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ProblemDetail handleConcurrentUpdate(OptimisticLockingFailureException ex) {
        log.warn("Concurrent update: {}", ex.getMessage());
        return problem(HttpStatus.CONFLICT, "The review was changed by someone else. Reload and try again.",
                "concurrent-update", "Concurrent Update");
    }

    @ExceptionHandler(DataIntegrityViolationException.class)
    public ProblemDetail handleIntegrityViolation(DataIntegrityViolationException ex) {
        log.warn("Constraint violation: {}", ex.getMostSpecificCause().getMessage());
        return problem(HttpStatus.CONFLICT, "The change conflicts with existing data.",
                "state-conflict", "State Conflict");
    }

    @ExceptionHandler(DataAccessException.class)
    public ProblemDetail handleStorageFailure(DataAccessException ex) {
        log.error("Storage failure", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "The review store is unavailable. Please try again later.",
                "storage-unavailable", "Storage Unavailable");
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        FieldError fieldError = ex.getBindingResult().getFieldError();
        String detail = fieldError != null ? fieldError.getDefaultMessage() : "Request validation failed";
        log.warn("Validation failed: {}", detail);
        ProblemDetail problem = problem(HttpStatus.BAD_REQUEST, detail, "validation", "Invalid Request");
        if (fieldError != null) {
            problem.setProperty("field", fieldError.getField());
        }
        return problem;
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class})
    public ProblemDetail handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        String detail = ex instanceof IllegalArgumentException ? ex.getMessage() : "Malformed request";
        return problem(HttpStatus.BAD_REQUEST, detail, "bad-request", "Invalid Request");
    }

    @ExceptionHandler(KantataApiException.class)
    public ProblemDetail handleKantata(KantataApiException ex) {
        log.warn("Kantata call failed: {}", ex.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "Kantata did not respond as expected. Please retry later.",
                "external-system", "External System Error");
    }

    @ExceptionHandler(RequestNotPermitted.class)
    public ProblemDetail handleRateLimited(RequestNotPermitted ex) {
        log.warn("Rate limited: {}", ex.getMessage());
        return problem(HttpStatus.TOO_MANY_REQUESTS, "Too many requests. Please retry later.",
                "rate-limited", "Rate Limited");
    }

    @ExceptionHandler(CallNotPermittedException.class)
    public ProblemDetail handleCircuitOpen(CallNotPermittedException ex) {
        log.warn("Circuit breaker open: {}", ex.getMessage());
        return problem(HttpStatus.SERVICE_UNAVAILABLE, "Service temporarily unavailable. Please retry later.",
                "service-unavailable", "Service Unavailable");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleUnexpected(Exception ex) {
        // Framework errors (unknown route, wrong method, ...) already carry their status
        if (ex instanceof ErrorResponse errorResponse) {
            return errorResponse.getBody();
        }
        log.error("Unexpected error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "An unexpected error occurred. Please try again later.",
                "internal", "Internal Server Error");
    }

    private static ProblemDetail problem(HttpStatus status, String detail, String type, String title) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setType(URI.create(ERROR_BASE + type));
        problem.setTitle(title);
        problem.setProperty("timestamp", Instant.now());
        return problem;
    }
}
