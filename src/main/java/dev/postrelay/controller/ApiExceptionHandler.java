package dev.postrelay.controller;

import dev.postrelay.exception.ExternalProcessFailureException;
import dev.postrelay.exception.NotFoundException;
import dev.postrelay.exception.PersistenceConflictException;
import dev.postrelay.exception.PreconditionViolationException;
import dev.postrelay.exception.StorageFailureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * Maps the relay exceptions to RFC 7807 problem responses.
 */
@Slf4j
@RestControllerAdvice
public class ApiExceptionHandler {

    @ExceptionHandler(NotFoundException.class)
    public ProblemDetail handleNotFound(NotFoundException e) {
        return problem(HttpStatus.NOT_FOUND, "Not found", e.getMessage());
    }

    @ExceptionHandler(PreconditionViolationException.class)
    public ProblemDetail handlePrecondition(PreconditionViolationException e) {
        ProblemDetail problem = problem(HttpStatus.CONFLICT, "Transition not allowed", e.getMessage());
        problem.setProperty("itemId", e.getItemId());
        problem.setProperty("state", e.getState());
        return problem;
    }

    @ExceptionHandler(PersistenceConflictException.class)
    public ProblemDetail handleConflict(PersistenceConflictException e) {
        log.warn("Concurrent modification: {}", e.getMessage());
        return problem(HttpStatus.CONFLICT, "Concurrent modification", e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException e) {
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", e.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return problem(HttpStatus.BAD_REQUEST, "Invalid request", detail);
    }

    @ExceptionHandler(ExternalProcessFailureException.class)
    public ProblemDetail handleExternalFailure(ExternalProcessFailureException e) {
        log.error("External job {} failed: {}", e.getJobName(), e.getMessage());
        return problem(HttpStatus.BAD_GATEWAY, "External job failed", e.getMessage());
    }

    @ExceptionHandler(StorageFailureException.class)
    public ProblemDetail handleStorageFailure(StorageFailureException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Storage failure", e.getMessage());
    }

    private static ProblemDetail problem(HttpStatus status, String title, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        return problem;
    }
}
