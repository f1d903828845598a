package com.agentflow.api.rest;

import com.agentflow.core.exception.ConflictException;
import com.agentflow.core.exception.InvalidStateTransitionException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.OptimisticLockException;
import com.agentflow.core.exception.AgentflowException;
import com.agentflow.core.exception.StoreUnavailableException;
import com.agentflow.core.exception.TransientStoreException;
import com.agentflow.core.exception.WorkflowValidationException;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Translates exceptions into {@link ErrorResponse} envelopes.
 *
 * <ul>
 *   <li>{@link WorkflowValidationException} → 400 with every violation</li>
 *   <li>{@link NotFoundException} → 404</li>
 *   <li>{@link ConflictException}, {@link InvalidStateTransitionException}, {@link OptimisticLockException} → 409</li>
 *   <li>{@link StoreUnavailableException}, {@link TransientStoreException} → 503</li>
 *   <li>unreadable bodies and malformed parameters → 400 {@code BAD_REQUEST}</li>
 *   <li>anything else → 500 {@code INTERNAL_ERROR}, without internal details</li>
 * </ul>
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    public static final String BAD_REQUEST = "BAD_REQUEST";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler(WorkflowValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(WorkflowValidationException e, HttpServletRequest request) {
        log.info("Rejected {} {}: {}", request.getMethod(), request.getRequestURI(), e.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(e.getErrorCode(), e.getResult(), request.getRequestURI()));
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(NotFoundException e, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, e, request);
    }

    @ExceptionHandler({
        ConflictException.class,
        InvalidStateTransitionException.class,
        OptimisticLockException.class
    })
    public ResponseEntity<ErrorResponse> handleConflict(AgentflowException e, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, e, request);
    }

    @ExceptionHandler({StoreUnavailableException.class, TransientStoreException.class})
    public ResponseEntity<ErrorResponse> handleStore(AgentflowException e, HttpServletRequest request) {
        log.error("Store unavailable serving {} {}", request.getMethod(), request.getRequestURI(), e);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, e, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                          HttpServletRequest request) {
        log.info("Unreadable request body at {}: {}", request.getRequestURI(), e.getMessage());
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(BAD_REQUEST, "Malformed JSON request body", request.getRequestURI()));
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        MissingServletRequestParameterException.class,
        IllegalArgumentException.class
    })
    public ResponseEntity<ErrorResponse> handleBadArgument(Exception e, HttpServletRequest request) {
        return ResponseEntity.badRequest()
            .body(ErrorResponse.of(BAD_REQUEST, e.getMessage(), request.getRequestURI()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unhandled exception at {} {}", request.getMethod(), request.getRequestURI(), e);
        return ResponseEntity.internalServerError()
            .body(ErrorResponse.of(INTERNAL_ERROR, "An unexpected error occurred", request.getRequestURI()));
    }

    // ========== Internal Methods ==========

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, AgentflowException e,
                                                         HttpServletRequest request) {
        if (status.is4xxClientError()) {
            log.debug("Client error [{}] at {}: {}", e.getErrorCode(), request.getRequestURI(), e.getMessage());
        }
        return ResponseEntity.status(status)
            .body(ErrorResponse.of(e.getErrorCode(), e.getMessage(), request.getRequestURI()));
    }
}
