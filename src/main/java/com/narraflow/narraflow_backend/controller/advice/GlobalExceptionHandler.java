package com.narraflow.narraflow_backend.controller.advice;

import com.narraflow.narraflow_backend.exception.*;
import com.narraflow.narraflow_backend.model.dto.ApiError;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.ServletRequestBindingException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.Map;

/**
 * Maps engine errors to HTTP statuses with an {@link ApiError} body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(FlowGraphException.class)
    public ResponseEntity<ApiError> handleFlowGraphException(FlowGraphException ex) {
        HttpStatus status = statusOf(ex);
        if (status.is5xxServerError()) {
            log.error("Flow graph error: {} [{}]", ex.getMessage(), ex.getErrorCode(), ex);
        } else {
            log.warn("Flow graph error: {} [{}]", ex.getMessage(), ex.getErrorCode());
        }
        return ResponseEntity.status(status).body(toApiError(ex));
    }

    @ExceptionHandler(OptimisticLockingFailureException.class)
    public ResponseEntity<ApiError> handleOptimisticLock(OptimisticLockingFailureException ex) {
        log.warn("Concurrent modification: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(ApiError.of("The node was changed concurrently, reload and retry", "CONCURRENT_MODIFICATION"));
    }

    @ExceptionHandler({
            IllegalArgumentException.class,
            HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            ServletRequestBindingException.class
    })
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(ApiError.of(ex.getMessage(), "INVALID_ARGUMENT"));
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ApiError> handleNoResourceFoundException(NoResourceFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiError.of("Resource not found", "NOT_FOUND"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception ex) {
        log.error("Unexpected error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ApiError("An unexpected error occurred", "INTERNAL_ERROR", null, ex.getMessage()));
    }

    public static HttpStatus statusOf(FlowGraphException ex) {
        if (ex instanceof StructuralViolationException || ex instanceof PayloadSchemaViolationException) {
            return HttpStatus.UNPROCESSABLE_ENTITY;
        }
        if (ex instanceof LockRequiredException) {
            return HttpStatus.LOCKED;
        }
        if (ex instanceof LockConflictException) {
            return HttpStatus.CONFLICT;
        }
        if (ex instanceof FlowNotFoundException || ex instanceof NodeNotFoundException) {
            return HttpStatus.NOT_FOUND;
        }
        if (ex instanceof SessionNotJoinedException) {
            return HttpStatus.FORBIDDEN;
        }
        if (ex instanceof ReferenceIndexException) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    public static ApiError toApiError(FlowGraphException ex) {
        Object details = null;
        if (ex instanceof LockConflictException conflict && conflict.getHeldLease() != null) {
            details = Map.of(
                    "holder", conflict.getHeldLease().holder(),
                    "sessionId", conflict.getHeldLease().sessionId());
        }
        return new ApiError(ex.getMessage(), ex.getErrorCode(), ex.getEntityId(), details);
    }
}
