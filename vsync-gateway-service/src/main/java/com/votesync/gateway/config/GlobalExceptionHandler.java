package com.votesync.gateway.config;

import com.votesync.common.exception.ErrorCode;
import com.votesync.common.exception.VoteSubmissionException;
import com.votesync.common.exception.VoteSyncException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST endpoints.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(VoteSyncException.class)
    public ResponseEntity<Map<String, Object>> handleVoteSyncException(VoteSyncException ex) {
        log.error("Vote sync exception: {} - {}", ex.getErrorCode(), ex.getMessage());

        String reason = ex instanceof VoteSubmissionException
                ? ((VoteSubmissionException) ex).getReason().name()
                : null;
        HttpStatus status = mapErrorCodeToHttpStatus(ex.getErrorCode());
        return ResponseEntity.status(status).body(body(ex.getErrorCode(), reason, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidationException(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        log.warn("Rejected request: {}", message);
        return ResponseEntity.badRequest().body(body(ErrorCode.INVALID_REQUEST, null, message));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<Map<String, Object>> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        log.warn("Rejected request: bad value for {}", ex.getName());
        return ResponseEntity.badRequest()
                .body(body(ErrorCode.INVALID_REQUEST, null, "Invalid value for '" + ex.getName() + "'"));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected exception", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(ErrorCode.UNKNOWN_ERROR, null, "An unexpected error occurred"));
    }

    HttpStatus mapErrorCodeToHttpStatus(ErrorCode errorCode) {
        switch (errorCode) {
            case PROPOSAL_NOT_FOUND:
                return HttpStatus.NOT_FOUND;
            case ALREADY_VOTED:
            case PROPOSAL_NOT_ACTIVE:
                return HttpStatus.CONFLICT;
            case INSUFFICIENT_WEIGHT:
            case INSUFFICIENT_FUNDS:
                return HttpStatus.UNPROCESSABLE_ENTITY;
            default:
                break;
        }

        int code = errorCode.getCode();

        if (code >= 1000 && code < 2000) {
            return HttpStatus.BAD_REQUEST;
        } else if (code >= 2000 && code < 3000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else if (code >= 4000 && code < 5000) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        } else {
            return HttpStatus.INTERNAL_SERVER_ERROR;
        }
    }

    private Map<String, Object> body(ErrorCode errorCode, String reason, String message) {
        Map<String, Object> response = new HashMap<>();
        response.put("timestamp", LocalDateTime.now());
        response.put("errorCode", errorCode.getCode());
        response.put("errorType", errorCode.name());
        response.put("reason", reason);
        response.put("message", message);
        return response;
    }
}
