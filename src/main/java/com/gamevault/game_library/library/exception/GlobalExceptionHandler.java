package com.gamevault.game_library.library.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Global exception handler for the library REST API.
 *
 * Rejected transitions keep the current and requested category in the response
 * details so clients can tell the user why nothing changed.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(AlreadyAdvancedException.class)
    public ResponseEntity<ApiError> handleAlreadyAdvanced(AlreadyAdvancedException e) {
        log.info("Transition rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(transitionError("Already Advanced", e));
    }

    @ExceptionHandler(GameNotFoundException.class)
    public ResponseEntity<ApiError> handleGameNotFound(GameNotFoundException e) {
        log.info("Transition rejected: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
            .body(transitionError("Game Not Found", e));
    }

    @ExceptionHandler(ConcurrentTransitionException.class)
    public ResponseEntity<ApiError> handleConcurrentTransition(ConcurrentTransitionException e) {
        log.warn("Transition conflict after retries: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.CONFLICT)
            .body(transitionError("Concurrent Modification", e));
    }

    @ExceptionHandler(LibraryStorageException.class)
    public ResponseEntity<ApiError> handleStorage(LibraryStorageException e) {
        log.error("Storage failure: {}", e.getMessage(), e);
        ApiError error = ApiError.builder()
            .error("Storage Error")
            .message(e.getMessage())
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ApiError> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return badRequest("Missing Required Header",
            "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ApiError> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("Missing required parameter: {}", e.getParameterName());
        return badRequest("Missing Required Parameter",
            "Required parameter '" + e.getParameterName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleValidationException(MethodArgumentNotValidException e) {
        log.warn("Validation failed: {}", e.getMessage());

        Map<String, Object> errors = e.getBindingResult()
            .getFieldErrors()
            .stream()
            .collect(Collectors.toMap(
                error -> error.getField(),
                error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                (existing, replacement) -> existing
            ));

        return badRequest("Validation Failed", "Request validation failed", errors);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiError> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid value for {}: {}", e.getName(), e.getValue());
        return badRequest("Invalid Request", "Invalid value for '" + e.getName() + "'", null);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().getMessage());
        return badRequest("Invalid Request", e.getMostSpecificCause().getMessage(), null);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return badRequest("Invalid Request", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        log.error("Unexpected error", e);

        ApiError error = ApiError.builder()
            .error("Internal Server Error")
            .message("An unexpected error occurred")
            .timestamp(Instant.now())
            .build();

        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
    }

    private ApiError transitionError(String error, LibraryTransitionException e) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("game_id", e.getGameId());
        details.put("current_category", LibraryTransitionException.label(e.getCurrentCategory()));
        details.put("requested_category",
            e.getRequestedCategory() != null ? e.getRequestedCategory().getValue() : "removed");
        details.put("retryable", e.isRetryable());

        return ApiError.builder()
            .error(error)
            .message(e.getMessage())
            .details(details)
            .timestamp(Instant.now())
            .build();
    }

    private ResponseEntity<ApiError> badRequest(String error, String message, Map<String, Object> details) {
        ApiError body = ApiError.builder()
            .error(error)
            .message(message)
            .details(details)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(body);
    }
}
