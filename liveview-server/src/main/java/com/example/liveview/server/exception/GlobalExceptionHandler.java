package com.example.liveview.server.exception;

import com.example.liveview.shared.dto.ErrorResponse;
import com.example.liveview.shared.exception.ContextNotFoundException;
import com.example.liveview.shared.exception.MalformedFrameException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.time.ZonedDateTime;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    /**
     * Plain text, the live client only checks the status.
     */
    @ExceptionHandler(ContextNotFoundException.class)
    public ResponseEntity<String> handleContextNotFoundException(ContextNotFoundException ex, ServerWebExchange exchange) {
        log.warn("ContextNotFoundException: {} (id '{}')", ex.getMessage(), ex.getContextId());
        return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .contentType(MediaType.TEXT_PLAIN)
                .body(ex.getMessage());
    }

    @ExceptionHandler(MalformedFrameException.class)
    public ResponseEntity<ErrorResponse> handleMalformedFrameException(MalformedFrameException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = errorResponse(exchange, HttpStatus.BAD_REQUEST.value(), "Malformed Callback", ex.getMessage());
        log.warn("MalformedFrameException: {}", ex.getMessage());
        return new ResponseEntity<>(errorResponse, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = errorResponse(exchange, ex.getStatusCode().value(), ex.getStatusCode().toString(), ex.getReason());

        if (ex.getStatusCode().is4xxClientError()) {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), exchange.getRequest().getPath(), ex.getReason());
        } else if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", exchange.getRequest().getPath(), ex);
        }

        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = errorResponse(exchange, HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error", "An unexpected error occurred. Please try again later.");
        log.error("An unexpected error occurred at path {}:", exchange.getRequest().getPath(), ex);
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ErrorResponse errorResponse(ServerWebExchange exchange, int status, String error, String message) {
        return ErrorResponse.builder()
                .timestamp(ZonedDateTime.now())
                .status(status)
                .error(error)
                .message(message)
                .path(exchange.getRequest().getPath().value())
                .contextId(exchange.getRequest().getQueryParams().getFirst("id"))
                .build();
    }
}
