package com.linlay.agentgateway.controller;

import com.linlay.agentgateway.model.api.ChatEnvelope;
import com.linlay.agentgateway.service.ErrorKind;
import com.linlay.agentgateway.service.GatewayException;
import com.linlay.agentgateway.service.UploadValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.buffer.DataBufferLimitException;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

import java.util.Objects;

/**
 * Renders every failure as a {@code success:false} envelope. Internal detail is logged, never returned.
 */
@RestControllerAdvice
public class GatewayExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GatewayExceptionHandler.class);

    static final String MESSAGE_TOO_LARGE = "Message too large";

    private final UploadValidator uploadValidator;

    public GatewayExceptionHandler(UploadValidator uploadValidator) {
        this.uploadValidator = uploadValidator;
    }

    @ExceptionHandler(GatewayException.class)
    public ResponseEntity<ChatEnvelope> handleGateway(GatewayException ex) {
        return envelope(ex.kind(), ex.getMessage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ChatEnvelope> handleValidation(WebExchangeBindException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse("Validation failed");
        log.info("Rejected request reason=validation, fields={}", ex.getBindingResult().getFieldErrorCount());
        return envelope(ErrorKind.INVALID_INPUT, message);
    }

    /**
     * A body crossed a buffering limit: the upload cap for multipart requests, the codec limit
     * for JSON chat messages.
     */
    @ExceptionHandler(DataBufferLimitException.class)
    public ResponseEntity<ChatEnvelope> handleBufferLimit(DataBufferLimitException ex, ServerWebExchange exchange) {
        MediaType contentType = exchange.getRequest().getHeaders().getContentType();
        if (contentType != null && MediaType.MULTIPART_FORM_DATA.isCompatibleWith(contentType)) {
            log.info("Rejected oversized upload: {}", ex.getMessage());
            return envelope(ErrorKind.PAYLOAD_TOO_LARGE, uploadValidator.tooLarge().getMessage());
        }
        log.info("Rejected oversized message path={}: {}", exchange.getRequest().getPath().value(), ex.getMessage());
        return envelope(ErrorKind.INVALID_INPUT, MESSAGE_TOO_LARGE);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ChatEnvelope> handleResponseStatusException(ResponseStatusException ex) {
        HttpStatusCode statusCode = ex.getStatusCode();
        String message = ex.getReason();
        if (message == null || message.isBlank()) {
            HttpStatus httpStatus = HttpStatus.resolve(statusCode.value());
            message = httpStatus != null ? httpStatus.getReasonPhrase() : "Request failed";
        }
        String error = statusCode.is4xxClientError() ? ErrorKind.INVALID_INPUT.name() : ErrorKind.DOWNSTREAM_ERROR.name();
        return ResponseEntity.status(statusCode).body(ChatEnvelope.failure(error, message));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ChatEnvelope> handleUnexpected(Exception ex) {
        log.error("Unhandled gateway error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ChatEnvelope.failure(ErrorKind.DOWNSTREAM_ERROR.name(), "Internal server error"));
    }

    private ResponseEntity<ChatEnvelope> envelope(ErrorKind kind, String message) {
        return ResponseEntity.status(kind.status()).body(ChatEnvelope.failure(kind.name(), message));
    }
}
