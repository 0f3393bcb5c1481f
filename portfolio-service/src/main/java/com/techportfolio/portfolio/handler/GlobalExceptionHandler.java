package com.techportfolio.portfolio.handler;

import com.techportfolio.common.exception.PortfolioException;
import com.techportfolio.common.exception.ValidationException;
import com.techportfolio.portfolio.dto.ErrorResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.stream.Collectors;

/**
 * Maps failures to {@link ErrorResponse} bodies. Storage and aggregation failures get
 * a generic message; their details only go to the log.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String GENERIC_MESSAGE = "The request could not be completed, please retry later";

    @ExceptionHandler(ValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(ValidationException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.isConflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST;
        log.info("Request rejected. path={} status={} reason={}", pathOf(exchange), status.value(), ex.getMessage());
        return build(status, ex.getMessage(), exchange);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleBinding(WebExchangeBindException ex, ServerWebExchange exchange) {
        String message = ex.getFieldErrors().stream()
            .map(GlobalExceptionHandler::describe)
            .collect(Collectors.joining("; "));
        return build(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInput(ServerWebInputException ex, ServerWebExchange exchange) {
        return build(HttpStatus.BAD_REQUEST, ex.getReason() != null ? ex.getReason() : "Invalid request", exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleStatus(ResponseStatusException ex, ServerWebExchange exchange) {
        HttpStatusCode code = ex.getStatusCode();
        HttpStatus status = HttpStatus.resolve(code.value());
        return build(status != null ? status : HttpStatus.INTERNAL_SERVER_ERROR,
                     ex.getReason() != null ? ex.getReason() : String.valueOf(code.value()), exchange);
    }

    @ExceptionHandler(PortfolioException.class)
    public ResponseEntity<ErrorResponse> handlePortfolio(PortfolioException ex, ServerWebExchange exchange) {
        log.error("Request failed. path={} kind={}", pathOf(exchange), ex.getKind(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_MESSAGE, exchange);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleOther(Exception ex, ServerWebExchange exchange) {
        log.error("Unexpected error. path={}", pathOf(exchange), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, GENERIC_MESSAGE, exchange);
    }

    private static ResponseEntity<ErrorResponse> build(HttpStatus status, String message, ServerWebExchange exchange) {
        ErrorResponse body = new ErrorResponse(status.value(), status.getReasonPhrase(), message,
                                               pathOf(exchange), LocalDateTime.now());
        return ResponseEntity.status(status).body(body);
    }

    private static String pathOf(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().value();
    }

    private static String describe(FieldError error) {
        return error.getField() + " " + error.getDefaultMessage();
    }
}
