package com.netcourier.rag.controller;

import com.netcourier.rag.service.PipelineException;
import com.netcourier.rag.service.PipelineStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(PipelineException.class)
    public ResponseEntity<Map<String, Object>> handlePipelineException(PipelineException exception) {
        if (exception.status().is5xxServerError()) {
            log.error("{} stage failed: {}", exception.stage(), exception.getMessage(), exception);
        }
        return error(exception.status(), exception.getMessage(), exception.stage());
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(WebExchangeBindException exception,
                                                                ServerWebExchange exchange) {
        String message = exception.getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return error(HttpStatus.BAD_REQUEST, message.isEmpty() ? "Invalid request" : message, stageFor(exchange));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(ServerWebInputException exception,
                                                                ServerWebExchange exchange) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body", stageFor(exchange));
    }

    private PipelineStage stageFor(ServerWebExchange exchange) {
        String path = exchange.getRequest().getPath().value();
        return path.startsWith("/query") ? PipelineStage.QUERY : PipelineStage.INGESTION;
    }

    private ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, PipelineStage stage) {
        return ResponseEntity.status(status)
                .body(Map.of(
                        "error", message,
                        "stage", stage.name()
                ));
    }
}
