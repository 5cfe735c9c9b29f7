package io.github.drompincen.cronsync.app.controller;

import io.github.drompincen.cronsync.runtime.editor.JobValidationException;
import io.github.drompincen.cronsync.runtime.gateway.GatewayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@RestControllerAdvice
public class CronExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(CronExceptionHandler.class);

    @ExceptionHandler(JobValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, String> handleValidation(JobValidationException ex) {
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, String> handleConflict(IllegalStateException ex) {
        return Map.of("error", ex.getMessage());
    }

    @ExceptionHandler(GatewayException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Map<String, String> handleGateway(GatewayException ex) {
        log.warn("Gateway request failed: {}", ex.getMessage());
        return Map.of("error", ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName());
    }
}
