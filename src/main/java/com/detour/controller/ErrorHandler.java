package com.detour.controller;

import com.detour.interceptor.InterceptorException;
import com.detour.transport.ErrorKind;
import com.detour.transport.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

@Slf4j
@RestControllerAdvice
public class ErrorHandler {

    @ExceptionHandler(TransportException.class)
    public ResponseEntity<Map<String, Object>> handleTransport(TransportException ex) {
        boolean timeout = ex.getKind() == ErrorKind.TIMEOUT;
        HttpStatus status = timeout ? HttpStatus.GATEWAY_TIMEOUT : HttpStatus.BAD_GATEWAY;
        return ResponseEntity.status(status).body(Map.of(
                "code", timeout ? "UPSTREAM_TIMEOUT" : "UPSTREAM_UNREACHABLE",
                "kind", ex.getKind().name(),
                "message", String.valueOf(ex.getMessage())
        ));
    }

    @ExceptionHandler(InterceptorException.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleInterceptor(InterceptorException ex) {
        log.error("Interceptor failure", ex);
        return Map.of(
                "code", "INTERCEPTOR_FAILED",
                "interceptor", String.valueOf(ex.getInterceptorName()),
                "message", String.valueOf(ex.getMessage())
        );
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleBadRequest(IllegalArgumentException ex) {
        return Map.of(
                "code", "BAD_REQUEST",
                "message", String.valueOf(ex.getMessage())
        );
    }
}
