package com.pulsegrid.matrix.controller;

import com.pulsegrid.matrix.config.ConfigurationException;
import com.pulsegrid.matrix.controller.dto.ErrorResponseDto;
import com.pulsegrid.matrix.provider.ProviderException;
import com.pulsegrid.matrix.security.RequestContextHolder;
import jakarta.validation.ConstraintViolationException;
import java.util.HashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ConfigurationException.class)
    public ResponseEntity<ErrorResponseDto> handleConfiguration(ConfigurationException ex) {
        log.error("Anomaly matrix run aborted by configuration error: {}", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "CONFIGURATION_ERROR", ex.getMessage(), Map.of("key", ex.key()));
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponseDto> handleProvider(ProviderException ex) {
        log.error("Anomaly matrix run aborted by provider error: {}", ex.getMessage());
        Map<String, Object> details = new HashMap<>();
        details.put("segmentPair", ex.segmentPair());
        details.put("metric", ex.metricId());
        return build(HttpStatus.BAD_GATEWAY, "PROVIDER_ERROR", ex.getMessage(), details);
    }

    @ExceptionHandler({IllegalArgumentException.class, MethodArgumentTypeMismatchException.class, ConstraintViolationException.class})
    public ResponseEntity<ErrorResponseDto> handleIllegalArgument(Exception ex) {
        return build(HttpStatus.BAD_REQUEST, "INVALID_ARGUMENT", ex.getMessage(), Map.of());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponseDto> handleGeneral(Exception ex) {
        log.error("Unexpected error", ex);
        Map<String, Object> details = new HashMap<>();
        details.put("reason", ex.getMessage());
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "INTERNAL_ERROR", "Unexpected error", details);
    }

    private ResponseEntity<ErrorResponseDto> build(HttpStatus status, String code, String message, Map<String, Object> details) {
        String traceId = RequestContextHolder.get().map(RequestContextHolder.RequestContext::traceId).orElse(null);
        return ResponseEntity.status(status)
                .body(new ErrorResponseDto(code, message, details, traceId));
    }
}
