package com.containerkit.engine.api;

import com.containerkit.engine.error.EngineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps {@link EngineException} kinds onto HTTP statuses for every controller.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(EngineException.class)
    public ProblemDetail handleEngineException(EngineException e) {
        HttpStatus status = statusFor(e.getKind());
        if (status.is5xxServerError()) {
            log.warn("Request failed [{}]: {}", e.getKind(), e.getMessage());
        }
        ProblemDetail body = ProblemDetail.forStatusAndDetail(status, e.getMessage());
        body.setProperty("kind", e.getKind().name());
        return body;
    }

    static HttpStatus statusFor(EngineException.Kind kind) {
        return switch (kind) {
            case NOT_FOUND  -> HttpStatus.NOT_FOUND;
            case VALIDATION -> HttpStatus.BAD_REQUEST;
            case RESOURCE   -> HttpStatus.SERVICE_UNAVAILABLE;
            case TIMEOUT    -> HttpStatus.GATEWAY_TIMEOUT;
            case INTERNAL   -> HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
