package ru.nsu.g.akononov.agent.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import ru.nsu.g.akononov.agent.api.ApiViews.ApiError;

import java.time.Clock;

/**
 * Turns every error the web layer raises into the API's JSON error body.
 */
@RestControllerAdvice
public class ApiExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class.getSimpleName());

    @Autowired
    private Clock clock;

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleUnexpected(Exception exception, WebRequest request) {
        logger.error("Handler for {} failed", request.getDescription(false), exception);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(body("internal error"));
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(HttpMessageNotReadableException ex,
                                                                  HttpHeaders headers, HttpStatusCode status,
                                                                  WebRequest request) {
        String detail;
        if (ex.getCause() instanceof JsonProcessingException) {
            detail = ((JsonProcessingException) ex.getCause()).getOriginalMessage();
        } else {
            detail = "request body is missing or unreadable";
        }
        return ResponseEntity.status(HttpStatus.BAD_REQUEST).headers(headers).body(body("invalid JSON: " + detail));
    }

    @Override
    protected ResponseEntity<Object> handleExceptionInternal(Exception ex, Object body, HttpHeaders headers,
                                                             HttpStatusCode statusCode, WebRequest request) {
        String message;
        switch (statusCode.value()) {
            case 404:
                message = "not found";
                break;
            case 405:
                message = "method not allowed";
                break;
            case 415:
                message = "unsupported content type";
                break;
            default:
                message = ex.getMessage();
        }
        return ResponseEntity.status(statusCode).headers(headers).body(body(message));
    }

    private ApiError body(String message) {
        return new ApiError(message, SnapshotMapper.format(clock.instant()));
    }
}
