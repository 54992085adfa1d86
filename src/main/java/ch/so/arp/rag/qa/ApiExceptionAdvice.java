package ch.so.arp.rag.qa;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Maps the domain exceptions to JSON error responses with a meaningful status.
 */
@RestControllerAdvice(annotations = RestController.class)
public class ApiExceptionAdvice {

    private static final Logger LOGGER = LoggerFactory.getLogger(ApiExceptionAdvice.class);

    @ExceptionHandler(QuestionNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(QuestionNotFoundException ex,
            HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "not_found", ex, request);
    }

    @ExceptionHandler({ QuestionReferenceException.class, QaPairValidationException.class,
            IllegalArgumentException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "bad_request", ex, request);
    }

    @ExceptionHandler(ExternalServiceException.class)
    public ResponseEntity<Map<String, Object>> handleExternalFailure(ExternalServiceException ex,
            HttpServletRequest request) {
        LOGGER.error("External service failure on {}: {}", request.getRequestURI(), ex.getMessage(), ex);
        return respond(HttpStatus.BAD_GATEWAY, "external_service_failure", ex, request);
    }

    private static ResponseEntity<Map<String, Object>> respond(HttpStatus status, String error, Exception ex,
            HttpServletRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", error);
        body.put("message", ex.getMessage());
        body.put("path", request.getRequestURI());
        body.put("timestamp", Instant.now().toString());
        return ResponseEntity.status(status).body(body);
    }
}
