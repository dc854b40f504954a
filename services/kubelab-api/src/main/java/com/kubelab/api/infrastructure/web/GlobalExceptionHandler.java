package com.kubelab.api.infrastructure.web;

import com.kubelab.observability.CorrelationContextHolder;
import com.kubelab.security.InvalidCredentialsException;
import com.kubelab.security.MissingCredentialsException;
import com.kubelab.security.UnauthorizedException;
import java.net.URI;
import java.time.Instant;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.NoHandlerFoundException;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://kubelab.local/errors/unauthorized",
 *   "title": "Unauthorized",
 *   "status": 401,
 *   "detail": "Could not validate credentials",
 *   "timestamp": "2024-05-01T12:00:00Z",
 *   "correlationId": "abc-123"
 * }
 * </pre>
 *
 * <p>Authentication failures map to 401 with {@code WWW-Authenticate: Bearer}, except a
 * protected route called without Bearer credentials, which is 403. Every token verification
 * failure gets the same detail whatever check failed.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final String ERROR_TYPE_BASE = "https://kubelab.local/errors/";
    static final String BEARER_CHALLENGE = "Bearer";

    @ExceptionHandler(InvalidCredentialsException.class)
    public ResponseEntity<ProblemDetail> handleInvalidCredentials(InvalidCredentialsException ex) {
        log.warn("Login failed: {}", ex.getMessage());
        return challenge(
                problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized", ex.getMessage()));
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<ProblemDetail> handleUnauthorized(UnauthorizedException ex) {
        log.debug("Token verification failed: reason={}", ex.reason());
        return challenge(problem(HttpStatus.UNAUTHORIZED, "Unauthorized", "unauthorized",
                UnauthorizedException.DETAIL));
    }

    @ExceptionHandler(MissingCredentialsException.class)
    public ProblemDetail handleMissingCredentials(MissingCredentialsException ex) {
        log.warn("Protected route called without bearer credentials: {}", ex.getMessage());
        return problem(HttpStatus.FORBIDDEN, "Forbidden", "forbidden", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
        log.warn("Validation failed: {}", ex.getMessage());
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .sorted()
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(HttpMessageNotReadableException ex) {
        log.warn("Unreadable request body: {}", ex.getMessage());
        return problem(HttpStatus.UNPROCESSABLE_ENTITY, "Validation Error", "validation",
                "Request body is missing or is not valid JSON");
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ProblemDetail handleResponseStatus(ResponseStatusException ex) {
        HttpStatusCode status = ex.getStatusCode();
        if (status.is5xxServerError()) {
            log.error("Request failed with {}: {}", status.value(), ex.getReason());
        } else {
            log.warn("Request failed with {}: {}", status.value(), ex.getReason());
        }
        return problem(status, title(status), slug(status), ex.getReason());
    }

    @ExceptionHandler({
        NoHandlerFoundException.class,
        HttpRequestMethodNotSupportedException.class,
        HttpMediaTypeNotSupportedException.class,
        MissingServletRequestParameterException.class,
        AsyncRequestTimeoutException.class
    })
    public ProblemDetail handleFrameworkError(Exception ex) {
        ErrorResponse error = (ErrorResponse) ex;
        HttpStatusCode status = error.getStatusCode();
        log.warn("Request rejected with {}: {}", status.value(), ex.getMessage());
        return problem(status, title(status), slug(status), error.getBody().getDetail());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return problem(HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex) {
        log.error("Internal server error", ex);
        return problem(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "internal",
                "An unexpected error occurred");
    }

    private static ResponseEntity<ProblemDetail> challenge(ProblemDetail problem) {
        return ResponseEntity.status(problem.getStatus())
                .header(HttpHeaders.WWW_AUTHENTICATE, BEARER_CHALLENGE)
                .body(problem);
    }

    private static ProblemDetail problem(
            HttpStatusCode status, String title, String typeSlug, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + typeSlug));
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContextHolder.get()
                .ifPresent(ctx -> problem.setProperty("correlationId", ctx.correlationId()));
        return problem;
    }

    private static String title(HttpStatusCode status) {
        HttpStatus known = HttpStatus.resolve(status.value());
        return known != null ? known.getReasonPhrase() : "HTTP " + status.value();
    }

    private static String slug(HttpStatusCode status) {
        return title(status).toLowerCase(Locale.ROOT).replace(' ', '-');
    }
}
