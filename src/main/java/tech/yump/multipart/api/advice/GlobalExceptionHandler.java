package tech.yump.multipart.api.advice;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.ServletWebRequest;
import org.springframework.web.context.request.WebRequest;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;
import tech.yump.multipart.audit.AuditHelper;
import tech.yump.multipart.secrets.DuplicateKeyException;
import tech.yump.multipart.secrets.EmptyPartException;
import tech.yump.multipart.secrets.InsufficientChunksException;
import tech.yump.multipart.secrets.KeyExistsException;
import tech.yump.multipart.secrets.KeyMissingException;
import tech.yump.multipart.secrets.KeyTooLargeException;
import tech.yump.multipart.secrets.MalformedPartException;
import tech.yump.multipart.secrets.MultipartSecretException;
import tech.yump.multipart.secrets.PartLimitExceededException;
import tech.yump.multipart.secrets.PathSegmentMissingException;
import tech.yump.multipart.secrets.PathSegmentNotObjectException;
import tech.yump.multipart.storage.PartNotFoundException;
import tech.yump.multipart.storage.StorageException;
import tech.yump.multipart.storage.StoreUnavailableException;

import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@RestControllerAdvice
@RequiredArgsConstructor
@Slf4j
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {

    private final AuditHelper auditHelper;

    private static final String MULTIPART_EVENT_TYPE = "multipart_operation";
    private static final Pattern MULTIPART_PATH_PATTERN = Pattern.compile(".*/v1/multipart/(?:(find|keys)/)?(.+)");

    // --- Specific Handlers ---

    @ExceptionHandler({KeyExistsException.class, DuplicateKeyException.class,
            InsufficientChunksException.class, PartLimitExceededException.class})
    public ResponseEntity<ProblemDetail> handleConflict(MultipartSecretException ex, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, titleOf(ex), ex.getMessage(), request);
    }

    @ExceptionHandler({KeyMissingException.class, PathSegmentMissingException.class})
    public ResponseEntity<ProblemDetail> handleMissing(MultipartSecretException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, titleOf(ex), ex.getMessage(), request);
    }

    @ExceptionHandler({KeyTooLargeException.class, PathSegmentNotObjectException.class,
            MalformedPartException.class, EmptyPartException.class})
    public ResponseEntity<ProblemDetail> handleUnprocessable(MultipartSecretException ex, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, titleOf(ex), ex.getMessage(), request);
    }

    @ExceptionHandler(MultipartSecretException.class)
    public ResponseEntity<ProblemDetail> handleMultipartSecretException(MultipartSecretException ex, HttpServletRequest request) {
        log.error("Multipart secret error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Multipart Secret Error", ex.getMessage(), request);
    }

    @ExceptionHandler(PartNotFoundException.class)
    public ResponseEntity<ProblemDetail> handlePartNotFound(PartNotFoundException ex, HttpServletRequest request) {
        return respond(HttpStatus.NOT_FOUND, "Part Not Found", ex.getMessage(), request);
    }

    @ExceptionHandler(StoreUnavailableException.class)
    public ResponseEntity<ProblemDetail> handleStoreUnavailable(StoreUnavailableException ex, HttpServletRequest request) {
        log.error("Secret store unavailable: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable", ex.getMessage(), request);
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ProblemDetail> handleStorageException(StorageException ex, HttpServletRequest request) {
        log.error("Storage error: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Storage Error", ex.getMessage(), request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ProblemDetail> handleIllegalArgumentException(IllegalArgumentException ex, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage(), request);
    }

    @Override
    protected ResponseEntity<Object> handleHttpMessageNotReadable(
            @NonNull HttpMessageNotReadableException ex, @NonNull HttpHeaders headers, @NonNull HttpStatusCode status, @NonNull WebRequest request) {

        String message = "Malformed request body. Please provide a JSON object of key-value pairs.";
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle("Bad Request");

        // Log the underlying cause for debugging, but don't expose it in the response
        log.warn("Bad request: Malformed JSON received. Request: {}. Details: {}",
                request.getDescription(false), ex.getMessage());

        if (request instanceof ServletWebRequest servletWebRequest) {
            HttpServletRequest servletRequest = servletWebRequest.getRequest();
            auditHelper.logHttpEvent(
                    "request_validation",
                    determineActionFromRequest(servletRequest),
                    "failure",
                    status.value(),
                    message,
                    extractContextData(servletRequest)
            );
        } else {
            log.error("Could not obtain HttpServletRequest from WebRequest for audit logging in handleHttpMessageNotReadable.");
        }

        return handleExceptionInternal(ex, problemDetail, headers, status, request);
    }

    // --- Fallback Handler ---

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ProblemDetail> handleGenericException(Exception ex, HttpServletRequest request) {
        log.error("An unexpected error occurred: {}. Request: {} {}", ex.getMessage(), request.getMethod(), request.getRequestURI(), ex);
        // Don't expose internal details
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected internal error occurred.", request, "system_error");
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, String title, String message, HttpServletRequest request) {
        return respond(status, title, message, request, MULTIPART_EVENT_TYPE);
    }

    private ResponseEntity<ProblemDetail> respond(HttpStatus status, String title, String message,
                                                  HttpServletRequest request, String eventType) {
        ProblemDetail problemDetail = ProblemDetail.forStatusAndDetail(status, message);
        problemDetail.setTitle(title);
        if (status.is4xxClientError()) {
            log.warn("{}: {}. Request: {} {}", title, message, request.getMethod(), request.getRequestURI());
        }

        auditHelper.logHttpEvent(
                eventType,
                determineActionFromRequest(request),
                "failure",
                status.value(),
                message,
                extractContextData(request)
        );
        return ResponseEntity.status(status).body(problemDetail);
    }

    /**
     * "KeyExistsException" becomes "Key Exists".
     */
    private static String titleOf(Exception ex) {
        String name = ex.getClass().getSimpleName().replaceFirst("Exception$", "");
        return name.replaceAll("(?<=[a-z])(?=[A-Z])", " ");
    }

    private String determineActionFromRequest(HttpServletRequest request) {
        String path = request.getRequestURI();
        if (path.contains("/v1/multipart/find/")) return "find";
        if (path.contains("/v1/multipart/keys/")) return "read_keys";
        if (path.contains("/v1/multipart/")) {
            return switch (request.getMethod().toUpperCase()) {
                case "PUT" -> "add";
                case "PATCH" -> "update";
                default -> "unknown_multipart";
            };
        }
        return "unknown";
    }

    private Map<String, Object> extractContextData(HttpServletRequest request) {
        Map<String, Object> data = new HashMap<>();
        Matcher matcher = MULTIPART_PATH_PATTERN.matcher(request.getRequestURI());
        if (matcher.matches()) {
            data.put("base_name", matcher.group(2));
        }
        String path = request.getParameter("path");
        if (path != null) {
            data.put("path", path);
        }
        return data;
    }
}
