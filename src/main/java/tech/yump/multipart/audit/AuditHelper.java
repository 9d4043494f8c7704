package tech.yump.multipart.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Component
@RequiredArgsConstructor
@Slf4j
public class AuditHelper {

    public static final String REQUEST_ID_HEADER = "X-Request-Id";

    private final AuditBackend auditBackend;

    /**
     * Logs an audit event related to an HTTP request outcome (success or failure).
     * Request context is gathered from the current request if one is bound to the thread.
     *
     * @param type         The type of event (e.g., "multipart_operation").
     * @param action       The specific action performed (e.g., "add", "find").
     * @param outcome      The result ("success" or "failure").
     * @param statusCode   The HTTP status code associated with the outcome.
     * @param errorMessage Optional error message (for failures).
     * @param data         Optional map containing context-specific data.
     */
    public void logHttpEvent(
            String type,
            String action,
            String outcome,
            int statusCode,
            @Nullable String errorMessage,
            @Nullable Map<String, Object> data) {

        HttpServletRequest request = getCurrentHttpRequest();

        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal("anonymous")
                .sourceAddress(request != null ? request.getRemoteAddr() : "unknown")
                .build();
        AuditEvent.ResponseInfo responseInfo = AuditEvent.ResponseInfo.builder()
                .statusCode(statusCode)
                .errorMessage(errorMessage)
                .build();

        logEventInternal(type, action, outcome, "http", authInfo, buildRequestInfo(request), responseInfo, data);
    }

    /**
     * Logs an audit event for an operation run outside an HTTP request, i.e. from the command line.
     *
     * @param type      The type of event.
     * @param action    The specific action performed.
     * @param outcome   The result ("success" or "failure").
     * @param principal Optional principal identifier; falls back to the operating system user.
     * @param data      Optional map containing context-specific data.
     */
    public void logInternalEvent(
            String type,
            String action,
            String outcome,
            @Nullable String principal,
            @Nullable Map<String, Object> data) {

        String effectivePrincipal = Optional.ofNullable(principal)
                .orElseGet(() -> System.getProperty("user.name", "system"));
        AuditEvent.AuthInfo authInfo = AuditEvent.AuthInfo.builder()
                .principal(effectivePrincipal)
                .sourceAddress("local")
                .build();

        logEventInternal(type, action, outcome, "cli", authInfo, null, null, data);
    }

    private void logEventInternal(
            String type,
            String action,
            String outcome,
            String source,
            @Nullable AuditEvent.AuthInfo authInfo,
            @Nullable AuditEvent.RequestInfo requestInfo,
            @Nullable AuditEvent.ResponseInfo responseInfo,
            @Nullable Map<String, Object> data) {
        try {
            AuditEvent auditEvent = AuditEvent.builder()
                    .timestamp(Instant.now())
                    .type(type)
                    .action(action)
                    .outcome(outcome)
                    .source(source)
                    .authInfo(authInfo)
                    .requestInfo(requestInfo)
                    .responseInfo(responseInfo)
                    .data(data != null && !data.isEmpty() ? data : null)
                    .build();

            auditBackend.logEvent(auditEvent);

        } catch (Exception e) {
            log.error("Failed to log audit event in AuditHelper: Type={}, Action={}, Outcome={}, Error={}",
                    type, action, outcome, e.getMessage(), e);
        }
    }

    @Nullable
    private HttpServletRequest getCurrentHttpRequest() {
        return Optional.ofNullable(RequestContextHolder.getRequestAttributes())
                .filter(ServletRequestAttributes.class::isInstance)
                .map(ServletRequestAttributes.class::cast)
                .map(ServletRequestAttributes::getRequest)
                .orElse(null);
    }

    @Nullable
    private AuditEvent.RequestInfo buildRequestInfo(@Nullable HttpServletRequest request) {
        if (request == null) {
            return null;
        }
        String requestId = Optional.ofNullable(request.getHeader(REQUEST_ID_HEADER))
                .orElseGet(() -> UUID.randomUUID().toString());
        return AuditEvent.RequestInfo.builder()
                .requestId(requestId)
                .httpMethod(request.getMethod())
                .path(request.getRequestURI())
                .headers(Map.of("User-Agent", Optional.ofNullable(request.getHeader("User-Agent")).orElse("N/A")))
                .build();
    }
}
