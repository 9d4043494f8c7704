package tech.yump.multipart.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * A single audit log entry for an operation on a multipart secret.
 * Never carries secret values: only names, paths and counts go into {@code data}.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEvent(
        Instant timestamp,
        String type,            // "multipart_operation", "request_validation", "system_error"
        String action,          // "add", "update", "find", "read_keys"
        String outcome,         // "success" or "failure"
        String source,          // "http" or "cli"

        AuthInfo authInfo,
        RequestInfo requestInfo,
        ResponseInfo responseInfo,

        Map<String, Object> data
) {

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record AuthInfo(
            String principal,
            String sourceAddress
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RequestInfo(
            String requestId,
            String httpMethod,
            String path,
            Map<String, String> headers // non-sensitive only
    ) {}

    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record ResponseInfo(
            int statusCode,
            String errorMessage
    ) {}
}
