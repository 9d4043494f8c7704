package tech.yump.multipart.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes each audit event as one JSON line to the {@code multipart.audit} logger, so audit output
 * can be routed apart from application logging. Failed operations are logged at WARN.
 */
@Slf4j(topic = LogAuditBackend.AUDIT_LOGGER)
@RequiredArgsConstructor
public class LogAuditBackend implements AuditBackend {

    public static final String AUDIT_LOGGER = "multipart.audit";
    static final String FAILURE_OUTCOME = "failure";

    private final ObjectMapper objectMapper;

    @Override
    public void logEvent(AuditEvent event) {
        if (event == null) {
            log.warn("Ignoring null audit event");
            return;
        }
        boolean failure = FAILURE_OUTCOME.equals(event.outcome());

        String line;
        try {
            line = "AUDIT_EVENT: " + objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            // Only the event header is printed; data may name secrets
            log.error("Could not serialize audit event {}/{}: {}", event.type(), event.action(), e.getOriginalMessage());
            line = String.format("AUDIT_EVENT_UNSERIALIZED: type=%s action=%s outcome=%s source=%s",
                    event.type(), event.action(), event.outcome(), event.source());
        }

        if (failure) {
            log.warn(line);
        } else {
            log.info(line);
        }
    }
}
