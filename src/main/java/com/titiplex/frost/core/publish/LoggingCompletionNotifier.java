package com.titiplex.frost.core.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.frost.core.model.CompletionNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Default notifier: writes the notice payload to the log, where a delivery agent picks it up.
 */
@Component
public class LoggingCompletionNotifier implements CompletionNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingCompletionNotifier.class);
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void send(CompletionNotice notice) {
        try {
            log.info("FROST completion notice: {}", mapper.writeValueAsString(notice));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize completion notice for session {}: {}", notice.sessionId(), e.getMessage());
        }
    }
}
