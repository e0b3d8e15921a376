package com.titiplex.frost.core.publish;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.titiplex.frost.core.model.SigningRequestNotice;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class LoggingSigningRequestNotifier implements SigningRequestNotifier {
    private static final Logger log = LoggerFactory.getLogger(LoggingSigningRequestNotifier.class);
    private final ObjectMapper mapper = new ObjectMapper();

    @Override
    public void send(SigningRequestNotice notice) {
        try {
            log.info("FROST signing request: {}", mapper.writeValueAsString(notice));
        } catch (JsonProcessingException e) {
            log.warn("Cannot serialize signing request for session {}: {}", notice.sessionId(), e.getMessage());
        }
    }
}
