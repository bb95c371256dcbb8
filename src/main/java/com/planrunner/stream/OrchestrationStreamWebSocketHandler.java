package com.planrunner.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Push-only endpoint. Clients connect with {@code ?runId=...&since=...} and receive the run's events.
 */
@Component
@Slf4j
public class OrchestrationStreamWebSocketHandler extends TextWebSocketHandler {

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamWebSocketHandler(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        var queryParams = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = queryParams.getFirst("runId");
        if (runId == null || runId.isBlank()) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        long since = parseLong(queryParams.getFirst("since"), 0L);
        hub.attach(runId, session, since);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        // Server push only.
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.detach(session);
    }

    private long parseLong(String value, long fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return fallback;
        }
    }
}
