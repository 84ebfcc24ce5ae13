package com.gnovoa.tourney.out;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gnovoa.tourney.events.OptimizationEvent;
import com.gnovoa.tourney.ws.WsRouter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;

@Component
public final class WebSocketEventPublisher implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(WebSocketEventPublisher.class);

    private final WsRouter router;
    private final ObjectMapper mapper;

    public WebSocketEventPublisher(WsRouter router, ObjectMapper mapper) {
        this.router = router;
        this.mapper = mapper;
    }

    @Override
    public void publish(OptimizationEvent event) {
        String json;
        try {
            json = mapper.writeValueAsString(event);
        } catch (IOException e) {
            log.error("Failed to serialize {} event for job {}", event.type(), event.jobId(), e);
            return;
        }
        log.debug("Publishing {} for job {}: best {}", event.type(), event.jobId(), event.bestScore());

        TextMessage msg = new TextMessage(json);
        for (WebSocketSession s : router.forKey(WsRouter.jobKey(event.jobId()))) {
            if (!s.isOpen()) continue;
            // sessions are shared with other jobs' worker threads
            synchronized (s) {
                try {
                    s.sendMessage(msg);
                } catch (IOException | IllegalStateException e) {
                    log.error("Failed to send {} event to session {}", event.type(), s.getId(), e);
                }
            }
        }
    }
}
