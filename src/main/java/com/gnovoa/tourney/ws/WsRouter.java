package com.gnovoa.tourney.ws;

import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public final class WsRouter extends TextWebSocketHandler {

    private final ConcurrentHashMap<String, Set<WebSocketSession>> sessions = new ConcurrentHashMap<>();

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String key = routeKey(session.getUri() == null ? "" : session.getUri().getPath());
        sessions.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet()).add(session);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String key = routeKey(session.getUri() == null ? "" : session.getUri().getPath());
        var set = sessions.get(key);
        if (set != null) set.remove(session);
    }

    public Set<WebSocketSession> forKey(String key) {
        return sessions.getOrDefault(key, Set.of());
    }

    public static String jobKey(String jobId) {
        return "job:" + jobId;
    }

    static String routeKey(String path) {
        // /ws/optimizations/{jobId} -> job:{jobId}
        String[] p = path.split("/");
        if (path.contains("/ws/optimizations/") && p.length >= 4) {
            return jobKey(p[p.length - 1]);
        }
        return "unknown";
    }
}
