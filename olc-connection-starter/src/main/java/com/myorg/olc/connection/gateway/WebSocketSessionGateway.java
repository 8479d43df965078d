package com.myorg.olc.connection.gateway;

import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions held by this instance, keyed by connection id.
 */
@Slf4j
public class WebSocketSessionGateway implements ChannelGateway {

    private final Map<String, WebSocketSession> sessions = new ConcurrentHashMap<>();

    public void register(String connectionId, WebSocketSession session) {
        sessions.put(connectionId, session);
    }

    public void unregister(String connectionId) {
        sessions.remove(connectionId);
    }

    public int openSessions() {
        return sessions.size();
    }

    @Override
    public void send(String connectionId, String payload) {
        WebSocketSession session = sessions.get(connectionId);
        if (session == null || !session.isOpen()) {
            sessions.remove(connectionId);
            throw new ChannelGoneException(connectionId);
        }
        try {
            // WebSocketSession is not safe for concurrent sends
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException e) {
            if (!session.isOpen()) {
                sessions.remove(connectionId);
                throw new ChannelGoneException(connectionId);
            }
            throw new ChannelSendException("Send failed connectionId=" + connectionId, e);
        }
    }
}
