package com.myorg.olc.connection.gateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.connection.ConnectionRegistry;
import com.myorg.olc.connection.route.ChannelRouteHandler;
import com.myorg.olc.connection.route.ChannelRouter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Optional;
import java.util.UUID;

/**
 * Connect / disconnect bookkeeping plus dispatch of inbound JSON frames by their {@code action}.
 * Connection ids are random UUIDs kept in the session attributes; websocket session ids are only
 * unique within one server.
 */
@Slf4j
@RequiredArgsConstructor
public class ConnectionWebSocketHandler extends TextWebSocketHandler {

    public static final String CONNECTION_ID_ATTRIBUTE = "olc.connectionId";

    private final ConnectionRegistry registry;
    private final WebSocketSessionGateway gateway;
    private final ChannelRouter router;
    private final ObjectMapper mapper;

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        String connectionId = UUID.randomUUID().toString();
        session.getAttributes().put(CONNECTION_ID_ATTRIBUTE, connectionId);
        gateway.register(connectionId, session);
        registry.onConnect(connectionId);
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        String connectionId = connectionId(session);
        if (connectionId == null) return;
        gateway.unregister(connectionId);
        registry.onDisconnect(connectionId);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws IOException {
        String connectionId = connectionId(session);
        if (connectionId == null) {
            reply(session, null, "connection is not registered");
            return;
        }

        JsonNode body;
        try {
            body = mapper.readTree(message.getPayload());
        } catch (IOException e) {
            reply(session, null, "message is not valid JSON");
            return;
        }

        String action = body.path(ChannelRouter.ACTION_FIELD).asText(null);
        Optional<ChannelRouteHandler> route = router.find(action);
        if (route.isEmpty()) {
            log.debug("No route for action={} connectionId={}", action, connectionId);
            reply(session, action, "unknown action");
            return;
        }

        try {
            route.get().handle(connectionId, body);
        } catch (Exception e) {
            log.warn("Route failed action={} connectionId={}", action, connectionId, e);
            reply(session, action, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    public static String connectionId(WebSocketSession session) {
        Object id = session.getAttributes().get(CONNECTION_ID_ATTRIBUTE);
        return id == null ? null : id.toString();
    }

    private void reply(WebSocketSession session, String action, String error) throws IOException {
        var node = mapper.createObjectNode();
        if (action != null) node.put(ChannelRouter.ACTION_FIELD, action);
        node.put("status", "ERROR");
        node.put("detail", error);
        synchronized (session) {
            session.sendMessage(new TextMessage(mapper.writeValueAsString(node)));
        }
    }
}
