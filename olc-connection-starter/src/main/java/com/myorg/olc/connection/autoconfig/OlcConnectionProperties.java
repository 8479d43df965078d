package com.myorg.olc.connection.autoconfig;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "olc.connection")
public class OlcConnectionProperties {

    private boolean enabled = true;

    private WebSocket websocket = new WebSocket();

    private boolean metricsEnabled = true;

    /** Id recorded on connection rows held by this instance. Blank means a random id per start. */
    private String instanceId;

    private Relay relay = new Relay();

    @Data
    public static class Relay {
        /** Redis pub/sub relay to the instance holding a socket, when Redis is available. */
        private boolean enabled = true;
        private String channelPrefix = "olc:connection:relay:";
    }

    @Data
    public static class WebSocket {
        private boolean enabled = true;
        private String path = "/ws/imports";
        private List<String> allowedOrigins = new ArrayList<>(List.of("*"));
    }
}
