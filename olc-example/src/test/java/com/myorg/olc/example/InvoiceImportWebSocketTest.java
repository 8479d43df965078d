package com.myorg.olc.example;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.invoice.InvoiceRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.client.standard.StandardWebSocketClient;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = {
                "olc.eventing.listener.enabled=false",
                "olc.eventing.topics.create=false",
                "olc.queue.consumer.poll-interval=100ms",
                "olc.queue.consumer.initial-delay=100ms",
                "olc.ledger.sweeper.scheduling-enabled=false"
        }
)
class InvoiceImportWebSocketTest {

    private static final String INVOICES = """
            [
              {"invoiceNumber":"WS-1","customerName":"globex","totalValue":10.00,"productId":"p1","quantity":1},
              {"invoiceNumber":"WS-2","customerName":"globex","totalValue":20.00,"productId":"p2","quantity":2}
            ]
            """;

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    InvoiceRepository invoices;

    private final ObjectMapper mapper = new ObjectMapper();
    private final BlockingQueue<JsonNode> received = new LinkedBlockingQueue<>();
    private WebSocketSession session;

    @AfterEach
    void close() throws Exception {
        if (session != null && session.isOpen()) session.close();
    }

    @Test
    void importOverWebSocketRunsToCompletion() throws Exception {
        connect();
        send("{\"action\":\"getImportUrl\"}");

        JsonNode issued = next();
        assertThat(issued.get("status").asText()).isEqualTo("URL_ISSUED");
        String transactionId = issued.get("transactionId").asText();
        String path = URI.create(issued.get("url").asText()).getPath();

        ResponseEntity<Void> put = rest.exchange(path, HttpMethod.PUT,
                new HttpEntity<>(INVOICES.getBytes(StandardCharsets.UTF_8)), Void.class);
        assertThat(put.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);

        assertThat(next().get("status").asText()).isEqualTo("PROGRESS");
        assertThat(next().get("status").asText()).isEqualTo("PROGRESS");
        JsonNode done = next();
        assertThat(done.get("status").asText()).isEqualTo("COMPLETED");
        assertThat(done.get("processed").asInt()).isEqualTo(2);
        assertThat(invoices.find("globex", "WS-2")).isPresent();

        send("{\"action\":\"cancelImport\",\"transactionId\":\"" + transactionId + "\"}");
        JsonNode cancel = next();
        assertThat(cancel.get("status").asText()).isEqualTo("COMPLETED");
    }

    @Test
    void cancelBeforeUploadAndUnknownActions() throws Exception {
        connect();
        send("{\"action\":\"getImportUrl\",\"transactionId\":\"ws-cancel-1\"}");
        assertThat(next().get("status").asText()).isEqualTo("URL_ISSUED");

        send("{\"action\":\"cancelImport\",\"transactionId\":\"ws-cancel-1\"}");
        assertThat(next().get("status").asText()).isEqualTo("CANCELLED");

        send("{\"action\":\"getImportUrl\",\"transactionId\":\"ws-cancel-1\"}");
        assertThat(next().get("status").asText()).isEqualTo("ERROR");

        send("{\"action\":\"dance\"}");
        JsonNode unknown = next();
        assertThat(unknown.get("status").asText()).isEqualTo("ERROR");
        assertThat(unknown.get("detail").asText()).isEqualTo("unknown action");
    }

    @Test
    void uploadWithoutTargetIsRejected() {
        ResponseEntity<String> put = rest.exchange("/uploads/invoices/never-issued", HttpMethod.PUT,
                new HttpEntity<>("[]".getBytes(StandardCharsets.UTF_8)), String.class);
        assertThat(put.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    private void connect() throws Exception {
        session = new StandardWebSocketClient()
                .execute(new TextWebSocketHandler() {
                    @Override
                    protected void handleTextMessage(WebSocketSession s, TextMessage message) throws Exception {
                        received.add(mapper.readTree(message.getPayload()));
                    }
                }, "ws://localhost:" + port + "/ws/imports")
                .get(10, TimeUnit.SECONDS);
    }

    private void send(String json) throws Exception {
        session.sendMessage(new TextMessage(json));
    }

    private JsonNode next() throws InterruptedException {
        JsonNode n = received.poll(20, TimeUnit.SECONDS);
        assertThat(n).as("message from server").isNotNull();
        return n;
    }
}
