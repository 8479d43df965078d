package com.myorg.olc.invoice.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.olc.connection.route.ChannelRouteHandler;
import com.myorg.olc.invoice.InvoiceImportService;
import lombok.RequiredArgsConstructor;

/**
 * {@code {"action":"getImportUrl"}}, optionally with a client chosen {@code transactionId}.
 */
@RequiredArgsConstructor
public class GetImportUrlRoute implements ChannelRouteHandler {

    public static final String ACTION = "getImportUrl";

    private final InvoiceImportService imports;

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void handle(String connectionId, JsonNode message) {
        JsonNode tx = message.get("transactionId");
        if (tx != null && tx.isTextual() && !tx.asText().isBlank()) {
            imports.requestImport(connectionId, tx.asText());
        } else {
            imports.requestImport(connectionId);
        }
    }
}
