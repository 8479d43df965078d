package com.myorg.olc.invoice.route;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.olc.connection.route.ChannelRouteHandler;
import com.myorg.olc.contracts.core.exception.ValidationException;
import com.myorg.olc.invoice.InvoiceImportService;
import lombok.RequiredArgsConstructor;

/**
 * {@code {"action":"cancelImport","transactionId":"..."}}
 */
@RequiredArgsConstructor
public class CancelImportRoute implements ChannelRouteHandler {

    public static final String ACTION = "cancelImport";

    private final InvoiceImportService imports;

    @Override
    public String action() {
        return ACTION;
    }

    @Override
    public void handle(String connectionId, JsonNode message) {
        JsonNode tx = message.get("transactionId");
        if (tx == null || !tx.isTextual() || tx.asText().isBlank()) {
            throw new ValidationException("transactionId is required");
        }
        imports.cancel(connectionId, tx.asText());
    }
}
