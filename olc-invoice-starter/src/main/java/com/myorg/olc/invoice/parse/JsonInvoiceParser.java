package com.myorg.olc.invoice.parse;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.olc.contracts.invoice.InvoiceRecord;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a JSON array of invoices, or a single invoice object.
 */
public class JsonInvoiceParser implements InvoiceParser {

    private final ObjectMapper mapper;

    public JsonInvoiceParser(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public List<InvoiceRecord> parse(byte[] content) {
        if (content == null || content.length == 0) {
            throw new InvoiceParseException("empty invoice file");
        }
        JsonNode root;
        try {
            root = mapper.readTree(content);
        } catch (IOException e) {
            throw new InvoiceParseException("invoice file is not valid JSON", e);
        }

        List<InvoiceRecord> out = new ArrayList<>();
        if (root != null && root.isArray()) {
            for (int i = 0; i < root.size(); i++) {
                out.add(toRecord(root.get(i), i));
            }
        } else if (root != null && root.isObject()) {
            out.add(toRecord(root, 0));
        } else {
            throw new InvoiceParseException("invoice file must hold an object or an array");
        }
        return out;
    }

    private InvoiceRecord toRecord(JsonNode n, int index) {
        if (!n.isObject()) throw new InvoiceParseException("record " + index + " is not an object");

        String invoiceNumber = requiredText(n, "invoiceNumber", index);
        String customerName = requiredText(n, "customerName", index);

        BigDecimal total;
        JsonNode t = n.get("totalValue");
        if (t == null || t.isNull()) {
            throw new InvoiceParseException("record " + index + ": totalValue is required");
        }
        if (t.isNumber()) {
            total = t.decimalValue();
        } else {
            try {
                total = new BigDecimal(t.asText());
            } catch (NumberFormatException e) {
                throw new InvoiceParseException("record " + index + ": totalValue is not a number", e);
            }
        }

        int quantity = quantityOf(n.get("quantity"), index);
        if (quantity <= 0) {
            throw new InvoiceParseException("record " + index + ": quantity must be positive");
        }

        JsonNode p = n.get("productId");
        return InvoiceRecord.builder()
                .invoiceNumber(invoiceNumber)
                .customerName(customerName)
                .totalValue(total)
                .productId(p == null || p.isNull() ? null : p.asText())
                .quantity(quantity)
                .build();
    }

    // whole numbers only: 2.0 is 2, 2.7 is refused rather than truncated
    private static int quantityOf(JsonNode q, int index) {
        if (q == null || q.isNull()) return 1;
        BigDecimal value;
        if (q.isNumber()) {
            value = q.decimalValue();
        } else if (q.isTextual()) {
            try {
                value = new BigDecimal(q.asText().trim());
            } catch (NumberFormatException e) {
                throw new InvoiceParseException("record " + index + ": quantity is not a number", e);
            }
        } else {
            throw new InvoiceParseException("record " + index + ": quantity is not a number");
        }
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new InvoiceParseException("record " + index + ": quantity must be a whole number, got " + q.asText(), e);
        }
    }

    private static String requiredText(JsonNode n, String field, int index) {
        JsonNode v = n.get(field);
        if (v == null || v.isNull() || !v.isValueNode() || v.asText().isBlank()) {
            throw new InvoiceParseException("record " + index + ": " + field + " is required");
        }
        return v.asText();
    }
}
