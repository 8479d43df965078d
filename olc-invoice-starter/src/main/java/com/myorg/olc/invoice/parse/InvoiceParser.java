package com.myorg.olc.invoice.parse;

import com.myorg.olc.contracts.invoice.InvoiceRecord;

import java.util.List;

public interface InvoiceParser {

    /**
     * @throws InvoiceParseException if the content is unreadable or any record is invalid;
     *                               no record is returned in that case
     */
    List<InvoiceRecord> parse(byte[] content);
}
