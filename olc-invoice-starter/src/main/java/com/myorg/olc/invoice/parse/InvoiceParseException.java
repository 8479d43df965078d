package com.myorg.olc.invoice.parse;

import com.myorg.olc.contracts.core.exception.PoisonMessageException;

/**
 * The uploaded file can never be imported as it is.
 */
public class InvoiceParseException extends PoisonMessageException {
    public InvoiceParseException(String message) {
        super(message);
    }

    public InvoiceParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
