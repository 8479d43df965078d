package com.myorg.olc.invoice;

import com.myorg.olc.contracts.core.exception.OlcNonRetryableException;

/** An import that kept failing and was moved to FAILED. Redelivering the notification cannot help. */
public class ImportAbandonedException extends OlcNonRetryableException {
    public ImportAbandonedException(String message, Throwable cause) {
        super("IMPORT_ABANDONED", message, cause);
    }
}
