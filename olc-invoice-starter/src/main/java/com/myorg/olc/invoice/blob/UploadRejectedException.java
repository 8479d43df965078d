package com.myorg.olc.invoice.blob;

import com.myorg.olc.contracts.core.exception.ValidationException;

public class UploadRejectedException extends ValidationException {
    public UploadRejectedException(String message) {
        super(message);
    }
}
