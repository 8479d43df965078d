package com.myorg.olc.contracts.invoice;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ImportTransaction {
    private String transactionId;
    private String connectionId;
    private ImportState state;
    private String resourceKey;
    private long createdAtMs;
    private Long expiresAtEpochSec; // null = never
    private int processed;
    private int duplicates;
    private int attempts; // processing runs started, resumes included
}
