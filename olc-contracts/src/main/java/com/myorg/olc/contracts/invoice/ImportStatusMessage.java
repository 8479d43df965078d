package com.myorg.olc.contracts.invoice;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Pushed to the client that owns an import. {@code status} is an {@link ImportState} name,
 * or one of {@link #PROGRESS}, {@link #TIMEOUT}, {@link #ERROR}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ImportStatusMessage {
    public static final String PROGRESS = "PROGRESS";
    public static final String TIMEOUT = "TIMEOUT";
    public static final String ERROR = "ERROR";

    private String transactionId;
    private String status;
    private String detail;
    private Integer processed;
    private Integer duplicates;
    private String url;
    private Long expiresAtEpochSec;
}
