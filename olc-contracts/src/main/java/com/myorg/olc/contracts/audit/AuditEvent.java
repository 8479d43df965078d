package com.myorg.olc.contracts.audit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditEvent {
    private String source;      // e.g. "app.invoice"
    private String detailType;  // e.g. "Invoice", "ImportTimeout"
    @Builder.Default
    private Map<String, Object> detail = new LinkedHashMap<>();
    private long occurredAtMs;
}
