package com.myorg.olc.observability;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "olc.observability")
public class OlcObservabilityProperties {
    private boolean enabled = true;

    private boolean mdcEnabled = true;
    private boolean metricsEnabled = true;

    // low cardinality tags only; orderId and eventId never become tags
    private boolean tagEventType = true;
    private boolean tagOutcome = true;
}
