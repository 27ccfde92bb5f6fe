package com.hftrisk.risk;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Sizing and scheduling of the risk service's channels and monitors. */
@Value
@Builder
public class RiskServiceSettings {

    @Builder.Default
    int eventBufferSize = 1000;

    @Builder.Default
    int violationBufferSize = 100;

    @Builder.Default
    Duration exposureCheckInterval = Duration.ofSeconds(30);

    @Builder.Default
    Duration drawdownCheckInterval = Duration.ofSeconds(60);

    /** Events kept for lookup; resolved events are evicted first once this is exceeded. */
    @Builder.Default
    int maxRetainedEvents = 10_000;

    /** Upper bound on how long stop() waits for each background thread. */
    @Builder.Default
    Duration stopTimeout = Duration.ofSeconds(5);
}
