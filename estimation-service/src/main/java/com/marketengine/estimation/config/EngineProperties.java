package com.marketengine.estimation.config;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code market-engine.*} settings. Scalars left unset and table entries not
 * listed keep the built-in engine defaults.
 */
@Data
@NoArgsConstructor
@ConfigurationProperties(prefix = "market-engine")
public class EngineProperties {

    private Integer maxProducts;

    private Integer retrainMinRows;

    private Integer retrainWindowRows;

    /** Starts the periodic retraining loop when true. */
    private boolean retrainEnabled = true;

    /** Delay between retraining cycles per marketplace. */
    private Duration retrainInterval = Duration.ofHours(24);

    private List<String> retrainMarketplaces = List.of("US");

    /** Lifetime of a cached rank/category enrichment. */
    private Duration enrichmentTtl = Duration.ofDays(7);

    /** Upstream enrichment calls allowed per Tier-2 refinement. */
    private int enrichmentMaxCalls = 10;

    /** Upper bound on cached enrichments held in memory. */
    private int enrichmentCacheMaxEntries = 50_000;

    /** Upper bound on the Tier-1 listing fetch. */
    private Duration listingTimeout = Duration.ofSeconds(10);

    private Map<String, Curve> categoryCurves = new LinkedHashMap<>();

    private Map<String, Band> cogsBands = new LinkedHashMap<>();

    @Data
    @NoArgsConstructor
    public static class Curve {
        private double a;
        private double b;
    }

    @Data
    @NoArgsConstructor
    public static class Band {
        private double lowPct;
        private double highPct;
    }
}
