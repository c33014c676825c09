package com.marketengine.estimation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketengine.common.calibration.EstimatorTrainer;
import com.marketengine.common.calibration.RetrainPolicy;
import com.marketengine.common.cogs.CogsAssumptionEngine;
import com.marketengine.common.config.CogsBand;
import com.marketengine.common.config.CurveConstants;
import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.curve.BsrRevenueCurveModel;
import com.marketengine.common.margin.MarginSnapshotBuilder;
import com.marketengine.common.tier1.Tier1FastEstimator;
import com.marketengine.common.tier2.Tier2RefinementPipeline;
import com.marketengine.estimation.cache.InMemoryTtlCache;
import com.marketengine.estimation.cache.TtlCache;
import com.marketengine.estimation.client.RankEnrichment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Wires the pure estimation engines from {@link EngineProperties}. A malformed
 * curve or band table fails here, at startup.
 */
@Configuration
@EnableConfigurationProperties(EngineProperties.class)
public class EngineConfig {

    private static final Logger log = LoggerFactory.getLogger(EngineConfig.class);

    @Bean
    public EngineSettings engineSettings(EngineProperties props) {
        Map<String, CurveConstants> curves = new LinkedHashMap<>();
        props.getCategoryCurves().forEach((key, c) -> curves.put(key, new CurveConstants(c.getA(), c.getB())));
        Map<String, CogsBand> bands = new LinkedHashMap<>();
        props.getCogsBands().forEach((key, b) -> bands.put(key, new CogsBand(b.getLowPct(), b.getHighPct())));

        EngineSettings settings = EngineSettings.defaults().withOverrides(
            props.getMaxProducts(), props.getRetrainMinRows(), props.getRetrainWindowRows(), curves, bands);
        log.info("ENGINE_SETTINGS maxProducts={} retrainMinRows={} retrainWindowRows={} curves={} bands={}",
            settings.maxProducts(), settings.retrainMinRows(), settings.retrainWindowRows(),
            settings.categoryCurves().size(), settings.cogsBands().size());
        return settings;
    }

    @Bean
    public BsrRevenueCurveModel bsrRevenueCurveModel(EngineSettings settings) {
        return new BsrRevenueCurveModel(settings);
    }

    @Bean
    public Tier1FastEstimator tier1FastEstimator(EngineSettings settings) {
        return new Tier1FastEstimator(settings);
    }

    @Bean
    public Tier2RefinementPipeline tier2RefinementPipeline(BsrRevenueCurveModel curveModel) {
        return new Tier2RefinementPipeline(curveModel);
    }

    @Bean
    public MarginSnapshotBuilder marginSnapshotBuilder(EngineSettings settings) {
        return new MarginSnapshotBuilder(new CogsAssumptionEngine(settings));
    }

    @Bean
    public RetrainPolicy retrainPolicy(EngineSettings settings) {
        return new RetrainPolicy(settings.retrainMinRows(), settings.retrainWindowRows());
    }

    @Bean
    public EstimatorTrainer estimatorTrainer(RetrainPolicy policy) {
        return new EstimatorTrainer(policy);
    }

    @Bean
    public TtlCache<RankEnrichment> enrichmentCache(EngineProperties props, Clock clock) {
        return new InMemoryTtlCache<>("rank_enrichment", clock, props.getEnrichmentCacheMaxEntries());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
