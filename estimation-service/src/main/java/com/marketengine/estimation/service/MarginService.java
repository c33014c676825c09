package com.marketengine.estimation.service;

import com.marketengine.common.margin.MarginSnapshotBuilder;
import com.marketengine.common.model.CostOverrides;
import com.marketengine.common.model.FeeQuote;
import com.marketengine.common.model.MarginRequest;
import com.marketengine.common.model.MarginSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

/**
 * Margin snapshots on demand. Invalid overrides surface as
 * {@code InvalidCostOverrideException} errors on the returned {@link Mono}.
 */
@Service
public class MarginService {

    private static final Logger log = LoggerFactory.getLogger(MarginService.class);

    private final MarginSnapshotBuilder builder;

    public MarginService(MarginSnapshotBuilder builder) {
        this.builder = builder;
    }

    public Mono<MarginSnapshot> build(MarginRequest request) {
        if (request == null || request.mode() == null) {
            return Mono.error(new IllegalArgumentException("margin mode is required"));
        }
        return Mono.fromCallable(() -> builder.build(request))
            .doOnSuccess(this::logSnapshot);
    }

    public Mono<MarginSnapshot> refine(MarginSnapshot previous, CostOverrides overrides, FeeQuote feeQuote) {
        if (previous == null || previous.request() == null) {
            return Mono.error(new IllegalArgumentException("previous snapshot with its request is required"));
        }
        return Mono.fromCallable(() -> builder.refine(previous, overrides, feeQuote))
            .doOnSuccess(snapshot -> {
                log.info("MARGIN_REFINED previousTier={} newTier={}",
                    previous.confidenceTier(), snapshot.confidenceTier());
                logSnapshot(snapshot);
            });
    }

    private void logSnapshot(MarginSnapshot snapshot) {
        log.info("MARGIN_SNAPSHOT mode={} price={} priceSource={} cogs={}-{} fee={} feeSource={} tier={} belowBreakeven={}",
            snapshot.mode(), snapshot.assumedPrice(), snapshot.priceSource(), snapshot.cogsMin(),
            snapshot.cogsMax(), snapshot.fbaFee(), snapshot.fbaFeeSource(), snapshot.confidenceTier(),
            snapshot.belowBreakeven());
    }
}
