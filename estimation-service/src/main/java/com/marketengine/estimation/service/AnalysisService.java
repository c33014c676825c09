package com.marketengine.estimation.service;

import com.marketengine.common.model.Listing;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.tier1.Tier1FastEstimator;
import com.marketengine.estimation.client.ListingClient;
import com.marketengine.estimation.config.EngineProperties;
import com.marketengine.estimation.dto.AnalyzeRequestDTO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Keyword analysis entry point.
 *
 * <p>Tier-1 is computed in the request and returned as soon as the listing
 * fetch completes. Tier-2 is then started detached on the bounded-elastic
 * scheduler; its outcome never reaches the caller.
 */
@Service
public class AnalysisService {

    private static final Logger log = LoggerFactory.getLogger(AnalysisService.class);

    static final String DEFAULT_MARKETPLACE = "US";

    private final ListingClient listingClient;
    private final Tier1FastEstimator tier1Estimator;
    private final Tier2RefinementService refinementService;
    private final EngineProperties props;
    private final Clock clock;

    public AnalysisService(ListingClient listingClient,
                           Tier1FastEstimator tier1Estimator,
                           Tier2RefinementService refinementService,
                           EngineProperties props,
                           Clock clock) {
        this.listingClient     = listingClient;
        this.tier1Estimator    = tier1Estimator;
        this.refinementService = refinementService;
        this.props             = props;
        this.clock             = clock;
    }

    public Mono<Tier1Snapshot> analyzeKeyword(AnalyzeRequestDTO request) {
        if (request == null || request.keyword() == null || request.keyword().isBlank()) {
            return Mono.error(new IllegalArgumentException("keyword is required"));
        }
        String keyword = request.keyword().trim();
        String marketplace = request.marketplace() != null && !request.marketplace().isBlank()
            ? request.marketplace().trim().toUpperCase(Locale.ROOT) : DEFAULT_MARKETPLACE;
        int page = request.page() != null && request.page() > 0 ? request.page() : 1;
        String snapshotId = UUID.randomUUID().toString();

        return listingClient.fetchKeywordPage(keyword, marketplace, page, props.getListingTimeout())
            .map(raw -> {
                Tier1Snapshot snapshot = tier1Estimator.buildSnapshot(
                    snapshotId, keyword, marketplace, raw, request.category(), clock.instant());
                log.info("TIER1_COMPLETE snapshotId={} keyword={} marketplace={} products={} totalRevenue={}",
                    snapshotId, keyword, marketplace, snapshot.products().size(),
                    snapshot.aggregates().totalRevenue());
                startRefinement(snapshot, raw, request.category(), page);
                return snapshot;
            });
    }

    private void startRefinement(Tier1Snapshot snapshot, List<Listing> raw, String category, int page) {
        refinementService.refine(snapshot, raw, category, page)
            .subscribeOn(Schedulers.boundedElastic())
            .subscribe(
                refinement -> log.info("TIER2_DETACHED_DONE snapshotId={} failedSteps={}",
                    snapshot.snapshotId(), refinement.failedSteps()),
                err -> log.warn("TIER2_DETACHED_FAILED snapshotId={} reason={}",
                    snapshot.snapshotId(), err.getMessage()));
    }
}
