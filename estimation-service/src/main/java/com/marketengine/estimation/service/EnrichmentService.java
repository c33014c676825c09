package com.marketengine.estimation.service;

import com.marketengine.common.model.Listing;
import com.marketengine.common.tier1.AsinValidator;
import com.marketengine.estimation.cache.EnrichmentBudget;
import com.marketengine.estimation.cache.TtlCache;
import com.marketengine.estimation.client.EnrichmentClient;
import com.marketengine.estimation.client.RankEnrichment;
import com.marketengine.estimation.config.EngineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Adds category rank and category to raw listings before Tier-2 runs.
 *
 * <p><strong>Flow per distinct ASIN without a rank:</strong>
 * <ol>
 *   <li>cache hit → applied, no budget used</li>
 *   <li>budget left → one upstream call, shared by concurrent callers, result cached</li>
 *   <li>budget spent → skipped, listing stays unenriched</li>
 * </ol>
 * A failed lookup only leaves its listing unenriched.
 */
@Service
public class EnrichmentService {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentService.class);

    private final EnrichmentClient client;
    private final TtlCache<RankEnrichment> cache;
    private final EngineProperties props;

    public EnrichmentService(EnrichmentClient client, TtlCache<RankEnrichment> cache, EngineProperties props) {
        this.client = client;
        this.cache  = cache;
        this.props  = props;
    }

    public EnrichmentBudget newBudget() {
        return EnrichmentBudget.of(props.getEnrichmentMaxCalls());
    }

    public Mono<List<Listing>> enrich(List<Listing> raw, String marketplace, EnrichmentBudget budget) {
        Set<String> pending = new LinkedHashSet<>();
        for (Listing listing : raw) {
            String asin = AsinValidator.canonical(listing.asin());
            if (asin != null && listing.rankInCategory() == null) {
                pending.add(asin);
            }
        }
        if (pending.isEmpty()) {
            return Mono.just(raw);
        }

        Map<String, RankEnrichment> found = new ConcurrentHashMap<>();
        return Flux.fromIterable(pending)
            .concatMap(asin -> lookup(asin, marketplace, budget)
                .doOnNext(enrichment -> found.put(asin, enrichment)))
            .then(Mono.fromCallable(() -> {
                log.info("ENRICHMENT_COMPLETE marketplace={} pending={} enriched={} budgetUsed={}/{}",
                    marketplace, pending.size(), found.size(), budget.used(), budget.max());
                return apply(raw, found);
            }));
    }

    private Mono<RankEnrichment> lookup(String asin, String marketplace, EnrichmentBudget budget) {
        String key = marketplace + ":" + asin;
        RankEnrichment cached = cache.get(key);
        if (cached != null) {
            return Mono.just(cached);
        }
        if (!budget.tryAcquire()) {
            log.info("ENRICHMENT_BUDGET_EXHAUSTED asin={} used={} max={}", asin, budget.used(), budget.max());
            return Mono.empty();
        }
        return cache.dedupe(key, () -> client.fetchRank(asin, marketplace))
            .doOnNext(enrichment -> cache.put(key, enrichment, props.getEnrichmentTtl()));
    }

    private static List<Listing> apply(List<Listing> raw, Map<String, RankEnrichment> found) {
        return raw.stream()
            .map(listing -> {
                String asin = AsinValidator.canonical(listing.asin());
                RankEnrichment enrichment = asin != null ? found.get(asin) : null;
                return enrichment == null ? listing
                    : listing.withEnrichment(enrichment.rankInCategory(), enrichment.category());
            })
            .toList();
    }
}
