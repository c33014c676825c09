package com.marketengine.estimation.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/**
 * Looks up category rank and category per ASIN. Used by Tier-2 only.
 *
 * <p>All errors are absorbed into an empty result so that a failing lookup
 * leaves that listing unenriched and never aborts the refinement.
 */
@Component
public class EnrichmentClient {

    private static final Logger log = LoggerFactory.getLogger(EnrichmentClient.class);

    private final WebClient enrichmentWebClient;

    public EnrichmentClient(WebClient enrichmentWebClient) {
        this.enrichmentWebClient = enrichmentWebClient;
    }

    public Mono<RankEnrichment> fetchRank(String asin, String marketplace) {
        return enrichmentWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/catalog/{asin}/rank")
                .queryParam("marketplace", marketplace)
                .build(asin))
            .retrieve()
            .bodyToMono(RankEnrichment.class)
            .onErrorResume(e -> {
                log.warn("ENRICHMENT_FETCH_FAILED asin={} marketplace={} reason={}", asin, marketplace, e.getMessage());
                return Mono.empty();
            });
    }
}
