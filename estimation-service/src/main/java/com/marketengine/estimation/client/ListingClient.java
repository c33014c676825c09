package com.marketengine.estimation.client;

import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.Listing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Fetches raw page-one listings from the upstream listing service.
 *
 * <p>Unlike enrichment, a failed fetch is surfaced: Tier-1 has nothing to show
 * without listings. Timeouts and transport errors are reported as a
 * {@link MarketEngineException} tagged {@code ListingClient}.
 */
@Component
public class ListingClient {

    private static final Logger log = LoggerFactory.getLogger(ListingClient.class);

    private static final ParameterizedTypeReference<List<Listing>> LISTINGS = new ParameterizedTypeReference<>() {};

    private final WebClient listingWebClient;

    public ListingClient(WebClient listingWebClient) {
        this.listingWebClient = listingWebClient;
    }

    public Mono<List<Listing>> fetchKeywordPage(String keyword, String marketplace, int page, Duration timeout) {
        return listingWebClient.get()
            .uri(uriBuilder -> uriBuilder
                .path("/api/v1/listings/search")
                .queryParam("keyword", keyword)
                .queryParam("marketplace", marketplace)
                .queryParam("page", page)
                .build())
            .retrieve()
            .bodyToMono(LISTINGS)
            .defaultIfEmpty(List.of())
            .timeout(timeout)
            .doOnSuccess(listings -> log.info("LISTINGS_FETCHED keyword={} marketplace={} page={} count={}",
                keyword, marketplace, page, listings.size()))
            .onErrorMap(e -> !(e instanceof MarketEngineException), e -> fetchFailure(keyword, e));
    }

    private static MarketEngineException fetchFailure(String keyword, Throwable e) {
        String reason = e instanceof TimeoutException ? "timed out" : e.getMessage();
        log.warn("LISTINGS_FETCH_FAILED keyword={} reason={}", keyword, reason);
        return new MarketEngineException("ListingClient", "listing fetch failed for '" + keyword + "': " + reason, e);
    }
}
