package com.marketengine.estimation.service;

import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;
import com.marketengine.estimation.cache.EnrichmentBudget;
import com.marketengine.estimation.cache.InMemoryTtlCache;
import com.marketengine.estimation.client.EnrichmentClient;
import com.marketengine.estimation.client.RankEnrichment;
import com.marketengine.estimation.config.EngineProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class EnrichmentServiceTest {

    @Mock
    private EnrichmentClient client;

    private InMemoryTtlCache<RankEnrichment> cache;
    private EnrichmentService service;

    @BeforeEach
    void setUp() {
        EngineProperties props = new EngineProperties();
        props.setEnrichmentMaxCalls(2);
        cache = new InMemoryTtlCache<>("test");
        service = new EnrichmentService(client, cache, props);
        when(client.fetchRank(anyString(), eq("US")))
            .thenAnswer(inv -> Mono.just(new RankEnrichment(inv.getArgument(0), 1500, "Kitchen")));
    }

    private static Listing listing(int i, Integer rank) {
        return new Listing(String.format("B%09d", i), "t", 20.0, 4.5, 100, false, i, i,
            "Brand", Fulfillment.FBA, null, false, rank, null);
    }

    private static List<Listing> page() {
        return List.of(listing(1, null), listing(2, null), listing(3, null), listing(4, null));
    }

    @Test
    void newBudgetUsesConfiguredMax() {
        assertEquals(2, service.newBudget().max());
    }

    @Test
    @DisplayName("upstream calls stop at the budget; the rest stay unenriched")
    void budgetCapsCalls() {
        StepVerifier.create(service.enrich(page(), "US", EnrichmentBudget.of(2)))
            .assertNext(enriched -> {
                assertEquals(1500, enriched.get(0).rankInCategory());
                assertEquals("Kitchen", enriched.get(1).category());
                assertNull(enriched.get(2).rankInCategory());
                assertNull(enriched.get(3).rankInCategory());
            })
            .verifyComplete();
        verify(client, times(2)).fetchRank(anyString(), eq("US"));
    }

    @Test
    @DisplayName("cache hits are applied without spending budget")
    void cacheHitIsFree() {
        cache.put("US:B000000003", new RankEnrichment("B000000003", 42, "Kitchen"), Duration.ofDays(7));
        EnrichmentBudget budget = EnrichmentBudget.of(2);

        StepVerifier.create(service.enrich(page(), "US", budget))
            .assertNext(enriched -> {
                assertNotNull(enriched.get(0).rankInCategory());
                assertNotNull(enriched.get(1).rankInCategory());
                assertEquals(42, enriched.get(2).rankInCategory());
                assertNull(enriched.get(3).rankInCategory());
            })
            .verifyComplete();
        assertEquals(2, budget.used());
    }

    @Test
    @DisplayName("fetched ranks are cached for the next refinement")
    void resultsAreCached() {
        StepVerifier.create(service.enrich(List.of(listing(1, null)), "US", EnrichmentBudget.of(2)))
            .expectNextCount(1)
            .verifyComplete();
        assertNotNull(cache.get("US:B000000001"));
    }

    @Test
    void listingsWithRankNeedNoLookup() {
        List<Listing> ranked = List.of(listing(1, 900), listing(2, 1200));
        StepVerifier.create(service.enrich(ranked, "US", EnrichmentBudget.of(2)))
            .assertNext(enriched -> assertSame(ranked, enriched))
            .verifyComplete();
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("a failed lookup leaves only that listing unenriched")
    void failedLookup() {
        when(client.fetchRank("B000000001", "US")).thenReturn(Mono.empty());
        StepVerifier.create(service.enrich(List.of(listing(1, null), listing(2, null)), "US", EnrichmentBudget.of(5)))
            .assertNext(enriched -> {
                assertNull(enriched.get(0).rankInCategory());
                assertEquals(1500, enriched.get(1).rankInCategory());
            })
            .verifyComplete();
    }
}
