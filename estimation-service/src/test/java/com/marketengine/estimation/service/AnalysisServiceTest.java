package com.marketengine.estimation.service;

import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;
import com.marketengine.common.tier1.Tier1FastEstimator;
import com.marketengine.estimation.client.ListingClient;
import com.marketengine.estimation.config.EngineProperties;
import com.marketengine.estimation.dto.AnalyzeRequestDTO;
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

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class AnalysisServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ListingClient listingClient;

    @Mock
    private Tier2RefinementService refinementService;

    private AnalysisService service;
    private List<Listing> page;

    @BeforeEach
    void setUp() {
        service = new AnalysisService(listingClient, new Tier1FastEstimator(EngineSettings.defaults()),
            refinementService, new EngineProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        page = new ArrayList<>();
        for (int i = 1; i <= 6; i++) {
            page.add(new Listing(String.format("B%09d", i), "t", 30.0, 4.5, 200, false, i, i,
                "Brand", Fulfillment.FBA, null, false, null, null));
        }
        when(refinementService.refine(any(), anyList(), any(), anyInt())).thenReturn(Mono.empty());
    }

    @Test
    @DisplayName("Tier-1 snapshot is returned and Tier-2 is started for it")
    void tier1ThenDetachedRefinement() {
        when(listingClient.fetchKeywordPage(eq("garlic press"), eq("US"), eq(1), any()))
            .thenReturn(Mono.just(page));

        StepVerifier.create(service.analyzeKeyword(new AnalyzeRequestDTO("  garlic press ", null, null, null)))
            .assertNext(snapshot -> {
                assertEquals("garlic press", snapshot.keyword());
                assertEquals("US", snapshot.marketplace());
                assertEquals(6, snapshot.products().size());
                assertEquals(NOW, snapshot.createdAt());
                assertNotNull(snapshot.snapshotId());
            })
            .verifyComplete();

        verify(refinementService, timeout(2000)).refine(any(), eq(page), isNull(), eq(1));
    }

    @Test
    void marketplaceAndPageFromRequest() {
        when(listingClient.fetchKeywordPage(eq("tea"), eq("UK"), eq(2), any())).thenReturn(Mono.just(page));

        StepVerifier.create(service.analyzeKeyword(new AnalyzeRequestDTO("tea", "uk", "Grocery", 2)))
            .assertNext(snapshot -> assertEquals("UK", snapshot.marketplace()))
            .verifyComplete();
        verify(refinementService, timeout(2000)).refine(any(), anyList(), eq("Grocery"), eq(2));
    }

    @Test
    @DisplayName("a failing refinement never reaches the caller")
    void refinementFailureIsDetached() {
        when(listingClient.fetchKeywordPage(anyString(), anyString(), anyInt(), any())).thenReturn(Mono.just(page));
        when(refinementService.refine(any(), anyList(), any(), anyInt()))
            .thenReturn(Mono.error(new RuntimeException("boom")));

        StepVerifier.create(service.analyzeKeyword(new AnalyzeRequestDTO("tea", null, null, null)))
            .expectNextCount(1)
            .verifyComplete();
    }

    @Test
    void blankKeywordRejected() {
        StepVerifier.create(service.analyzeKeyword(new AnalyzeRequestDTO("  ", null, null, null)))
            .expectError(IllegalArgumentException.class)
            .verify();
        verify(refinementService, never()).refine(any(), anyList(), any(), anyInt());
    }

    @Test
    void listingFailurePropagates() {
        when(listingClient.fetchKeywordPage(anyString(), anyString(), anyInt(), any()))
            .thenReturn(Mono.error(new MarketEngineException("ListingClient", "timed out")));

        StepVerifier.create(service.analyzeKeyword(new AnalyzeRequestDTO("tea", null, null, null)))
            .expectErrorMatches(e -> e instanceof MarketEngineException
                && "ListingClient".equals(((MarketEngineException) e).getComponent()))
            .verify();
    }
}
