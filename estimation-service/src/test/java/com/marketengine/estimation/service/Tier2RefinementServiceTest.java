package com.marketengine.estimation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.curve.BsrRevenueCurveModel;
import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.MarketObservation;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.tier1.Tier1FastEstimator;
import com.marketengine.common.tier2.Tier2RefinementPipeline;
import com.marketengine.estimation.cache.EnrichmentBudget;
import com.marketengine.estimation.repository.Tier2RefinementRepository;
import com.marketengine.estimation.store.ObservationStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
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
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class Tier2RefinementServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private EnrichmentService enrichmentService;

    @Mock
    private CalibrationService calibrationService;

    @Mock
    private Tier2RefinementRepository refinementRepository;

    @Mock
    private ObservationStore observationStore;

    private final EngineSettings settings = EngineSettings.defaults();
    private Tier2RefinementService service;
    private List<Listing> raw;
    private Tier1Snapshot tier1;

    @BeforeEach
    void setUp() {
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        service = new Tier2RefinementService(enrichmentService, calibrationService,
            new Tier2RefinementPipeline(new BsrRevenueCurveModel(settings)),
            refinementRepository, observationStore, mapper, Clock.fixed(NOW, ZoneOffset.UTC));

        raw = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            raw.add(new Listing(String.format("B%09d", i), "t", 25.0, 4.4, 500 + i, i % 4 == 0, i, i,
                "Brand" + (i % 3), Fulfillment.FBA, null, false, null, null));
        }
        tier1 = new Tier1FastEstimator(settings).buildSnapshot("snap-1", "garlic press", "US", raw, null, NOW);

        when(enrichmentService.newBudget()).thenReturn(EnrichmentBudget.of(10));
        when(enrichmentService.enrich(anyList(), eq("US"), any()))
            .thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        when(calibrationService.activeModels("US")).thenReturn(Mono.just(Map.of()));
        when(refinementRepository.upsert(anyString(), anyString(), anyString(), anyString(), any(), any()))
            .thenReturn(Mono.empty());
        when(observationStore.append(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
    }

    @Test
    @DisplayName("refinement and moat verdict are stored, then the observation is appended")
    void persistsAndRecords() {
        StepVerifier.create(service.refine(tier1, raw, null, 1))
            .assertNext(refinement -> {
                assertEquals("snap-1", refinement.snapshotId());
                assertEquals(NOW, refinement.completedAt());
            })
            .verifyComplete();

        ArgumentCaptor<String> moatJson = ArgumentCaptor.forClass(String.class);
        verify(refinementRepository).upsert(eq("snap-1"), eq("US"), eq("garlic press"), anyString(),
            moatJson.capture(), any());
        assertNotNull(moatJson.getValue());

        ArgumentCaptor<MarketObservation> observation = ArgumentCaptor.forClass(MarketObservation.class);
        verify(observationStore).append(observation.capture());
        assertEquals("snap-1", observation.getValue().snapshotId());
        assertEquals("garlic press", observation.getValue().normalizedKeyword());
        assertFalse(observation.getValue().dataQuality().fallbackUsed());
    }

    @Test
    @DisplayName("a storage failure does not fail the refinement or skip the observation")
    void storageFailureIsNonFatal() {
        doReturn(Mono.error(new RuntimeException("connection reset")))
            .when(refinementRepository).upsert(anyString(), anyString(), anyString(), anyString(), any(), any());

        StepVerifier.create(service.refine(tier1, raw, null, 1))
            .expectNextCount(1)
            .verifyComplete();
        verify(observationStore).append(any());
    }

    @Test
    void observationFailureIsNonFatal() {
        doReturn(Mono.error(new RuntimeException("disk full"))).when(observationStore).append(any());

        StepVerifier.create(service.refine(tier1, raw, null, 1))
            .assertNext(refinement -> assertEquals("snap-1", refinement.snapshotId()))
            .verifyComplete();
        verify(observationStore).append(any());
    }

    @Test
    @DisplayName("enrichment failure falls back to the raw listings")
    void enrichmentFailure() {
        doReturn(Mono.error(new RuntimeException("catalog down")))
            .when(enrichmentService).enrich(anyList(), eq("US"), any());

        StepVerifier.create(service.refine(tier1, raw, null, 1))
            .assertNext(refinement -> assertEquals(0, refinement.rankCoverage()))
            .verifyComplete();
    }
}
