package com.marketengine.estimation.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketengine.common.calibration.ObservationBuilder;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.BrandMoatVerdict;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.PageOneListing;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.model.Tier2Refinement;
import com.marketengine.common.moat.BrandMoatClassifier;
import com.marketengine.common.tier2.Tier2RefinementPipeline;
import com.marketengine.common.trace.SnapshotTrace;
import com.marketengine.estimation.dto.RefinementDTO;
import com.marketengine.estimation.model.Tier2RefinementEntity;
import com.marketengine.estimation.repository.Tier2RefinementRepository;
import com.marketengine.estimation.store.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Background Tier-2 pass for one finished Tier-1 snapshot.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>rank/category enrichment within the per-refinement call budget</li>
 *   <li>active calibration models for the marketplace</li>
 *   <li>{@link Tier2RefinementPipeline} (steps fail independently)</li>
 *   <li>brand moat verdict over the Tier-1 products</li>
 *   <li>persist refinement + verdict, then append the training observation</li>
 * </ol>
 * Each persistence step is non-fatal. The Tier-1 snapshot is never modified.
 */
@Service
public class Tier2RefinementService {

    private static final Logger log = LoggerFactory.getLogger(Tier2RefinementService.class);

    private final EnrichmentService enrichmentService;
    private final CalibrationService calibrationService;
    private final Tier2RefinementPipeline pipeline;
    private final Tier2RefinementRepository refinementRepository;
    private final ObservationStore observationStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public Tier2RefinementService(EnrichmentService enrichmentService,
                                  CalibrationService calibrationService,
                                  Tier2RefinementPipeline pipeline,
                                  Tier2RefinementRepository refinementRepository,
                                  ObservationStore observationStore,
                                  ObjectMapper objectMapper,
                                  Clock clock) {
        this.enrichmentService    = enrichmentService;
        this.calibrationService   = calibrationService;
        this.pipeline             = pipeline;
        this.refinementRepository = refinementRepository;
        this.observationStore     = observationStore;
        this.objectMapper         = objectMapper;
        this.clock                = clock;
    }

    private record SerializedRefinement(String refinement, String moatVerdict) {}

    public Mono<Tier2Refinement> refine(Tier1Snapshot tier1, List<Listing> rawListings, String category, int page) {
        String snapshotId = tier1.snapshotId();
        String marketplace = tier1.marketplace();

        Mono<List<Listing>> enriched = enrichmentService
            .enrich(rawListings, marketplace, enrichmentService.newBudget())
            .onErrorResume(e -> {
                log.warn("ENRICHMENT_FAILED snapshotId={} reason={}", snapshotId, e.getMessage());
                return Mono.just(rawListings);
            });

        Mono<Tier2Refinement> refinement = Mono.zip(enriched, calibrationService.activeModels(marketplace))
            .map(tuple -> pipeline.refine(snapshotId, tuple.getT1(), tier1, category, tuple.getT2(), clock.instant()))
            .flatMap(result -> {
                BrandMoatVerdict moat = classifyMoat(tier1);
                return persist(tier1, result, moat)
                    .then(recordObservation(tier1, rawListings, result, category, page))
                    .thenReturn(result);
            });

        return SnapshotTrace.tag(refinement, snapshotId);
    }

    public Mono<RefinementDTO> findRefinement(String snapshotId) {
        return refinementRepository.findById(snapshotId)
            .map(this::toDto);
    }

    // ── steps ──────────────────────────────────────────────────────────────

    private BrandMoatVerdict classifyMoat(Tier1Snapshot tier1) {
        try {
            return BrandMoatClassifier.classify(tier1.products().stream().map(PageOneListing::from).toList());
        } catch (RuntimeException e) {
            log.warn("BRAND_MOAT_FAILED snapshotId={} reason={}", tier1.snapshotId(), e.getMessage());
            return null;
        }
    }

    private Mono<Void> persist(Tier1Snapshot tier1, Tier2Refinement refinement, BrandMoatVerdict moat) {
        return Mono.fromCallable(() -> new SerializedRefinement(
                objectMapper.writeValueAsString(refinement),
                moat != null ? objectMapper.writeValueAsString(moat) : null))
            .flatMap(json -> refinementRepository.upsert(
                tier1.snapshotId(), tier1.marketplace(), tier1.keyword(), json.refinement(), json.moatVerdict(),
                LocalDateTime.ofInstant(refinement.completedAt(), ZoneOffset.UTC)))
            .onErrorResume(e -> nonFatal("Refinement persistence", e));
    }

    private Mono<Void> recordObservation(Tier1Snapshot tier1, List<Listing> raw, Tier2Refinement refinement,
                                         String category, int page) {
        return Mono.fromCallable(() -> ObservationBuilder.build(tier1, raw, refinement, category, page, clock.instant()))
            .flatMap(observationStore::append)
            .then()
            .onErrorResume(e -> nonFatal("Observation append", e));
    }

    private Mono<Void> nonFatal(String step, Throwable e) {
        return Mono.deferContextual(ctx -> {
            SnapshotTrace.log(ctx, snapshotId ->
                log.warn("{} failed (non-fatal). snapshotId={} reason={}", step, snapshotId, e.getMessage()));
            return Mono.empty();
        });
    }

    private RefinementDTO toDto(Tier2RefinementEntity entity) {
        try {
            return new RefinementDTO(
                entity.getSnapshotId(),
                objectMapper.readValue(entity.getRefinement(), Tier2Refinement.class),
                entity.getMoatVerdict() != null
                    ? objectMapper.readValue(entity.getMoatVerdict(), BrandMoatVerdict.class) : null);
        } catch (Exception e) {
            throw new MarketEngineException("Tier2RefinementService",
                "stored refinement is unreadable for snapshotId=" + entity.getSnapshotId(), e);
        }
    }
}
