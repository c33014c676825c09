package com.marketengine.estimation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.DataQuality;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.ListingSummary;
import com.marketengine.common.model.MarketObservation;
import com.marketengine.common.model.ObservationOutputs;
import com.marketengine.estimation.model.MarketObservationEntity;
import com.marketengine.estimation.repository.MarketObservationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Component
public class R2dbcObservationStore implements ObservationStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcObservationStore.class);

    private final MarketObservationRepository repository;
    private final ObjectMapper objectMapper;

    public R2dbcObservationStore(MarketObservationRepository repository, ObjectMapper objectMapper) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<MarketObservation> append(MarketObservation observation) {
        return Mono.fromCallable(() -> toEntity(observation))
            .flatMap(repository::save)
            .map(this::fromEntity)
            .doOnSuccess(saved -> log.info("MARKET_OBSERVATION_INSERTED id={} marketplace={} keyword={} listings={}",
                saved.id(), saved.marketplace(), saved.normalizedKeyword(), saved.dataQuality().listingsCount()));
    }

    @Override
    public Mono<Long> countSince(String marketplace, Instant since) {
        return repository.countSince(marketplace, LocalDateTime.ofInstant(since, ZoneOffset.UTC))
            .defaultIfEmpty(0L);
    }

    @Override
    public Flux<MarketObservation> findRecent(String marketplace, int limit) {
        return repository.findRecent(marketplace, limit)
            .flatMap(entity -> Mono.justOrEmpty(readOrSkip(entity)));
    }

    // ── mapping ────────────────────────────────────────────────────────────

    private MarketObservationEntity toEntity(MarketObservation observation) {
        try {
            MarketObservationEntity entity = new MarketObservationEntity();
            entity.setMarketplace(observation.marketplace());
            entity.setKeyword(observation.keyword());
            entity.setNormalizedKeyword(observation.normalizedKeyword());
            entity.setPage(observation.page());
            entity.setSnapshotId(observation.snapshotId());
            entity.setSummary(objectMapper.writeValueAsString(observation.summary()));
            entity.setInputs(observation.inputs() != null ? objectMapper.writeValueAsString(observation.inputs()) : null);
            entity.setOutputs(observation.outputs() != null ? objectMapper.writeValueAsString(observation.outputs()) : null);
            entity.setDataQuality(objectMapper.writeValueAsString(observation.dataQuality()));
            entity.setCreatedAt(LocalDateTime.ofInstant(observation.createdAt(), ZoneOffset.UTC));
            return entity;
        } catch (Exception e) {
            throw new MarketEngineException("R2dbcObservationStore", "failed to serialise observation for persistence", e);
        }
    }

    private MarketObservation fromEntity(MarketObservationEntity entity) {
        try {
            return new MarketObservation(
                entity.getId(),
                entity.getMarketplace(),
                entity.getKeyword(),
                entity.getNormalizedKeyword(),
                entity.getPage(),
                entity.getSnapshotId(),
                objectMapper.readValue(entity.getSummary(), ListingSummary.class),
                entity.getInputs() != null ? objectMapper.readValue(entity.getInputs(), EstimatorInputs.class) : null,
                entity.getOutputs() != null ? objectMapper.readValue(entity.getOutputs(), ObservationOutputs.class) : null,
                objectMapper.readValue(entity.getDataQuality(), DataQuality.class),
                entity.getCreatedAt().toInstant(ZoneOffset.UTC));
        } catch (Exception e) {
            throw new MarketEngineException("R2dbcObservationStore", "unreadable observation id=" + entity.getId(), e);
        }
    }

    private MarketObservation readOrSkip(MarketObservationEntity entity) {
        try {
            return fromEntity(entity);
        } catch (MarketEngineException e) {
            log.warn("Skipping unreadable observation. id={} reason={}", entity.getId(), e.getMessage());
            return null;
        }
    }
}
