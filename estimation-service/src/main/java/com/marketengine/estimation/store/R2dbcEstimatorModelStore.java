package com.marketengine.estimation.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelCoefficients;
import com.marketengine.common.model.ModelType;
import com.marketengine.common.model.TrainingDiagnostics;
import com.marketengine.estimation.model.EstimatorModelEntity;
import com.marketengine.estimation.repository.EstimatorModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

@Component
public class R2dbcEstimatorModelStore implements EstimatorModelStore {

    private static final Logger log = LoggerFactory.getLogger(R2dbcEstimatorModelStore.class);

    private final EstimatorModelRepository repository;
    private final TransactionalOperator transactionalOperator;
    private final ObjectMapper objectMapper;

    public R2dbcEstimatorModelStore(EstimatorModelRepository repository,
                                    TransactionalOperator transactionalOperator,
                                    ObjectMapper objectMapper) {
        this.repository            = repository;
        this.transactionalOperator = transactionalOperator;
        this.objectMapper          = objectMapper;
    }

    @Override
    public Mono<EstimatorModel> findActive(String marketplace, ModelType type) {
        return repository.findActive(marketplace, type.key())
            .flatMap(entity -> Mono.justOrEmpty(fromEntity(entity)));
    }

    @Override
    public Mono<EstimatorModel> saveAndActivate(EstimatorModel model) {
        return Mono.fromCallable(() -> toEntity(model))
            .flatMap(repository::save)
            .flatMap(saved -> repository.activate(saved.getMarketplace(), saved.getModelType(), saved.getId())
                .thenReturn(model.withId(saved.getId())))
            .as(transactionalOperator::transactional)
            .doOnSuccess(stored -> log.info("MODEL_ACTIVATED marketplace={} modelType={} version={} id={}",
                stored.marketplace(), stored.modelType().key(), stored.modelVersion(), stored.id()));
    }

    @Override
    public Flux<EstimatorModel> findVersions(String marketplace, ModelType type, int limit) {
        return repository.findVersions(marketplace, type.key(), limit)
            .flatMap(entity -> Mono.justOrEmpty(fromEntity(entity)));
    }

    // ── mapping ────────────────────────────────────────────────────────────

    private EstimatorModelEntity toEntity(EstimatorModel model) {
        try {
            EstimatorModelEntity entity = new EstimatorModelEntity();
            entity.setMarketplace(model.marketplace());
            entity.setModelType(model.modelType().key());
            entity.setModelVersion(model.modelVersion());
            entity.setCoefficients(objectMapper.writeValueAsString(model.coefficients()));
            entity.setTrainedAt(LocalDateTime.ofInstant(model.trainedAt(), ZoneOffset.UTC));
            entity.setTrainingRows(model.trainingRowCount());
            entity.setTrainingDiagnostics(model.diagnostics() != null
                ? objectMapper.writeValueAsString(model.diagnostics()) : null);
            entity.setCreatedAt(LocalDateTime.now(ZoneOffset.UTC));
            return entity;
        } catch (Exception e) {
            throw new MarketEngineException("R2dbcEstimatorModelStore", "failed to serialise model for persistence", e);
        }
    }

    private EstimatorModel fromEntity(EstimatorModelEntity entity) {
        try {
            return new EstimatorModel(
                entity.getId(),
                entity.getMarketplace(),
                ModelType.fromKey(entity.getModelType()),
                entity.getModelVersion(),
                objectMapper.readValue(entity.getCoefficients(), ModelCoefficients.class),
                entity.getTrainedAt().toInstant(ZoneOffset.UTC),
                entity.getTrainingRows(),
                entity.getTrainingDiagnostics() != null
                    ? objectMapper.readValue(entity.getTrainingDiagnostics(), TrainingDiagnostics.class) : null);
        } catch (Exception e) {
            log.warn("Skipping unreadable estimator model. id={} reason={}", entity.getId(), e.getMessage());
            return null;
        }
    }
}
