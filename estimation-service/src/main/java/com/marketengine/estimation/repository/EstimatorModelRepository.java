package com.marketengine.estimation.repository;

import com.marketengine.estimation.model.EstimatorModelEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface EstimatorModelRepository extends ReactiveCrudRepository<EstimatorModelEntity, Long> {

    /**
     * The version the active pointer refers to. Empty when no model has been
     * activated for the pair yet.
     */
    @Query("""
        SELECT m.* FROM estimator_models m
        JOIN active_estimator_models a ON a.model_id = m.id
        WHERE a.marketplace = :marketplace
          AND a.model_type  = :modelType
        """)
    Mono<EstimatorModelEntity> findActive(String marketplace, String modelType);

    /**
     * Moves the active pointer in one statement. Readers see either the old or
     * the new version, never neither.
     */
    @Modifying
    @Query("""
        INSERT INTO active_estimator_models (marketplace, model_type, model_id, activated_at)
        VALUES (:marketplace, :modelType, :modelId, NOW())
        ON CONFLICT (marketplace, model_type) DO UPDATE SET
            model_id     = :modelId,
            activated_at = NOW()
        """)
    Mono<Void> activate(String marketplace, String modelType, long modelId);

    @Query("""
        SELECT * FROM estimator_models
        WHERE marketplace = :marketplace
          AND model_type  = :modelType
        ORDER BY trained_at DESC
        LIMIT :limit
        """)
    Flux<EstimatorModelEntity> findVersions(String marketplace, String modelType, int limit);
}
