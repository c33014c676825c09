package com.marketengine.estimation.store;

import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Versioned calibration models. Every training run adds a new version;
 * activation moves a per-(marketplace, model type) pointer.
 */
public interface EstimatorModelStore {

    /** Empty when no version is active for the pair. */
    Mono<EstimatorModel> findActive(String marketplace, ModelType type);

    /**
     * Inserts {@code model} as a new version and points the active record at
     * it, atomically.
     *
     * @return the stored model with its id assigned
     */
    Mono<EstimatorModel> saveAndActivate(EstimatorModel model);

    /** Newest first. */
    Flux<EstimatorModel> findVersions(String marketplace, ModelType type, int limit);
}
