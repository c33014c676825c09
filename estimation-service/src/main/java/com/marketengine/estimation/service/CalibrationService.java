package com.marketengine.estimation.service;

import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelType;
import com.marketengine.estimation.store.EstimatorModelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * Read side of the calibration models. A failed lookup counts as "no active
 * model", so callers fall back to the heuristic baseline.
 */
@Service
public class CalibrationService {

    private static final Logger log = LoggerFactory.getLogger(CalibrationService.class);

    private final EstimatorModelStore modelStore;

    public CalibrationService(EstimatorModelStore modelStore) {
        this.modelStore = modelStore;
    }

    /** Active model per type; types without one are absent from the map. */
    public Mono<Map<ModelType, EstimatorModel>> activeModels(String marketplace) {
        return Flux.fromArray(ModelType.values())
            .flatMap(type -> activeModel(marketplace, type))
            .collectMap(EstimatorModel::modelType);
    }

    public Mono<EstimatorModel> activeModel(String marketplace, ModelType type) {
        return modelStore.findActive(marketplace, type)
            .onErrorResume(e -> {
                log.warn("ACTIVE_MODEL_LOOKUP_FAILED marketplace={} modelType={} reason={}",
                    marketplace, type.key(), e.getMessage());
                return Mono.empty();
            });
    }

    public Flux<EstimatorModel> versions(String marketplace, ModelType type, int limit) {
        return modelStore.findVersions(marketplace, type, limit);
    }
}
