package com.marketengine.estimation.service;

import com.marketengine.common.calibration.EstimatorTrainer;
import com.marketengine.common.calibration.RetrainPolicy;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelType;
import com.marketengine.estimation.store.EstimatorModelStore;
import com.marketengine.estimation.store.ObservationStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Retrains each model type of a marketplace when enough observations arrived
 * since its active version was trained.
 *
 * <pre>
 *   since   = active.trainedAt (epoch when none)
 *   count   = observations after since
 *   count &lt; retrain_min_rows          → RETRAIN_SKIPPED
 *   else train on the newest retrain_window_rows rows of any age → insert version + move pointer
 * </pre>
 *
 * Types are independent: one failing never blocks the other, and failures are
 * logged, not propagated.
 */
@Service
public class RetrainingService {

    private static final Logger log = LoggerFactory.getLogger(RetrainingService.class);

    private final EstimatorModelStore modelStore;
    private final ObservationStore observationStore;
    private final EstimatorTrainer trainer;
    private final RetrainPolicy policy;
    private final Clock clock;

    public RetrainingService(EstimatorModelStore modelStore,
                             ObservationStore observationStore,
                             EstimatorTrainer trainer,
                             RetrainPolicy policy,
                             Clock clock) {
        this.modelStore       = modelStore;
        this.observationStore = observationStore;
        this.trainer          = trainer;
        this.policy           = policy;
        this.clock            = clock;
    }

    /** @return the versions activated in this pass, possibly none */
    public Mono<List<EstimatorModel>> retrain(String marketplace) {
        return Flux.fromArray(ModelType.values())
            .concatMap(type -> retrain(marketplace, type))
            .collectList();
    }

    public Mono<EstimatorModel> retrain(String marketplace, ModelType type) {
        return modelStore.findActive(marketplace, type)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty())
            .flatMap(active -> {
                Instant since = RetrainPolicy.since(active.map(EstimatorModel::trainedAt).orElse(null));
                return observationStore.countSince(marketplace, since)
                    .flatMap(count -> {
                        if (!policy.shouldRetrain(count)) {
                            log.info("RETRAIN_SKIPPED marketplace={} modelType={} newRows={} required={} reason=insufficient_rows",
                                marketplace, type.key(), count, policy.minRows());
                            return Mono.empty();
                        }
                        log.info("RETRAIN_START marketplace={} modelType={} newRows={} window={}",
                            marketplace, type.key(), count, policy.windowRows());
                        return observationStore.findRecent(marketplace, policy.windowRows())
                            .collectList()
                            .flatMap(rows -> Mono.justOrEmpty(trainer.train(marketplace, type, rows, clock.instant())))
                            .flatMap(modelStore::saveAndActivate);
                    });
            })
            .onErrorResume(e -> {
                log.warn("RETRAIN_FAILED marketplace={} modelType={} reason={}", marketplace, type.key(), e.getMessage(), e);
                return Mono.empty();
            });
    }
}
