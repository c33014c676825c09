package com.marketengine.estimation.store;

import com.marketengine.common.model.MarketObservation;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;

/** Append-only training observations. */
public interface ObservationStore {

    Mono<MarketObservation> append(MarketObservation observation);

    /** Observations created strictly after {@code since}. Only gates retraining. */
    Mono<Long> countSince(String marketplace, Instant since);

    /** Newest observations first, at most {@code limit}, whatever their age. */
    Flux<MarketObservation> findRecent(String marketplace, int limit);
}
