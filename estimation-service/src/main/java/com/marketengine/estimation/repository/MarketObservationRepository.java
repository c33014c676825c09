package com.marketengine.estimation.repository;

import com.marketengine.estimation.model.MarketObservationEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface MarketObservationRepository extends ReactiveCrudRepository<MarketObservationEntity, Long> {

    @Query("""
        SELECT COUNT(*) FROM market_observations
        WHERE marketplace = :marketplace
          AND created_at  > :since
        """)
    Mono<Long> countSince(String marketplace, LocalDateTime since);

    /** Most recent observations first, capped at {@code limit} rows, regardless of age. */
    @Query("""
        SELECT * FROM market_observations
        WHERE marketplace = :marketplace
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<MarketObservationEntity> findRecent(String marketplace, int limit);
}
