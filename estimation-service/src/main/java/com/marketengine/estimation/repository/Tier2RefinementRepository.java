package com.marketengine.estimation.repository;

import com.marketengine.estimation.model.Tier2RefinementEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface Tier2RefinementRepository extends ReactiveCrudRepository<Tier2RefinementEntity, String> {

    @Modifying
    @Query("""
        INSERT INTO tier2_refinements
            (snapshot_id, marketplace, keyword, refinement, moat_verdict, completed_at)
        VALUES
            (:snapshotId, :marketplace, :keyword, :refinement, :moatVerdict, :completedAt)
        ON CONFLICT (snapshot_id) DO UPDATE SET
            refinement   = :refinement,
            moat_verdict = :moatVerdict,
            completed_at = :completedAt
        """)
    Mono<Void> upsert(String snapshotId, String marketplace, String keyword,
                      String refinement, String moatVerdict, LocalDateTime completedAt);
}
