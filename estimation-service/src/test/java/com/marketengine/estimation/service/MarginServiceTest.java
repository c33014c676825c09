package com.marketengine.estimation.service;

import com.marketengine.common.cogs.CogsAssumptionEngine;
import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.exception.InvalidCostOverrideException;
import com.marketengine.common.margin.MarginSnapshotBuilder;
import com.marketengine.common.model.ConfidenceTier;
import com.marketengine.common.model.CostOverrides;
import com.marketengine.common.model.MarginMode;
import com.marketengine.common.model.MarginRequest;
import com.marketengine.common.model.MarginSnapshot;
import com.marketengine.common.model.SourcingModel;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import static org.junit.jupiter.api.Assertions.*;

class MarginServiceTest {

    private final MarginService service = new MarginService(new MarginSnapshotBuilder(new CogsAssumptionEngine(EngineSettings.defaults())));

    private static MarginRequest request(CostOverrides overrides) {
        return new MarginRequest(MarginMode.ASIN, SourcingModel.DROPSHIPPING, null, 20.0, null, null, overrides);
    }

    @Test
    void buildsSnapshot() {
        StepVerifier.create(service.build(request(null)))
            .assertNext(snapshot -> {
                assertEquals(14.0, snapshot.cogsMin(), 1e-9);
                assertEquals(17.0, snapshot.cogsMax(), 1e-9);
                assertTrue(snapshot.belowBreakeven());
            })
            .verifyComplete();
    }

    @Test
    void invalidOverrideSurfacesAsError() {
        StepVerifier.create(service.build(request(CostOverrides.cogs(25.0))))
            .expectError(InvalidCostOverrideException.class)
            .verify();
    }

    @Test
    void missingModeRejected() {
        MarginRequest noMode = new MarginRequest(null, SourcingModel.DROPSHIPPING, null, 20.0, null, null, null);
        StepVerifier.create(service.build(noMode))
            .expectError(IllegalArgumentException.class)
            .verify();
    }

    @Test
    void refineAppliesCogsOverride() {
        MarginSnapshot first = service.build(request(null)).block();
        StepVerifier.create(service.refine(first, CostOverrides.cogs(8.0), null))
            .assertNext(refined -> {
                assertEquals(8.0, refined.cogsMin(), 1e-9);
                assertEquals(8.0, refined.cogsMax(), 1e-9);
                assertNotEquals(ConfidenceTier.ESTIMATED, refined.confidenceTier());
            })
            .verifyComplete();
    }

    @Test
    void refineWithoutPreviousRejected() {
        StepVerifier.create(service.refine(null, CostOverrides.none(), null))
            .expectError(IllegalArgumentException.class)
            .verify();
    }
}
