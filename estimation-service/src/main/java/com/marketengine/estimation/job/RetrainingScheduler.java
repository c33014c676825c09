package com.marketengine.estimation.job;

import com.marketengine.estimation.config.EngineProperties;
import com.marketengine.estimation.service.RetrainingService;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Locale;

/**
 * Periodic retraining loop, one independent loop per configured marketplace:
 * <pre>
 *   delay(interval) → retrain(marketplace) → reschedule
 * </pre>
 *
 * <p>Each cycle is a fresh {@link Mono}; {@code Mono.delay()} holds no thread
 * while waiting. A failed cycle is logged and the loop reschedules with the
 * same interval, so it never stops.
 */
@Component
@ConditionalOnProperty(prefix = "market-engine", name = "retrain-enabled", havingValue = "true", matchIfMissing = true)
public class RetrainingScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetrainingScheduler.class);

    static final Duration INITIAL_DELAY = Duration.ofMinutes(1);

    private final RetrainingService retrainingService;
    private final EngineProperties props;

    public RetrainingScheduler(RetrainingService retrainingService, EngineProperties props) {
        this.retrainingService = retrainingService;
        this.props             = props;
    }

    @PostConstruct
    public void startRetrainingLoops() {
        log.info("Retraining scheduler started. marketplaces={} interval={}",
            props.getRetrainMarketplaces(), props.getRetrainInterval());
        for (String raw : props.getRetrainMarketplaces()) {
            scheduleNextCycle(raw.trim().toUpperCase(Locale.ROOT), INITIAL_DELAY);
        }
    }

    // ── loop ───────────────────────────────────────────────────────────────

    private void scheduleNextCycle(String marketplace, Duration delay) {
        Mono.delay(delay)
            .then(retrainingService.retrain(marketplace))
            .subscribe(
                activated -> {
                    log.info("RETRAIN_CYCLE_DONE marketplace={} activated={} nextIntervalSeconds={}",
                        marketplace, activated.size(), props.getRetrainInterval().toSeconds());
                    scheduleNextCycle(marketplace, props.getRetrainInterval());
                },
                err -> {
                    log.error("Retraining cycle failed for marketplace={}, rescheduling", marketplace, err);
                    scheduleNextCycle(marketplace, props.getRetrainInterval());
                });
    }
}
