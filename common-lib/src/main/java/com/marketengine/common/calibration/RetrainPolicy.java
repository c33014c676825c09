package com.marketengine.common.calibration;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Retraining gate and model version naming.
 *
 * <p>A retrain runs only when at least {@code minRows} observations arrived
 * since the active model was trained. The gate is a minimum sample size and
 * matches the MEDIUM confidence threshold of {@link SelfCalibratingEstimator}.
 */
public final class RetrainPolicy {

    private static final DateTimeFormatter VERSION_FORMAT =
        DateTimeFormatter.ofPattern("yyyyMMdd.HHmmss").withZone(ZoneOffset.UTC);

    private final int minRows;
    private final int windowRows;

    public RetrainPolicy(int minRows, int windowRows) {
        this.minRows = minRows;
        this.windowRows = windowRows;
    }

    public boolean shouldRetrain(long newRowsSinceLastTraining) {
        return newRowsSinceLastTraining >= minRows;
    }

    /** Lower bound for "new" observations: the active model's training time, or epoch. */
    public static Instant since(Instant activeTrainedAt) {
        return activeTrainedAt != null ? activeTrainedAt : Instant.EPOCH;
    }

    /** {@code v2.0.<UTC yyyyMMdd.HHmmss>} of the training time. */
    public static String modelVersion(Instant trainedAt) {
        return "v2.0." + VERSION_FORMAT.format(trainedAt);
    }

    public int minRows() {
        return minRows;
    }

    public int windowRows() {
        return windowRows;
    }
}
