package com.marketengine.common.curve;

import com.marketengine.common.config.CurveConstants;
import com.marketengine.common.config.EngineSettings;

import java.util.Locale;
import java.util.Map;

/**
 * Converts a best-seller rank within a category into estimated monthly units.
 *
 * <h3>Curve</h3>
 * <pre>
 *   raw      = A x rank^(-B)                         (A, B per category)
 *   smoothed = raw x 0.92 + min(raw, 2000) x 0.08
 *   units    = clamp(smoothed, 5, 100000)
 * </pre>
 *
 * <p>Unknown categories use the {@code default} curve. Stateless and
 * deterministic: identical inputs always yield identical estimates.
 */
public final class BsrRevenueCurveModel {

    public static final double MIN_UNITS = 5;
    public static final double MAX_UNITS = 100_000;

    static final double SMOOTHING_WEIGHT = 0.08;
    static final double SMOOTHING_CAP = 2000;

    private final Map<String, CurveConstants> curves;

    public BsrRevenueCurveModel(EngineSettings settings) {
        this.curves = settings.categoryCurves();
    }

    /**
     * @param rankInCategory best-seller rank; null, non-positive or non-finite is unusable
     * @param categoryKey    free-text category; null or unknown falls back to the default curve
     * @return the estimate, or {@code null} when the rank is unusable
     */
    public UnitsEstimate estimateUnits(Number rankInCategory, String categoryKey) {
        if (rankInCategory == null) {
            return null;
        }
        double rank = rankInCategory.doubleValue();
        if (!Double.isFinite(rank) || rank <= 0) {
            return null;
        }

        String key = normalize(categoryKey);
        CurveConstants curve = curves.get(key);
        boolean defaultCurve = curve == null;
        if (defaultCurve) {
            key = EngineSettings.DEFAULT_CURVE;
            curve = curves.get(key);
        }

        double raw = curve.a() * Math.pow(rank, -curve.b());
        double smoothed = raw * (1 - SMOOTHING_WEIGHT) + Math.min(raw, SMOOTHING_CAP) * SMOOTHING_WEIGHT;
        double bounded = Math.max(MIN_UNITS, Math.min(MAX_UNITS, smoothed));
        boolean clamped = bounded != smoothed;

        return new UnitsEstimate(Math.round(bounded), raw, clamped, key, defaultCurve);
    }

    static String normalize(String categoryKey) {
        if (categoryKey == null || categoryKey.isBlank()) {
            return EngineSettings.DEFAULT_CURVE;
        }
        return categoryKey.trim().toLowerCase(Locale.ROOT);
    }
}
