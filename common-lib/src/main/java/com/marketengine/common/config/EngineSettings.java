package com.marketengine.common.config;

import com.marketengine.common.exception.MarketEngineException;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Overridable constants of the estimation engine.
 *
 * <p>Built-in defaults live in {@link #defaults()}; the host application merges
 * its configuration over them with {@link #withOverrides}. Validation runs on
 * construction: a malformed table is a configuration error and fails fast.
 *
 * <h3>COGS band keys</h3>
 * <pre>
 *   private_label.electronics | private_label.home_goods | private_label.beauty | private_label.default
 *   wholesale_arbitrage | retail_arbitrage | dropshipping | unknown
 * </pre>
 *
 * @param maxProducts       page-one cap for Tier-1 (49)
 * @param retrainMinRows    minimum new observations before retraining (200)
 * @param retrainWindowRows most recent observations used for training (1000)
 * @param categoryCurves    curve constants keyed by lower-case category; must contain {@code default}
 * @param cogsBands         COGS bands keyed as above
 */
public record EngineSettings(
    int maxProducts,
    int retrainMinRows,
    int retrainWindowRows,
    Map<String, CurveConstants> categoryCurves,
    Map<String, CogsBand> cogsBands
) {
    public static final String DEFAULT_CURVE = "default";

    public EngineSettings {
        if (maxProducts <= 0) {
            throw new MarketEngineException("EngineSettings", "maxProducts must be positive, got " + maxProducts);
        }
        if (retrainMinRows <= 0 || retrainWindowRows < retrainMinRows) {
            throw new MarketEngineException("EngineSettings",
                "retrain window (" + retrainWindowRows + ") must be >= min rows (" + retrainMinRows + ") > 0");
        }
        if (categoryCurves == null || !categoryCurves.containsKey(DEFAULT_CURVE)) {
            throw new MarketEngineException("EngineSettings", "category curve table needs a 'default' entry");
        }
        categoryCurves.forEach((key, curve) -> {
            if (!(curve.a() > 0) || !(curve.b() > 0)) {
                throw new MarketEngineException("EngineSettings", "curve '" + key + "' needs a > 0 and b > 0");
            }
        });
        if (cogsBands == null) {
            throw new MarketEngineException("EngineSettings", "COGS band table is required");
        }
        cogsBands.forEach((key, band) -> {
            if (band.lowPct() < 0 || band.highPct() > 100 || band.lowPct() > band.highPct()) {
                throw new MarketEngineException("EngineSettings",
                    "COGS band '" + key + "' must satisfy 0 <= low <= high <= 100");
            }
        });
        categoryCurves = Map.copyOf(categoryCurves);
        cogsBands = Map.copyOf(cogsBands);
    }

    public static EngineSettings defaults() {
        Map<String, CurveConstants> curves = new HashMap<>();
        curves.put(DEFAULT_CURVE,            new CurveConstants(15000, 0.65));
        curves.put("home & kitchen",         new CurveConstants(20000, 0.65));
        curves.put("kitchen & dining",       new CurveConstants(18000, 0.65));
        curves.put("sports & outdoors",      new CurveConstants(16000, 0.66));
        curves.put("beauty & personal care", new CurveConstants(24000, 0.66));
        curves.put("toys & games",           new CurveConstants(28000, 0.67));
        curves.put("electronics",            new CurveConstants(30000, 0.70));

        Map<String, CogsBand> bands = new HashMap<>();
        bands.put("private_label.electronics", new CogsBand(30, 45));
        bands.put("private_label.home_goods",  new CogsBand(20, 30));
        bands.put("private_label.beauty",      new CogsBand(15, 30));
        bands.put("private_label.default",     new CogsBand(25, 35));
        bands.put("wholesale_arbitrage",       new CogsBand(55, 75));
        bands.put("retail_arbitrage",          new CogsBand(60, 80));
        bands.put("dropshipping",              new CogsBand(70, 85));
        bands.put("unknown",                   new CogsBand(40, 65));

        return new EngineSettings(49, 200, 1000, curves, bands);
    }

    /**
     * Returns a copy with the non-null scalars and every supplied table entry
     * replacing the corresponding value here.
     */
    public EngineSettings withOverrides(Integer maxProductsOverride,
                                        Integer retrainMinRowsOverride,
                                        Integer retrainWindowRowsOverride,
                                        Map<String, CurveConstants> curveOverrides,
                                        Map<String, CogsBand> bandOverrides) {
        Map<String, CurveConstants> curves = new HashMap<>(categoryCurves);
        if (curveOverrides != null) {
            curveOverrides.forEach((key, value) -> curves.put(key.trim().toLowerCase(Locale.ROOT), value));
        }
        Map<String, CogsBand> bands = new HashMap<>(cogsBands);
        if (bandOverrides != null) {
            bandOverrides.forEach((key, value) -> bands.put(key.trim().toLowerCase(Locale.ROOT), value));
        }
        return new EngineSettings(
            maxProductsOverride != null ? maxProductsOverride : maxProducts,
            retrainMinRowsOverride != null ? retrainMinRowsOverride : retrainMinRows,
            retrainWindowRowsOverride != null ? retrainWindowRowsOverride : retrainWindowRows,
            curves,
            bands);
    }
}
