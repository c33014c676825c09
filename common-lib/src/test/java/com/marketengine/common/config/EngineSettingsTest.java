package com.marketengine.common.config;

import com.marketengine.common.exception.MarketEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EngineSettingsTest {

    @Test
    void defaults() {
        EngineSettings settings = EngineSettings.defaults();
        assertEquals(49, settings.maxProducts());
        assertEquals(200, settings.retrainMinRows());
        assertEquals(1000, settings.retrainWindowRows());
        assertEquals(new CurveConstants(15000, 0.65), settings.categoryCurves().get(EngineSettings.DEFAULT_CURVE));
        assertEquals(new CogsBand(70, 85), settings.cogsBands().get("dropshipping"));
        assertEquals(8, settings.cogsBands().size());
    }

    @Test
    @DisplayName("overrides replace scalars and merge table entries by lower-case key")
    void overrides() {
        EngineSettings settings = EngineSettings.defaults().withOverrides(
            25, null, null,
            Map.of("Pet Supplies", new CurveConstants(12000, 0.6)),
            Map.of("dropshipping", new CogsBand(65, 80)));

        assertEquals(25, settings.maxProducts());
        assertEquals(200, settings.retrainMinRows());
        assertEquals(new CurveConstants(12000, 0.6), settings.categoryCurves().get("pet supplies"));
        assertEquals(new CurveConstants(30000, 0.70), settings.categoryCurves().get("electronics"));
        assertEquals(new CogsBand(65, 80), settings.cogsBands().get("dropshipping"));
    }

    @Test
    @DisplayName("override keys fold the same way under a Turkish default locale")
    void overrideKeysIgnoreDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            EngineSettings settings = EngineSettings.defaults().withOverrides(null, null, null,
                Map.of("KITCHEN & DINING", new CurveConstants(20000, 0.7)),
                Map.of("PRIVATE_LABEL.DEFAULT", new CogsBand(20, 35)));

            assertEquals(new CurveConstants(20000, 0.7), settings.categoryCurves().get("kitchen & dining"));
            assertEquals(new CogsBand(20, 35), settings.cogsBands().get("private_label.default"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void missingDefaultCurve() {
        assertThrows(MarketEngineException.class, () -> new EngineSettings(49, 200, 1000,
            Map.of("electronics", new CurveConstants(30000, 0.7)), Map.of()));
    }

    @Test
    void nonPositiveCurveConstants() {
        assertThrows(MarketEngineException.class, () -> EngineSettings.defaults().withOverrides(
            null, null, null, Map.of("toys & games", new CurveConstants(0, 0.67)), null));
    }

    @Test
    void invertedCogsBand() {
        MarketEngineException ex = assertThrows(MarketEngineException.class, () -> EngineSettings.defaults()
            .withOverrides(null, null, null, null, Map.of("unknown", new CogsBand(70, 40))));
        assertEquals("EngineSettings", ex.getComponent());
    }

    @Test
    void windowSmallerThanMinimum() {
        assertThrows(MarketEngineException.class,
            () -> EngineSettings.defaults().withOverrides(null, 500, 100, null, null));
    }
}
