package com.marketengine.common.calibration;

import com.marketengine.common.exception.MarketEngineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LinearModelTrainerTest {

    private static final double[][] X = {
        {10, 5.0, 10, 20}, {20, 6.0, 20, 30}, {30, 7.0, 30, 40}, {40, 8.0, 40, 50}, {50, 9.0, 50, 60}
    };

    @Test
    @DisplayName("same training set → identical coefficients")
    void deterministic() {
        double[] y = {0.1, 0.2, 0.3, 0.4, 0.5};
        LinearModelTrainer.Fit a = LinearModelTrainer.train(X, y);
        LinearModelTrainer.Fit b = LinearModelTrainer.train(X, y);
        assertEquals(a.intercept(), b.intercept());
        assertArrayEquals(a.coefficients(), b.coefficients());
        assertEquals(a.rSquared(), b.rSquared());
    }

    @Test
    @DisplayName("a rising target gives positive weights and beats the mean")
    void learnsDirection() {
        double[] y = {0.1, 0.2, 0.3, 0.4, 0.5};
        LinearModelTrainer.Fit fit = LinearModelTrainer.train(X, y);
        for (double c : fit.coefficients()) {
            assertTrue(c > 0);
        }
        assertTrue(fit.rSquared() > 0 && fit.rSquared() <= 1.0);
    }

    @Test
    @DisplayName("constant target: R^2 reported as 0, intercept moves toward the target")
    void constantTarget() {
        double[] y = {0.5, 0.5, 0.5, 0.5, 0.5};
        LinearModelTrainer.Fit fit = LinearModelTrainer.train(X, y);
        assertEquals(0.0, fit.rSquared());
        double predicted = fit.intercept();
        for (int j = 0; j < 4; j++) {
            predicted += fit.coefficients()[j] * X[0][j];
        }
        // 100 steps of 0.01 close 1 - 0.99^100 ~ 63% of the gap
        assertEquals(0.5 * (1 - Math.pow(0.99, 100)), predicted, 1e-9);
        assertEquals(0.5 - predicted, fit.meanAbsoluteError(), 1e-9);
    }

    @Test
    @DisplayName("zero-variance feature does not blow up")
    void constantFeature() {
        double[][] x = {{1, 3}, {1, 4}, {1, 5}};
        LinearModelTrainer.Fit fit = LinearModelTrainer.train(x, new double[] {1, 2, 3});
        assertTrue(Double.isFinite(fit.intercept()));
        assertEquals(0.0, fit.coefficients()[0]);
    }

    @Test
    void tooFewSamples() {
        assertThrows(MarketEngineException.class,
            () -> LinearModelTrainer.train(new double[][] {{1, 2, 3, 4}}, new double[] {1}));
    }
}
