package com.marketengine.common.calibration;

import com.marketengine.common.exception.MarketEngineException;

/**
 * Least-squares fit by plain full-batch gradient descent with a fixed learning
 * rate and iteration count. Features are z-scored before descent and the
 * weights mapped back to the raw feature scale afterwards, so the step size is
 * independent of feature magnitudes.
 *
 * <p>Same training set, same coefficients: no randomness, no early stopping.
 */
public final class LinearModelTrainer {

    public static final double LEARNING_RATE = 0.01;
    public static final int ITERATIONS = 100;
    public static final int MIN_SAMPLES = 2;

    private LinearModelTrainer() {}

    /**
     * @param intercept    bias on the raw feature scale
     * @param coefficients one weight per feature, raw scale
     * @param rSquared     coefficient of determination; 0 when the target has no variance
     * @param meanAbsoluteError mean |prediction - target|
     */
    public record Fit(double intercept, double[] coefficients, double rSquared, double meanAbsoluteError) {}

    public static Fit train(double[][] x, double[] y) {
        int n = x.length;
        if (n < MIN_SAMPLES || y.length != n) {
            throw new MarketEngineException("LinearModelTrainer",
                "need at least " + MIN_SAMPLES + " aligned samples, got x=" + n + " y=" + y.length);
        }
        int features = x[0].length;

        // ── standardize ────────────────────────────────────────────────────
        double[] mean = new double[features];
        double[] std = new double[features];
        for (int j = 0; j < features; j++) {
            double sum = 0;
            for (double[] row : x) {
                sum += row[j];
            }
            mean[j] = sum / n;
            double var = 0;
            for (double[] row : x) {
                var += (row[j] - mean[j]) * (row[j] - mean[j]);
            }
            std[j] = Math.sqrt(var / n);
            if (std[j] == 0) {
                std[j] = 1.0;
            }
        }
        double[][] z = new double[n][features];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < features; j++) {
                z[i][j] = (x[i][j] - mean[j]) / std[j];
            }
        }

        // ── gradient descent ───────────────────────────────────────────────
        double bias = 0;
        double[] w = new double[features];
        for (int iter = 0; iter < ITERATIONS; iter++) {
            double gradBias = 0;
            double[] gradW = new double[features];
            for (int i = 0; i < n; i++) {
                double error = bias - y[i];
                for (int j = 0; j < features; j++) {
                    error += w[j] * z[i][j];
                }
                gradBias += error;
                for (int j = 0; j < features; j++) {
                    gradW[j] += error * z[i][j];
                }
            }
            bias -= LEARNING_RATE * gradBias / n;
            for (int j = 0; j < features; j++) {
                w[j] -= LEARNING_RATE * gradW[j] / n;
            }
        }

        // ── back to raw scale ──────────────────────────────────────────────
        double[] coefficients = new double[features];
        double intercept = bias;
        for (int j = 0; j < features; j++) {
            coefficients[j] = w[j] / std[j];
            intercept -= coefficients[j] * mean[j];
        }

        // ── diagnostics ────────────────────────────────────────────────────
        double yMean = 0;
        for (double v : y) {
            yMean += v;
        }
        yMean /= n;
        double ssRes = 0;
        double ssTot = 0;
        double absErr = 0;
        for (int i = 0; i < n; i++) {
            double prediction = intercept;
            for (int j = 0; j < features; j++) {
                prediction += coefficients[j] * x[i][j];
            }
            ssRes += (prediction - y[i]) * (prediction - y[i]);
            ssTot += (y[i] - yMean) * (y[i] - yMean);
            absErr += Math.abs(prediction - y[i]);
        }
        double rSquared = ssTot > 0 ? 1.0 - ssRes / ssTot : 0.0;

        return new Fit(intercept, coefficients, rSquared, absErr / n);
    }
}
