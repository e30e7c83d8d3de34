package com.enms.analytics.baseline;

import com.google.common.base.Preconditions;
import org.apache.commons.math3.stat.regression.OLSMultipleLinearRegression;

import java.util.Arrays;

/**
 * Ordinary least squares with intercept. Fit metrics are computed with {@link #predict},
 * so a stored model reproduces its own R² on the training data.
 */
public final class BaselineRegression {

    private static final double EPSILON = 1e-9;

    private BaselineRegression() {
    }

    /**
     * @param x one row per sample, one column per feature
     * @param y observed target per sample
     * @throws org.apache.commons.math3.linear.SingularMatrixException if features are collinear
     */
    public static FittedModel fit(double[][] x, double[] y) {
        Preconditions.checkArgument(x.length == y.length, "Row count mismatch: %s vs %s", x.length, y.length);
        Preconditions.checkArgument(x.length > 0 && x[0].length > 0, "Empty training data");

        OLSMultipleLinearRegression ols = new OLSMultipleLinearRegression();
        ols.newSampleData(y, x);
        double[] beta = ols.estimateRegressionParameters();

        double intercept = beta[0];
        double[] coefficients = Arrays.copyOfRange(beta, 1, beta.length);

        double ssRes = 0.0;
        double absSum = 0.0;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - predict(intercept, coefficients, x[i]);
            ssRes += residual * residual;
            absSum += Math.abs(residual);
        }

        return new FittedModel(intercept, coefficients, rSquared(intercept, coefficients, x, y),
                Math.sqrt(ssRes / y.length), absSum / y.length, y.length);
    }

    public static double predict(double intercept, double[] coefficients, double[] values) {
        Preconditions.checkArgument(coefficients.length == values.length,
                "Expected %s feature values, got %s", coefficients.length, values.length);
        double result = intercept;
        for (int i = 0; i < coefficients.length; i++) {
            result += coefficients[i] * values[i];
        }
        return result;
    }

    public static double rSquared(double intercept, double[] coefficients, double[][] x, double[] y) {
        double mean = Arrays.stream(y).average().orElse(0.0);
        double ssRes = 0.0;
        double ssTot = 0.0;
        for (int i = 0; i < y.length; i++) {
            double residual = y[i] - predict(intercept, coefficients, x[i]);
            ssRes += residual * residual;
            ssTot += (y[i] - mean) * (y[i] - mean);
        }
        if (ssTot < EPSILON) {
            // Constant target: perfect if reproduced, otherwise explains nothing
            return ssRes < EPSILON ? 1.0 : 0.0;
        }
        return 1.0 - ssRes / ssTot;
    }

    /**
     * Fitted coefficients and in-sample quality.
     */
    public record FittedModel(double intercept, double[] coefficients, double rSquared,
                              double rmse, double mae, int sampleCount) {

        /**
         * R² penalized for the number of features, used to compare candidate subsets.
         */
        public double adjustedRSquared() {
            int p = coefficients.length;
            if (sampleCount - p - 1 <= 0) {
                return rSquared;
            }
            return 1.0 - (1.0 - rSquared) * (sampleCount - 1) / (sampleCount - p - 1);
        }
    }
}
