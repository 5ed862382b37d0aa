/**
 * Copyright (C) 2016, BMW AG
 * Author: Stefan Holder (stefan.holder@bmw.de)
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *    http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.bmw.hmmfit;

import org.apache.commons.math3.linear.CholeskyDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.NonPositiveDefiniteMatrixException;
import org.apache.commons.math3.linear.NonSymmetricMatrixException;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.FastMath;

/**
 * Multivariate normal density based on the Cholesky factor of its covariance, plus the closed-form
 * estimators shared by the Gaussian emission families.
 */
final class GaussianDensity {

    private static final double LOG_2_PI = FastMath.log(2.0 * FastMath.PI);

    private static final double SYMMETRY_THRESHOLD = 1e-8;

    /**
     * Components with less posterior mass keep their previous parameters in the M-step.
     */
    static final double MIN_MASS = 1e-10;

    private final double[] mean;
    private final double[][] lower;
    private final double logNormalizer;

    /**
     * @param minCovar jitter added on the diagonal if the covariance is not positive-definite
     *
     * @throws IllegalArgumentException if the covariance is not symmetric positive-definite even
     * after adding minCovar on the diagonal
     */
    GaussianDensity(double[] mean, double[][] covariance, double minCovar) {
        this.mean = mean;
        this.lower = choleskyFactor(covariance, minCovar);
        double logDeterminant = 0.0;
        for (int i = 0; i < lower.length; i++) {
            logDeterminant += 2.0 * FastMath.log(lower[i][i]);
        }
        this.logNormalizer = -0.5 * (mean.length * LOG_2_PI + logDeterminant);
    }

    double logDensity(double[] x) {
        // Solves lower * z = x - mean by forward substitution.
        final int d = mean.length;
        final double[] z = new double[d];
        double squaredNorm = 0.0;
        for (int i = 0; i < d; i++) {
            double value = x[i] - mean[i];
            for (int j = 0; j < i; j++) {
                value -= lower[i][j] * z[j];
            }
            z[i] = value / lower[i][i];
            squaredNorm += z[i] * z[i];
        }
        return logNormalizer - 0.5 * squaredNorm;
    }

    double[] sample(RandomGenerator random) {
        final int d = mean.length;
        final double[] z = new double[d];
        for (int i = 0; i < d; i++) {
            z[i] = random.nextGaussian();
        }
        final double[] result = mean.clone();
        for (int i = 0; i < d; i++) {
            for (int j = 0; j <= i; j++) {
                result[i] += lower[i][j] * z[j];
            }
        }
        return result;
    }

    /**
     * Returns the lower Cholesky factor of covariance. Retries once with minCovar added on the
     * diagonal.
     *
     * @throws IllegalArgumentException if the covariance is not symmetric positive-definite
     */
    static double[][] choleskyFactor(double[][] covariance, double minCovar) {
        for (double[] row : covariance) {
            for (double value : row) {
                if (Double.isNaN(value) || Double.isInfinite(value)) {
                    throw new IllegalArgumentException("Covariance must be finite.");
                }
            }
        }
        try {
            return decompose(covariance);
        } catch (NonPositiveDefiniteMatrixException e) {
            final double[][] floored = Utils.copy(covariance);
            for (int i = 0; i < floored.length; i++) {
                floored[i][i] += minCovar;
            }
            try {
                return decompose(floored);
            } catch (NonPositiveDefiniteMatrixException | NonSymmetricMatrixException e2) {
                throw new IllegalArgumentException(
                        "Covariance must be symmetric, positive-definite.", e2);
            }
        } catch (NonSymmetricMatrixException e) {
            throw new IllegalArgumentException("Covariance must be symmetric, positive-definite.",
                    e);
        }
    }

    private static double[][] decompose(double[][] covariance) {
        return new CholeskyDecomposition(MatrixUtils.createRealMatrix(covariance),
                SYMMETRY_THRESHOLD, CholeskyDecomposition.DEFAULT_ABSOLUTE_POSITIVITY_THRESHOLD)
                .getL().getData();
    }

    /**
     * Sample covariance with n - 1 normalization. All zero for a single observation.
     */
    static double[][] sampleCovariance(double[][] observations) {
        final int n = observations.length;
        final int d = observations[0].length;
        final double[] mean = new double[d];
        for (double[] x : observations) {
            for (int a = 0; a < d; a++) {
                mean[a] += x[a] / n;
            }
        }
        final double[][] result = new double[d][d];
        if (n < 2) {
            return result;
        }
        for (double[] x : observations) {
            for (int a = 0; a < d; a++) {
                for (int b = 0; b < d; b++) {
                    result[a][b] += (x[a] - mean[a]) * (x[b] - mean[b]);
                }
            }
        }
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                result[a][b] /= n - 1;
            }
        }
        return result;
    }

    /**
     * Global covariance of the data with minCovar added on the diagonal, projected onto the given
     * covariance type.
     */
    static double[][] initialCovariance(double[][] observations, CovarianceType type,
            double minCovar) {
        final double[][] covariance = sampleCovariance(observations);
        for (int a = 0; a < covariance.length; a++) {
            covariance[a][a] += minCovar;
        }
        return type.constrain(covariance);
    }

    /**
     * Posterior mean of a Gaussian under a normal prior with mean meansPrior and weight
     * meansWeight. Returns previous if the component has no mass.
     */
    static double[] estimateMean(double[] weightedSum, double mass, double meansPrior,
            double meansWeight, double[] previous) {
        final double denominator = meansWeight + mass;
        if (mass < MIN_MASS || denominator <= 0.0) {
            return previous.clone();
        }
        final double[] result = new double[weightedSum.length];
        for (int a = 0; a < result.length; a++) {
            result[a] = (meansWeight * meansPrior + weightedSum[a]) / denominator;
        }
        return result;
    }

    /**
     * Re-estimates the covariances of a group of K Gaussians from their weighted statistics.
     * For {@link CovarianceType#TIED} the group shares one pooled matrix. Components without mass
     * keep their previous covariance.
     *
     * @param weightedSums K x D sums of posterior-weighted observations
     * @param weightedSquares K x D sums of posterior-weighted squared observations
     * @param weightedOuters K x D x D sums of posterior-weighted outer products, only required
     * for FULL and TIED
     * @param masses K posterior masses
     * @param means K x D already re-estimated means
     * @param previous K x D x D current covariances
     */
    static double[][][] estimateCovariances(CovarianceType type, double[][] weightedSums,
            double[][] weightedSquares, double[][][] weightedOuters, double[] masses,
            double[][] means, double[][][] previous, double meansPrior, double meansWeight,
            double covarsPrior, double covarsWeight) {
        final int k = masses.length;
        final int d = means[0].length;
        final double[][][] result = new double[k][][];

        if (type == CovarianceType.TIED) {
            final double[][] pooled = new double[d][d];
            double totalMass = 0.0;
            for (int c = 0; c < k; c++) {
                addNumerator(pooled, type, weightedSums[c], null, weightedOuters[c], masses[c],
                        means[c], meansPrior, meansWeight);
                totalMass += masses[c];
            }
            if (totalMass < MIN_MASS) {
                return Utils.copy(previous);
            }
            final double denominator = Math.max(covarsWeight - d, 0.0) + totalMass;
            final double[][] shared = divide(pooled, covarsPrior, denominator);
            for (int c = 0; c < k; c++) {
                result[c] = type.constrain(shared);
            }
            return result;
        }

        for (int c = 0; c < k; c++) {
            if (masses[c] < MIN_MASS) {
                result[c] = Utils.copy(previous[c]);
                continue;
            }
            final double[][] numerator = new double[d][d];
            addNumerator(numerator, type, weightedSums[c],
                    weightedSquares == null ? null : weightedSquares[c],
                    weightedOuters == null ? null : weightedOuters[c], masses[c], means[c],
                    meansPrior, meansWeight);
            final double denominator;
            if (type == CovarianceType.FULL) {
                denominator = Math.max(covarsWeight - d, 0.0) + masses[c];
            } else {
                denominator = Math.max(Math.max(covarsWeight - 1.0, 0.0) + masses[c], 1e-5);
            }
            result[c] = type.constrain(divide(numerator, covarsPrior, denominator));
        }
        return result;
    }

    /**
     * Adds the scatter of one component around its mean to numerator. Uses only the diagonal for
     * SPHERICAL and DIAGONAL.
     */
    private static void addNumerator(double[][] numerator, CovarianceType type,
            double[] weightedSum, double[] weightedSquare, double[][] weightedOuter, double mass,
            double[] mean, double meansPrior, double meansWeight) {
        final int d = mean.length;
        if (!type.needsOuterProducts()) {
            for (int a = 0; a < d; a++) {
                final double meanDiff = mean[a] - meansPrior;
                numerator[a][a] += meansWeight * meanDiff * meanDiff + weightedSquare[a]
                        - 2.0 * mean[a] * weightedSum[a] + mean[a] * mean[a] * mass;
            }
            return;
        }
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                numerator[a][b] += meansWeight * (mean[a] - meansPrior) * (mean[b] - meansPrior)
                        + weightedOuter[a][b] - weightedSum[a] * mean[b]
                        - mean[a] * weightedSum[b] + mean[a] * mean[b] * mass;
            }
        }
    }

    private static double[][] divide(double[][] numerator, double covarsPrior,
            double denominator) {
        final int d = numerator.length;
        final double[][] result = new double[d][d];
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++) {
                final double prior = a == b ? covarsPrior : 0.0;
                result[a][b] = (prior + numerator[a][b]) / denominator;
            }
        }
        return result;
    }

}
