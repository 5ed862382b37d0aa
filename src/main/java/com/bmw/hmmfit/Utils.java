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

import org.apache.commons.math3.util.FastMath;

class Utils {

    /**
     * Tolerance for checking that probability vectors sum to one.
     */
    static final double PROBABILITY_DELTA = 1e-6;

    /**
     * Returns log(sum(exp(values))) without overflow or underflow.
     * Returns negative infinity if all values are negative infinity and NaN if any value is NaN.
     */
    static double logSumExp(double[] values) {
        double max = Double.NEGATIVE_INFINITY;
        for (double value : values) {
            if (Double.isNaN(value)) {
                return Double.NaN;
            }
            if (value > max) {
                max = value;
            }
        }
        if (max == Double.NEGATIVE_INFINITY || max == Double.POSITIVE_INFINITY) {
            return max;
        }
        double sum = 0.0;
        for (double value : values) {
            sum += FastMath.exp(value - max);
        }
        return max + FastMath.log(sum);
    }

    /**
     * Element-wise natural logarithm. Zero probabilities map to negative infinity.
     */
    static double[] log(double[] probabilities) {
        final double[] result = new double[probabilities.length];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = FastMath.log(probabilities[i]);
        }
        return result;
    }

    static double[][] log(double[][] probabilities) {
        final double[][] result = new double[probabilities.length][];
        for (int i = 0; i < probabilities.length; i++) {
            result[i] = log(probabilities[i]);
        }
        return result;
    }

    /**
     * Returns the index of the maximum. Ties go to the lowest index.
     */
    static int argMax(double[] values) {
        int result = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[result]) {
                result = i;
            }
        }
        return result;
    }

    static double sum(double[] values) {
        double result = 0.0;
        for (double value : values) {
            result += value;
        }
        return result;
    }

    /**
     * Normalizes the given vector in place. Returns false and leaves the vector unchanged if it
     * sums to zero.
     */
    static boolean normalize(double[] values) {
        final double sum = sum(values);
        if (sum == 0.0) {
            return false;
        }
        for (int i = 0; i < values.length; i++) {
            values[i] /= sum;
        }
        return true;
    }

    /**
     * Note that this check must not be used for probability densities.
     */
    static boolean probabilityInRange(double probability, double delta) {
        return probability >= -delta && probability <= 1.0 + delta;
    }

    static boolean sumsToOne(double[] probabilities) {
        return Math.abs(sum(probabilities) - 1.0) <= PROBABILITY_DELTA;
    }

    /**
     * Checks that the given vector is a probability distribution.
     *
     * @throws IllegalArgumentException otherwise
     */
    static void checkStochastic(double[] probabilities, String name) {
        for (double probability : probabilities) {
            if (Double.isNaN(probability) || probability < 0.0) {
                throw new IllegalArgumentException(name + " must be non-negative.");
            }
        }
        if (!sumsToOne(probabilities)) {
            throw new IllegalArgumentException(name + " must sum to 1 (got "
                    + sum(probabilities) + ").");
        }
    }

    static double[] copy(double[] values) {
        return values == null ? null : values.clone();
    }

    static double[][] copy(double[][] values) {
        if (values == null) {
            return null;
        }
        final double[][] result = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            result[i] = values[i].clone();
        }
        return result;
    }

    static double[][][] copy(double[][][] values) {
        if (values == null) {
            return null;
        }
        final double[][][] result = new double[values.length][][];
        for (int i = 0; i < values.length; i++) {
            result[i] = copy(values[i]);
        }
        return result;
    }

    /**
     * Draws an index from the given discrete distribution.
     */
    static int sampleIndex(double[] probabilities, double uniform) {
        double cumulative = 0.0;
        for (int i = 0; i < probabilities.length; i++) {
            cumulative += probabilities[i];
            if (uniform < cumulative) {
                return i;
            }
        }
        // Rounding errors may leave the cumulative sum slightly below 1.
        for (int i = probabilities.length - 1; i >= 0; i--) {
            if (probabilities[i] > 0.0) {
                return i;
            }
        }
        return probabilities.length - 1;
    }

}
