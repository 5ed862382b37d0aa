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

/**
 * Structure of Gaussian covariance matrices. Covariances are always exposed in full D x D form;
 * the type constrains how they are validated and re-estimated.
 */
public enum CovarianceType {

    /** A single variance per state, i.e. sigma^2 * I. */
    SPHERICAL,

    /** A variance per state and feature. Off-diagonal entries are zero. */
    DIAGONAL,

    /** An unconstrained symmetric positive-definite matrix per state. */
    FULL,

    /** One full matrix shared by all states (or by all mixture components of a state). */
    TIED;

    /**
     * Whether the re-estimation needs the outer products of the observations.
     */
    boolean needsOuterProducts() {
        return this == FULL || this == TIED;
    }

    /**
     * Projects a full covariance estimate onto this structure. Returns a new matrix.
     */
    double[][] constrain(double[][] covariance) {
        final int d = covariance.length;
        final double[][] result = new double[d][d];
        switch (this) {
        case SPHERICAL:
            double mean = 0.0;
            for (int i = 0; i < d; i++) {
                mean += covariance[i][i];
            }
            mean /= d;
            for (int i = 0; i < d; i++) {
                result[i][i] = mean;
            }
            return result;
        case DIAGONAL:
            for (int i = 0; i < d; i++) {
                result[i][i] = covariance[i][i];
            }
            return result;
        default:
            // Symmetrize to remove rounding asymmetry of the estimate.
            for (int i = 0; i < d; i++) {
                for (int j = 0; j < d; j++) {
                    result[i][j] = 0.5 * (covariance[i][j] + covariance[j][i]);
                }
            }
            return result;
        }
    }

    /**
     * Checks that the given matrix has this structure, ignoring positive-definiteness.
     *
     * @throws IllegalArgumentException if it does not
     */
    void checkStructure(double[][] covariance, String name) {
        final int d = covariance.length;
        for (int i = 0; i < d; i++) {
            if (covariance[i].length != d) {
                throw new IllegalArgumentException(name + " must be a square matrix.");
            }
        }
        if (this == FULL || this == TIED) {
            return;
        }
        for (int i = 0; i < d; i++) {
            for (int j = 0; j < d; j++) {
                if (i != j && covariance[i][j] != 0.0) {
                    throw new IllegalArgumentException(name
                            + " must be diagonal for covariance type " + this + ".");
                }
            }
            if (this == SPHERICAL && covariance[i][i] != covariance[0][0]) {
                throw new IllegalArgumentException(name + " must be a multiple of the identity "
                        + "for covariance type " + this + ".");
            }
        }
    }

}
