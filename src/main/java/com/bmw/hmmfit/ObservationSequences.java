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

import java.util.Arrays;

/**
 * A set of independent observation sequences stored as one concatenated T_total x D array plus the
 * length of each sequence. No state or likelihood information crosses sequence boundaries.
 */
public final class ObservationSequences {

    private final double[][] observations;
    private final int[] lengths;
    private final int[] starts;

    /**
     * @param observations concatenated observations, one row per time step
     * @param lengths lengths of the individual sequences, must sum to the number of rows. Pass
     * null to treat all observations as a single sequence.
     *
     * @throws IllegalArgumentException if the dimensions are inconsistent
     */
    public ObservationSequences(double[][] observations, int[] lengths) {
        if (observations == null) {
            throw new NullPointerException("observations must not be null.");
        }
        if (observations.length == 0) {
            throw new IllegalArgumentException("observations must not be empty.");
        }
        final int dimension = observations[0].length;
        if (dimension == 0) {
            throw new IllegalArgumentException("observations must have at least one feature.");
        }
        for (double[] row : observations) {
            if (row.length != dimension) {
                throw new IllegalArgumentException(
                        "All observations must have " + dimension + " features.");
            }
        }
        if (lengths == null) {
            lengths = new int[] {observations.length};
        }

        starts = new int[lengths.length];
        int total = 0;
        for (int k = 0; k < lengths.length; k++) {
            if (lengths[k] <= 0) {
                throw new IllegalArgumentException("Sequence lengths must be positive.");
            }
            starts[k] = total;
            total += lengths[k];
        }
        if (total != observations.length) {
            throw new IllegalArgumentException("Sequence lengths sum to " + total
                    + " but there are " + observations.length + " observations.");
        }
        this.observations = observations;
        this.lengths = lengths.clone();
    }

    /**
     * Number of sequences.
     */
    public int size() {
        return lengths.length;
    }

    public int length(int k) {
        return lengths[k];
    }

    /**
     * Row of the first observation of sequence k in the concatenated array.
     */
    public int start(int k) {
        return starts[k];
    }

    public int totalLength() {
        return observations.length;
    }

    public int dimension() {
        return observations[0].length;
    }

    /**
     * Returns the rows of sequence k. The rows are shared with the concatenated array.
     */
    public double[][] sequence(int k) {
        return Arrays.copyOfRange(observations, starts[k], starts[k] + lengths[k]);
    }

    /**
     * Returns the concatenated observations. The array is not copied.
     */
    public double[][] observations() {
        return observations;
    }

}
