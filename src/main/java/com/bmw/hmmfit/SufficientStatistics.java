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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Running totals of one E-step: expected start state counts, expected transition counts and the
 * statistics of the emission family, each zero-initialized.
 *
 * <p>Emission statistics are registered by name as flat arrays in row-major order, see
 * {@link EmissionModel#initializeSufficientStatistics(SufficientStatistics)}. Adding sequences and
 * merging accumulators is associative and commutative up to floating-point summation order.
 *
 * <p>Instances are not thread-safe. Concurrent E-steps use one instance per task and
 * {@link #merge(SufficientStatistics)} the results afterwards.
 */
public class SufficientStatistics {

    private final int numStates;
    private int numSequences;
    private final double[] startCounts;
    private final double[][] transitionCounts;
    private final Map<String, double[]> emissionStatistics = new LinkedHashMap<>();

    public SufficientStatistics(int numStates) {
        if (numStates <= 0) {
            throw new IllegalArgumentException("Number of states must be positive.");
        }
        this.numStates = numStates;
        this.startCounts = new double[numStates];
        this.transitionCounts = new double[numStates][numStates];
    }

    /**
     * Registers a zero-initialized emission statistic.
     *
     * @throws IllegalStateException if a statistic with this name already exists
     */
    public void register(String name, int length) {
        if (emissionStatistics.containsKey(name)) {
            throw new IllegalStateException("Statistic " + name + " is already registered.");
        }
        emissionStatistics.put(name, new double[length]);
    }

    /**
     * Returns the live array of the given emission statistic. Callers add into it.
     *
     * @throws IllegalArgumentException if no statistic with this name is registered
     */
    public double[] emission(String name) {
        final double[] result = emissionStatistics.get(name);
        if (result == null) {
            throw new IllegalArgumentException("Unknown statistic " + name + ".");
        }
        return result;
    }

    public Set<String> emissionNames() {
        return Collections.unmodifiableSet(emissionStatistics.keySet());
    }

    /**
     * Adds the start and transition posteriors of one sequence.
     */
    public void addSequence(ForwardBackwardResult forwardBackward) {
        final double[] firstPosteriors = forwardBackward.posteriors[0];
        if (firstPosteriors.length != numStates) {
            throw new IllegalArgumentException("Expected posteriors for " + numStates
                    + " states.");
        }
        numSequences++;
        for (int i = 0; i < numStates; i++) {
            startCounts[i] += firstPosteriors[i];
            for (int j = 0; j < numStates; j++) {
                transitionCounts[i][j] += forwardBackward.xiSum[i][j];
            }
        }
    }

    /**
     * Adds all totals of other to this accumulator.
     *
     * @throws IllegalArgumentException if the accumulators have different shapes
     */
    public void merge(SufficientStatistics other) {
        if (other.numStates != numStates
                || !other.emissionStatistics.keySet().equals(emissionStatistics.keySet())) {
            throw new IllegalArgumentException("Cannot merge statistics of different shape.");
        }
        numSequences += other.numSequences;
        for (int i = 0; i < numStates; i++) {
            startCounts[i] += other.startCounts[i];
            for (int j = 0; j < numStates; j++) {
                transitionCounts[i][j] += other.transitionCounts[i][j];
            }
        }
        for (Map.Entry<String, double[]> entry : emissionStatistics.entrySet()) {
            final double[] values = entry.getValue();
            final double[] otherValues = other.emissionStatistics.get(entry.getKey());
            if (otherValues.length != values.length) {
                throw new IllegalArgumentException("Statistic " + entry.getKey()
                        + " has a different length.");
            }
            for (int k = 0; k < values.length; k++) {
                values[k] += otherValues[k];
            }
        }
    }

    public int getNumStates() {
        return numStates;
    }

    /**
     * Number of sequences added, including merged ones.
     */
    public int getNumSequences() {
        return numSequences;
    }

    /**
     * Expected number of sequences starting in each state. Live array.
     */
    double[] startCounts() {
        return startCounts;
    }

    /**
     * Expected number of transitions between each pair of states. Live array.
     */
    double[][] transitionCounts() {
        return transitionCounts;
    }

    public double[] getStartCounts() {
        return startCounts.clone();
    }

    public double[][] getTransitionCounts() {
        return Utils.copy(transitionCounts);
    }

}
