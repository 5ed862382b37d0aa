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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Tracks the total log-likelihood of each EM iteration and decides when to stop.
 *
 * <p>Instances are immutable. {@link #report(double)} returns the monitor of the next iteration,
 * so the training loop hands the current value back into the next iteration.
 *
 * <p>EM must not decrease the log-likelihood. Decreases beyond a small relative tolerance are
 * logged and recorded as anomalies but do not stop training.
 */
public final class ConvergenceMonitor {

    private static final Logger logger = LoggerFactory.getLogger(ConvergenceMonitor.class);

    /**
     * Relative tolerance for log-likelihood decreases that are attributed to rounding.
     */
    static final double DECREASE_TOLERANCE = 1e-6;

    private final double tol;
    private final int nIter;
    private final List<Double> history;
    private final List<Integer> decreasingIterations;

    /**
     * @param tol convergence threshold for the absolute change of the log-likelihood between two
     * iterations
     * @param nIter maximum number of iterations
     */
    public ConvergenceMonitor(double tol, int nIter) {
        this(tol, nIter, Collections.<Double>emptyList(), Collections.<Integer>emptyList());
    }

    private ConvergenceMonitor(double tol, int nIter, List<Double> history,
            List<Integer> decreasingIterations) {
        if (tol < 0.0 || Double.isNaN(tol)) {
            throw new IllegalArgumentException("tol must be non-negative.");
        }
        if (nIter <= 0) {
            throw new IllegalArgumentException("nIter must be positive.");
        }
        this.tol = tol;
        this.nIter = nIter;
        this.history = history;
        this.decreasingIterations = decreasingIterations;
    }

    /**
     * Returns a monitor whose history is extended by the given log-likelihood.
     */
    public ConvergenceMonitor report(double logLikelihood) {
        final List<Double> newHistory = new ArrayList<>(history);
        newHistory.add(logLikelihood);
        List<Integer> newDecreasing = decreasingIterations;

        if (!history.isEmpty()) {
            final double previous = history.get(history.size() - 1);
            final double delta = logLikelihood - previous;
            if (delta < -DECREASE_TOLERANCE * Math.max(1.0, Math.abs(previous))) {
                logger.warn("Model is not converging. Log-likelihood {} of iteration {} is lower "
                        + "than {}, delta is {}.", logLikelihood, newHistory.size(), previous,
                        delta);
                newDecreasing = new ArrayList<>(decreasingIterations);
                newDecreasing.add(newHistory.size());
                newDecreasing = Collections.unmodifiableList(newDecreasing);
            }
        }
        return new ConvergenceMonitor(tol, nIter, Collections.unmodifiableList(newHistory),
                newDecreasing);
    }

    /**
     * Whether the log-likelihood changed less than tol in the last iteration or the iteration cap
     * was reached.
     */
    public boolean isConverged() {
        return isTolReached() || isIterationLimitReached();
    }

    public boolean isTolReached() {
        final int size = history.size();
        return size > 1 && Math.abs(history.get(size - 1) - history.get(size - 2)) < tol;
    }

    public boolean isIterationLimitReached() {
        return history.size() >= nIter;
    }

    /**
     * Number of reported iterations.
     */
    public int getIteration() {
        return history.size();
    }

    /**
     * Total log-likelihood of each iteration, oldest first.
     */
    public List<Double> getHistory() {
        return history;
    }

    /**
     * One-based iteration numbers whose log-likelihood decreased beyond the rounding tolerance.
     */
    public List<Integer> getDecreasingIterations() {
        return decreasingIterations;
    }

    public double getTol() {
        return tol;
    }

    public int getNIter() {
        return nIter;
    }

    @Override
    public String toString() {
        return "ConvergenceMonitor [tol=" + tol + ", nIter=" + nIter + ", iteration="
                + getIteration() + ", converged=" + isConverged() + ", history=" + history + "]";
    }

}
