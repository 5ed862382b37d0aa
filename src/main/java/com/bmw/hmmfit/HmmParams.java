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
import java.util.EnumSet;
import java.util.Set;

public class HmmParams {

    private int nIter = 10;
    private double tol = 1e-2;
    private Set<HmmParameter> initParams = EnumSet.allOf(HmmParameter.class);
    private Set<HmmParameter> params = EnumSet.allOf(HmmParameter.class);
    private long randomSeed = 0L;
    private DecoderAlgorithm algorithm = DecoderAlgorithm.VITERBI;
    private double startProbPrior = 1.0;
    private double transMatPrior = 1.0;
    private int threads = 1;

    /**
     * Maximum number of EM iterations. Default is 10.
     */
    public HmmParams setNIter(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("nIter must be positive.");
        }
        this.nIter = value;
        return this;
    }

    /**
     * Training stops once the total log-likelihood changes by less than this value between two
     * iterations. Default is 0.01.
     */
    public HmmParams setTol(double value) {
        if (value < 0.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException("tol must be non-negative.");
        }
        this.tol = value;
        return this;
    }

    /**
     * Parameters that are initialized from the data before training unless already set.
     * Default is all parameters.
     */
    public HmmParams setInitParams(Set<HmmParameter> value) {
        this.initParams = copy(value);
        return this;
    }

    /**
     * Parameters that are re-estimated in each M-step. Default is all parameters.
     */
    public HmmParams setParams(Set<HmmParameter> value) {
        this.params = copy(value);
        return this;
    }

    /**
     * Seed of the generator used for data-driven initialization. Default is 0.
     */
    public HmmParams setRandomSeed(long value) {
        this.randomSeed = value;
        return this;
    }

    /**
     * Decoder used by {@link Hmm#decode(double[][], int[])} and
     * {@link Hmm#predict(double[][], int[])}. Default is {@link DecoderAlgorithm#VITERBI}.
     */
    public HmmParams setAlgorithm(DecoderAlgorithm value) {
        if (value == null) {
            throw new NullPointerException("algorithm must not be null.");
        }
        this.algorithm = value;
        return this;
    }

    /**
     * Dirichlet concentration of the start probabilities. Default is 1, i.e. no prior.
     */
    public HmmParams setStartProbPrior(double value) {
        if (value <= 0.0) {
            throw new IllegalArgumentException("startProbPrior must be positive.");
        }
        this.startProbPrior = value;
        return this;
    }

    /**
     * Dirichlet concentration of each transition matrix row. Default is 1, i.e. no prior.
     */
    public HmmParams setTransMatPrior(double value) {
        if (value <= 0.0) {
            throw new IllegalArgumentException("transMatPrior must be positive.");
        }
        this.transMatPrior = value;
        return this;
    }

    /**
     * Number of worker threads for the E-step. Sequences are processed concurrently, their
     * statistics are merged in sequence order. Default is 1.
     */
    public HmmParams setThreads(int value) {
        if (value <= 0) {
            throw new IllegalArgumentException("threads must be positive.");
        }
        this.threads = value;
        return this;
    }

    public int getNIter() {
        return nIter;
    }

    public double getTol() {
        return tol;
    }

    public Set<HmmParameter> getInitParams() {
        return Collections.unmodifiableSet(initParams);
    }

    public Set<HmmParameter> getParams() {
        return Collections.unmodifiableSet(params);
    }

    public long getRandomSeed() {
        return randomSeed;
    }

    public DecoderAlgorithm getAlgorithm() {
        return algorithm;
    }

    public double getStartProbPrior() {
        return startProbPrior;
    }

    public double getTransMatPrior() {
        return transMatPrior;
    }

    public int getThreads() {
        return threads;
    }

    private static Set<HmmParameter> copy(Set<HmmParameter> value) {
        if (value == null) {
            throw new NullPointerException("Parameter set must not be null.");
        }
        return value.isEmpty() ? EnumSet.noneOf(HmmParameter.class) : EnumSet.copyOf(value);
    }

}
