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

import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

/**
 * Time-homogeneous HMM with a fixed number N of hidden states, start probabilities, a transition
 * matrix and a pluggable {@link EmissionModel}.
 *
 * <p>Observations are passed as one T_total x D array of concatenated sequences plus the lengths
 * of the individual sequences. Passing null as lengths treats all rows as a single sequence.
 * Each sequence is an independent sample path.
 *
 * <p>Parameters that are not set by the caller are initialized from the data by
 * {@link #fit(double[][], int[])}, see {@link HmmParams#setInitParams(java.util.Set)}.
 * Instances are not thread-safe.
 */
public class Hmm {

    private static final int MAX_POWER_ITERATIONS = 100000;
    private static final double STATIONARY_DELTA = 1e-12;

    private final EmissionModel emissionModel;
    private HmmParams params;
    private double[] startProb;
    private double[][] transMat;

    public Hmm(EmissionModel emissionModel) {
        this(emissionModel, new HmmParams());
    }

    public Hmm(EmissionModel emissionModel, HmmParams params) {
        if (emissionModel == null) {
            throw new NullPointerException("emissionModel must not be null.");
        }
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }
        this.emissionModel = emissionModel;
        this.params = params;
    }

    public int getNumStates() {
        return emissionModel.getNumStates();
    }

    public EmissionModel getEmissionModel() {
        return emissionModel;
    }

    public HmmParams getParams() {
        return params;
    }

    public Hmm setParams(HmmParams params) {
        if (params == null) {
            throw new NullPointerException("params must not be null.");
        }
        this.params = params;
        return this;
    }

    /**
     * Returns a copy of the start probabilities or null if not set.
     */
    public double[] getStartProb() {
        return Utils.copy(startProb);
    }

    /**
     * Sets the start probabilities. They are validated by {@link #check()} before use.
     */
    public Hmm setStartProb(double[] startProb) {
        this.startProb = Utils.copy(startProb);
        return this;
    }

    /**
     * Returns a copy of the transition matrix or null if not set.
     */
    public double[][] getTransMat() {
        return Utils.copy(transMat);
    }

    /**
     * Sets the transition matrix, where transMat[i][j] is the probability of a transition from
     * state i to state j. It is validated by {@link #check()} before use.
     */
    public Hmm setTransMat(double[][] transMat) {
        this.transMat = Utils.copy(transMat);
        return this;
    }

    /**
     * Estimates the parameters with the Baum-Welch algorithm.
     *
     * @param observations concatenated observations of all sequences
     * @param lengths lengths of the sequences or null for a single sequence
     * @throws DegenerateSequenceException if a sequence has zero probability. The parameters of
     * the last completed iteration are kept.
     */
    public FitResult fit(double[][] observations, int[] lengths) {
        return new EmTrainer(this, params).fit(new ObservationSequences(observations, lengths));
    }

    /**
     * Returns the total log-likelihood of the observations.
     */
    public double score(double[][] observations, int[] lengths) {
        final ObservationSequences sequences = checkedSequences(observations, lengths);
        final double[] logStartProb = Utils.log(startProb);
        final double[][] logTransMat = Utils.log(transMat);
        double result = 0.0;
        for (int k = 0; k < sequences.size(); k++) {
            final double[][] logLikelihoods = emissionModel.logLikelihoods(
                    sequences.sequence(k));
            try {
                result += ForwardBackwardAlgorithm.logLikelihood(logStartProb, logTransMat,
                        logLikelihoods);
            } catch (DegenerateSequenceException e) {
                throw new DegenerateSequenceException(k, e);
            }
        }
        return result;
    }

    /**
     * Returns the total log-likelihood and the state posteriors of each observation.
     */
    public Posteriors scoreSamples(double[][] observations, int[] lengths) {
        final ObservationSequences sequences = checkedSequences(observations, lengths);
        final double[] logStartProb = Utils.log(startProb);
        final double[][] logTransMat = Utils.log(transMat);
        final double[][] posteriors = new double[sequences.totalLength()][];
        double logLikelihood = 0.0;
        for (int k = 0; k < sequences.size(); k++) {
            final double[][] logLikelihoods = emissionModel.logLikelihoods(
                    sequences.sequence(k));
            final ForwardBackwardResult forwardBackward;
            try {
                forwardBackward = ForwardBackwardAlgorithm.compute(logStartProb, logTransMat,
                        logLikelihoods);
            } catch (DegenerateSequenceException e) {
                throw new DegenerateSequenceException(k, e);
            }
            logLikelihood += forwardBackward.logLikelihood;
            System.arraycopy(forwardBackward.posteriors, 0, posteriors, sequences.start(k),
                    sequences.length(k));
        }
        return new Posteriors(logLikelihood, posteriors);
    }

    /**
     * Decodes the hidden states with the algorithm configured in {@link HmmParams}.
     */
    public DecodeResult decode(double[][] observations, int[] lengths) {
        return decode(observations, lengths, params.getAlgorithm());
    }

    /**
     * Decodes the hidden states of each sequence with the given algorithm.
     */
    public DecodeResult decode(double[][] observations, int[] lengths,
            DecoderAlgorithm algorithm) {
        if (algorithm == null) {
            throw new NullPointerException("algorithm must not be null.");
        }
        final ObservationSequences sequences = checkedSequences(observations, lengths);
        final double[] logStartProb = Utils.log(startProb);
        final double[][] logTransMat = Utils.log(transMat);
        final int[][] sequenceStates = new int[sequences.size()][];
        final double[] scores = new double[sequences.size()];
        for (int k = 0; k < sequences.size(); k++) {
            final double[][] logLikelihoods = emissionModel.logLikelihoods(
                    sequences.sequence(k));
            final MostLikelySequence decoded;
            try {
                decoded = algorithm.decode(logStartProb, logTransMat, logLikelihoods);
            } catch (DegenerateSequenceException e) {
                throw new DegenerateSequenceException(k, e);
            }
            sequenceStates[k] = decoded.states;
            scores[k] = decoded.score;
        }
        return new DecodeResult(algorithm, sequenceStates, scores);
    }

    /**
     * Returns the decoded states of all observations in input order.
     */
    public int[] predict(double[][] observations, int[] lengths) {
        return decode(observations, lengths).states;
    }

    /**
     * Returns the T_total x N state posteriors.
     */
    public double[][] predictProba(double[][] observations, int[] lengths) {
        return scoreSamples(observations, lengths).posteriors;
    }

    /**
     * Draws a single sequence of the given length.
     *
     * @throws IllegalStateException if a parameter is not set
     */
    public Sample sample(int numSamples, long randomSeed) {
        return sample(numSamples, new Well19937c(randomSeed));
    }

    /**
     * @see #sample(int, long)
     */
    public Sample sample(int numSamples, RandomGenerator random) {
        if (numSamples <= 0) {
            throw new IllegalArgumentException("Number of samples must be positive.");
        }
        if (random == null) {
            throw new NullPointerException("random must not be null.");
        }
        check();
        final int[] states = new int[numSamples];
        final double[][] observations = new double[numSamples][];
        int state = Utils.sampleIndex(startProb, random.nextDouble());
        for (int t = 0; t < numSamples; t++) {
            if (t > 0) {
                state = Utils.sampleIndex(transMat[state], random.nextDouble());
            }
            states[t] = state;
            observations[t] = emissionModel.generateSample(state, random);
        }
        return new Sample(observations, states);
    }

    /**
     * Returns the stationary distribution pi of the Markov chain, i.e. pi * transMat = pi.
     * Computed by power iteration on the lazy chain (I + transMat) / 2, which has the same
     * stationary distributions and converges for periodic chains as well. For reducible chains
     * the result depends on the uniform starting point.
     *
     * @throws IllegalStateException if the transition matrix is not set
     */
    public double[] stationaryDistribution() {
        if (transMat == null) {
            throw new IllegalStateException("Transition matrix must be set.");
        }
        checkTransMat();
        final int n = transMat.length;
        double[] pi = ParameterInitializer.uniformStartProb(n);
        for (int iteration = 0; iteration < MAX_POWER_ITERATIONS; iteration++) {
            final double[] next = new double[n];
            for (int i = 0; i < n; i++) {
                next[i] += 0.5 * pi[i];
                for (int j = 0; j < n; j++) {
                    next[j] += 0.5 * pi[i] * transMat[i][j];
                }
            }
            Utils.normalize(next);
            double change = 0.0;
            for (int i = 0; i < n; i++) {
                change = Math.max(change, Math.abs(next[i] - pi[i]));
            }
            pi = next;
            if (change < STATIONARY_DELTA) {
                break;
            }
        }
        return pi;
    }

    /**
     * Validates all parameters.
     *
     * @throws IllegalStateException if a parameter is not set
     * @throws IllegalArgumentException if a parameter is invalid
     */
    public void check() {
        if (startProb == null) {
            throw new IllegalStateException("Start probabilities must be set.");
        }
        if (transMat == null) {
            throw new IllegalStateException("Transition matrix must be set.");
        }
        if (!emissionModel.isInitialized()) {
            throw new IllegalStateException("Emission parameters must be set.");
        }
        checkStartProb();
        checkTransMat();
        emissionModel.check();
    }

    /**
     * Validates the parameters set by the caller and the dimension of the observations before
     * any missing parameter is initialized.
     *
     * @throws IllegalStateException if a parameter is missing and not listed in initParams
     * @throws IllegalArgumentException if a parameter is invalid
     */
    void checkBeforeInitialization(ObservationSequences sequences,
            Set<HmmParameter> initParams) {
        if (startProb != null) {
            checkStartProb();
        } else if (!initParams.contains(HmmParameter.START)) {
            throw new IllegalStateException("Start probabilities must be set.");
        }
        if (transMat != null) {
            checkTransMat();
        } else if (!initParams.contains(HmmParameter.TRANSITION)) {
            throw new IllegalStateException("Transition matrix must be set.");
        }
        if (emissionModel.isInitialized()) {
            emissionModel.check();
        }
        checkObservations(sequences);
    }

    private void checkStartProb() {
        final int numStates = getNumStates();
        if (startProb.length != numStates) {
            throw new IllegalArgumentException("Start probabilities must have " + numStates
                    + " entries.");
        }
        Utils.checkStochastic(startProb, "Start probabilities");
    }

    private void checkTransMat() {
        final int numStates = getNumStates();
        if (transMat.length != numStates) {
            throw new IllegalArgumentException("Transition matrix must be " + numStates + " x "
                    + numStates + ".");
        }
        for (int i = 0; i < numStates; i++) {
            if (transMat[i].length != numStates) {
                throw new IllegalArgumentException("Transition matrix must be " + numStates
                        + " x " + numStates + ".");
            }
            Utils.checkStochastic(transMat[i], "Row " + i + " of the transition matrix");
        }
    }

    /**
     * Checks that the observations have as many features as the emission model expects.
     */
    void checkObservations(ObservationSequences sequences) {
        final int numFeatures = emissionModel.getNumFeatures();
        if (numFeatures != -1 && numFeatures != sequences.dimension()) {
            throw new IllegalArgumentException("Expected observations with " + numFeatures
                    + " features but got " + sequences.dimension() + ".");
        }
    }

    private ObservationSequences checkedSequences(double[][] observations, int[] lengths) {
        check();
        final ObservationSequences result = new ObservationSequences(observations, lengths);
        checkObservations(result);
        return result;
    }

    /**
     * Empty statistics with the shape required by the current parameters.
     */
    SufficientStatistics newSufficientStatistics() {
        final SufficientStatistics result = new SufficientStatistics(getNumStates());
        emissionModel.initializeSufficientStatistics(result);
        return result;
    }

    /**
     * Live start probabilities.
     */
    double[] startProb() {
        return startProb;
    }

    /**
     * Live transition matrix.
     */
    double[][] transMat() {
        return transMat;
    }

}
