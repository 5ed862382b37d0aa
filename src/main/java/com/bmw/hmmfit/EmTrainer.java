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
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Baum-Welch training, i.e. expectation maximization of the parameters of an {@link Hmm}.
 *
 * <p>Each iteration runs the {@link ForwardBackwardAlgorithm} on every sequence, accumulates the
 * {@link SufficientStatistics} and re-estimates the parameters selected by
 * {@link HmmParams#setParams(Set)}. The {@link ConvergenceMonitor} decides when to stop.
 *
 * <p>A {@link DegenerateSequenceException} in the E-step aborts the fit. The parameters of the last
 * completed iteration are kept. The loop checks the interrupt flag of the calling thread between
 * iterations and throws a {@link CancellationException} if it is set.
 */
public class EmTrainer {

    private static final Logger logger = LoggerFactory.getLogger(EmTrainer.class);

    /**
     * Statistics and log-likelihood of an E-step over some sequences.
     */
    private static class EStepResult {
        final SufficientStatistics statistics;
        final double logLikelihood;

        EStepResult(SufficientStatistics statistics, double logLikelihood) {
            this.statistics = statistics;
            this.logLikelihood = logLikelihood;
        }
    }

    private final Hmm hmm;
    private final HmmParams params;
    private volatile TrainingState state = TrainingState.INITIALIZING;

    public EmTrainer(Hmm hmm, HmmParams params) {
        if (hmm == null || params == null) {
            throw new NullPointerException("hmm and params must not be null.");
        }
        this.hmm = hmm;
        this.params = params;
    }

    public TrainingState getState() {
        return state;
    }

    /**
     * Initializes missing parameters and iterates until convergence or the iteration cap.
     *
     * @throws IllegalArgumentException if the parameters are invalid or inconsistent with the data
     * @throws IllegalStateException if a parameter is missing and not selected for initialization
     * @throws DegenerateSequenceException if a sequence has zero probability
     * @throws CancellationException if the calling thread was interrupted
     */
    public FitResult fit(ObservationSequences sequences) {
        state = TrainingState.INITIALIZING;
        hmm.checkBeforeInitialization(sequences, params.getInitParams());
        final RandomGenerator random = new Well19937c(params.getRandomSeed());
        ParameterInitializer.initialize(hmm, sequences, params.getInitParams(), random);
        hmm.check();
        hmm.checkObservations(sequences);
        logger.debug("Training {} states on {} sequences with {} observations, estimating {}.",
                hmm.getNumStates(), sequences.size(), sequences.totalLength(),
                params.getParams());

        ConvergenceMonitor monitor = new ConvergenceMonitor(params.getTol(), params.getNIter());
        state = TrainingState.ITERATING;
        final int threads = Math.min(params.getThreads(), sequences.size());
        final ExecutorService executor = threads > 1 ? Executors.newFixedThreadPool(threads)
                : null;
        try {
            while (!monitor.isConverged()) {
                if (Thread.currentThread().isInterrupted()) {
                    throw new CancellationException("Training interrupted after "
                            + monitor.getIteration() + " iterations.");
                }
                final EStepResult eStep = executor == null ? doEStep(sequences)
                        : doEStep(sequences, executor);
                doMStep(eStep.statistics);
                monitor = monitor.report(eStep.logLikelihood);
                logger.debug("Iteration {}: log-likelihood {}", monitor.getIteration(),
                        eStep.logLikelihood);
            }
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }

        state = monitor.isTolReached() ? TrainingState.CONVERGED
                : TrainingState.ITERATION_LIMIT_REACHED;
        logger.info("Training finished with state {} after {} iterations, log-likelihood {}.",
                state, monitor.getIteration(),
                monitor.getHistory().get(monitor.getIteration() - 1));
        return new FitResult(state, monitor, hmm.getStartProb(), hmm.getTransMat());
    }

    private EStepResult doEStep(ObservationSequences sequences) {
        final double[] logStartProb = Utils.log(hmm.startProb());
        final double[][] logTransMat = Utils.log(hmm.transMat());
        final SufficientStatistics statistics = hmm.newSufficientStatistics();
        double logLikelihood = 0.0;
        for (int k = 0; k < sequences.size(); k++) {
            logLikelihood += accumulateSequence(statistics, sequences, k, logStartProb,
                    logTransMat);
        }
        return new EStepResult(statistics, logLikelihood);
    }

    /**
     * Processes each sequence as a separate task with its own statistics and merges the results
     * in sequence order.
     */
    private EStepResult doEStep(final ObservationSequences sequences,
            ExecutorService executor) {
        final double[] logStartProb = Utils.log(hmm.startProb());
        final double[][] logTransMat = Utils.log(hmm.transMat());
        final List<Future<EStepResult>> futures = new ArrayList<>();
        for (int k = 0; k < sequences.size(); k++) {
            final int sequenceIndex = k;
            futures.add(executor.submit(new Callable<EStepResult>() {
                @Override
                public EStepResult call() {
                    final SufficientStatistics statistics = hmm.newSufficientStatistics();
                    final double logLikelihood = accumulateSequence(statistics, sequences,
                            sequenceIndex, logStartProb, logTransMat);
                    return new EStepResult(statistics, logLikelihood);
                }
            }));
        }

        final SufficientStatistics statistics = hmm.newSufficientStatistics();
        double logLikelihood = 0.0;
        for (Future<EStepResult> future : futures) {
            final EStepResult result = get(future);
            statistics.merge(result.statistics);
            logLikelihood += result.logLikelihood;
        }
        return new EStepResult(statistics, logLikelihood);
    }

    private double accumulateSequence(SufficientStatistics statistics,
            ObservationSequences sequences, int k, double[] logStartProb,
            double[][] logTransMat) {
        final EmissionModel emissionModel = hmm.getEmissionModel();
        final double[][] observations = sequences.sequence(k);
        final double[][] logLikelihoods = emissionModel.logLikelihoods(observations);
        final ForwardBackwardResult forwardBackward;
        try {
            forwardBackward = ForwardBackwardAlgorithm.compute(logStartProb, logTransMat,
                    logLikelihoods);
        } catch (DegenerateSequenceException e) {
            throw new DegenerateSequenceException(k, e);
        }
        statistics.addSequence(forwardBackward);
        emissionModel.accumulateSufficientStatistics(statistics, observations, logLikelihoods,
                forwardBackward.posteriors);
        return forwardBackward.logLikelihood;
    }

    /**
     * Re-estimates the selected parameters. Start and transition probabilities are only
     * committed after the emission model accepted its update.
     */
    private void doMStep(SufficientStatistics statistics) {
        final Set<HmmParameter> estimate = params.getParams();
        double[] newStartProb = hmm.startProb();
        if (estimate.contains(HmmParameter.START)) {
            newStartProb = dirichletUpdate(statistics.startCounts(), params.getStartProbPrior(),
                    hmm.startProb());
        }
        double[][] newTransMat = hmm.transMat();
        if (estimate.contains(HmmParameter.TRANSITION)) {
            final double[][] counts = statistics.transitionCounts();
            newTransMat = new double[counts.length][];
            for (int i = 0; i < counts.length; i++) {
                newTransMat[i] = dirichletUpdate(counts[i], params.getTransMatPrior(),
                        hmm.transMat()[i]);
            }
        }
        hmm.getEmissionModel().doMStep(statistics, estimate);
        hmm.setStartProb(newStartProb);
        hmm.setTransMat(newTransMat);
    }

    /**
     * Mode of the Dirichlet posterior: max(prior - 1 + counts, 0), normalized. Keeps previous if
     * there is no evidence.
     */
    static double[] dirichletUpdate(double[] counts, double prior, double[] previous) {
        final double[] result = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            result[i] = Math.max(prior - 1.0 + counts[i], 0.0);
        }
        return Utils.normalize(result) ? result : previous.clone();
    }

    private static EStepResult get(Future<EStepResult> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Training interrupted during the E-step.");
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

}
