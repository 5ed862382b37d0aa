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
 * Outcome of {@link EmTrainer#fit(ObservationSequences)}. The fitted emission parameters stay on
 * the emission model of the {@link Hmm}.
 */
public class FitResult {

    private final TrainingState state;
    private final ConvergenceMonitor monitor;
    private final double[] startProb;
    private final double[][] transMat;

    public FitResult(TrainingState state, ConvergenceMonitor monitor, double[] startProb,
            double[][] transMat) {
        this.state = state;
        this.monitor = monitor;
        this.startProb = Utils.copy(startProb);
        this.transMat = Utils.copy(transMat);
    }

    /**
     * Either {@link TrainingState#CONVERGED} or {@link TrainingState#ITERATION_LIMIT_REACHED}.
     */
    public TrainingState getState() {
        return state;
    }

    public ConvergenceMonitor getMonitor() {
        return monitor;
    }

    public double[] getStartProb() {
        return Utils.copy(startProb);
    }

    public double[][] getTransMat() {
        return Utils.copy(transMat);
    }

    @Override
    public String toString() {
        return "FitResult [state=" + state + ", monitor=" + monitor + "]";
    }

}
