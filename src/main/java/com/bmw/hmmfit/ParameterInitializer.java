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
import java.util.EnumSet;
import java.util.Set;

import org.apache.commons.math3.random.RandomGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Supplies starting values for the parameters that are selected for initialization and have not
 * been set by the caller: uniform start and transition probabilities and data-driven emission
 * parameters.
 */
public final class ParameterInitializer {

    private static final Logger logger = LoggerFactory.getLogger(ParameterInitializer.class);

    private ParameterInitializer() {
    }

    public static double[] uniformStartProb(int numStates) {
        final double[] result = new double[numStates];
        Arrays.fill(result, 1.0 / numStates);
        return result;
    }

    public static double[][] uniformTransMat(int numStates) {
        final double[][] result = new double[numStates][];
        for (int i = 0; i < numStates; i++) {
            result[i] = uniformStartProb(numStates);
        }
        return result;
    }

    /**
     * Initializes the missing parameters of hmm that are listed in initParams. The emission
     * parameters come first, so that hmm is left unchanged if they cannot be initialized.
     */
    public static void initialize(Hmm hmm, ObservationSequences sequences,
            Set<HmmParameter> initParams, RandomGenerator random) {
        final EmissionModel emissionModel = hmm.getEmissionModel();
        final Set<HmmParameter> emissionCodes = EnumSet.noneOf(HmmParameter.class);
        emissionCodes.addAll(emissionModel.getParameterCodes());
        emissionCodes.retainAll(initParams);
        if (!emissionModel.isInitialized() && !emissionCodes.isEmpty()) {
            logger.debug("Initializing emission parameters {} from {} observations.",
                    emissionCodes, sequences.totalLength());
        }
        // Emission models ignore the codes they do not own.
        emissionModel.initFromData(sequences.observations(), initParams, random);

        final int numStates = hmm.getNumStates();
        if (initParams.contains(HmmParameter.START)) {
            if (hmm.getStartProb() == null) {
                hmm.setStartProb(uniformStartProb(numStates));
                logger.debug("Initialized uniform start probabilities.");
            } else {
                logger.debug("Keeping the start probabilities set by the caller.");
            }
        }
        if (initParams.contains(HmmParameter.TRANSITION)) {
            if (hmm.getTransMat() == null) {
                hmm.setTransMat(uniformTransMat(numStates));
                logger.debug("Initialized uniform transition matrix.");
            } else {
                logger.debug("Keeping the transition matrix set by the caller.");
            }
        }
    }

}
