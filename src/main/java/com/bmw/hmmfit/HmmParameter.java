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
 * Identifies a group of model parameters. Sets of these select which parameters are initialized
 * from data before training ({@link HmmParams#setInitParams(java.util.Set)}) and which are
 * re-estimated in the M-step ({@link HmmParams#setParams(java.util.Set)}).
 *
 * <p>{@link #START} and {@link #TRANSITION} belong to the Markov chain itself. All other codes
 * belong to an emission family; families ignore codes they do not own.
 */
public enum HmmParameter {

    /** Initial state probabilities. */
    START,

    /** State transition matrix. */
    TRANSITION,

    /** Gaussian and Gaussian mixture means. */
    MEANS,

    /** Gaussian and Gaussian mixture covariances. */
    COVARIANCES,

    /** Mixture weights of a Gaussian mixture. */
    WEIGHTS,

    /** Symbol probabilities of a categorical emission. */
    EMISSION_PROBABILITIES,

    /** Rates of a Poisson emission. */
    RATES

}
