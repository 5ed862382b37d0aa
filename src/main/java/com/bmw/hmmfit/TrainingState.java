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
 * States of an {@link EmTrainer} run.
 */
public enum TrainingState {

    /** Data-driven defaults are assigned and the parameters are validated. */
    INITIALIZING,

    /** E-step and M-step are repeated. */
    ITERATING,

    /** The log-likelihood changed less than the tolerance between two iterations. */
    CONVERGED,

    /** The iteration cap was hit before the log-likelihood converged. */
    ITERATION_LIMIT_REACHED;

    public boolean isTerminal() {
        return this == CONVERGED || this == ITERATION_LIMIT_REACHED;
    }

}
