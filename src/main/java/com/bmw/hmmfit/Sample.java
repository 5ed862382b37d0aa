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
 * Synthetic observations drawn from an {@link Hmm} together with the hidden states that
 * generated them.
 */
public class Sample {

    /**
     * n x D observations, one row per time step.
     */
    public final double[][] observations;

    /**
     * Hidden state of each time step.
     */
    public final int[] states;

    public Sample(double[][] observations, int[] states) {
        this.observations = observations;
        this.states = states;
    }

    public int length() {
        return states.length;
    }

}
