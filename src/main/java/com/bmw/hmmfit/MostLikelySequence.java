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
 * Decoded state sequence of one observation sequence.
 */
public class MostLikelySequence {

    /**
     * Zero-based state index for each time step.
     */
    public final int[] states;

    /**
     * For {@link DecoderAlgorithm#VITERBI} the joint log probability
     * log p(s_1, ..., s_T, o_1, ..., o_T) of the returned states. For {@link DecoderAlgorithm#MAP}
     * the mean over all time steps of the posterior probability of the chosen state.
     */
    public final double score;

    /**
     * Sequence of computed Viterbi messages for each time step. Is null if message history
     * is not kept or for MAP decoding.
     *
     * <p>messageHistory[t][s] contains the log probability of the most likely sequence ending in
     * state s at time step t given the observations o_1, ..., o_t.
     * Formally, this is max log p(s_1, ..., s_t, o_1, ..., o_t) w.r.t. s_1, ..., s_{t-1}.
     */
    public final double[][] messageHistory;

    public MostLikelySequence(int[] states, double score, double[][] messageHistory) {
        this.states = states;
        this.score = score;
        this.messageHistory = messageHistory;
    }

    public String messageHistoryString() {
        if (messageHistory == null) {
            return "No message history";
        }
        final StringBuilder sb = new StringBuilder();
        sb.append("Message history with log probabilities\n\n");
        for (int t = 0; t < messageHistory.length; t++) {
            sb.append("Time step " + t + "\n");
            for (int s = 0; s < messageHistory[t].length; s++) {
                sb.append(s + ": " + messageHistory[t][s] + "\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }

}
