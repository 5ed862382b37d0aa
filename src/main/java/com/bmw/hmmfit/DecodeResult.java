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
 * Decoded hidden states of a set of observation sequences.
 */
public class DecodeResult {

    public final DecoderAlgorithm algorithm;

    /**
     * States of all sequences concatenated in input order.
     */
    public final int[] states;

    /**
     * States of each sequence.
     */
    public final int[][] sequenceStates;

    /**
     * Score of each sequence, see {@link MostLikelySequence#score}.
     */
    public final double[] scores;

    public DecodeResult(DecoderAlgorithm algorithm, int[][] sequenceStates, double[] scores) {
        this.algorithm = algorithm;
        this.sequenceStates = sequenceStates;
        this.scores = scores;

        int totalLength = 0;
        for (int[] sequence : sequenceStates) {
            totalLength += sequence.length;
        }
        this.states = new int[totalLength];
        int offset = 0;
        for (int[] sequence : sequenceStates) {
            System.arraycopy(sequence, 0, states, offset, sequence.length);
            offset += sequence.length;
        }
    }

    /**
     * Sum of the sequence scores. For {@link DecoderAlgorithm#VITERBI} this is the joint log
     * probability of all decoded paths.
     */
    public double totalScore() {
        return Utils.sum(scores);
    }

}
