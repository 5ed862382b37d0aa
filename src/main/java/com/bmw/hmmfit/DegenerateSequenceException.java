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
 * Thrown if an observation sequence has zero probability under every state path, i.e. its total
 * log-likelihood is negative infinity. This is also known as an HMM break. Also thrown with a
 * separate message if the log-likelihood is NaN, which points to invalid observations.
 */
public class DegenerateSequenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int sequenceIndex;

    /**
     * For a single sequence whose position within a sequence set is not known.
     */
    public DegenerateSequenceException(String message) {
        super(message);
        this.sequenceIndex = -1;
    }

    public DegenerateSequenceException(int sequenceIndex, DegenerateSequenceException cause) {
        super("Sequence " + sequenceIndex + ": " + cause.getMessage(), cause);
        this.sequenceIndex = sequenceIndex;
    }

    /**
     * Returns the zero-based index of the offending sequence within the sequence set, or -1 if
     * unknown.
     */
    public int getSequenceIndex() {
        return sequenceIndex;
    }

}
