/*
 *  Licensed to GraphHopper GmbH under one or more contributor
 *  license agreements. See the NOTICE file distributed with this work for
 *  additional information regarding copyright ownership.
 *
 *  GraphHopper GmbH licenses this file to you under the Apache License,
 *  Version 2.0 (the "License"); you may not use this file except in
 *  compliance with the License. You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */
package com.viterbi.hmm;

import com.viterbi.util.Helper;

/**
 * The arithmetic in which the probabilities of an {@link HmmModel} are expressed.
 */
public enum ProbabilityScale {
    /**
     * Plain probabilities in [0,1], combined by multiplication. Long sequences of small values
     * can underflow to 0, use {@link #LOG} for them.
     */
    LINEAR {
        @Override
        public double combine(double score, double probability) {
            return score * probability;
        }

        @Override
        public boolean isValid(double probability) {
            return probability >= 0 && probability <= 1;
        }

        @Override
        public boolean isUnreachable(double score) {
            return score == 0;
        }
    },
    /**
     * Natural logarithms of probabilities, i.e. values <= 0, combined by addition. Negative
     * infinity is the logarithm of 0 and therefore valid, but it is never chained.
     */
    LOG {
        @Override
        public double combine(double score, double logProbability) {
            return score + logProbability;
        }

        @Override
        public boolean isValid(double logProbability) {
            return logProbability <= 0;
        }

        @Override
        public boolean isUnreachable(double score) {
            return score == Double.NEGATIVE_INFINITY;
        }
    };

    /**
     * Chains a probability to the score of a partial sequence.
     */
    public abstract double combine(double score, double probability);

    /**
     * Returns false for values outside of the domain of this scale. NaN is never valid.
     */
    public abstract boolean isValid(double probability);

    /**
     * Returns true if the score is the zero element of this scale, i.e. the sequence ending in
     * the scored state is impossible.
     */
    public abstract boolean isUnreachable(double score);

    /**
     * Parses "linear" or "log", case-insensitive.
     */
    public static ProbabilityScale fromString(String name) {
        String lower = Helper.toLowerCase(name.trim());
        if (lower.equals("linear"))
            return LINEAR;
        if (lower.equals("log"))
            return LOG;
        throw new IllegalArgumentException("Unknown probability scale '" + name + "', use linear or log");
    }

    @Override
    public String toString() {
        return Helper.toLowerCase(name());
    }
}
