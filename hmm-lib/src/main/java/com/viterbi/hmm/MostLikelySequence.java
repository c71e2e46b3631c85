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

import java.util.Collections;
import java.util.List;

/**
 * The result of decoding an {@link HmmModel}.
 *
 * @param <S> the state type
 */
public class MostLikelySequence<S> {
    /**
     * The scale of {@link #probability}.
     */
    public final ProbabilityScale scale;

    /**
     * The joint probability p(s_0, ..., s_T, o_0, ..., o_T) of {@link #sequence} and the
     * observations, or its logarithm for {@link ProbabilityScale#LOG}.
     */
    public final double probability;

    /**
     * The most likely state for each time step, i.e. it has as many entries as there are
     * observations.
     */
    public final List<S> sequence;

    /**
     * The layers of the forward pass. Null unless the decoder was asked to keep them.
     */
    public final Trellis trellis;

    public MostLikelySequence(ProbabilityScale scale, double probability, List<S> sequence, Trellis trellis) {
        this.scale = scale;
        this.probability = probability;
        this.sequence = Collections.unmodifiableList(sequence);
        this.trellis = trellis;
    }

    @Override
    public String toString() {
        return "MostLikelySequence [" + scale + " probability=" + probability + ", sequence=" + sequence + "]";
    }
}
