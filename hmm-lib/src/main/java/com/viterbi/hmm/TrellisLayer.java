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

import com.carrotsearch.hppc.DoubleArrayList;
import com.carrotsearch.hppc.IntArrayList;
import com.carrotsearch.hppc.IntIntHashMap;

/**
 * One time step of the {@link Trellis}: for each reachable state the score of the most likely
 * sequence ending in it, i.e. max p(s_0, ..., s_t, o_0, ..., o_t) w.r.t. s_0, ..., s_{t-1}
 * (or its logarithm), and the back pointer to the previous state of that sequence.
 * <p>
 * States are referenced by their registration index in the {@link HmmModel}. Entries are stored
 * in insertion order, which the decoder keeps equal to the registration order. Unreachable
 * states have no entry.
 */
public class TrellisLayer {
    /**
     * Back pointer of the entries of the first time step.
     */
    public static final int NO_PREDECESSOR = -1;

    private final IntArrayList stateIndices;
    private final DoubleArrayList scores;
    private final IntArrayList predecessors;
    private final IntIntHashMap slotByStateIndex;

    TrellisLayer(int expectedStates) {
        stateIndices = new IntArrayList(expectedStates);
        scores = new DoubleArrayList(expectedStates);
        predecessors = new IntArrayList(expectedStates);
        slotByStateIndex = new IntIntHashMap(expectedStates);
    }

    void add(int stateIndex, double score, int predecessorIndex) {
        if (slotByStateIndex.containsKey(stateIndex))
            throw new IllegalArgumentException("State index " + stateIndex + " was already added to this layer");

        slotByStateIndex.put(stateIndex, stateIndices.size());
        stateIndices.add(stateIndex);
        scores.add(score);
        predecessors.add(predecessorIndex);
    }

    public int size() {
        return stateIndices.size();
    }

    public boolean isEmpty() {
        return stateIndices.isEmpty();
    }

    public boolean contains(int stateIndex) {
        return slotByStateIndex.containsKey(stateIndex);
    }

    /**
     * @return the slot of the specified state in this layer or -1 if the state is unreachable
     */
    public int slotOf(int stateIndex) {
        int index = slotByStateIndex.indexOf(stateIndex);
        return slotByStateIndex.indexExists(index) ? slotByStateIndex.indexGet(index) : -1;
    }

    public int getStateIndex(int slot) {
        return stateIndices.get(slot);
    }

    public double getScore(int slot) {
        return scores.get(slot);
    }

    /**
     * @return the registration index of the previous state or {@link #NO_PREDECESSOR}
     */
    public int getPredecessor(int slot) {
        return predecessors.get(slot);
    }

    /**
     * Returns the first slot with the maximum score, or -1 if the layer is empty.
     */
    int bestSlot() {
        int best = -1;
        double maxScore = Double.NEGATIVE_INFINITY;
        for (int slot = 0; slot < stateIndices.size(); slot++) {
            double score = scores.get(slot);
            if (best < 0 || score > maxScore) {
                best = slot;
                maxScore = score;
            }
        }
        return best;
    }
}
