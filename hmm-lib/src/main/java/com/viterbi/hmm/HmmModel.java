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

import com.carrotsearch.hppc.IntDoubleHashMap;
import com.carrotsearch.hppc.IntIntHashMap;
import com.carrotsearch.hppc.LongDoubleHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Holds the states, the observation sequence and the start, emission and transition
 * probabilities consumed by the {@link ViterbiDecoder}.
 * <p>
 * States are kept in a dense list in registration order. This order is the iteration order of
 * the decoder and therefore decides ties between equally likely states. All probability tables
 * are keyed by {@link Identifiable#getId()}, never by equals or hashCode of the caller types.
 * <p>
 * Every put method uses last-write-wins: setting a key twice replaces the earlier value.
 * Adding a state whose id is already registered replaces the stored state but keeps its
 * registration slot. Values are stored as given and are validated by the decoder against
 * the {@link ProbabilityScale} it runs with.
 * <p>
 * This class is not thread-safe. Populate it completely before decoding; afterwards any number
 * of threads may decode it concurrently.
 *
 * @param <S> the state type
 * @param <O> the observation type
 */
public class HmmModel<S extends Identifiable, O extends Identifiable> {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final List<S> states = new ArrayList<>();
    private final IntIntHashMap stateIndexById = new IntIntHashMap();
    private final List<O> observations = new ArrayList<>();
    private final IntDoubleHashMap startProbabilities = new IntDoubleHashMap();
    private final LongDoubleHashMap emissionProbabilities = new LongDoubleHashMap();
    private final LongDoubleHashMap transitionProbabilities = new LongDoubleHashMap();

    public HmmModel<S, O> addState(S state) {
        int id = state.getId();
        int index = stateIndexById.indexOf(id);
        if (stateIndexById.indexExists(index)) {
            int slot = stateIndexById.indexGet(index);
            logger.debug("state id " + id + " already registered at index " + slot + ", replacing " + states.get(slot) + " with " + state);
            states.set(slot, state);
        } else {
            stateIndexById.put(id, states.size());
            states.add(state);
        }
        return this;
    }

    /**
     * Appends the observation for the next time step. The same observation may be added
     * several times.
     */
    public HmmModel<S, O> addObservation(O observation) {
        if (observation == null)
            throw new NullPointerException("observation must not be null");

        observations.add(observation);
        return this;
    }

    public HmmModel<S, O> putStartProbability(S state, double probability) {
        startProbabilities.put(state.getId(), probability);
        return this;
    }

    public HmmModel<S, O> putEmissionProbability(S state, O observation, double probability) {
        emissionProbabilities.put(toKey(state.getId(), observation.getId()), probability);
        return this;
    }

    public HmmModel<S, O> putTransitionProbability(S from, S to, double probability) {
        transitionProbabilities.put(toKey(from.getId(), to.getId()), probability);
        return this;
    }

    /**
     * @return the states in registration order
     */
    public List<S> getStates() {
        return Collections.unmodifiableList(states);
    }

    public S getState(int index) {
        return states.get(index);
    }

    public int getStateCount() {
        return states.size();
    }

    /**
     * @return the registration index of the state with the specified id or -1 if there is none
     */
    public int getStateIndex(int stateId) {
        int index = stateIndexById.indexOf(stateId);
        return stateIndexById.indexExists(index) ? stateIndexById.indexGet(index) : -1;
    }

    /**
     * @return the observations, index i is time step i
     */
    public List<O> getObservations() {
        return Collections.unmodifiableList(observations);
    }

    public O getObservation(int timeStep) {
        return observations.get(timeStep);
    }

    public int getObservationCount() {
        return observations.size();
    }

    public boolean hasStartProbability(int stateId) {
        return startProbabilities.containsKey(stateId);
    }

    public double getStartProbability(int stateId) {
        int index = startProbabilities.indexOf(stateId);
        if (!startProbabilities.indexExists(index))
            throw new IllegalArgumentException("No start probability for state " + stateId);
        return startProbabilities.indexGet(index);
    }

    public boolean hasEmissionProbability(int stateId, int observationId) {
        return emissionProbabilities.containsKey(toKey(stateId, observationId));
    }

    public double getEmissionProbability(int stateId, int observationId) {
        int index = emissionProbabilities.indexOf(toKey(stateId, observationId));
        if (!emissionProbabilities.indexExists(index))
            throw new IllegalArgumentException("No emission probability for state " + stateId + " and observation " + observationId);
        return emissionProbabilities.indexGet(index);
    }

    public boolean hasTransitionProbability(int fromStateId, int toStateId) {
        return transitionProbabilities.containsKey(toKey(fromStateId, toStateId));
    }

    public double getTransitionProbability(int fromStateId, int toStateId) {
        int index = transitionProbabilities.indexOf(toKey(fromStateId, toStateId));
        if (!transitionProbabilities.indexExists(index))
            throw new IllegalArgumentException("No transition probability from state " + fromStateId + " to state " + toStateId);
        return transitionProbabilities.indexGet(index);
    }

    /**
     * Packs two ids into one key: the first id in the upper 32 bits, the second in the lower.
     */
    static long toKey(int high, int low) {
        return ((long) high << 32) | (low & 0xFFFFFFFFL);
    }

    @Override
    public String toString() {
        return "states:" + states.size() + ", observations:" + observations.size()
                + ", start probabilities:" + startProbabilities.size()
                + ", emission probabilities:" + emissionProbabilities.size()
                + ", transition probabilities:" + transitionProbabilities.size();
    }
}
