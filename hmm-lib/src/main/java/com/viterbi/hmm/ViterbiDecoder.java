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

import com.viterbi.hmm.exceptions.*;
import com.viterbi.util.PMap;
import com.viterbi.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Implementation of the Viterbi algorithm for a stationary hidden Markov model with fixed start,
 * emission and transition probabilities, see e.g. Rabiner, Juang, An introduction to Hidden
 * Markov Models, IEEE ASSP Mag., pp 4-16, June 1986.
 * <p>
 * The forward pass builds one {@link TrellisLayer} per observation. A state only enters a layer
 * if it can explain the observation and, after the first time step, has an allowed transition
 * from a state of the previous layer. For each state the most likely predecessor is kept as back
 * pointer, which is followed backwards from the most likely last state to retrieve the result.
 * <p>
 * Missing table entries mean probability zero. Scores equal to zero (or negative infinity for
 * {@link ProbabilityScale#LOG}) are never stored, so they cannot be part of the result.
 * <p>
 * States are always iterated in registration order and a candidate only replaces the current
 * maximum if it is strictly greater. So among equally likely states the first registered one
 * wins, for every back pointer as well as for the last state.
 * <p>
 * A decoder only holds its configuration, hence one instance can decode any number of models,
 * also concurrently, as long as no model is modified while it is decoded.
 */
public class ViterbiDecoder {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ProbabilityScale scale;
    private final boolean keepTrellis;

    public ViterbiDecoder() {
        this(ProbabilityScale.LINEAR, false);
    }

    /**
     * @param keepTrellis whether to return the layers of the forward pass in
     *                    {@link MostLikelySequence#trellis} for debugging
     */
    public ViterbiDecoder(boolean keepTrellis) {
        this(ProbabilityScale.LINEAR, keepTrellis);
    }

    /**
     * @param scale       the scale used by {@link #decode(HmmModel)}
     * @param keepTrellis whether to return the layers of the forward pass in
     *                    {@link MostLikelySequence#trellis} for debugging
     */
    public ViterbiDecoder(ProbabilityScale scale, boolean keepTrellis) {
        if (scale == null)
            throw new NullPointerException("scale must not be null");
        this.scale = scale;
        this.keepTrellis = keepTrellis;
    }

    /**
     * Creates a decoder from the hints "scale" (linear or log, default linear) and
     * "keep_trellis" (default false).
     */
    public static ViterbiDecoder fromHints(PMap hints) {
        ProbabilityScale scale = ProbabilityScale.fromString(hints.getString("scale", ProbabilityScale.LINEAR.toString()));
        return new ViterbiDecoder(scale, hints.getBool("keep_trellis", false));
    }

    public ProbabilityScale getScale() {
        return scale;
    }

    public boolean isKeepTrellis() {
        return keepTrellis;
    }

    /**
     * Decodes a model whose probabilities are all in [0,1].
     */
    public <S extends Identifiable, O extends Identifiable> MostLikelySequence<S> evalPath(HmmModel<S, O> model) {
        return decode(model, ProbabilityScale.LINEAR);
    }

    /**
     * Decodes a model whose probabilities are all logarithmic, i.e. <= 0.
     */
    public <S extends Identifiable, O extends Identifiable> MostLikelySequence<S> evalPathLogProbabilities(HmmModel<S, O> model) {
        return decode(model, ProbabilityScale.LOG);
    }

    /**
     * Decodes the model with the scale of this decoder.
     */
    public <S extends Identifiable, O extends Identifiable> MostLikelySequence<S> decode(HmmModel<S, O> model) {
        return decode(model, scale);
    }

    /**
     * Computes the most likely sequence of states for the observations of the specified model.
     * Formally, this is argmax p(s_0, ..., s_T, o_0, ..., o_T) with respect to s_0, ..., s_T,
     * where s_t is the state and o_t the observation at time step t.
     *
     * @throws NoObservationsException      if the model has no observations
     * @throws NoStatesException            if the model has no states
     * @throws InvalidProbabilityException  if a probability needed for decoding is outside of
     *                                      the domain of the scale
     * @throws NoValidInitStatesException   if no state can explain the first observation
     * @throws PathBrokenException          if no state is reachable at some intermediate time step
     * @throws NoValidPathException         if no state is reachable at the last time step
     * @throws InconsistentTrellisException if backtracking fails, which indicates a bug
     */
    public <S extends Identifiable, O extends Identifiable> MostLikelySequence<S> decode(HmmModel<S, O> model,
                                                                                          ProbabilityScale scale) {
        if (model == null || scale == null)
            throw new NullPointerException("model and scale must not be null");
        if (model.getObservationCount() == 0)
            throw new NoObservationsException();
        if (model.getStateCount() == 0)
            throw new NoStatesException();

        StopWatch sw = new StopWatch("decode").start();
        Trellis trellis = forwardPass(model, scale);
        TrellisLayer lastLayer = trellis.getLastLayer();
        int lastSlot = lastLayer.bestSlot();
        List<S> sequence = backtrack(model, trellis, lastLayer.getStateIndex(lastSlot));
        sw.stop();

        double probability = lastLayer.getScore(lastSlot);
        logger.debug("decoded " + model.getObservationCount() + " observations with " + model.getStateCount()
                + " states, " + scale + " probability:" + probability + ", " + sw);
        return new MostLikelySequence<>(scale, probability, sequence, keepTrellis ? trellis : null);
    }

    private <S extends Identifiable, O extends Identifiable> Trellis forwardPass(HmmModel<S, O> model,
                                                                                 ProbabilityScale scale) {
        final int timeSteps = model.getObservationCount();
        final Trellis trellis = new Trellis(timeSteps);
        TrellisLayer layer = computeInitialLayer(model, scale);
        if (layer.isEmpty())
            throw new NoValidInitStatesException();
        trellis.add(layer);

        for (int timeStep = 1; timeStep < timeSteps; timeStep++) {
            layer = forwardStep(model, scale, timeStep, layer);
            if (layer.isEmpty()) {
                logger.debug("no reachable state at time step " + timeStep + " of " + timeSteps);
                if (timeStep == timeSteps - 1)
                    throw new NoValidPathException(timeStep);
                throw new PathBrokenException(timeStep);
            }
            trellis.add(layer);
        }
        return trellis;
    }

    /**
     * Scores each state with start probability times emission probability of the first
     * observation.
     */
    private <S extends Identifiable, O extends Identifiable> TrellisLayer computeInitialLayer(HmmModel<S, O> model,
                                                                                              ProbabilityScale scale) {
        final int stateCount = model.getStateCount();
        final int observationId = model.getObservation(0).getId();
        final TrellisLayer layer = new TrellisLayer(stateCount);
        for (int stateIndex = 0; stateIndex < stateCount; stateIndex++) {
            final int stateId = model.getState(stateIndex).getId();
            if (!model.hasStartProbability(stateId) || !model.hasEmissionProbability(stateId, observationId))
                continue;

            final double startProbability = model.getStartProbability(stateId);
            if (!scale.isValid(startProbability))
                throw InvalidProbabilityException.forStart(scale, stateId, startProbability);

            final double emissionProbability = emissionProbability(model, scale, stateId, observationId, 0);
            final double score = scale.combine(startProbability, emissionProbability);
            if (scale.isUnreachable(score))
                continue;

            layer.add(stateIndex, score, TrellisLayer.NO_PREDECESSOR);
        }
        return layer;
    }

    /**
     * Computes the layer of the specified time step with the back pointers to the states of the
     * previous layer.
     */
    private <S extends Identifiable, O extends Identifiable> TrellisLayer forwardStep(HmmModel<S, O> model,
                                                                                      ProbabilityScale scale,
                                                                                      int timeStep,
                                                                                      TrellisLayer prevLayer) {
        assert !prevLayer.isEmpty();
        final int stateCount = model.getStateCount();
        final int observationId = model.getObservation(timeStep).getId();
        final TrellisLayer layer = new TrellisLayer(stateCount);

        for (int curIndex = 0; curIndex < stateCount; curIndex++) {
            final int curId = model.getState(curIndex).getId();
            if (!model.hasEmissionProbability(curId, observationId))
                continue;

            final double emissionProbability = emissionProbability(model, scale, curId, observationId, timeStep);
            double maxScore = Double.NEGATIVE_INFINITY;
            int maxPrevIndex = TrellisLayer.NO_PREDECESSOR;
            for (int prevSlot = 0; prevSlot < prevLayer.size(); prevSlot++) {
                final int prevIndex = prevLayer.getStateIndex(prevSlot);
                final int prevId = model.getState(prevIndex).getId();
                if (!model.hasTransitionProbability(prevId, curId))
                    continue;

                final double transitionProbability = model.getTransitionProbability(prevId, curId);
                if (!scale.isValid(transitionProbability))
                    throw InvalidProbabilityException.forTransition(scale, prevId, curId, timeStep, transitionProbability);

                final double score = scale.combine(scale.combine(prevLayer.getScore(prevSlot), transitionProbability),
                        emissionProbability);
                if (scale.isUnreachable(score))
                    continue;

                if (maxPrevIndex == TrellisLayer.NO_PREDECESSOR || score > maxScore) {
                    maxScore = score;
                    maxPrevIndex = prevIndex;
                }
            }

            // No allowed transition from any reachable state, so curState is unreachable.
            if (maxPrevIndex != TrellisLayer.NO_PREDECESSOR)
                layer.add(curIndex, maxScore, maxPrevIndex);
        }
        return layer;
    }

    private static double emissionProbability(HmmModel<?, ?> model, ProbabilityScale scale, int stateId,
                                              int observationId, int timeStep) {
        final double emissionProbability = model.getEmissionProbability(stateId, observationId);
        if (!scale.isValid(emissionProbability))
            throw InvalidProbabilityException.forEmission(scale, stateId, observationId, timeStep, emissionProbability);
        return emissionProbability;
    }

    /**
     * Follows the back pointers from the specified state of the last layer to the first layer.
     *
     * @return the states in forward time order
     * @throws InconsistentTrellisException if a state or its back pointer is missing
     */
    static <S extends Identifiable> List<S> backtrack(HmmModel<S, ?> model, Trellis trellis, int lastStateIndex) {
        final List<S> result = new ArrayList<>(trellis.size());
        int stateIndex = lastStateIndex;
        for (int timeStep = trellis.size() - 1; timeStep >= 0; timeStep--) {
            final TrellisLayer layer = trellis.getLayer(timeStep);
            final int slot = layer.slotOf(stateIndex);
            if (slot < 0)
                throw new InconsistentTrellisException(timeStep, stateIndex);

            result.add(model.getState(stateIndex));
            stateIndex = layer.getPredecessor(slot);
            if (timeStep > 0 && stateIndex == TrellisLayer.NO_PREDECESSOR)
                throw new InconsistentTrellisException(timeStep, layer.getStateIndex(slot));
        }

        Collections.reverse(result);
        return result;
    }
}
