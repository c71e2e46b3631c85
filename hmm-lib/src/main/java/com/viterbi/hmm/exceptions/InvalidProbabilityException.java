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
package com.viterbi.hmm.exceptions;

import com.viterbi.hmm.ProbabilityScale;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown if a probability of the model is outside of the domain of the scale used for decoding,
 * i.e. not in [0,1] for {@link ProbabilityScale#LINEAR} or not <= 0 for
 * {@link ProbabilityScale#LOG}. The details name the table, the offending value and the key.
 */
public class InvalidProbabilityException extends IllegalArgumentException implements HmmException {

    public enum Table {
        START, EMISSION, TRANSITION
    }

    private final Table table;
    private final double value;
    private final Map<String, Object> details;

    private InvalidProbabilityException(String message, Table table, double value, Map<String, Object> details) {
        super(message);
        this.table = table;
        this.value = value;
        this.details = Collections.unmodifiableMap(details);
    }

    public static InvalidProbabilityException forStart(ProbabilityScale scale, int stateId, double value) {
        Map<String, Object> details = createDetails(Table.START, scale, value, 0);
        details.put("state_id", stateId);
        return new InvalidProbabilityException("Invalid " + scale + " start probability " + value
                + " for state " + stateId, Table.START, value, details);
    }

    public static InvalidProbabilityException forEmission(ProbabilityScale scale, int stateId, int observationId,
                                                          int timeStep, double value) {
        Map<String, Object> details = createDetails(Table.EMISSION, scale, value, timeStep);
        details.put("state_id", stateId);
        details.put("observation_id", observationId);
        return new InvalidProbabilityException("Invalid " + scale + " emission probability " + value
                + " for state " + stateId + " and observation " + observationId + " at time step " + timeStep,
                Table.EMISSION, value, details);
    }

    public static InvalidProbabilityException forTransition(ProbabilityScale scale, int fromStateId, int toStateId,
                                                            int timeStep, double value) {
        Map<String, Object> details = createDetails(Table.TRANSITION, scale, value, timeStep);
        details.put("from_state_id", fromStateId);
        details.put("to_state_id", toStateId);
        return new InvalidProbabilityException("Invalid " + scale + " transition probability " + value
                + " from state " + fromStateId + " to state " + toStateId + " at time step " + timeStep,
                Table.TRANSITION, value, details);
    }

    private static Map<String, Object> createDetails(Table table, ProbabilityScale scale, double value, int timeStep) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("table", table);
        details.put("scale", scale);
        details.put("value", value);
        details.put("time_step", timeStep);
        return details;
    }

    public Table getTable() {
        return table;
    }

    public double getValue() {
        return value;
    }

    @Override
    public Map<String, Object> getDetails() {
        return details;
    }
}
