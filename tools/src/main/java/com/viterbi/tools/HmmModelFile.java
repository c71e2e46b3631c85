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
package com.viterbi.tools;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The JSON document of a model file. States and observations are declared once with id and
 * name, everything else references them by name:
 * <pre>
 * { "states": [{"id": 1, "name": "Healthy"}, {"id": 2, "name": "Fever"}],
 *   "observations": [{"id": 1, "name": "normal"}, {"id": 2, "name": "cold"}],
 *   "sequence": ["normal", "cold", "normal"],
 *   "start": {"Healthy": 0.6, "Fever": 0.4},
 *   "emission": {"Healthy": {"normal": 0.5, "cold": 0.4}, "Fever": {"normal": 0.1}},
 *   "transition": {"Healthy": {"Healthy": 0.7, "Fever": 0.3}} }
 * </pre>
 * Missing entries are probability zero.
 */
public class HmmModelFile {
    private List<Label> states = new ArrayList<>();
    private List<Label> observations = new ArrayList<>();
    private List<String> sequence = new ArrayList<>();
    private Map<String, Double> start = new LinkedHashMap<>();
    private Map<String, Map<String, Double>> emission = new LinkedHashMap<>();
    private Map<String, Map<String, Double>> transition = new LinkedHashMap<>();

    @JsonProperty
    public List<Label> getStates() {
        return states;
    }

    @JsonProperty
    public void setStates(List<Label> states) {
        this.states = states;
    }

    @JsonProperty
    public List<Label> getObservations() {
        return observations;
    }

    @JsonProperty
    public void setObservations(List<Label> observations) {
        this.observations = observations;
    }

    /**
     * @return the names of the observations in time step order
     */
    @JsonProperty
    public List<String> getSequence() {
        return sequence;
    }

    @JsonProperty
    public void setSequence(List<String> sequence) {
        this.sequence = sequence;
    }

    @JsonProperty
    public Map<String, Double> getStart() {
        return start;
    }

    @JsonProperty
    public void setStart(Map<String, Double> start) {
        this.start = start;
    }

    /**
     * @return state name to observation name to probability
     */
    @JsonProperty
    public Map<String, Map<String, Double>> getEmission() {
        return emission;
    }

    @JsonProperty
    public void setEmission(Map<String, Map<String, Double>> emission) {
        this.emission = emission;
    }

    /**
     * @return name of the previous state to name of the next state to probability
     */
    @JsonProperty
    public Map<String, Map<String, Double>> getTransition() {
        return transition;
    }

    @JsonProperty
    public void setTransition(Map<String, Map<String, Double>> transition) {
        this.transition = transition;
    }
}
