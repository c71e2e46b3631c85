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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown if backtracking hits a state without a recorded predecessor. This means the forward
 * pass and the backtracking disagree, i.e. it is a bug and never caused by the model.
 */
public class InconsistentTrellisException extends IllegalStateException implements HmmException {

    private final int timeStep;
    private final int stateIndex;

    public InconsistentTrellisException(int timeStep, int stateIndex) {
        super("Backtracking failed at time step " + timeStep + ": state index " + stateIndex + " has no recorded predecessor");
        this.timeStep = timeStep;
        this.stateIndex = stateIndex;
    }

    public int getTimeStep() {
        return timeStep;
    }

    public int getStateIndex() {
        return stateIndex;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("time_step", timeStep);
        details.put("state_index", stateIndex);
        return details;
    }
}
