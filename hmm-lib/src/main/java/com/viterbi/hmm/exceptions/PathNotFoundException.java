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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown if the model is valid but assigns probability zero to every state sequence of the
 * observations. The subclasses tell at which time step the sequence stopped being explainable.
 */
public class PathNotFoundException extends RuntimeException implements HmmException {

    public static final String TIME_STEP = "time_step";

    protected final int timeStep;

    public PathNotFoundException(String message, int timeStep) {
        super(message);
        this.timeStep = timeStep;
    }

    /**
     * @return the first time step without any reachable state
     */
    public int getTimeStep() {
        return timeStep;
    }

    @Override
    public Map<String, Object> getDetails() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put(TIME_STEP, timeStep);
        return Collections.unmodifiableMap(details);
    }
}
