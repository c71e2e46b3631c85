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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The layers computed by the forward pass, one per time step. A decoder keeps the trellis in
 * its result only if asked to, see {@link ViterbiDecoder#ViterbiDecoder(ProbabilityScale, boolean)}.
 */
public class Trellis {
    private final List<TrellisLayer> layers;

    Trellis(int timeSteps) {
        layers = new ArrayList<>(timeSteps);
    }

    void add(TrellisLayer layer) {
        layers.add(layer);
    }

    public TrellisLayer getLayer(int timeStep) {
        return layers.get(timeStep);
    }

    public TrellisLayer getLastLayer() {
        if (layers.isEmpty())
            throw new IllegalStateException("Trellis is empty");
        return layers.get(layers.size() - 1);
    }

    public List<TrellisLayer> getLayers() {
        return Collections.unmodifiableList(layers);
    }

    public int size() {
        return layers.size();
    }
}
