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

/**
 * Renders a {@link Trellis} for debugging. Each time step is printed as a block of
 * "state: score <- previous state" lines in the order of the layer.
 */
public class TrellisPrinter {
    private TrellisPrinter() {
    }

    /**
     * @throws IllegalStateException if the decoder did not keep the trellis
     */
    public static String format(MostLikelySequence<?> result, HmmModel<?, ?> model) {
        if (result.trellis == null)
            throw new IllegalStateException("Trellis was not recorded, create the decoder with keepTrellis=true");
        return format(result.trellis, model, result.scale);
    }

    public static String format(Trellis trellis, HmmModel<?, ?> model, ProbabilityScale scale) {
        final StringBuilder sb = new StringBuilder();
        sb.append("Trellis with ").append(scale).append(" probabilities\n\n");
        for (int timeStep = 0; timeStep < trellis.size(); timeStep++) {
            TrellisLayer layer = trellis.getLayer(timeStep);
            sb.append("Time step ").append(timeStep).append(", observation ")
                    .append(model.getObservation(timeStep)).append("\n");
            for (int slot = 0; slot < layer.size(); slot++) {
                sb.append(model.getState(layer.getStateIndex(slot))).append(": ").append(layer.getScore(slot));
                int predecessor = layer.getPredecessor(slot);
                if (predecessor != TrellisLayer.NO_PREDECESSOR)
                    sb.append(" <- ").append(model.getState(predecessor));
                sb.append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
