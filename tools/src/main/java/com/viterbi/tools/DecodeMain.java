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

import com.viterbi.hmm.*;
import com.viterbi.hmm.exceptions.HmmException;
import com.viterbi.util.PMap;
import com.viterbi.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Decodes the observation sequence of a JSON model file and prints the most likely state
 * sequence, see {@link HmmModelFile} for the format.
 */
public class DecodeMain {

    public static void main(String[] args) {
        int status = new DecodeMain(System.out).start(PMap.read(args));
        if (status != 0)
            System.exit(status);
    }

    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final PrintStream out;

    public DecodeMain(PrintStream out) {
        this.out = out;
    }

    /**
     * @return the exit status, 0 on success and 1 if the model could not be read or decoded
     */
    public int start(PMap args) {
        String modelLocation = args.getString("model", "");
        if (modelLocation.isEmpty()) {
            out.println("Usage: decode the observation sequence of a model file\n"
                    + "java -jar viterbi-tools.jar model=weather.json\n"
                    + "java -jar viterbi-tools.jar model=weather-log.json scale=log keep_trellis=true\n");
            return 0;
        }

        logger.info("Configuration: " + args);
        try {
            ViterbiDecoder decoder = ViterbiDecoder.fromHints(args);
            HmmModel<Label, Label> model = new HmmModelReader().read(new File(modelLocation));

            StopWatch sw = new StopWatch("decode").start();
            MostLikelySequence<Label> result = decoder.decode(model);
            sw.stop();

            List<String> names = new ArrayList<>(result.sequence.size());
            for (Label state : result.sequence) {
                names.add(state.getName());
            }
            out.println(modelLocation);
            out.println("\t" + result.scale + " probability:\t" + result.probability);
            out.println("\tpath:\t" + String.join(", ", names));
            if (result.trellis != null)
                out.print(TrellisPrinter.format(result, model));
            logger.info("decoded " + model.getObservationCount() + " observations, " + sw);
            return 0;
        } catch (RuntimeException ex) {
            if (ex instanceof HmmException)
                logger.error("Cannot decode " + modelLocation + ": " + ex.getMessage() + ", details: "
                        + ((HmmException) ex).getDetails(), ex);
            else
                logger.error("Problem with file " + modelLocation + " Error: " + ex.getMessage(), ex);
            return 1;
        }
    }
}
