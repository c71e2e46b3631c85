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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.viterbi.hmm.HmmModel;
import com.viterbi.util.StopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

/**
 * Reads an {@link HmmModelFile} and builds the {@link HmmModel} it describes. NaN, Infinity and
 * -Infinity are accepted as numbers, so files with logarithmic probabilities can express
 * probability zero.
 */
public class HmmModelReader {
    private final Logger logger = LoggerFactory.getLogger(getClass());
    private final ObjectMapper objectMapper;

    public HmmModelReader() {
        this.objectMapper = JsonMapper.builder().enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS).build();
    }

    public HmmModel<Label, Label> read(File file) {
        StopWatch sw = new StopWatch("read " + file.getName()).start();
        HmmModel<Label, Label> model;
        try (Reader reader = Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8)) {
            model = read(reader);
        } catch (IOException ex) {
            throw new RuntimeException("Cannot read model file " + file.getAbsolutePath(), ex);
        }
        logger.info("loaded " + model + ", " + sw.stop());
        return model;
    }

    /**
     * @throws IllegalArgumentException if the document is malformed or references an unknown
     *                                  or ambiguous state or observation
     */
    public HmmModel<Label, Label> read(Reader reader) {
        HmmModelFile file;
        try {
            file = objectMapper.readValue(reader, HmmModelFile.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalArgumentException("Invalid model file: " + ex.getOriginalMessage(), ex);
        } catch (IOException ex) {
            throw new RuntimeException(ex);
        }
        if (file == null)
            throw new IllegalArgumentException("Invalid model file: empty document");
        return build(file);
    }

    public HmmModel<Label, Label> build(HmmModelFile file) {
        Map<String, Label> states = index("state", nullToEmpty(file.getStates()));
        Map<String, Label> observations = index("observation", nullToEmpty(file.getObservations()));

        HmmModel<Label, Label> model = new HmmModel<>();
        for (Label state : states.values()) {
            model.addState(state);
        }
        for (String name : nullToEmpty(file.getSequence())) {
            model.addObservation(lookup("observation", observations, name, "sequence"));
        }

        for (Map.Entry<String, Double> entry : nullToEmpty(file.getStart()).entrySet()) {
            model.putStartProbability(lookup("state", states, entry.getKey(), "start"),
                    probability(entry.getValue(), "start." + entry.getKey()));
        }
        for (Map.Entry<String, Map<String, Double>> row : nullToEmpty(file.getEmission()).entrySet()) {
            Label state = lookup("state", states, row.getKey(), "emission");
            for (Map.Entry<String, Double> entry : nullToEmpty(row.getValue()).entrySet()) {
                String path = "emission." + row.getKey() + "." + entry.getKey();
                model.putEmissionProbability(state, lookup("observation", observations, entry.getKey(), path),
                        probability(entry.getValue(), path));
            }
        }
        for (Map.Entry<String, Map<String, Double>> row : nullToEmpty(file.getTransition()).entrySet()) {
            Label from = lookup("state", states, row.getKey(), "transition");
            for (Map.Entry<String, Double> entry : nullToEmpty(row.getValue()).entrySet()) {
                String path = "transition." + row.getKey() + "." + entry.getKey();
                model.putTransitionProbability(from, lookup("state", states, entry.getKey(), path),
                        probability(entry.getValue(), path));
            }
        }
        return model;
    }

    private static Map<String, Label> index(String type, List<Label> labels) {
        Map<String, Label> byName = new LinkedHashMap<>();
        Set<Integer> ids = new HashSet<>();
        for (Label label : labels) {
            if (label == null || label.getName() == null)
                throw new IllegalArgumentException("Every " + type + " needs a name");
            if (byName.containsKey(label.getName()))
                throw new IllegalArgumentException("Duplicate " + type + " name '" + label.getName() + "'");
            if (!ids.add(label.getId()))
                throw new IllegalArgumentException("Duplicate " + type + " id " + label.getId() + " of '" + label.getName() + "'");
            byName.put(label.getName(), label);
        }
        return byName;
    }

    private static Label lookup(String type, Map<String, Label> labels, String name, String path) {
        Label label = labels.get(name);
        if (label == null)
            throw new IllegalArgumentException("Unknown " + type + " '" + name + "' in " + path);
        return label;
    }

    private static double probability(Double value, String path) {
        if (value == null)
            throw new IllegalArgumentException("Missing probability for " + path);
        return value;
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? Collections.emptyList() : list;
    }

    private static <K, V> Map<K, V> nullToEmpty(Map<K, V> map) {
        return map == null ? Collections.emptyMap() : map;
    }
}
