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

import com.viterbi.hmm.HmmModel;
import com.viterbi.hmm.MostLikelySequence;
import com.viterbi.hmm.ViterbiDecoder;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class HmmModelReaderTest {

    private static final Label HEALTHY = new Label(1, "Healthy");
    private static final Label FEVER = new Label(2, "Fever");

    private static HmmModel<Label, Label> readResource(String name) {
        Reader reader = new InputStreamReader(HmmModelReaderTest.class.getResourceAsStream("/" + name), StandardCharsets.UTF_8);
        return new HmmModelReader().read(reader);
    }

    private static HmmModel<Label, Label> createWeatherModel() {
        Label normal = new Label(1, "normal");
        Label cold = new Label(2, "cold");
        Label dizzy = new Label(3, "dizzy");
        HmmModel<Label, Label> model = new HmmModel<>();
        model.addState(HEALTHY).addState(FEVER);
        model.addObservation(normal).addObservation(cold).addObservation(dizzy);
        model.putStartProbability(HEALTHY, 0.6).putStartProbability(FEVER, 0.4);
        model.putEmissionProbability(HEALTHY, normal, 0.5);
        model.putEmissionProbability(HEALTHY, cold, 0.4);
        model.putEmissionProbability(HEALTHY, dizzy, 0.1);
        model.putEmissionProbability(FEVER, normal, 0.1);
        model.putEmissionProbability(FEVER, cold, 0.3);
        model.putEmissionProbability(FEVER, dizzy, 0.6);
        model.putTransitionProbability(HEALTHY, HEALTHY, 0.7);
        model.putTransitionProbability(HEALTHY, FEVER, 0.3);
        model.putTransitionProbability(FEVER, HEALTHY, 0.4);
        model.putTransitionProbability(FEVER, FEVER, 0.6);
        return model;
    }

    @Test
    public void testReadWeather() {
        HmmModel<Label, Label> model = readResource("weather.json");
        assertEquals(Arrays.asList(HEALTHY, FEVER), model.getStates());
        assertEquals(3, model.getObservationCount());
        assertEquals("dizzy", model.getObservation(2).getName());
        assertEquals(0.3, model.getTransitionProbability(HEALTHY.getId(), FEVER.getId()), 0);

        MostLikelySequence<Label> fromFile = new ViterbiDecoder().evalPath(model);
        MostLikelySequence<Label> fromBuilder = new ViterbiDecoder().evalPath(createWeatherModel());
        assertEquals(Arrays.asList(HEALTHY, HEALTHY, FEVER), fromFile.sequence);
        assertEquals(fromBuilder.sequence, fromFile.sequence);
        assertEquals(fromBuilder.probability, fromFile.probability, 0);
        assertEquals(0.01512, fromFile.probability, 0);
    }

    @Test
    public void testReadLogModelWithNegativeInfinity() {
        HmmModel<Label, Label> model = readResource("umbrella-log.json");
        assertEquals(Double.NEGATIVE_INFINITY, model.getStartProbability(3), 0);

        MostLikelySequence<Label> result = new ViterbiDecoder().evalPathLogProbabilities(model);
        assertEquals(Arrays.asList("Rain", "Rain", "Sun", "Rain"), Arrays.asList(result.sequence.get(0).getName(),
                result.sequence.get(1).getName(), result.sequence.get(2).getName(), result.sequence.get(3).getName()));
        assertEquals(0.0367416, Math.exp(result.probability), 1e-8);
    }

    @Test
    public void testReadFile(@TempDir File dir) throws Exception {
        File file = new File(dir, "model.json");
        java.nio.file.Files.write(file.toPath(), ("{\"states\": [{\"id\": 4, \"name\": \"s\"}],"
                + " \"observations\": [{\"id\": 9, \"name\": \"o\"}], \"sequence\": [\"o\", \"o\"],"
                + " \"start\": {\"s\": 1}, \"emission\": {\"s\": {\"o\": 0.5}}, \"transition\": {\"s\": {\"s\": 1}}}")
                .getBytes(StandardCharsets.UTF_8));

        HmmModel<Label, Label> model = new HmmModelReader().read(file);
        MostLikelySequence<Label> result = new ViterbiDecoder().evalPath(model);
        assertEquals(2, result.sequence.size());
        assertEquals(0.25, result.probability, 0);

        assertThrows(RuntimeException.class, () -> new HmmModelReader().read(new File(dir, "missing.json")));
    }

    @Test
    public void testMissingTablesAreEmpty() {
        HmmModel<Label, Label> model = new HmmModelReader().read(new StringReader("{\"states\": [{\"id\": 1, \"name\": \"s\"}]}"));
        assertEquals(1, model.getStateCount());
        assertEquals(0, model.getObservationCount());
        assertFalse(model.hasStartProbability(1));
    }

    @Test
    public void testUnknownNames() {
        String prefix = "{\"states\": [{\"id\": 1, \"name\": \"s\"}], \"observations\": [{\"id\": 1, \"name\": \"o\"}], ";
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
                () -> new HmmModelReader().read(new StringReader(prefix + "\"sequence\": [\"o\", \"p\"]}")));
        assertEquals("Unknown observation 'p' in sequence", ex.getMessage());

        ex = assertThrows(IllegalArgumentException.class,
                () -> new HmmModelReader().read(new StringReader(prefix + "\"start\": {\"t\": 1}}")));
        assertEquals("Unknown state 't' in start", ex.getMessage());

        ex = assertThrows(IllegalArgumentException.class,
                () -> new HmmModelReader().read(new StringReader(prefix + "\"emission\": {\"s\": {\"x\": 1}}}")));
        assertEquals("Unknown observation 'x' in emission.s.x", ex.getMessage());

        ex = assertThrows(IllegalArgumentException.class,
                () -> new HmmModelReader().read(new StringReader(prefix + "\"transition\": {\"s\": {\"t\": 1}}}")));
        assertEquals("Unknown state 't' in transition.s.t", ex.getMessage());
    }

    @Test
    public void testDuplicates() {
        assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(new StringReader(
                "{\"states\": [{\"id\": 1, \"name\": \"s\"}, {\"id\": 2, \"name\": \"s\"}]}")));
        assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(new StringReader(
                "{\"observations\": [{\"id\": 1, \"name\": \"o\"}, {\"id\": 1, \"name\": \"p\"}]}")));
    }

    @Test
    public void testMalformed() {
        assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(new StringReader("{\"states\": [")));
        assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(new StringReader("{\"unknown\": 1}")));
        assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(new StringReader("")));
        IllegalArgumentException ex = assertThrows(IllegalArgumentException.class, () -> new HmmModelReader().read(
                new StringReader("{\"states\": [{\"id\": 1, \"name\": \"s\"}], \"start\": {\"s\": null}}")));
        assertEquals("Missing probability for start.s", ex.getMessage());
    }
}
