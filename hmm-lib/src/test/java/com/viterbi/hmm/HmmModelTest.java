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

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class HmmModelTest {

    @Test
    public void testLastWriteWins() {
        Symbol a = new Symbol(1, "a");
        Symbol b = new Symbol(2, "b");
        Symbol o = new Symbol(1, "o");
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        model.addState(a).addState(b).addObservation(o);

        model.putStartProbability(a, 0.2).putStartProbability(a, 0.8);
        model.putEmissionProbability(a, o, 0.1).putEmissionProbability(a, o, 0.9);
        model.putTransitionProbability(a, b, 0.3).putTransitionProbability(a, b, 0.4);

        assertEquals(0.8, model.getStartProbability(a.id), 0);
        assertEquals(0.9, model.getEmissionProbability(a.id, o.id), 0);
        assertEquals(0.4, model.getTransitionProbability(a.id, b.id), 0);
        assertFalse(model.hasTransitionProbability(b.id, a.id));
        assertFalse(model.hasStartProbability(b.id));
        assertEquals("states:2, observations:1, start probabilities:1, emission probabilities:1, transition probabilities:1",
                model.toString());
    }

    @Test
    public void testDuplicateStateIdKeepsSlot() {
        Symbol a = new Symbol(1, "a");
        Symbol b = new Symbol(2, "b");
        Symbol otherA = new Symbol(1, "a2");
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        model.addState(a).addState(b).addState(otherA);

        assertEquals(2, model.getStateCount());
        assertEquals(Arrays.asList(otherA, b), model.getStates());
        assertEquals(0, model.getStateIndex(1));
        assertEquals(1, model.getStateIndex(2));
        assertEquals(-1, model.getStateIndex(3));
    }

    @Test
    public void testProbabilitiesAreKeyedById() {
        Symbol a = new Symbol(1, "a");
        Symbol sameIdOtherName = new Symbol(1, "x");
        Symbol o = new Symbol(5, "o");
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        model.addState(a).addObservation(o);
        model.putEmissionProbability(sameIdOtherName, o, 0.5);
        assertTrue(model.hasEmissionProbability(a.id, o.id));
    }

    @Test
    public void testKeysOfNegativeIdsDoNotCollide() {
        assertNotEquals(HmmModel.toKey(-1, 0), HmmModel.toKey(0, -1));
        assertNotEquals(HmmModel.toKey(-1, -1), HmmModel.toKey(0, -1));
        assertNotEquals(HmmModel.toKey(1, 2), HmmModel.toKey(2, 1));

        Symbol minus = new Symbol(-1, "minus");
        Symbol zero = new Symbol(0, "zero");
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        model.addState(minus).addState(zero);
        model.putTransitionProbability(minus, zero, 0.25);
        model.putTransitionProbability(zero, minus, 0.75);
        model.putTransitionProbability(minus, minus, 0.5);
        assertEquals(0.25, model.getTransitionProbability(-1, 0), 0);
        assertEquals(0.75, model.getTransitionProbability(0, -1), 0);
        assertEquals(0.5, model.getTransitionProbability(-1, -1), 0);
        assertFalse(model.hasTransitionProbability(0, 0));
    }

    @Test
    public void testMissingEntries() {
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        assertThrows(IllegalArgumentException.class, () -> model.getStartProbability(1));
        assertThrows(IllegalArgumentException.class, () -> model.getEmissionProbability(1, 1));
        assertThrows(IllegalArgumentException.class, () -> model.getTransitionProbability(1, 1));
        assertThrows(NullPointerException.class, () -> model.addObservation(null));
    }

    @Test
    public void testObservationsKeepOrderAndRepetitions() {
        Symbol o1 = new Symbol(1, "o1");
        Symbol o2 = new Symbol(2, "o2");
        HmmModel<Symbol, Symbol> model = new HmmModel<>();
        model.addObservation(o1).addObservation(o2).addObservation(o1);
        assertEquals(3, model.getObservationCount());
        assertEquals(Arrays.asList(o1, o2, o1), model.getObservations());
        assertEquals(o2, model.getObservation(1));
        assertThrows(UnsupportedOperationException.class, () -> model.getObservations().clear());
    }
}
