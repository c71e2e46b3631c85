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
package com.viterbi.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class HelperTest {

    @Test
    public void testCamelCaseToUnderscore() {
        assertEquals("keep_trellis", Helper.camelCaseToUnderScore("keepTrellis"));
        assertEquals("test_case_t_b_d", Helper.camelCaseToUnderScore("testCaseTBD"));
        assertEquals("_test_case", Helper.camelCaseToUnderScore("TestCase"));

        assertEquals("_test_case", Helper.camelCaseToUnderScore("_test_case"));
        assertEquals("", Helper.camelCaseToUnderScore(""));
    }

    @Test
    public void testToObject() {
        assertEquals(true, Helper.toObject("true"));
        assertEquals(false, Helper.toObject("FALSE"));
        assertEquals(1, Helper.toObject("1"));
        assertEquals(10_000_000_000L, Helper.toObject("10000000000"));
        assertEquals(0.5f, Helper.toObject("0.5"));
        assertEquals("weather.json", Helper.toObject("weather.json"));
    }

    @Test
    public void testIsEmpty() {
        assertTrue(Helper.isEmpty(null));
        assertTrue(Helper.isEmpty("  "));
        assertFalse(Helper.isEmpty("x"));
    }
}
