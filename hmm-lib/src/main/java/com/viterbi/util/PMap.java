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

import java.util.LinkedHashMap;

/**
 * A properties map (String to Object) holding the hints for a decoder or a command line run.
 * Keys are stored in under_score notation, values are converted to Boolean, Integer, Long,
 * Float or Double where the string allows it.
 */
public class PMap {
    private final LinkedHashMap<String, Object> map;

    public PMap() {
        this.map = new LinkedHashMap<>(5);
    }

    /**
     * Parses a string of the form "key1=value1|key2=value2".
     */
    public PMap(String propertiesString) {
        this();
        for (String s : propertiesString.split("\\|")) {
            s = s.trim();
            int index = s.indexOf("=");
            if (index < 0)
                continue;

            putObject(s.substring(0, index), Helper.toObject(s.substring(index + 1)));
        }
    }

    /**
     * Reads a PMap from a string array consisting of key=value pairs. Leading dashes of a key are
     * ignored, so "--model=x.json", "-model=x.json" and "model=x.json" are the same.
     */
    public static PMap read(String[] args) {
        PMap pMap = new PMap();
        for (String arg : args) {
            int index = arg.indexOf("=");
            if (index <= 0)
                continue;

            String key = arg.substring(0, index);
            while (key.startsWith("-")) {
                key = key.substring(1);
            }

            String value = arg.substring(index + 1);
            key = Helper.camelCaseToUnderScore(key);
            Object old = pMap.map.put(key, Helper.toObject(value));
            if (old != null)
                throw new IllegalArgumentException("Pair '" + key + "'='" + value + "' not possible to "
                        + "add to the PMap-object as the key already exists with '" + old + "'");
        }
        return pMap;
    }

    public PMap putObject(String key, Object object) {
        if (object == null)
            throw new NullPointerException("Value cannot be null");

        map.put(Helper.camelCaseToUnderScore(key), object);
        return this;
    }

    public boolean getBool(String key, boolean _default) {
        Object object = map.get(Helper.camelCaseToUnderScore(key));
        return object instanceof Boolean ? (Boolean) object : _default;
    }

    /**
     * Returns the string form of the value for any value type, e.g. also for a file name that
     * happened to be parsed as a number.
     */
    public String getString(String key, String _default) {
        Object object = map.get(Helper.camelCaseToUnderScore(key));
        return object == null ? _default : object.toString();
    }

    @Override
    public String toString() {
        return map.toString();
    }
}
