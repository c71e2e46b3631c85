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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.viterbi.hmm.Identifiable;

/**
 * A state or observation of a model file, identified by its id and referenced by its name in
 * the probability tables of the file.
 */
public class Label implements Identifiable {
    private int id;
    private String name;

    public Label() {
    }

    public Label(int id, String name) {
        this.id = id;
        this.name = name;
    }

    @JsonProperty
    @Override
    public int getId() {
        return id;
    }

    @JsonProperty
    public void setId(int id) {
        this.id = id;
    }

    @JsonProperty
    public String getName() {
        return name;
    }

    @JsonProperty
    public void setName(String name) {
        this.name = name;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null || getClass() != obj.getClass())
            return false;
        Label other = (Label) obj;
        return id == other.id && (name == null ? other.name == null : name.equals(other.name));
    }

    @Override
    public int hashCode() {
        return 31 * id + (name == null ? 0 : name.hashCode());
    }

    @Override
    public String toString() {
        return name;
    }
}
