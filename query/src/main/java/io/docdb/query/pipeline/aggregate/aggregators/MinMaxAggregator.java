/*
 * Licensed to Crate under one or more contributor license agreements.
 * See the NOTICE file distributed with this work for additional
 * information regarding copyright ownership.  Crate licenses this file
 * to you under the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.  You may
 * obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or
 * implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 *
 * However, if you have executed another commercial license agreement
 * with Crate these terms will supersede the license and you may use the
 * software solely pursuant to the terms of the relevant commercial
 * agreement.
 */

package io.docdb.query.pipeline.aggregate.aggregators;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.ItemComparator;
import io.docdb.json.Json;

/**
 * Partials are either plain values or {@code {"min": value, "count": n}} ({@code "max"} respectively),
 * where a count of 0 means the range had no values.
 * Arrays and objects can't be ordered, once one shows up the result is undefined.
 */
final class MinMaxAggregator implements Aggregator {

    private static final String COUNT = "count";
    private static final String STATE = "state";
    private static final String VALUE = "value";

    private enum State {
        EMPTY,
        VALUE,
        UNDEFINED
    }

    private final boolean isMin;
    private final String partialProperty;
    private State state;
    private JsonNode globalValue;

    private MinMaxAggregator(boolean isMin, State state, JsonNode globalValue) {
        this.isMin = isMin;
        this.partialProperty = isMin ? "min" : "max";
        this.state = state;
        this.globalValue = globalValue;
    }

    static MinMaxAggregator createMin(@Nullable JsonNode continuationToken) {
        return create(true, continuationToken);
    }

    static MinMaxAggregator createMax(@Nullable JsonNode continuationToken) {
        return create(false, continuationToken);
    }

    private static MinMaxAggregator create(boolean isMin, @Nullable JsonNode continuationToken) {
        if (continuationToken == null) {
            return new MinMaxAggregator(isMin, State.EMPTY, Json.undefined());
        }
        String tokenType = isMin ? "min aggregator token" : "max aggregator token";
        if (continuationToken.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape(tokenType, continuationToken);
        }
        JsonNode stateNode = continuationToken.get(STATE);
        State state;
        try {
            state = State.valueOf(stateNode == null ? "" : stateNode.asText());
        } catch (IllegalArgumentException e) {
            throw new MalformedContinuationTokenException("Malformed " + tokenType + ": " + continuationToken, e);
        }
        JsonNode value = continuationToken.path(VALUE);
        if (state == State.VALUE && ItemComparator.isPrimitive(value) == false) {
            throw MalformedContinuationTokenException.missingProperty(tokenType, VALUE, continuationToken);
        }
        return new MinMaxAggregator(isMin, state, state == State.VALUE ? value : Json.undefined());
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (state == State.UNDEFINED) {
            return;
        }
        JsonNode value = localValue;
        if (localValue.isObject() && localValue.has(COUNT)) {
            if (localValue.get(COUNT).asLong() == 0) {
                return;
            }
            value = localValue.path(partialProperty);
        }
        if (value.isMissingNode()) {
            return;
        }
        if (ItemComparator.isPrimitive(value) == false) {
            state = State.UNDEFINED;
            globalValue = Json.undefined();
            return;
        }
        if (state == State.EMPTY) {
            state = State.VALUE;
            globalValue = value;
            return;
        }
        int cmp = ItemComparator.INSTANCE.compare(value, globalValue);
        if (isMin ? cmp < 0 : cmp > 0) {
            globalValue = value;
        }
    }

    @Override
    public JsonNode result() {
        return state == State.VALUE ? globalValue : Json.undefined();
    }

    @Override
    public JsonNode continuationToken() {
        ObjectNode token = Json.object();
        token.put(STATE, state.name());
        if (state == State.VALUE) {
            token.set(VALUE, globalValue);
        }
        return token;
    }
}
