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

import java.util.LinkedHashMap;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.google.common.hash.HashCode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.ContentHash;
import io.docdb.json.Json;

/**
 * Values are de-duplicated by content, in order of first appearance.
 */
final class MakeSetAggregator implements Aggregator {

    private final Map<HashCode, JsonNode> globalSet = new LinkedHashMap<>();

    private MakeSetAggregator() {
    }

    static MakeSetAggregator create(@Nullable JsonNode continuationToken) {
        MakeSetAggregator aggregator = new MakeSetAggregator();
        if (continuationToken == null) {
            return aggregator;
        }
        if (continuationToken.isArray() == false) {
            throw MalformedContinuationTokenException.invalidShape("make set aggregator token", continuationToken);
        }
        aggregator.addAll(continuationToken);
        return aggregator;
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (localValue.isArray() == false) {
            throw new MalformedQueryResultException("an array partial", localValue);
        }
        addAll(localValue);
    }

    private void addAll(JsonNode values) {
        for (JsonNode value : values) {
            globalSet.putIfAbsent(ContentHash.of(value), value);
        }
    }

    @Override
    public JsonNode result() {
        return toArray();
    }

    @Override
    public JsonNode continuationToken() {
        return toArray();
    }

    private ArrayNode toArray() {
        ArrayNode array = Json.NODES.arrayNode(globalSet.size());
        for (JsonNode value : globalSet.values()) {
            array.add(value.deepCopy());
        }
        return array;
    }
}
