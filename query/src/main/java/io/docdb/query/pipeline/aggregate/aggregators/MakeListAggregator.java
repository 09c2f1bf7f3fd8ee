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
import com.fasterxml.jackson.databind.node.ArrayNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.Json;

final class MakeListAggregator implements Aggregator {

    private final ArrayNode globalList;

    private MakeListAggregator(ArrayNode globalList) {
        this.globalList = globalList;
    }

    static MakeListAggregator create(@Nullable JsonNode continuationToken) {
        if (continuationToken == null) {
            return new MakeListAggregator(Json.NODES.arrayNode());
        }
        if (continuationToken.isArray() == false) {
            throw MalformedContinuationTokenException.invalidShape("make list aggregator token", continuationToken);
        }
        return new MakeListAggregator(((ArrayNode) continuationToken).deepCopy());
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (localValue.isArray() == false) {
            throw new MalformedQueryResultException("an array partial", localValue);
        }
        globalList.addAll((ArrayNode) localValue);
    }

    @Override
    public JsonNode result() {
        return globalList.deepCopy();
    }

    @Override
    public JsonNode continuationToken() {
        return globalList.deepCopy();
    }
}
