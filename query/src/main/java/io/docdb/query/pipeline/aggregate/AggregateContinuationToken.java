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

package io.docdb.query.pipeline.aggregate;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;

/**
 * {@code {"SourceToken": <input continuation, null or "DONE">, "AggregationToken": <aggregator state>}}
 */
public record AggregateContinuationToken(JsonNode singleGroupAggregatorContinuationToken,
                                         @Nullable JsonNode sourceContinuationToken) {

    private static final String TOKEN_TYPE = "aggregate continuation token";
    static final String SOURCE_TOKEN = "SourceToken";
    static final String AGGREGATION_TOKEN = "AggregationToken";

    public JsonNode toJson() {
        ObjectNode json = Json.object();
        json.set(SOURCE_TOKEN, sourceContinuationToken);
        json.set(AGGREGATION_TOKEN, singleGroupAggregatorContinuationToken);
        return json;
    }

    public static AggregateContinuationToken fromJson(@Nullable JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape(TOKEN_TYPE, json);
        }
        if (json.has(SOURCE_TOKEN) == false) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, SOURCE_TOKEN, json);
        }
        JsonNode sourceToken = json.get(SOURCE_TOKEN);
        if (sourceToken.isNull()) {
            sourceToken = null;
        }
        JsonNode aggregationToken = json.get(AGGREGATION_TOKEN);
        if (aggregationToken == null || aggregationToken.isNull()) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, AGGREGATION_TOKEN, json);
        }
        return new AggregateContinuationToken(aggregationToken, sourceToken);
    }
}
