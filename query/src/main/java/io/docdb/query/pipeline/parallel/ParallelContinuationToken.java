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

package io.docdb.query.pipeline.parallel;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;
import io.docdb.pagination.CrossFeedRangeState;
import io.docdb.pagination.FeedRangeState;
import io.docdb.pagination.PageState;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.PartitionedToken;

/**
 * Continuation of one range of a parallel query: {@code {"token": <state or null>, "range": {"min", "max"}}}.
 * The continuation of the whole query is an array of these, one per range that still has data.
 */
public record ParallelContinuationToken(@Nullable JsonNode token, FeedRangeEpk range) implements PartitionedToken {

    private static final String TOKEN_TYPE = "parallel continuation token";
    private static final String TOKEN = "token";
    private static final String RANGE = "range";

    public JsonNode toJson() {
        ObjectNode json = Json.object();
        json.set(TOKEN, token == null ? NullNode.getInstance() : token);
        json.set(RANGE, range.toRangeJson());
        return json;
    }

    public static ParallelContinuationToken fromJson(@Nullable JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape(TOKEN_TYPE, json);
        }
        if (json.has(TOKEN) == false) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, TOKEN, json);
        }
        JsonNode token = json.get(TOKEN);
        JsonNode range = json.get(RANGE);
        if (range == null) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, RANGE, json);
        }
        return new ParallelContinuationToken(token.isNull() ? null : token, FeedRangeEpk.fromRangeJson(range));
    }

    public static List<ParallelContinuationToken> listFromJson(@Nullable JsonNode json) {
        if (json == null || json.isArray() == false || json.isEmpty()) {
            throw MalformedContinuationTokenException.invalidShape("parallel continuation token list", json);
        }
        List<ParallelContinuationToken> tokens = new ArrayList<>(json.size());
        for (JsonNode element : json) {
            tokens.add(fromJson(element));
        }
        return tokens;
    }

    public static JsonNode listToJson(CrossFeedRangeState state) {
        ArrayNode array = Json.NODES.arrayNode(state.feedRangeStates().size());
        for (FeedRangeState feedRangeState : state.feedRangeStates()) {
            if (feedRangeState.feedRange() instanceof FeedRangeEpk epk) {
                PageState pageState = feedRangeState.state();
                array.add(new ParallelContinuationToken(pageState == null ? null : pageState.value(), epk).toJson());
            } else {
                throw new IllegalStateException(
                    "Parallel queries run on effective partition key ranges, got: " + feedRangeState.feedRange());
            }
        }
        return array;
    }
}
