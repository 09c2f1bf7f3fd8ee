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

package io.docdb.pagination;

import java.util.ArrayList;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;

/**
 * Encodes the state of a cross partition read feed as an array of {@link FeedRangeContinuation}s.
 */
public final class CrossFeedRangeStateCodec {

    private CrossFeedRangeStateCodec() {
    }

    public static JsonNode toJson(CrossFeedRangeState state) {
        ArrayNode array = Json.NODES.arrayNode(state.feedRangeStates().size());
        for (FeedRangeState feedRangeState : state.feedRangeStates()) {
            array.add(FeedRangeContinuation.toJson(feedRangeState));
        }
        return array;
    }

    public static CrossFeedRangeState fromJson(@Nullable JsonNode json) {
        if (json == null || json.isArray() == false || json.isEmpty()) {
            throw MalformedContinuationTokenException.invalidShape("cross feed range state", json);
        }
        List<FeedRangeState> feedRangeStates = new ArrayList<>(json.size());
        for (JsonNode element : json) {
            feedRangeStates.add(FeedRangeContinuation.fromJson(element));
        }
        return new CrossFeedRangeState(feedRangeStates);
    }
}
