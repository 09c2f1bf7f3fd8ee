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

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;
import io.docdb.routing.FeedRange;

/**
 * Serialized form of a {@link FeedRangeState}: {@code {"FeedRange": <range>, "State": <state or null>}}.
 */
public final class FeedRangeContinuation {

    static final String FEED_RANGE_PROPERTY = "FeedRange";
    static final String STATE_PROPERTY = "State";

    private FeedRangeContinuation() {
    }

    public static JsonNode toJson(FeedRangeState feedRangeState) {
        ObjectNode json = Json.object();
        json.set(FEED_RANGE_PROPERTY, feedRangeState.feedRange().toJson());
        PageState state = feedRangeState.state();
        json.set(STATE_PROPERTY, state == null ? NullNode.getInstance() : state.value());
        return json;
    }

    public static FeedRangeState fromJson(@Nullable JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape("feed range continuation", json);
        }
        JsonNode feedRange = json.get(FEED_RANGE_PROPERTY);
        if (feedRange == null) {
            throw MalformedContinuationTokenException.missingProperty(
                "feed range continuation", FEED_RANGE_PROPERTY, json);
        }
        if (json.has(STATE_PROPERTY) == false) {
            throw MalformedContinuationTokenException.missingProperty(
                "feed range continuation", STATE_PROPERTY, json);
        }
        JsonNode state = json.get(STATE_PROPERTY);
        return new FeedRangeState(FeedRange.fromJson(feedRange), state.isNull() ? null : new PageState(state));
    }
}
