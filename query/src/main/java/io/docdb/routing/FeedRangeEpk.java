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

package io.docdb.routing;

import java.util.Comparator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;

/**
 * Half open interval {@code [min, max)} of effective partition keys.
 * Keys are upper case hex strings compared lexicographically, {@code ""} is the smallest key
 * and {@code "FF"} is the exclusive upper bound of the key space.
 */
public record FeedRangeEpk(String min, String max) implements FeedRange {

    public static final String MINIMUM_INCLUSIVE = "";
    public static final String MAXIMUM_EXCLUSIVE = "FF";
    public static final FeedRangeEpk FULL_RANGE = new FeedRangeEpk(MINIMUM_INCLUSIVE, MAXIMUM_EXCLUSIVE);

    public static final Comparator<FeedRangeEpk> BY_MIN = Comparator.comparing(FeedRangeEpk::min);

    private static final String MIN_PROPERTY = "min";
    private static final String MAX_PROPERTY = "max";

    public FeedRangeEpk {
        Preconditions.checkNotNull(min, "min must not be null");
        Preconditions.checkNotNull(max, "max must not be null");
        Preconditions.checkArgument(min.compareTo(max) < 0, "range [%s,%s) is empty", min, max);
    }

    public boolean contains(FeedRangeEpk other) {
        return min.compareTo(other.min) <= 0 && other.max.compareTo(max) <= 0;
    }

    public boolean overlaps(FeedRangeEpk other) {
        return min.compareTo(other.max) < 0 && other.min.compareTo(max) < 0;
    }

    @Override
    public JsonNode toJson() {
        ObjectNode json = Json.object();
        json.set(RANGE_PROPERTY, toRangeJson());
        return json;
    }

    /**
     * @return {@code {"min": ..., "max": ...}}
     */
    public ObjectNode toRangeJson() {
        ObjectNode range = Json.object();
        range.put(MIN_PROPERTY, min);
        range.put(MAX_PROPERTY, max);
        return range;
    }

    public static FeedRangeEpk fromRangeJson(JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape("range", json);
        }
        JsonNode min = json.get(MIN_PROPERTY);
        if (min == null || min.isTextual() == false) {
            throw MalformedContinuationTokenException.missingProperty("range", MIN_PROPERTY, json);
        }
        JsonNode max = json.get(MAX_PROPERTY);
        if (max == null || max.isTextual() == false) {
            throw MalformedContinuationTokenException.missingProperty("range", MAX_PROPERTY, json);
        }
        if (min.textValue().compareTo(max.textValue()) >= 0) {
            throw MalformedContinuationTokenException.invalidShape("range", json);
        }
        return new FeedRangeEpk(min.textValue(), max.textValue());
    }

    @Override
    public String toString() {
        return "[" + min + "," + max + ")";
    }
}
