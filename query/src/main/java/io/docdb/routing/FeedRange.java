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

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.exceptions.MalformedContinuationTokenException;

/**
 * Identifies a slice of a container: an interval of effective partition keys,
 * a single logical partition key or a physical partition key range.
 */
public sealed interface FeedRange permits FeedRangeEpk, FeedRangePartitionKey, FeedRangePartitionKeyRange {

    String RANGE_PROPERTY = "Range";
    String PARTITION_KEY_PROPERTY = "PK";
    String PARTITION_KEY_RANGE_ID_PROPERTY = "PKRangeId";

    /**
     * @return the descriptor of this range, for example {@code {"Range": {"min": "", "max": "FF"}}}
     */
    JsonNode toJson();

    static FeedRange fromJson(JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape("feed range", json);
        }
        JsonNode range = json.get(RANGE_PROPERTY);
        if (range != null) {
            return FeedRangeEpk.fromRangeJson(range);
        }
        JsonNode partitionKey = json.get(PARTITION_KEY_PROPERTY);
        if (partitionKey != null) {
            return new FeedRangePartitionKey(partitionKey);
        }
        JsonNode rangeId = json.get(PARTITION_KEY_RANGE_ID_PROPERTY);
        if (rangeId != null && rangeId.isTextual()) {
            return new FeedRangePartitionKeyRange(rangeId.textValue());
        }
        throw MalformedContinuationTokenException.invalidShape("feed range", json);
    }
}
