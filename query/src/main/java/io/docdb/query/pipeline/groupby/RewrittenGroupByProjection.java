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

package io.docdb.query.pipeline.groupby;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.exceptions.MalformedQueryResultException;

/**
 * A document of a rewritten group by query: {@code {"groupByItems": [...], "payload": ...}}.
 * The grouping key is the array of group by items.
 */
public record RewrittenGroupByProjection(JsonNode groupByItems, JsonNode payload) {

    private static final String GROUP_BY_ITEMS = "groupByItems";
    private static final String PAYLOAD = "payload";
    private static final String EXPECTED_SHAPE = "an object with `groupByItems` array and `payload`";

    public static RewrittenGroupByProjection of(JsonNode document) {
        if (document.isObject() == false) {
            throw new MalformedQueryResultException(EXPECTED_SHAPE, document);
        }
        JsonNode groupByItems = document.get(GROUP_BY_ITEMS);
        JsonNode payload = document.get(PAYLOAD);
        if (groupByItems == null || groupByItems.isArray() == false || payload == null) {
            throw new MalformedQueryResultException(EXPECTED_SHAPE, document);
        }
        return new RewrittenGroupByProjection(groupByItems, payload);
    }
}
