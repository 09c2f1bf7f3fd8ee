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

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.Json;

/**
 * Partial aggregates arrive wrapped as {@code {"item": <partial>}}, a missing item is undefined.
 */
final class AggregateItem {

    static final String ITEM = "item";

    private AggregateItem() {
    }

    static JsonNode itemOf(JsonNode wrapped) {
        if (wrapped.isMissingNode()) {
            return Json.undefined();
        }
        if (wrapped.isObject() == false) {
            throw new MalformedQueryResultException("an object with an `item` property", wrapped);
        }
        return wrapped.path(ITEM);
    }
}
