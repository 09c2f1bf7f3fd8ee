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

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.exceptions.MalformedQueryResultException;

/**
 * Extracts the partial aggregates from a document of the rewritten query.
 *
 * <ul>
 *     <li>{@code SELECT VALUE}: {@code [{"item": <partial>}]}, a bare {@code {"item": <partial>}} is accepted too</li>
 *     <li>otherwise: {@code {"payload": {"alias": {"item": <partial>}, ...}}}</li>
 * </ul>
 */
final class RewrittenAggregateProjections {

    private static final String PAYLOAD = "payload";

    private RewrittenAggregateProjections() {
    }

    static JsonNode payloadOf(JsonNode document, boolean isValueQuery) {
        if (isValueQuery) {
            if (document.isArray() && document.isEmpty() == false) {
                return document.get(0);
            }
            if (document.isObject()) {
                return document;
            }
            throw new MalformedQueryResultException("an array with the aggregate item as first element", document);
        }
        JsonNode payload = document.get(PAYLOAD);
        if (document.isObject() == false || payload == null) {
            throw new MalformedQueryResultException("an object with a `payload` property", document);
        }
        return payload;
    }
}
