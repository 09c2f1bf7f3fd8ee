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

package io.docdb.query.pipeline.take;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;

/**
 * {@code {"TakeCount": <documents left>, "SourceToken": <input continuation>}}
 */
public record TakeContinuationToken(int takeCount, JsonNode sourceToken) {

    private static final String TOKEN_TYPE = "take continuation token";
    private static final String TAKE_COUNT = "TakeCount";
    private static final String SOURCE_TOKEN = "SourceToken";

    public JsonNode toJson() {
        ObjectNode json = Json.object();
        json.put(TAKE_COUNT, takeCount);
        json.set(SOURCE_TOKEN, sourceToken);
        return json;
    }

    public static TakeContinuationToken fromJson(@Nullable JsonNode json) {
        if (json == null || json.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape(TOKEN_TYPE, json);
        }
        JsonNode takeCount = json.get(TAKE_COUNT);
        if (takeCount == null || takeCount.canConvertToInt() == false || takeCount.isIntegralNumber() == false
            || takeCount.intValue() < 0) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, TAKE_COUNT, json);
        }
        JsonNode sourceToken = json.get(SOURCE_TOKEN);
        if (sourceToken == null || sourceToken.isNull()) {
            throw MalformedContinuationTokenException.missingProperty(TOKEN_TYPE, SOURCE_TOKEN, json);
        }
        return new TakeContinuationToken(takeCount.intValue(), sourceToken);
    }
}
