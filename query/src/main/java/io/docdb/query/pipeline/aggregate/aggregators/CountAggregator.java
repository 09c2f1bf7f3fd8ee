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

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.Json;

final class CountAggregator implements Aggregator {

    private long globalCount;

    private CountAggregator(long globalCount) {
        this.globalCount = globalCount;
    }

    static CountAggregator create(@Nullable JsonNode continuationToken) {
        if (continuationToken == null) {
            return new CountAggregator(0L);
        }
        if (continuationToken.isIntegralNumber() == false) {
            throw MalformedContinuationTokenException.invalidShape("count aggregator token", continuationToken);
        }
        return new CountAggregator(continuationToken.longValue());
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (localValue.isNumber() == false) {
            throw new MalformedQueryResultException("a numeric partial count", localValue);
        }
        globalCount += localValue.longValue();
    }

    @Override
    public JsonNode result() {
        return Json.number(globalCount);
    }

    @Override
    public JsonNode continuationToken() {
        return Json.number(globalCount);
    }
}
