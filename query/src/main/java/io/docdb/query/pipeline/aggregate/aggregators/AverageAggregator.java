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
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.Json;

/**
 * Keeps sum and count apart, averages of averages would weigh ranges wrongly.
 * Partials look like {@code {"sum": 12, "count": 3}}; a partial without sum makes the average undefined.
 */
final class AverageAggregator implements Aggregator {

    private static final String SUM = "sum";
    private static final String COUNT = "count";

    @Nullable
    private Double sum;
    private long count;

    private AverageAggregator(@Nullable Double sum, long count) {
        this.sum = sum;
        this.count = count;
    }

    static AverageAggregator create(@Nullable JsonNode continuationToken) {
        if (continuationToken == null) {
            return new AverageAggregator(0.0, 0L);
        }
        if (continuationToken.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape("average aggregator token", continuationToken);
        }
        JsonNode count = continuationToken.get(COUNT);
        if (count == null || count.isIntegralNumber() == false) {
            throw MalformedContinuationTokenException.missingProperty(
                "average aggregator token", COUNT, continuationToken);
        }
        JsonNode sum = continuationToken.get(SUM);
        if (sum != null && sum.isNumber() == false) {
            throw MalformedContinuationTokenException.missingProperty(
                "average aggregator token", SUM, continuationToken);
        }
        return new AverageAggregator(sum == null ? null : sum.doubleValue(), count.longValue());
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (localValue.isObject() == false) {
            throw new MalformedQueryResultException("an average partial {\"sum\", \"count\"}", localValue);
        }
        JsonNode localCount = localValue.get(COUNT);
        if (localCount == null || localCount.isNumber() == false) {
            throw new MalformedQueryResultException("an average partial {\"sum\", \"count\"}", localValue);
        }
        if (localCount.longValue() == 0) {
            return;
        }
        JsonNode localSum = localValue.get(SUM);
        if (sum != null && localSum != null && localSum.isNumber()) {
            sum += localSum.doubleValue();
        } else {
            sum = null;
        }
        count += localCount.longValue();
    }

    @Override
    public JsonNode result() {
        if (sum == null || count <= 0) {
            return Json.undefined();
        }
        return Json.number(sum / count);
    }

    @Override
    public JsonNode continuationToken() {
        ObjectNode token = Json.object();
        if (sum != null) {
            token.set(SUM, Json.number(sum));
        }
        token.put(COUNT, count);
        return token;
    }
}
