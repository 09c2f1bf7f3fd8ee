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
import io.docdb.json.Json;

final class SumAggregator implements Aggregator {

    private static final String UNDEFINED = "undefined";

    /**
     * NaN once a partial was not a number, the sum stays undefined from then on.
     */
    private double globalSum;

    private SumAggregator(double globalSum) {
        this.globalSum = globalSum;
    }

    static SumAggregator create(@Nullable JsonNode continuationToken) {
        if (continuationToken == null) {
            return new SumAggregator(0.0);
        }
        if (continuationToken.isNumber()) {
            return new SumAggregator(continuationToken.doubleValue());
        }
        if (continuationToken.isTextual() && UNDEFINED.equals(continuationToken.textValue())) {
            return new SumAggregator(Double.NaN);
        }
        throw MalformedContinuationTokenException.invalidShape("sum aggregator token", continuationToken);
    }

    @Override
    public void aggregate(JsonNode localValue) {
        if (Double.isNaN(globalSum)) {
            return;
        }
        if (localValue.isNumber() == false) {
            globalSum = Double.NaN;
            return;
        }
        globalSum += localValue.doubleValue();
    }

    @Override
    public JsonNode result() {
        return Double.isNaN(globalSum) ? Json.undefined() : Json.number(globalSum);
    }

    @Override
    public JsonNode continuationToken() {
        return Double.isNaN(globalSum) ? Json.text(UNDEFINED) : Json.number(globalSum);
    }
}
