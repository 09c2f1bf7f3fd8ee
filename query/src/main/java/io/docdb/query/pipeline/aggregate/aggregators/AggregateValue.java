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
import io.docdb.json.Json;

/**
 * One projected value of a group: either an aggregate function or a scalar
 * (for example the grouping key itself) that is the same for every document of the group.
 */
abstract class AggregateValue {

    abstract void addValue(JsonNode value);

    abstract JsonNode result();

    abstract JsonNode continuationToken();

    /**
     * @param operator null for a scalar value
     */
    static AggregateValue create(@Nullable AggregateOperator operator, @Nullable JsonNode continuationToken) {
        if (operator == null) {
            return ScalarAggregateValue.create(continuationToken);
        }
        return new AggregateAggregateValue(Aggregators.create(operator, continuationToken));
    }

    private static final class AggregateAggregateValue extends AggregateValue {

        private final Aggregator aggregator;

        private AggregateAggregateValue(Aggregator aggregator) {
            this.aggregator = aggregator;
        }

        @Override
        void addValue(JsonNode value) {
            aggregator.aggregate(AggregateItem.itemOf(value));
        }

        @Override
        JsonNode result() {
            return aggregator.result();
        }

        @Override
        JsonNode continuationToken() {
            return aggregator.continuationToken();
        }
    }

    /**
     * Keeps the first value it sees.
     */
    private static final class ScalarAggregateValue extends AggregateValue {

        private static final String INITIALIZED = "initialized";
        private static final String VALUE = "value";

        private boolean initialized;
        private JsonNode value;

        private ScalarAggregateValue(boolean initialized, JsonNode value) {
            this.initialized = initialized;
            this.value = value;
        }

        static ScalarAggregateValue create(@Nullable JsonNode continuationToken) {
            if (continuationToken == null) {
                return new ScalarAggregateValue(false, Json.undefined());
            }
            JsonNode initialized = continuationToken.get(INITIALIZED);
            if (continuationToken.isObject() == false || initialized == null || initialized.isBoolean() == false) {
                throw MalformedContinuationTokenException.missingProperty(
                    "scalar aggregate token", INITIALIZED, continuationToken);
            }
            return new ScalarAggregateValue(initialized.booleanValue(), continuationToken.path(VALUE));
        }

        @Override
        void addValue(JsonNode value) {
            if (initialized == false) {
                this.value = value;
                initialized = true;
            }
        }

        @Override
        JsonNode result() {
            return value;
        }

        @Override
        JsonNode continuationToken() {
            ObjectNode token = Json.object();
            token.put(INITIALIZED, initialized);
            if (value.isMissingNode() == false) {
                token.set(VALUE, value);
            }
            return token;
        }
    }
}
