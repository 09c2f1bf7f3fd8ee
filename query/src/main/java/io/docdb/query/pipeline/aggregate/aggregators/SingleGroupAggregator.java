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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.json.Json;

/**
 * Aggregates all projected values of one group.
 *
 * <ul>
 *     <li>{@code SELECT VALUE AGG(...)}: the payload is the single wrapped partial aggregate
 *     and the result is the bare aggregate.</li>
 *     <li>{@code SELECT AGG(...) AS a, key AS k}: the payload is an object keyed by alias
 *     and the result is an object with the aliases in projection order. Undefined values are left out.</li>
 * </ul>
 */
public abstract class SingleGroupAggregator {

    /**
     * Folds the payload of one document.
     */
    public abstract void addValues(JsonNode values);

    /**
     * @return the result so far, undefined if there is none
     */
    public abstract JsonNode result();

    public abstract JsonNode continuationToken();

    /**
     * @param aggregates the aggregate functions of a {@code SELECT VALUE} query
     * @param aggregateAliasToAggregateType alias to aggregate operator, a null operator marks a scalar alias
     * @param orderedAliases the aliases in projection order
     * @param continuationToken state of a previous aggregator, null to start empty
     * @throws MalformedContinuationTokenException if the continuation token can't be decoded
     */
    public static SingleGroupAggregator create(List<AggregateOperator> aggregates,
                                               Map<String, AggregateOperator> aggregateAliasToAggregateType,
                                               List<String> orderedAliases,
                                               boolean hasSelectValue,
                                               @Nullable JsonNode continuationToken) {
        if (hasSelectValue) {
            AggregateOperator operator = aggregates.isEmpty() ? null : aggregates.get(0);
            return new SelectValueAggregateValues(AggregateValue.create(operator, continuationToken));
        }
        return SelectListAggregateValues.create(aggregateAliasToAggregateType, orderedAliases, continuationToken);
    }

    private static final class SelectValueAggregateValues extends SingleGroupAggregator {

        private final AggregateValue aggregateValue;

        private SelectValueAggregateValues(AggregateValue aggregateValue) {
            this.aggregateValue = aggregateValue;
        }

        @Override
        public void addValues(JsonNode values) {
            aggregateValue.addValue(values);
        }

        @Override
        public JsonNode result() {
            return aggregateValue.result();
        }

        @Override
        public JsonNode continuationToken() {
            return aggregateValue.continuationToken();
        }
    }

    private static final class SelectListAggregateValues extends SingleGroupAggregator {

        private final Map<String, AggregateValue> aliasToValue;
        private final List<String> orderedAliases;

        private SelectListAggregateValues(Map<String, AggregateValue> aliasToValue, List<String> orderedAliases) {
            this.aliasToValue = aliasToValue;
            this.orderedAliases = orderedAliases;
        }

        static SelectListAggregateValues create(Map<String, AggregateOperator> aggregateAliasToAggregateType,
                                                List<String> orderedAliases,
                                                @Nullable JsonNode continuationToken) {
            if (continuationToken != null && continuationToken.isObject() == false) {
                throw MalformedContinuationTokenException.invalidShape("select list aggregate token", continuationToken);
            }
            Map<String, AggregateValue> aliasToValue = new LinkedHashMap<>();
            for (String alias : orderedAliases) {
                JsonNode aliasToken = null;
                if (continuationToken != null) {
                    aliasToken = continuationToken.get(alias);
                    if (aliasToken == null) {
                        throw MalformedContinuationTokenException.missingProperty(
                            "select list aggregate token", alias, continuationToken);
                    }
                }
                aliasToValue.put(alias, AggregateValue.create(aggregateAliasToAggregateType.get(alias), aliasToken));
            }
            return new SelectListAggregateValues(aliasToValue, List.copyOf(orderedAliases));
        }

        @Override
        public void addValues(JsonNode values) {
            if (values.isObject() == false) {
                throw new MalformedQueryResultException("an object keyed by alias", values);
            }
            for (Map.Entry<String, AggregateValue> entry : aliasToValue.entrySet()) {
                entry.getValue().addValue(values.path(entry.getKey()));
            }
        }

        @Override
        public JsonNode result() {
            ObjectNode result = Json.object();
            for (String alias : orderedAliases) {
                JsonNode value = aliasToValue.get(alias).result();
                if (value.isMissingNode() == false) {
                    result.set(alias, value);
                }
            }
            return result;
        }

        @Override
        public JsonNode continuationToken() {
            ObjectNode token = Json.object();
            for (Map.Entry<String, AggregateValue> entry : aliasToValue.entrySet()) {
                token.set(entry.getKey(), entry.getValue().continuationToken());
            }
            return token;
        }
    }
}
