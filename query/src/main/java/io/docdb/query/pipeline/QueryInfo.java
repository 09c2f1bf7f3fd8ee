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

package io.docdb.query.pipeline;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.jetbrains.annotations.Nullable;

import io.docdb.query.pipeline.aggregate.aggregators.AggregateOperator;

/**
 * What the query plan tells the client about a query.
 *
 * @param rewrittenQuery the query every range runs, producing partial results
 * @param aggregates aggregate functions of a {@code SELECT VALUE} query
 * @param groupByAliasToAggregateType alias to aggregate operator, null operators mark scalar aliases
 * @param orderedAliases aliases in projection order
 * @param top maximum number of documents, null if unlimited
 */
public record QueryInfo(String rewrittenQuery,
                        List<AggregateOperator> aggregates,
                        Map<String, AggregateOperator> groupByAliasToAggregateType,
                        List<String> orderedAliases,
                        boolean hasSelectValue,
                        boolean hasGroupBy,
                        @Nullable Integer top) {

    public QueryInfo {
        aggregates = List.copyOf(aggregates);
        groupByAliasToAggregateType = Collections.unmodifiableMap(new LinkedHashMap<>(groupByAliasToAggregateType));
        orderedAliases = List.copyOf(orderedAliases);
    }

    public boolean hasAggregates() {
        return aggregates.isEmpty() == false
            || groupByAliasToAggregateType.values().stream().anyMatch(operator -> operator != null);
    }
}
