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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.hash.HashCode;
import com.google.common.primitives.UnsignedBytes;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.ContentHash;
import io.docdb.json.Json;
import io.docdb.query.pipeline.aggregate.aggregators.AggregateOperator;
import io.docdb.query.pipeline.aggregate.aggregators.SingleGroupAggregator;

/**
 * Groups keyed by the 128 bit content hash of their group by items.
 *
 * Two different keys with the same hash end up in the same group. With a 128 bit hash
 * this is accepted as practically impossible.
 *
 * Groups are drained in ascending unsigned order of their hash, which makes the page
 * boundaries independent of the order the groups were created in.
 */
public final class GroupingTable {

    private static final Comparator<HashCode> HASH_ORDER =
        Comparator.comparing(HashCode::asBytes, UnsignedBytes.lexicographicalComparator());

    private final List<AggregateOperator> aggregates;
    private final Map<String, AggregateOperator> groupByAliasToAggregateType;
    private final List<String> orderedAliases;
    private final boolean hasSelectValue;
    private final Function<JsonNode, HashCode> hashFunction;
    private final TreeMap<HashCode, SingleGroupAggregator> table = new TreeMap<>(HASH_ORDER);

    private GroupingTable(List<AggregateOperator> aggregates,
                          Map<String, AggregateOperator> groupByAliasToAggregateType,
                          List<String> orderedAliases,
                          boolean hasSelectValue,
                          Function<JsonNode, HashCode> hashFunction) {
        this.aggregates = aggregates;
        this.groupByAliasToAggregateType = groupByAliasToAggregateType;
        this.orderedAliases = orderedAliases;
        this.hasSelectValue = hasSelectValue;
        this.hashFunction = hashFunction;
    }

    /**
     * @throws MalformedContinuationTokenException if the continuation token can't be decoded
     */
    public static GroupingTable create(List<AggregateOperator> aggregates,
                                       Map<String, AggregateOperator> groupByAliasToAggregateType,
                                       List<String> orderedAliases,
                                       boolean hasSelectValue,
                                       @Nullable JsonNode continuationToken) {
        return create(aggregates, groupByAliasToAggregateType, orderedAliases, hasSelectValue,
            ContentHash::of, continuationToken);
    }

    @VisibleForTesting
    static GroupingTable create(List<AggregateOperator> aggregates,
                                Map<String, AggregateOperator> groupByAliasToAggregateType,
                                List<String> orderedAliases,
                                boolean hasSelectValue,
                                Function<JsonNode, HashCode> hashFunction,
                                @Nullable JsonNode continuationToken) {
        GroupingTable groupingTable = new GroupingTable(
            aggregates, groupByAliasToAggregateType, orderedAliases, hasSelectValue, hashFunction);
        if (continuationToken == null) {
            return groupingTable;
        }
        if (continuationToken.isObject() == false) {
            throw MalformedContinuationTokenException.invalidShape("grouping table token", continuationToken);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = continuationToken.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            HashCode groupByKey;
            try {
                groupByKey = HashCode.fromString(field.getKey());
            } catch (IllegalArgumentException e) {
                throw new MalformedContinuationTokenException(
                    "Malformed grouping table token, invalid group key: " + field.getKey(), e);
            }
            groupingTable.table.put(groupByKey, groupingTable.newAggregator(field.getValue()));
        }
        return groupingTable;
    }

    private SingleGroupAggregator newAggregator(@Nullable JsonNode continuationToken) {
        return SingleGroupAggregator.create(
            aggregates, groupByAliasToAggregateType, orderedAliases, hasSelectValue, continuationToken);
    }

    public void addPayload(RewrittenGroupByProjection projection) {
        HashCode groupByKey = hashFunction.apply(projection.groupByItems());
        table.computeIfAbsent(groupByKey, k -> newAggregator(null)).addValues(projection.payload());
    }

    /**
     * Adds all projections or, if one of them can't be folded, none.
     */
    public void addPayloads(List<RewrittenGroupByProjection> projections) {
        Map<HashCode, JsonNode> touchedGroups = new HashMap<>();
        try {
            for (RewrittenGroupByProjection projection : projections) {
                HashCode groupByKey = hashFunction.apply(projection.groupByItems());
                if (touchedGroups.containsKey(groupByKey) == false) {
                    SingleGroupAggregator existing = table.get(groupByKey);
                    touchedGroups.put(groupByKey, existing == null ? null : existing.continuationToken());
                }
                addPayload(projection);
            }
        } catch (RuntimeException e) {
            for (Map.Entry<HashCode, JsonNode> touched : touchedGroups.entrySet()) {
                if (touched.getValue() == null) {
                    table.remove(touched.getKey());
                } else {
                    table.put(touched.getKey(), newAggregator(touched.getValue()));
                }
            }
            throw e;
        }
    }

    /**
     * Removes up to {@code maxItemCount} groups and returns their results.
     */
    public List<JsonNode> drain(int maxItemCount) {
        List<JsonNode> results = new ArrayList<>(Math.min(maxItemCount, table.size()));
        for (int i = 0; i < maxItemCount; i++) {
            Map.Entry<HashCode, SingleGroupAggregator> group = table.pollFirstEntry();
            if (group == null) {
                break;
            }
            JsonNode result = group.getValue().result();
            if (result.isMissingNode() == false) {
                results.add(result);
            }
        }
        return results;
    }

    public int size() {
        return table.size();
    }

    public boolean isDone() {
        return table.isEmpty();
    }

    public JsonNode continuationToken() {
        ObjectNode token = Json.object();
        for (Map.Entry<HashCode, SingleGroupAggregator> group : table.entrySet()) {
            token.set(group.getKey().toString(), group.getValue().continuationToken());
        }
        return token;
    }
}
