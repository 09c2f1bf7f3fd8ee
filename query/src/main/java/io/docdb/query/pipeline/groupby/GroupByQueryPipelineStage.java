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
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;

import io.docdb.concurrent.CompletableFutures;
import io.docdb.data.CancellationToken;
import io.docdb.data.Outcome;
import io.docdb.data.PageIterators;
import io.docdb.exceptions.MalformedQueryResultException;
import io.docdb.pagination.PageState;
import io.docdb.pagination.QueryPage;
import io.docdb.query.pipeline.ContinuationTokens;
import io.docdb.query.pipeline.CreatePipelineStage;
import io.docdb.query.pipeline.EmptyQueryPipelineStage;
import io.docdb.query.pipeline.ExecutionEnvironment;
import io.docdb.query.pipeline.QueryPipelineStage;
import io.docdb.query.pipeline.QueryPipelineStageBase;
import io.docdb.query.pipeline.aggregate.aggregators.AggregateOperator;

/**
 * Groups the documents of all ranges and emits one result per group.
 *
 * Works in two phases: first every input page is added to the {@link GroupingTable}, then,
 * once the input is drained, the groups are emitted in pages of at most {@code pageSize} results.
 *
 * In the {@link ExecutionEnvironment#COMPUTE} environment the first phase returns one empty page per
 * input page, each with a continuation holding the grouping table and the input continuation.
 * In the {@link ExecutionEnvironment#CLIENT} environment the input is drained within the first call.
 */
public final class GroupByQueryPipelineStage extends QueryPipelineStageBase {

    private static final Logger LOGGER = LogManager.getLogger(GroupByQueryPipelineStage.class);

    private final ExecutionEnvironment environment;
    private final GroupingTable groupingTable;
    private final int pageSize;

    private boolean inputDrained = false;
    private boolean returnedLastPage = false;
    private double drainedRequestCharge = 0;

    private GroupByQueryPipelineStage(QueryPipelineStage inputStage,
                                      ExecutionEnvironment environment,
                                      GroupingTable groupingTable,
                                      int pageSize) {
        super(inputStage);
        this.environment = environment;
        this.groupingTable = groupingTable;
        this.pageSize = pageSize;
    }

    /**
     * @throws io.docdb.exceptions.MalformedContinuationTokenException if the continuation can't be decoded
     *         or a continuation is passed in the client environment
     */
    public static QueryPipelineStage create(ExecutionEnvironment environment,
                                            List<AggregateOperator> aggregates,
                                            Map<String, AggregateOperator> groupByAliasToAggregateType,
                                            List<String> orderedAliases,
                                            boolean hasSelectValue,
                                            int pageSize,
                                            @Nullable JsonNode continuationToken,
                                            CreatePipelineStage createSourceStage) {
        Preconditions.checkArgument(pageSize > 0, "pageSize must be greater than 0");
        GroupingTable groupingTable;
        QueryPipelineStage source;
        if (environment == ExecutionEnvironment.CLIENT) {
            ContinuationTokens.ensureNoContinuation(continuationToken, "Group by query");
            groupingTable = GroupingTable.create(
                aggregates, groupByAliasToAggregateType, orderedAliases, hasSelectValue, null);
            source = createSourceStage.create(null);
        } else if (continuationToken == null) {
            groupingTable = GroupingTable.create(
                aggregates, groupByAliasToAggregateType, orderedAliases, hasSelectValue, null);
            source = createSourceStage.create(null);
        } else {
            GroupByContinuationToken token = GroupByContinuationToken.fromJson(continuationToken);
            groupingTable = GroupingTable.create(
                aggregates,
                groupByAliasToAggregateType,
                orderedAliases,
                hasSelectValue,
                token.groupingTableContinuationToken());
            if (ContinuationTokens.isDone(token.sourceContinuationToken())) {
                source = new EmptyQueryPipelineStage();
            } else {
                source = createSourceStage.create(token.sourceContinuationToken());
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Resuming group by query with {} groups", groupingTable.size());
            }
        }
        return new GroupByQueryPipelineStage(source, environment, groupingTable, pageSize);
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        return CompletableFutures.supplySafely(() -> {
            cancellationToken.throwIfCancelled();
            if (returnedLastPage) {
                current = null;
                return CompletableFuture.completedFuture(false);
            }
            if (inputDrained) {
                emitGroups(0, null);
                return CompletableFuture.completedFuture(true);
            }
            return environment == ExecutionEnvironment.CLIENT
                ? drainInput(cancellationToken)
                : moveNextPage(cancellationToken);
        });
    }

    private CompletableFuture<Boolean> drainInput(CancellationToken cancellationToken) {
        return PageIterators.visit(inputStage, cancellationToken, hasNext -> {
            if (hasNext == false) {
                inputDrained = true;
                emitGroups(drainedRequestCharge, null);
                return false;
            }
            cancellationToken.throwIfCancelled();
            Outcome<QueryPage> outcome = inputStage.current();
            if (outcome.failed()) {
                current = outcome;
                return false;
            }
            QueryPage page = outcome.result();
            Throwable failure = addToTable(page);
            if (failure != null) {
                current = Outcome.failure(failure);
                return false;
            }
            drainedRequestCharge += page.requestCharge();
            return true;
        }).thenApply(ignored -> true);
    }

    private CompletableFuture<Boolean> moveNextPage(CancellationToken cancellationToken) {
        return inputStage.moveNextAsync(cancellationToken).thenApply(hasNext -> {
            if (hasNext == false) {
                inputDrained = true;
                emitGroups(0, null);
                return true;
            }
            Outcome<QueryPage> outcome = inputStage.current();
            if (outcome.failed()) {
                current = outcome;
                return true;
            }
            QueryPage page = outcome.result();
            Throwable failure = addToTable(page);
            if (failure != null) {
                current = Outcome.failure(failure);
                return true;
            }
            GroupByContinuationToken token = new GroupByContinuationToken(
                groupingTable.continuationToken(),
                ContinuationTokens.sourceTokenOf(page.state()));
            current = Outcome.success(new QueryPage(
                List.of(),
                page.requestCharge(),
                page.activityId(),
                null,
                new PageState(token.toJson())));
            return true;
        });
    }

    @Nullable
    private Throwable addToTable(QueryPage page) {
        try {
            List<RewrittenGroupByProjection> projections = new ArrayList<>(page.documents().size());
            for (JsonNode document : page.documents()) {
                projections.add(RewrittenGroupByProjection.of(document));
            }
            groupingTable.addPayloads(projections);
            if (LOGGER.isTraceEnabled()) {
                LOGGER.trace("Added {} documents, grouping table has {} groups", projections.size(), groupingTable.size());
            }
            return null;
        } catch (MalformedQueryResultException e) {
            return e;
        }
    }

    private void emitGroups(double requestCharge, @Nullable String activityId) {
        List<JsonNode> results = groupingTable.drain(pageSize);
        PageState state = null;
        String disallowContinuationTokenMessage = null;
        if (groupingTable.isDone()) {
            returnedLastPage = true;
        } else if (environment == ExecutionEnvironment.COMPUTE) {
            GroupByContinuationToken token = new GroupByContinuationToken(
                groupingTable.continuationToken(),
                ContinuationTokens.DONE);
            state = new PageState(token.toJson());
        }
        if (environment == ExecutionEnvironment.CLIENT) {
            disallowContinuationTokenMessage = ContinuationTokens.CLIENT_DISALLOW_CONTINUATION_MESSAGE;
        }
        current = Outcome.success(new QueryPage(
            results,
            requestCharge,
            activityId,
            disallowContinuationTokenMessage,
            state));
    }
}
