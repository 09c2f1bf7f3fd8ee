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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

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
import io.docdb.query.pipeline.aggregate.aggregators.SingleGroupAggregator;

/**
 * Combines the partial aggregates of all ranges into a single result.
 *
 * <p>
 * In the {@link ExecutionEnvironment#CLIENT} environment the input is drained within the first call
 * and the result is the only page.
 * </p>
 * <p>
 * In the {@link ExecutionEnvironment#COMPUTE} environment every call folds a single input page and
 * returns an empty page whose continuation carries the aggregator state. Once the input is drained
 * the result is returned as the last page.
 * </p>
 */
public final class AggregateQueryPipelineStage extends QueryPipelineStageBase {

    private static final Logger LOGGER = LogManager.getLogger(AggregateQueryPipelineStage.class);

    private final ExecutionEnvironment environment;
    private final Function<JsonNode, SingleGroupAggregator> aggregatorFromToken;
    private final boolean isValueQuery;

    private SingleGroupAggregator aggregator;
    private double drainedRequestCharge = 0;
    private boolean returnedFinalPage = false;

    private AggregateQueryPipelineStage(QueryPipelineStage inputStage,
                                        ExecutionEnvironment environment,
                                        Function<JsonNode, SingleGroupAggregator> aggregatorFromToken,
                                        SingleGroupAggregator aggregator,
                                        boolean isValueQuery) {
        super(inputStage);
        this.environment = environment;
        this.aggregatorFromToken = aggregatorFromToken;
        this.aggregator = aggregator;
        this.isValueQuery = isValueQuery;
    }

    /**
     * @throws io.docdb.exceptions.MalformedContinuationTokenException if the continuation can't be decoded
     *         or a continuation is passed in the client environment
     */
    public static QueryPipelineStage create(ExecutionEnvironment environment,
                                            List<AggregateOperator> aggregates,
                                            Map<String, AggregateOperator> aliasToAggregateType,
                                            List<String> orderedAliases,
                                            boolean hasSelectValue,
                                            @Nullable JsonNode continuationToken,
                                            CreatePipelineStage createSourceStage) {
        Function<JsonNode, SingleGroupAggregator> aggregatorFromToken = token -> SingleGroupAggregator.create(
            aggregates, aliasToAggregateType, orderedAliases, hasSelectValue, token);

        SingleGroupAggregator aggregator;
        QueryPipelineStage source;
        if (environment == ExecutionEnvironment.CLIENT) {
            ContinuationTokens.ensureNoContinuation(continuationToken, "Aggregate query");
            aggregator = aggregatorFromToken.apply(null);
            source = createSourceStage.create(null);
        } else if (continuationToken == null) {
            aggregator = aggregatorFromToken.apply(null);
            source = createSourceStage.create(null);
        } else {
            AggregateContinuationToken token = AggregateContinuationToken.fromJson(continuationToken);
            aggregator = aggregatorFromToken.apply(token.singleGroupAggregatorContinuationToken());
            if (ContinuationTokens.isDone(token.sourceContinuationToken())) {
                source = new EmptyQueryPipelineStage();
            } else {
                source = createSourceStage.create(token.sourceContinuationToken());
            }
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Resuming aggregate query from {}", continuationToken);
            }
        }
        return new AggregateQueryPipelineStage(source, environment, aggregatorFromToken, aggregator, hasSelectValue);
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        return CompletableFutures.supplySafely(() -> {
            cancellationToken.throwIfCancelled();
            if (returnedFinalPage) {
                current = null;
                return CompletableFuture.completedFuture(false);
            }
            return environment == ExecutionEnvironment.CLIENT
                ? drainInput(cancellationToken)
                : moveNextPage(cancellationToken);
        });
    }

    private CompletableFuture<Boolean> drainInput(CancellationToken cancellationToken) {
        return PageIterators.visit(inputStage, cancellationToken, hasNext -> {
            if (hasNext == false) {
                emitFinalPage(drainedRequestCharge, null, ContinuationTokens.CLIENT_DISALLOW_CONTINUATION_MESSAGE);
                return false;
            }
            cancellationToken.throwIfCancelled();
            Outcome<QueryPage> outcome = inputStage.current();
            if (outcome.failed()) {
                current = outcome;
                return false;
            }
            QueryPage page = outcome.result();
            Throwable failure = fold(page);
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
                emitFinalPage(0, null, null);
                return true;
            }
            Outcome<QueryPage> outcome = inputStage.current();
            if (outcome.failed()) {
                current = outcome;
                return true;
            }
            QueryPage page = outcome.result();
            Throwable failure = fold(page);
            if (failure != null) {
                current = Outcome.failure(failure);
                return true;
            }
            AggregateContinuationToken token = new AggregateContinuationToken(
                aggregator.continuationToken(),
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

    /**
     * Folds all documents of the page or none of them.
     *
     * @return the failure if the page could not be folded
     */
    @Nullable
    private Throwable fold(QueryPage page) {
        List<JsonNode> payloads = new ArrayList<>(page.documents().size());
        try {
            for (JsonNode document : page.documents()) {
                payloads.add(RewrittenAggregateProjections.payloadOf(document, isValueQuery));
            }
        } catch (MalformedQueryResultException e) {
            return e;
        }
        JsonNode before = aggregator.continuationToken();
        try {
            for (JsonNode payload : payloads) {
                aggregator.addValues(payload);
            }
        } catch (MalformedQueryResultException e) {
            aggregator = aggregatorFromToken.apply(before);
            return e;
        }
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Folded {} partial aggregates", payloads.size());
        }
        return null;
    }

    private void emitFinalPage(double requestCharge,
                               @Nullable String activityId,
                               @Nullable String disallowContinuationTokenMessage) {
        JsonNode result = aggregator.result();
        List<JsonNode> documents = result.isMissingNode() ? List.of() : List.of(result);
        current = Outcome.success(new QueryPage(
            documents,
            requestCharge,
            activityId,
            disallowContinuationTokenMessage,
            null));
        returnedFinalPage = true;
    }
}
