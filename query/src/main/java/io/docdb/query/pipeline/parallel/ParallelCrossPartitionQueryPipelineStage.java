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

package io.docdb.query.pipeline.parallel;

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
import io.docdb.pagination.CrossFeedRangePage;
import io.docdb.pagination.CrossFeedRangeState;
import io.docdb.pagination.CrossPartitionRangePageAsyncEnumerator;
import io.docdb.pagination.Direction;
import io.docdb.pagination.DocumentContainer;
import io.docdb.pagination.FeedRangeState;
import io.docdb.pagination.PageState;
import io.docdb.pagination.QueryPage;
import io.docdb.pagination.QueryPartitionRangePageAsyncEnumerator;
import io.docdb.query.pipeline.QueryPipelineStage;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.PartitionMapper;
import io.docdb.routing.PartitionMapping;

/**
 * Source stage of a query: runs the rewritten query on every target range and passes the pages on
 * as they come, without merging them. The continuation lists the state of every range that still
 * has data.
 */
public final class ParallelCrossPartitionQueryPipelineStage implements QueryPipelineStage {

    private static final Logger LOGGER = LogManager.getLogger(ParallelCrossPartitionQueryPipelineStage.class);

    private final CrossPartitionRangePageAsyncEnumerator<QueryPage> crossPartitionEnumerator;
    @Nullable
    private Outcome<QueryPage> current;

    private ParallelCrossPartitionQueryPipelineStage(
            CrossPartitionRangePageAsyncEnumerator<QueryPage> crossPartitionEnumerator) {
        this.crossPartitionEnumerator = crossPartitionEnumerator;
    }

    /**
     * @param targetRanges the ranges the query has to read, as of now
     * @param continuationToken a continuation of a previous execution, possibly created with
     *                          a different set of ranges
     * @throws io.docdb.exceptions.MalformedContinuationTokenException if the continuation can't be decoded
     *         or doesn't fit the target ranges
     */
    public static QueryPipelineStage create(DocumentContainer documentContainer,
                                            PartitionMapper partitionMapper,
                                            String sqlQuery,
                                            List<FeedRangeEpk> targetRanges,
                                            int pageSize,
                                            Direction direction,
                                            @Nullable JsonNode continuationToken) {
        Preconditions.checkArgument(targetRanges.isEmpty() == false, "targetRanges must not be empty");
        CrossFeedRangeState state;
        if (continuationToken == null) {
            List<FeedRangeState> feedRangeStates = new ArrayList<>(targetRanges.size());
            for (FeedRangeEpk range : targetRanges) {
                feedRangeStates.add(new FeedRangeState(range, null));
            }
            state = new CrossFeedRangeState(feedRangeStates);
        } else {
            List<ParallelContinuationToken> tokens = ParallelContinuationToken.listFromJson(continuationToken);
            PartitionMapping<ParallelContinuationToken> mapping = partitionMapper.mapPartitions(targetRanges, tokens);
            state = resumeState(mapping, direction);
            if (LOGGER.isDebugEnabled()) {
                LOGGER.debug("Resuming parallel query on ranges {}", state.feedRangeStates());
            }
        }
        CrossPartitionRangePageAsyncEnumerator<QueryPage> enumerator = new CrossPartitionRangePageAsyncEnumerator<>(
            documentContainer,
            partitionMapper,
            feedRangeState -> new QueryPartitionRangePageAsyncEnumerator(
                documentContainer, sqlQuery, feedRangeState, pageSize),
            direction,
            state);
        return new ParallelCrossPartitionQueryPipelineStage(enumerator);
    }

    /**
     * Ranges are read one after another in enumeration order and the continuation lists every range
     * that still has data. The target is the listed range with the smallest start key.
     * Going forward, the ranges before the target are drained. Going in reverse, the ranges after the
     * target are drained unless the continuation lists them.
     */
    private static CrossFeedRangeState resumeState(PartitionMapping<ParallelContinuationToken> mapping,
                                                   Direction direction) {
        List<FeedRangeState> feedRangeStates = new ArrayList<>();
        if (direction == Direction.REVERSE) {
            addStates(feedRangeStates, mapping.mappingLeftOfTarget(), false);
        }
        addStates(feedRangeStates, mapping.targetMapping(), false);
        addStates(feedRangeStates, mapping.mappingRightOfTarget(), direction == Direction.REVERSE);
        return new CrossFeedRangeState(feedRangeStates);
    }

    private static void addStates(List<FeedRangeState> feedRangeStates,
                                  Map<FeedRangeEpk, ParallelContinuationToken> rangeToToken,
                                  boolean onlyListedRanges) {
        for (Map.Entry<FeedRangeEpk, ParallelContinuationToken> entry : rangeToToken.entrySet()) {
            ParallelContinuationToken token = entry.getValue();
            if (token == null && onlyListedRanges) {
                continue;
            }
            PageState state = token == null || token.token() == null ? null : new PageState(token.token());
            feedRangeStates.add(new FeedRangeState(entry.getKey(), state));
        }
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        return CompletableFutures.supplySafely(() -> {
            cancellationToken.throwIfCancelled();
            return crossPartitionEnumerator.moveNextAsync(cancellationToken).thenApply(hasNext -> {
                if (hasNext == false) {
                    current = null;
                    return false;
                }
                Outcome<CrossFeedRangePage<QueryPage>> outcome = crossPartitionEnumerator.current();
                if (outcome.failed()) {
                    current = Outcome.failure(outcome.exception());
                    return true;
                }
                QueryPage page = outcome.result().page();
                CrossFeedRangeState crossState = outcome.result().state();
                PageState state = crossState == null
                    ? null
                    : new PageState(ParallelContinuationToken.listToJson(crossState));
                current = Outcome.success(new QueryPage(
                    page.documents(),
                    page.requestCharge(),
                    page.activityId(),
                    page.disallowContinuationTokenMessage(),
                    state));
                return true;
            });
        });
    }

    @Nullable
    @Override
    public Outcome<QueryPage> current() {
        return current;
    }

    @Override
    public void close() {
        crossPartitionEnumerator.close();
    }
}
