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

package io.docdb.pagination;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import io.docdb.common.exceptions.Exceptions;
import io.docdb.concurrent.CompletableFutures;
import io.docdb.data.AsyncPageIterator;
import io.docdb.data.CancellationToken;
import io.docdb.data.Outcome;
import io.docdb.exceptions.FeedRangeGoneException;
import io.docdb.routing.FeedRange;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.PartitionMapper;

/**
 * Reads a feed that spans several ranges, one page at a time.
 *
 * <p>
 * Every pull reads the next page of the range that comes first according to
 * {@link PartitionRangePageAsyncEnumeratorComparator}. The returned page carries the state of all
 * ranges that still have data, so the enumeration can be resumed from any page.
 * </p>
 *
 * <p>
 * If a range is reported gone because its partition was split or merged, the {@link PartitionMapper}
 * places it onto the ranges that serve its keys now. These continue from the state of the gone range
 * and never cover a key another queued range covers.
 * </p>
 */
public final class CrossPartitionRangePageAsyncEnumerator<P extends Page>
    implements AsyncPageIterator<CrossFeedRangePage<P>> {

    private static final Logger LOGGER = LogManager.getLogger(CrossPartitionRangePageAsyncEnumerator.class);

    private final FeedRangeProvider feedRangeProvider;
    private final PartitionMapper partitionMapper;
    private final Function<FeedRangeState, PartitionRangePageAsyncEnumerator<P>> createPartitionRangeEnumerator;
    private final PartitionRangePageAsyncEnumeratorComparator comparator;
    @Nullable
    private final CrossFeedRangeState initialState;

    @Nullable
    private PriorityQueue<PartitionRangePageAsyncEnumerator<P>> enumerators;
    @Nullable
    private Outcome<CrossFeedRangePage<P>> current;

    /**
     * @param state where to resume from, null to start with all ranges of the provider
     */
    public CrossPartitionRangePageAsyncEnumerator(
            FeedRangeProvider feedRangeProvider,
            PartitionMapper partitionMapper,
            Function<FeedRangeState, PartitionRangePageAsyncEnumerator<P>> createPartitionRangeEnumerator,
            Direction direction,
            @Nullable CrossFeedRangeState state) {
        this.feedRangeProvider = feedRangeProvider;
        this.partitionMapper = partitionMapper;
        this.createPartitionRangeEnumerator = createPartitionRangeEnumerator;
        this.comparator = new PartitionRangePageAsyncEnumeratorComparator(direction);
        this.initialState = state;
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        return CompletableFutures.supplySafely(() -> {
            cancellationToken.throwIfCancelled();
            if (enumerators == null) {
                return initialize(cancellationToken).thenCompose(ignored -> moveNext(cancellationToken));
            }
            return moveNext(cancellationToken);
        });
    }

    private CompletableFuture<Void> initialize(CancellationToken cancellationToken) {
        if (initialState != null) {
            enumerators = new PriorityQueue<>(comparator);
            for (FeedRangeState feedRangeState : initialState.feedRangeStates()) {
                enqueue(createPartitionRangeEnumerator.apply(feedRangeState));
            }
            return CompletableFuture.completedFuture(null);
        }
        return feedRangeProvider.getFeedRangesAsync(cancellationToken).thenAccept(ranges -> {
            enumerators = new PriorityQueue<>(comparator);
            for (FeedRangeEpk range : ranges) {
                enqueue(createPartitionRangeEnumerator.apply(new FeedRangeState(range, null)));
            }
        });
    }

    private CompletableFuture<Boolean> moveNext(CancellationToken cancellationToken) {
        cancellationToken.throwIfCancelled();
        PartitionRangePageAsyncEnumerator<P> enumerator = enumerators.poll();
        if (enumerator == null) {
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        return enumerator.moveNextAsync(cancellationToken).thenCompose(hasNext -> {
            if (hasNext == false) {
                enumerator.close();
                return moveNext(cancellationToken);
            }
            Outcome<P> outcome = enumerator.current();
            assert outcome != null : "current() must be set after moveNextAsync returned true";
            if (outcome.failed()) {
                Throwable t = Exceptions.unwrap(outcome.exception());
                if (t instanceof FeedRangeGoneException) {
                    return handleGoneRange(enumerator, outcome.exception(), cancellationToken);
                }
                enqueue(enumerator);
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Reading range {} failed: {}",
                        enumerator.feedRangeState().feedRange(), Exceptions.messageOf(t));
                }
                current = Outcome.failure(outcome.exception());
                return CompletableFuture.completedFuture(true);
            }

            if (enumerator.feedRangeState().state() != null) {
                enqueue(enumerator);
            } else {
                enumerator.close();
            }
            current = Outcome.success(new CrossFeedRangePage<>(outcome.result(), currentState()));
            return CompletableFuture.completedFuture(true);
        });
    }

    private CompletableFuture<Boolean> handleGoneRange(PartitionRangePageAsyncEnumerator<P> enumerator,
                                                   Throwable goneFailure,
                                                   CancellationToken cancellationToken) {
        FeedRangeState parentState = enumerator.feedRangeState();
        FeedRange parentRange = parentState.feedRange();
        return feedRangeProvider.getChildRangesAsync(parentRange, cancellationToken)
            .thenCompose(childRanges -> {
                if (childRanges.size() > 1) {
                    return CompletableFuture.completedFuture(childRanges);
                }
                // The topology may be cached and stale, refresh once before trusting it.
                return feedRangeProvider.refreshProviderAsync(cancellationToken)
                    .thenCompose(ignored -> feedRangeProvider.getChildRangesAsync(parentRange, cancellationToken));
            })
            .thenCompose(childRanges -> {
                if (childRanges.isEmpty()) {
                    throw new IllegalStateException("Got no child ranges for gone range " + parentRange);
                }
                if (childRanges.size() == 1 && childRanges.get(0).equals(parentRange)) {
                    enqueue(enumerator);
                    current = Outcome.failure(goneFailure);
                    return CompletableFuture.completedFuture(true);
                }
                List<? extends FeedRange> replacements = parentRange instanceof FeedRangeEpk epk
                    ? partitionMapper.mapGoneRange(epk, childRanges)
                    : childRanges;
                if (replacements.isEmpty()) {
                    throw new IllegalStateException(
                        "Child ranges " + childRanges + " don't overlap gone range " + parentRange);
                }
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Range {} is gone, continuing on ranges {}", parentRange, replacements);
                }
                enumerator.close();
                for (FeedRange replacement : replacements) {
                    enqueue(createPartitionRangeEnumerator.apply(new FeedRangeState(replacement, parentState.state())));
                }
                return moveNext(cancellationToken);
            });
    }

    private void enqueue(PartitionRangePageAsyncEnumerator<P> enumerator) {
        FeedRange feedRange = enumerator.feedRangeState().feedRange();
        for (PartitionRangePageAsyncEnumerator<P> queued : enumerators) {
            if (queued.feedRangeState().feedRange().equals(feedRange)) {
                throw new IllegalStateException("Range " + feedRange + " is already being enumerated");
            }
        }
        enumerators.add(enumerator);
    }

    @Nullable
    private CrossFeedRangeState currentState() {
        if (enumerators.isEmpty()) {
            return null;
        }
        List<PartitionRangePageAsyncEnumerator<P>> ordered = new ArrayList<>(enumerators);
        ordered.sort(comparator);
        List<FeedRangeState> feedRangeStates = new ArrayList<>(ordered.size());
        for (PartitionRangePageAsyncEnumerator<P> enumerator : ordered) {
            feedRangeStates.add(enumerator.feedRangeState());
        }
        return new CrossFeedRangeState(feedRangeStates);
    }

    @Nullable
    @Override
    public Outcome<CrossFeedRangePage<P>> current() {
        return current;
    }

    @Override
    public void close() {
        if (enumerators != null) {
            for (PartitionRangePageAsyncEnumerator<P> enumerator : enumerators) {
                enumerator.close();
            }
            enumerators.clear();
        }
    }
}
