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

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.Nullable;

import io.docdb.data.AsyncPageIterator;
import io.docdb.data.CancellationToken;
import io.docdb.data.Outcome;

/**
 * Pages through a single range. After every successful page the range state moves forward;
 * a failed page leaves it unchanged so the same page can be requested again.
 */
public abstract class PartitionRangePageAsyncEnumerator<P extends Page> implements AsyncPageIterator<P> {

    private FeedRangeState feedRangeState;
    private boolean hasMoreResults = true;
    @Nullable
    private Outcome<P> current;

    protected PartitionRangePageAsyncEnumerator(FeedRangeState feedRangeState) {
        this.feedRangeState = feedRangeState;
    }

    public FeedRangeState feedRangeState() {
        return feedRangeState;
    }

    protected abstract CompletableFuture<Outcome<P>> getNextPageAsync(FeedRangeState feedRangeState,
                                                                     CancellationToken cancellationToken);

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        try {
            cancellationToken.throwIfCancelled();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        if (hasMoreResults == false) {
            current = null;
            return CompletableFuture.completedFuture(false);
        }
        return getNextPageAsync(feedRangeState, cancellationToken).thenApply(outcome -> {
            if (outcome.succeeded()) {
                PageState state = outcome.result().state();
                feedRangeState = new FeedRangeState(feedRangeState.feedRange(), state);
                hasMoreResults = state != null;
            }
            current = outcome;
            return true;
        });
    }

    @Nullable
    @Override
    public Outcome<P> current() {
        return current;
    }

    @Override
    public void close() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + feedRangeState + '}';
    }
}
