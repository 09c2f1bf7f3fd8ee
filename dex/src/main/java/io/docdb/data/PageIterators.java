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

package io.docdb.data;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Predicate;

import org.jetbrains.annotations.Nullable;

import io.docdb.common.exceptions.Exceptions;

public final class PageIterators {

    private PageIterators() {
    }

    /**
     * Drains the iterator and collects all pages.
     * The returned future fails with the first failure outcome the iterator reports.
     */
    public static <T> CompletableFuture<List<T>> collect(AsyncPageIterator<T> iterator,
                                                         CancellationToken cancellationToken) {
        List<T> pages = new ArrayList<>();
        List<Throwable> failures = new ArrayList<>(1);
        return visit(iterator, cancellationToken, hasNext -> {
            if (hasNext == false) {
                return false;
            }
            Outcome<T> outcome = iterator.current();
            assert outcome != null : "current() must be set after moveNextAsync returned true";
            if (outcome.failed()) {
                failures.add(outcome.exception());
                return false;
            }
            pages.add(outcome.result());
            return true;
        }).thenCompose(ignored -> failures.isEmpty()
            ? CompletableFuture.completedFuture(pages)
            : CompletableFuture.failedFuture(failures.get(0)));
    }

    /**
     * Moves the iterator forward until {@code onMoveNext} returns false.
     *
     * <p>
     * {@code onMoveNext} is called with the result of every {@link AsyncPageIterator#moveNextAsync}.
     * Moves that complete immediately are handled in a loop, only a move that is still pending
     * continues once it completes. A long run of ready pages runs in constant stack depth.
     * </p>
     *
     * The returned future fails if a move fails or {@code onMoveNext} throws.
     */
    public static CompletableFuture<Void> visit(AsyncPageIterator<?> iterator,
                                                CancellationToken cancellationToken,
                                                Predicate<Boolean> onMoveNext) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        visit(iterator, cancellationToken, onMoveNext, result, null);
        return result;
    }

    private static void visit(AsyncPageIterator<?> iterator,
                              CancellationToken cancellationToken,
                              Predicate<Boolean> onMoveNext,
                              CompletableFuture<Void> result,
                              @Nullable Boolean completedMove) {
        try {
            Boolean hasNext = completedMove;
            while (true) {
                if (hasNext != null && onMoveNext.test(hasNext) == false) {
                    result.complete(null);
                    return;
                }
                CompletableFuture<Boolean> move = iterator.moveNextAsync(cancellationToken);
                if (move.isDone() == false) {
                    move.whenComplete((next, t) -> {
                        if (t == null) {
                            visit(iterator, cancellationToken, onMoveNext, result, next);
                        } else {
                            result.completeExceptionally(Exceptions.unwrap(t));
                        }
                    });
                    return;
                }
                hasNext = move.join();
            }
        } catch (Throwable t) {
            result.completeExceptionally(Exceptions.unwrap(t));
        }
    }
}
