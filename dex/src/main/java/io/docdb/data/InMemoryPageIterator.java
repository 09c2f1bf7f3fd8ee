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

import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.Nullable;

import com.google.common.annotations.VisibleForTesting;

/**
 * AsyncPageIterator implementation that is backed by an {@link Iterable} of outcomes.
 */
public class InMemoryPageIterator<T> implements AsyncPageIterator<T> {

    private final Iterator<Outcome<T>> it;
    @Nullable
    private Outcome<T> current;

    public static <T> CloseAssertingPageIterator<T> empty() {
        return of(List.of());
    }

    public static <T> CloseAssertingPageIterator<T> of(Iterable<Outcome<T>> outcomes) {
        return new CloseAssertingPageIterator<>(new InMemoryPageIterator<>(outcomes));
    }

    @VisibleForTesting
    public InMemoryPageIterator(Iterable<Outcome<T>> outcomes) {
        this.it = outcomes.iterator();
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        try {
            cancellationToken.throwIfCancelled();
        } catch (Throwable t) {
            return CompletableFuture.failedFuture(t);
        }
        if (it.hasNext()) {
            current = it.next();
            return CompletableFuture.completedFuture(true);
        }
        current = null;
        return CompletableFuture.completedFuture(false);
    }

    @Nullable
    @Override
    public Outcome<T> current() {
        return current;
    }

    @Override
    public void close() {
    }
}
