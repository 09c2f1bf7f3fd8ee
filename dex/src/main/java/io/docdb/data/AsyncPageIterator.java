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

import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.Nullable;

/**
 * An iterator over pages that are produced asynchronously.
 *
 * A consumer pulls pages one at a time:
 *
 * <pre>
 *     it.moveNextAsync(cancellationToken).whenComplete((hasNext, t) -> {
 *         if (hasNext) {
 *             Outcome&lt;Page&gt; page = it.current();
 *             // either a page or a failure
 *         } else {
 *             // iterator is exhausted
 *         }
 *     });
 * </pre>
 *
 * Failures of the underlying data source are reported as a failed {@link Outcome} in {@link #current()}.
 * The returned future only completes exceptionally on cancellation or programming errors.
 *
 * Thread-safety notes:
 *
 * Concurrent usage of an AsyncPageIterator is not supported. A new call to {@link #moveNextAsync(CancellationToken)}
 * may only be issued once the future of the previous call completed.
 */
public interface AsyncPageIterator<T> extends AutoCloseable {

    /**
     * Advances the iterator to the next page.
     *
     * @return a future completing with true if {@link #current()} holds a new page or failure,
     *         false if the iterator is exhausted.
     */
    CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken);

    /**
     * @return the outcome of the last successful {@link #moveNextAsync(CancellationToken)} call,
     *         null before the first call or after the iterator got exhausted.
     */
    @Nullable
    Outcome<T> current();

    /**
     * Releases all resources. Calling close more than once has no effect.
     */
    @Override
    void close();
}
