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

import java.util.concurrent.CancellationException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import io.docdb.common.exceptions.Exceptions;

/**
 * Cooperative cancellation signal handed down a chain of page iterators.
 * Iterators check it before doing work and at every step of a multi page loop.
 */
public final class CancellationToken {

    private volatile Throwable reason = null;

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancel(new CancellationException("Operation was cancelled"));
    }

    public void cancel(@NotNull Throwable reason) {
        if (this.reason == null) {
            this.reason = reason;
        }
    }

    public boolean isCancelled() {
        return reason != null;
    }

    @Nullable
    public Throwable reason() {
        return reason;
    }

    public void throwIfCancelled() {
        Throwable r = reason;
        if (r != null) {
            Exceptions.rethrowUnchecked(r);
        }
    }
}
