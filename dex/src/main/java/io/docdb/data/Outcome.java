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

import java.util.Objects;
import java.util.function.Function;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import io.docdb.common.exceptions.Exceptions;

/**
 * Either the result of an operation or the failure that prevented it.
 */
public final class Outcome<T> {

    @Nullable
    private final T result;
    @Nullable
    private final Throwable exception;

    private Outcome(@Nullable T result, @Nullable Throwable exception) {
        this.result = result;
        this.exception = exception;
    }

    public static <T> Outcome<T> success(@NotNull T result) {
        return new Outcome<>(Objects.requireNonNull(result, "result must not be null"), null);
    }

    public static <T> Outcome<T> failure(@NotNull Throwable exception) {
        return new Outcome<>(null, Objects.requireNonNull(exception, "exception must not be null"));
    }

    public boolean succeeded() {
        return exception == null;
    }

    public boolean failed() {
        return exception != null;
    }

    public T result() {
        if (exception != null) {
            throw new IllegalStateException("Outcome is a failure, it has no result", exception);
        }
        return result;
    }

    public Throwable exception() {
        if (exception == null) {
            throw new IllegalStateException("Outcome is a success, it has no exception");
        }
        return exception;
    }

    /**
     * Returns the result or throws the failure unchanged.
     */
    public T getOrThrow() {
        if (exception != null) {
            return Exceptions.rethrowUnchecked(exception);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (exception != null) {
            return (Outcome<R>) this;
        }
        return success(mapper.apply(result));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Outcome<?> that = (Outcome<?>) o;
        return Objects.equals(result, that.result) && Objects.equals(exception, that.exception);
    }

    @Override
    public int hashCode() {
        return Objects.hash(result, exception);
    }

    @Override
    public String toString() {
        return exception == null ? "Success{" + result + '}' : "Failure{" + exception + '}';
    }
}
