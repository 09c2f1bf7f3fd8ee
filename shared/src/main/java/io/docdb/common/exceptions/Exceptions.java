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

package io.docdb.common.exceptions;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import com.google.common.base.MoreObjects;
import com.google.common.util.concurrent.UncheckedExecutionException;

public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Strips the wrappers futures and caches put around the actual failure.
     */
    public static Throwable unwrap(@NotNull Throwable t) {
        int counter = 0;
        Throwable result = t;
        while (result instanceof CompletionException ||
               result instanceof UncheckedExecutionException ||
               result instanceof ExecutionException) {
            Throwable cause = result.getCause();
            if (cause == null || cause == result) {
                return result;
            }
            if (counter > 10) {
                return result;
            }
            counter++;
            result = cause;
        }
        return result;
    }

    public static String messageOf(@Nullable Throwable t) {
        if (t == null) {
            return "Unknown";
        }
        Throwable unwrapped = unwrap(t);
        return MoreObjects.firstNonNull(unwrapped.getMessage(), unwrapped.toString());
    }

    public static RuntimeException toRuntimeException(Throwable t) {
        Throwable unwrapped = unwrap(t);
        if (unwrapped instanceof RuntimeException runtimeException) {
            return runtimeException;
        }
        if (unwrapped instanceof Error error) {
            throw error;
        }
        return new RuntimeException(unwrapped);
    }

    /**
     * Throws {@code t} without wrapping, even if it is a checked exception.
     */
    public static <T> T rethrowUnchecked(Throwable t) {
        Exceptions.<RuntimeException>sneakyThrow(t);
        throw new AssertionError("unreachable");
    }

    @SuppressWarnings("unchecked")
    private static <E extends Throwable> void sneakyThrow(Throwable t) throws E {
        throw (E) t;
    }
}
