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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

import org.junit.Test;

import com.google.common.util.concurrent.UncheckedExecutionException;

public class ExceptionsTest {

    @Test
    public void test_unwrap_strips_nested_future_wrappers() {
        IllegalStateException cause = new IllegalStateException("boom");
        Throwable wrapped = new CompletionException(new ExecutionException(new UncheckedExecutionException(cause)));
        assertThat(Exceptions.unwrap(wrapped)).isSameAs(cause);
    }

    @Test
    public void test_unwrap_keeps_wrapper_without_cause() {
        CompletionException e = new CompletionException("no cause", null);
        assertThat(Exceptions.unwrap(e)).isSameAs(e);
    }

    @Test
    public void test_message_of_falls_back_to_to_string() {
        assertThat(Exceptions.messageOf(null)).isEqualTo("Unknown");
        assertThat(Exceptions.messageOf(new CompletionException(new IllegalArgumentException())))
            .isEqualTo("java.lang.IllegalArgumentException");
        assertThat(Exceptions.messageOf(new IllegalArgumentException("bad token"))).isEqualTo("bad token");
    }

    @Test
    public void test_to_runtime_exception_wraps_checked_exceptions_only() {
        IllegalArgumentException runtime = new IllegalArgumentException("x");
        assertThat(Exceptions.toRuntimeException(new CompletionException(runtime))).isSameAs(runtime);

        IOException checked = new IOException("io");
        assertThat(Exceptions.toRuntimeException(checked)).hasCause(checked);
    }

    @Test
    public void test_rethrow_unchecked_throws_checked_exception_as_is() {
        IOException checked = new IOException("io");
        assertThatThrownBy(() -> Exceptions.rethrowUnchecked(checked)).isSameAs(checked);
    }
}
