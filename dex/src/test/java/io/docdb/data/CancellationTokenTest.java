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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CancellationException;

import org.junit.Test;

public class CancellationTokenTest {

    @Test
    public void test_token_is_not_cancelled_initially() {
        CancellationToken token = CancellationToken.none();
        assertThat(token.isCancelled()).isFalse();
        token.throwIfCancelled();
    }

    @Test
    public void test_cancel_without_reason_raises_cancellation_exception() {
        CancellationToken token = CancellationToken.none();
        token.cancel();
        assertThat(token.isCancelled()).isTrue();
        assertThatThrownBy(token::throwIfCancelled).isExactlyInstanceOf(CancellationException.class);
    }

    @Test
    public void test_first_reason_wins() {
        CancellationToken token = CancellationToken.none();
        IllegalStateException first = new IllegalStateException("first");
        token.cancel(first);
        token.cancel(new IllegalStateException("second"));
        assertThat(token.reason()).isSameAs(first);
        assertThatThrownBy(token::throwIfCancelled).isSameAs(first);
    }
}
