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

import java.util.List;

import org.junit.Test;

public class CloseAssertingPageIteratorTest {

    @Test
    public void test_move_next_after_close_fails() {
        CloseAssertingPageIterator<String> it = InMemoryPageIterator.of(List.of(Outcome.success("a")));
        it.close();
        it.close();
        assertThat(it.isClosed()).isTrue();
        assertThat(it.moveNextAsync(CancellationToken.none())).isCompletedExceptionally();
    }

    @Test
    public void test_forwards_current_of_delegate() {
        CloseAssertingPageIterator<String> it = InMemoryPageIterator.of(List.of(Outcome.success("a")));
        assertThat(it.current()).isNull();
        assertThat(it.moveNextAsync(CancellationToken.none()).join()).isTrue();
        assertThat(it.current()).isEqualTo(Outcome.success("a"));
        assertThat(it.moveNextAsync(CancellationToken.none()).join()).isFalse();
        assertThat(it.current()).isNull();
    }
}
