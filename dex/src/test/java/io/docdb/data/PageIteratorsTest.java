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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.Test;

public class PageIteratorsTest {

    @Test
    public void test_collect_returns_all_pages_in_order() throws Exception {
        AsyncPageIterator<String> it = InMemoryPageIterator.of(List.of(
            Outcome.success("a"),
            Outcome.success("b"),
            Outcome.success("c")));

        CompletableFuture<List<String>> pages = PageIterators.collect(it, CancellationToken.none());
        assertThat(pages.get(5, TimeUnit.SECONDS)).containsExactly("a", "b", "c");
    }

    @Test
    public void test_collect_fails_on_first_failure_outcome() {
        AsyncPageIterator<String> it = InMemoryPageIterator.of(List.of(
            Outcome.success("a"),
            Outcome.failure(new IllegalStateException("page 2 failed")),
            Outcome.success("c")));

        CompletableFuture<List<String>> pages = PageIterators.collect(it, CancellationToken.none());
        assertThatThrownBy(() -> pages.get(5, TimeUnit.SECONDS))
            .isExactlyInstanceOf(ExecutionException.class)
            .hasRootCauseMessage("page 2 failed");
    }

    @Test
    public void test_collect_of_empty_iterator_is_empty() throws Exception {
        assertThat(PageIterators.collect(InMemoryPageIterator.<String>empty(), CancellationToken.none())
            .get(5, TimeUnit.SECONDS)).isEmpty();
    }

    @Test
    public void test_collect_of_long_iterator_completes() throws Exception {
        List<Outcome<Integer>> outcomes = new ArrayList<>();
        for (int i = 0; i < 50_000; i++) {
            outcomes.add(Outcome.success(i));
        }

        List<Integer> pages = PageIterators.collect(InMemoryPageIterator.of(outcomes), CancellationToken.none())
            .get(5, TimeUnit.SECONDS);
        assertThat(pages).hasSize(50_000);
        assertThat(pages.get(49_999)).isEqualTo(49_999);
    }

    @Test
    public void test_collect_continues_after_pending_moves() throws Exception {
        AsyncPageIterator<String> source = InMemoryPageIterator.of(List.of(
            Outcome.success("a"),
            Outcome.success("b"),
            Outcome.success("c")));
        AsyncPageIterator<String> it = new ForwardingPageIterator<>() {

            @Override
            protected AsyncPageIterator<String> delegate() {
                return source;
            }

            @Override
            public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
                return super.moveNextAsync(cancellationToken).thenApplyAsync(hasNext -> hasNext);
            }
        };

        assertThat(PageIterators.collect(it, CancellationToken.none()).get(5, TimeUnit.SECONDS))
            .containsExactly("a", "b", "c");
    }

    @Test
    public void test_visit_stops_when_told_to() throws Exception {
        AsyncPageIterator<String> it = InMemoryPageIterator.of(List.of(
            Outcome.success("a"),
            Outcome.success("b"),
            Outcome.success("c")));
        List<String> visited = new ArrayList<>();

        PageIterators.visit(it, CancellationToken.none(), hasNext -> {
            visited.add(it.current().result());
            return visited.size() < 2;
        }).get(5, TimeUnit.SECONDS);

        assertThat(visited).containsExactly("a", "b");
        assertThat(it.moveNextAsync(CancellationToken.none()).get(5, TimeUnit.SECONDS)).isTrue();
        assertThat(it.current().result()).isEqualTo("c");
    }

    @Test
    public void test_visit_fails_with_exception_thrown_by_callback() {
        AsyncPageIterator<String> it = InMemoryPageIterator.of(List.of(Outcome.success("a")));

        CompletableFuture<Void> visit = PageIterators.visit(it, CancellationToken.none(), hasNext -> {
            throw new IllegalArgumentException("bad page");
        });
        assertThatThrownBy(() -> visit.get(5, TimeUnit.SECONDS))
            .isExactlyInstanceOf(ExecutionException.class)
            .cause()
            .isExactlyInstanceOf(IllegalArgumentException.class)
            .hasMessage("bad page");
    }

    @Test
    public void test_collect_with_cancelled_token_fails() {
        CancellationToken token = CancellationToken.none();
        token.cancel();
        AsyncPageIterator<String> it = InMemoryPageIterator.of(List.of(Outcome.success("a")));
        assertThat(PageIterators.collect(it, token)).isCompletedExceptionally();
    }
}
