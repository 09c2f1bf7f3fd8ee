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

package io.docdb.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.IntStream;

import org.junit.Before;
import org.junit.Test;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.data.CancellationToken;
import io.docdb.data.Outcome;
import io.docdb.exceptions.FeedRangeGoneException;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.PartitionMapper;
import io.docdb.testing.InMemoryContainer;

public class CrossPartitionRangePageAsyncEnumeratorTest {

    private static final int NUM_DOCUMENTS = 50;

    private InMemoryContainer container;

    @Before
    public void setUpContainer() {
        container = new InMemoryContainer("pk");
        for (int i = 0; i < NUM_DOCUMENTS; i++) {
            container.createItem("{\"id\": " + i + ", \"pk\": \"key-" + i + "\"}");
        }
        container.split(FeedRangeEpk.FULL_RANGE);
    }

    private CrossPartitionRangePageAsyncEnumerator<ReadFeedPage> enumerator(Direction direction,
                                                                             CrossFeedRangeState state) {
        return enumerator(container, direction, state);
    }

    private CrossPartitionRangePageAsyncEnumerator<ReadFeedPage> enumerator(FeedRangeProvider provider,
                                                                             Direction direction,
                                                                             CrossFeedRangeState state) {
        return new CrossPartitionRangePageAsyncEnumerator<>(
            provider,
            new PartitionMapper(),
            feedRangeState -> new ReadFeedPartitionRangePageAsyncEnumerator(container, feedRangeState, 7),
            direction,
            state);
    }

    private static Outcome<CrossFeedRangePage<ReadFeedPage>> next(
            CrossPartitionRangePageAsyncEnumerator<ReadFeedPage> enumerator) throws Exception {
        boolean hasNext = enumerator.moveNextAsync(CancellationToken.none()).get(5, TimeUnit.SECONDS);
        return hasNext ? enumerator.current() : null;
    }

    private static List<Integer> drainIds(CrossPartitionRangePageAsyncEnumerator<ReadFeedPage> enumerator)
            throws Exception {
        List<Integer> ids = new ArrayList<>();
        Outcome<CrossFeedRangePage<ReadFeedPage>> outcome;
        while ((outcome = next(enumerator)) != null) {
            ids.addAll(idsOf(outcome.getOrThrow().page()));
        }
        return ids;
    }

    private static List<Integer> idsOf(ReadFeedPage page) {
        List<Integer> ids = new ArrayList<>();
        for (JsonNode document : page.documents()) {
            ids.add(document.get("id").intValue());
        }
        return ids;
    }

    private static List<Integer> allIds() {
        return IntStream.range(0, NUM_DOCUMENTS).boxed().toList();
    }

    @Test
    public void test_enumeration_returns_every_document_once() throws Exception {
        var enumerator = enumerator(Direction.FORWARD, null);

        assertThat(drainIds(enumerator)).containsExactlyInAnyOrderElementsOf(allIds());
        assertThat(enumerator.current()).isNull();
    }

    @Test
    public void test_last_page_has_no_state() throws Exception {
        var enumerator = enumerator(Direction.FORWARD, null);
        CrossFeedRangePage<ReadFeedPage> last = null;
        Outcome<CrossFeedRangePage<ReadFeedPage>> outcome;
        while ((outcome = next(enumerator)) != null) {
            CrossFeedRangePage<ReadFeedPage> page = outcome.getOrThrow();
            if (last != null) {
                assertThat(last.state()).isNotNull();
            }
            last = page;
        }
        assertThat(last).isNotNull();
        assertThat(last.state()).isNull();
    }

    @Test
    public void test_enumeration_can_resume_from_any_page() throws Exception {
        List<Integer> ids = new ArrayList<>();
        CrossFeedRangeState state = null;
        int enumerators = 0;
        do {
            var enumerator = enumerator(Direction.FORWARD, state);
            enumerators++;
            CrossFeedRangePage<ReadFeedPage> page = next(enumerator).getOrThrow();
            ids.addAll(idsOf(page.page()));
            state = page.state() == null
                ? null
                : CrossFeedRangeStateCodec.fromJson(CrossFeedRangeStateCodec.toJson(page.state()));
            enumerator.close();
        } while (state != null);

        assertThat(ids).containsExactlyInAnyOrderElementsOf(allIds());
        assertThat(enumerators).isGreaterThan(2);
    }

    @Test
    public void test_ranges_are_read_one_after_another_in_direction_order() throws Exception {
        var forward = enumerator(Direction.FORWARD, null);
        CrossFeedRangePage<ReadFeedPage> first = next(forward).getOrThrow();
        FeedRangeState firstState = first.state().feedRangeStates().get(0);
        assertThat(firstState.feedRange()).isEqualTo(new FeedRangeEpk("", "7F80"));

        var reverse = enumerator(Direction.REVERSE, null);
        CrossFeedRangePage<ReadFeedPage> firstReverse = next(reverse).getOrThrow();
        FeedRangeState firstReverseState = firstReverse.state().feedRangeStates().get(0);
        assertThat(firstReverseState.feedRange()).isEqualTo(new FeedRangeEpk("7F80", "FF"));
        for (JsonNode document : firstReverse.page().documents()) {
            assertThat(InMemoryContainer.effectivePartitionKey(document.get("pk"))).isGreaterThanOrEqualTo("7F80");
        }
    }

    @Test
    public void test_reverse_enumeration_returns_every_document_once() throws Exception {
        assertThat(drainIds(enumerator(Direction.REVERSE, null))).containsExactlyInAnyOrderElementsOf(allIds());
    }

    @Test
    public void test_split_during_enumeration_continues_on_child_ranges() throws Exception {
        var enumerator = enumerator(Direction.FORWARD, null);
        List<Integer> ids = new ArrayList<>(idsOf(next(enumerator).getOrThrow().page()));

        container.split(new FeedRangeEpk("", "7F80"));

        CrossFeedRangePage<ReadFeedPage> afterSplit = next(enumerator).getOrThrow();
        ids.addAll(idsOf(afterSplit.page()));
        assertThat(afterSplit.state().feedRangeStates())
            .extracting(FeedRangeState::feedRange)
            .contains(new FeedRangeEpk("3FC0", "7F80"))
            .doesNotContain(new FeedRangeEpk("", "7F80"));
        ids.addAll(drainIds(enumerator));

        assertThat(ids).containsExactlyInAnyOrderElementsOf(allIds());
    }

    @Test
    public void test_merge_during_enumeration_keeps_reading_the_gone_range_only() throws Exception {
        FeedRangeEpk left = new FeedRangeEpk("", "7F80");
        FeedRangeEpk right = new FeedRangeEpk("7F80", "FF");
        var enumerator = enumerator(Direction.FORWARD, null);
        List<Integer> ids = new ArrayList<>(idsOf(next(enumerator).getOrThrow().page()));

        container.merge(left, right);
        container.injectFailure(new FeedRangeGoneException(left));

        CrossFeedRangePage<ReadFeedPage> afterMerge = next(enumerator).getOrThrow();
        ids.addAll(idsOf(afterMerge.page()));
        assertThat(afterMerge.state().feedRangeStates())
            .extracting(FeedRangeState::feedRange)
            .contains(right)
            .doesNotContain(FeedRangeEpk.FULL_RANGE);
        ids.addAll(drainIds(enumerator));

        assertThat(ids).containsExactlyInAnyOrderElementsOf(allIds());
    }

    @Test
    public void test_failed_page_is_reported_and_range_is_retried() throws Exception {
        var enumerator = enumerator(Direction.FORWARD, null);
        List<Integer> ids = new ArrayList<>(idsOf(next(enumerator).getOrThrow().page()));

        container.injectFailure(new IllegalStateException("Request rate is large"));
        Outcome<CrossFeedRangePage<ReadFeedPage>> failed = next(enumerator);
        assertThat(failed.failed()).isTrue();
        assertThat(failed.exception()).hasMessage("Request rate is large");

        ids.addAll(drainIds(enumerator));
        assertThat(ids).containsExactlyInAnyOrderElementsOf(allIds());
    }

    @Test
    public void test_gone_range_without_new_children_is_surfaced_after_refresh() throws Exception {
        FeedRangeEpk range = new FeedRangeEpk("", "7F80");
        FeedRangeProvider provider = mock(FeedRangeProvider.class);
        when(provider.getChildRangesAsync(eq(range), any()))
            .thenReturn(CompletableFuture.completedFuture(List.of(range)));
        when(provider.refreshProviderAsync(any())).thenReturn(CompletableFuture.completedFuture(null));
        container.injectFailure(new FeedRangeGoneException(range));

        var enumerator = enumerator(provider, Direction.FORWARD, new CrossFeedRangeState(List.of(
            new FeedRangeState(range, null))));

        Outcome<CrossFeedRangePage<ReadFeedPage>> outcome = next(enumerator);
        assertThat(outcome.failed()).isTrue();
        assertThat(outcome.exception()).isExactlyInstanceOf(FeedRangeGoneException.class);
        verify(provider).refreshProviderAsync(any());
        verify(provider, times(2)).getChildRangesAsync(eq(range), any());

        assertThat(next(enumerator).getOrThrow().page().documents()).isNotEmpty();
    }

    @Test
    public void test_cancelled_token_fails_move_next() {
        var enumerator = enumerator(Direction.FORWARD, null);
        CancellationToken token = CancellationToken.none();
        token.cancel();

        assertThat(enumerator.moveNextAsync(token)).isCompletedExceptionally();
    }
}
