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

import org.junit.Test;

import io.docdb.json.Json;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.FeedRangePartitionKey;
import io.docdb.routing.FeedRangePartitionKeyRange;

public class PartitionRangePageAsyncEnumeratorComparatorTest {

    private final PartitionRangePageAsyncEnumeratorComparator forward =
        new PartitionRangePageAsyncEnumeratorComparator(Direction.FORWARD);
    private final PartitionRangePageAsyncEnumeratorComparator reverse =
        new PartitionRangePageAsyncEnumeratorComparator(Direction.REVERSE);

    @Test
    public void test_epk_ranges_are_ordered_by_start_key() {
        FeedRangeEpk left = new FeedRangeEpk("", "7F");
        FeedRangeEpk right = new FeedRangeEpk("7F", "FF");

        assertThat(forward.compareFeedRanges(left, right)).isNegative();
        assertThat(reverse.compareFeedRanges(left, right)).isPositive();
        assertThat(forward.compareFeedRanges(left, left)).isZero();
    }

    @Test
    public void test_partition_keys_come_first_in_both_directions() {
        FeedRangePartitionKey partitionKey = new FeedRangePartitionKey(Json.text("a"));
        FeedRangeEpk epk = new FeedRangeEpk("", "7F");
        FeedRangePartitionKeyRange rangeId = new FeedRangePartitionKeyRange("1");

        assertThat(forward.compareFeedRanges(partitionKey, epk)).isNegative();
        assertThat(reverse.compareFeedRanges(partitionKey, epk)).isNegative();
        assertThat(forward.compareFeedRanges(partitionKey, rangeId)).isNegative();
        assertThat(forward.compareFeedRanges(rangeId, epk)).isNegative();
        assertThat(forward.compareFeedRanges(partitionKey, new FeedRangePartitionKey(Json.text("b")))).isZero();
    }
}
