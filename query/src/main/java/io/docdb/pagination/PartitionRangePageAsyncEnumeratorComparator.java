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

import java.util.Comparator;

import io.docdb.routing.FeedRange;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.FeedRangePartitionKey;
import io.docdb.routing.FeedRangePartitionKeyRange;

/**
 * Decides which range a cross partition enumeration reads from next.
 * Ranges of a single logical partition key come first and are equal among each other,
 * key ranges are ordered by start key, descending for {@link Direction#REVERSE}.
 */
public final class PartitionRangePageAsyncEnumeratorComparator
    implements Comparator<PartitionRangePageAsyncEnumerator<?>> {

    private final Direction direction;

    public PartitionRangePageAsyncEnumeratorComparator(Direction direction) {
        this.direction = direction;
    }

    @Override
    public int compare(PartitionRangePageAsyncEnumerator<?> a, PartitionRangePageAsyncEnumerator<?> b) {
        return compareFeedRanges(a.feedRangeState().feedRange(), b.feedRangeState().feedRange());
    }

    int compareFeedRanges(FeedRange a, FeedRange b) {
        int cmp = Integer.compare(kind(a), kind(b));
        if (cmp != 0) {
            return cmp;
        }
        if (a instanceof FeedRangeEpk epkA && b instanceof FeedRangeEpk epkB) {
            cmp = FeedRangeEpk.BY_MIN.compare(epkA, epkB);
        } else if (a instanceof FeedRangePartitionKeyRange rangeA && b instanceof FeedRangePartitionKeyRange rangeB) {
            cmp = rangeA.partitionKeyRangeId().compareTo(rangeB.partitionKeyRangeId());
        } else {
            return 0;
        }
        return direction == Direction.FORWARD ? cmp : -cmp;
    }

    private static int kind(FeedRange feedRange) {
        if (feedRange instanceof FeedRangePartitionKey) {
            return 0;
        }
        if (feedRange instanceof FeedRangePartitionKeyRange) {
            return 1;
        }
        return 2;
    }
}
