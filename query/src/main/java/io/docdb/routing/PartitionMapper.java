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

package io.docdb.routing;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Preconditions;

import io.docdb.exceptions.AmbiguousFeedRangeException;
import io.docdb.exceptions.MalformedContinuationTokenException;

/**
 * Reconciles the ranges a query recorded in its continuation tokens with the ranges
 * the container consists of now. Partitions may have been split or merged in between.
 *
 * The mapper has no state, one instance can be shared by any number of queries.
 */
public final class PartitionMapper {

    private static final Logger LOGGER = LogManager.getLogger(PartitionMapper.class);

    /**
     * @param currentRanges the ranges of the container right now
     * @param tokens the tokens of a previous execution, not empty
     * @throws MalformedContinuationTokenException if the tokens can't be placed onto the current ranges
     */
    public <T extends PartitionedToken> PartitionMapping<T> mapPartitions(List<FeedRangeEpk> currentRanges,
                                                                          List<T> tokens) {
        Preconditions.checkArgument(currentRanges.isEmpty() == false, "currentRanges must not be empty");
        Preconditions.checkArgument(tokens.isEmpty() == false, "tokens must not be empty");

        List<FeedRangeEpk> mergedRanges = mergeRangesWherePossible(currentRanges);
        NavigableMap<FeedRangeEpk, T> splitRanges = splitRangesBasedOffContinuationToken(mergedRanges, tokens);
        FeedRangeEpk targetRange = targetRange(tokens);
        return classify(splitRanges, tokens, targetRange);
    }

    /**
     * Places a range whose partition is gone onto the ranges that serve its keys now.
     * Every replacement is cut down to the part of the gone range it covers. After a split these
     * are the children. After a merge it is the gone range itself, served by the merged partition,
     * so the keys outside of it stay with whoever reads them already.
     *
     * @param goneRange the range that was reported gone
     * @param replacementRanges the current ranges overlapping the gone range
     * @return the pieces, sorted by start key, covering no key twice
     * @throws AmbiguousFeedRangeException if replacement ranges overlap each other
     */
    public List<FeedRangeEpk> mapGoneRange(FeedRangeEpk goneRange, List<FeedRangeEpk> replacementRanges) {
        List<FeedRangeEpk> sorted = new ArrayList<>(replacementRanges);
        sorted.sort(FeedRangeEpk.BY_MIN);
        List<FeedRangeEpk> pieces = new ArrayList<>(sorted.size());
        for (FeedRangeEpk range : sorted) {
            if (range.overlaps(goneRange) == false) {
                continue;
            }
            FeedRangeEpk piece = new FeedRangeEpk(
                max(range.min(), goneRange.min()),
                min(range.max(), goneRange.max()));
            FeedRangeEpk last = pieces.isEmpty() ? null : pieces.get(pieces.size() - 1);
            if (last != null && last.overlaps(piece)) {
                throw new AmbiguousFeedRangeException(goneRange, replacementRanges);
            }
            pieces.add(piece);
        }
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Mapped gone range {} onto {}", goneRange, pieces);
        }
        return pieces;
    }

    private static String min(String a, String b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String max(String a, String b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Sorts the ranges by start key and merges ranges where one ends where the next one starts.
     */
    @VisibleForTesting
    static List<FeedRangeEpk> mergeRangesWherePossible(List<FeedRangeEpk> ranges) {
        List<FeedRangeEpk> sorted = new ArrayList<>(ranges);
        sorted.sort(FeedRangeEpk.BY_MIN);
        Deque<FeedRangeEpk> merged = new ArrayDeque<>(sorted.size());
        for (FeedRangeEpk range : sorted) {
            FeedRangeEpk last = merged.peekLast();
            if (last != null && last.max().equals(range.min())) {
                merged.pollLast();
                merged.addLast(new FeedRangeEpk(last.min(), range.max()));
            } else {
                merged.addLast(range);
            }
        }
        return new ArrayList<>(merged);
    }

    /**
     * Cuts every range that fully contains a token range into the pieces left of the token,
     * the token range itself and right of the token. Pieces without a token map to null.
     * Tokens without an enclosing range are dropped.
     *
     * @return the pieces, sorted by start key
     */
    @VisibleForTesting
    static <T extends PartitionedToken> NavigableMap<FeedRangeEpk, T> splitRangesBasedOffContinuationToken(
            List<FeedRangeEpk> ranges,
            List<T> tokens) {
        TreeSet<FeedRangeEpk> remainingRanges = new TreeSet<>(FeedRangeEpk.BY_MIN);
        remainingRanges.addAll(ranges);
        NavigableMap<FeedRangeEpk, T> splitRanges = new TreeMap<>(FeedRangeEpk.BY_MIN);

        for (T token : tokens) {
            FeedRangeEpk tokenRange = token.range();
            List<FeedRangeEpk> overlapping = new ArrayList<>(1);
            for (FeedRangeEpk range : remainingRanges) {
                if (range.overlaps(tokenRange)) {
                    overlapping.add(range);
                }
            }
            if (overlapping.size() > 1) {
                throw new AmbiguousFeedRangeException(tokenRange, overlapping);
            }
            if (overlapping.isEmpty() || overlapping.get(0).contains(tokenRange) == false) {
                if (LOGGER.isDebugEnabled()) {
                    LOGGER.debug("Dropping continuation token for range {}, no current range contains it", tokenRange);
                }
                continue;
            }

            FeedRangeEpk range = overlapping.get(0);
            remainingRanges.remove(range);
            if (range.min().equals(tokenRange.min()) == false) {
                remainingRanges.add(new FeedRangeEpk(range.min(), tokenRange.min()));
            }
            splitRanges.put(tokenRange, token);
            if (range.max().equals(tokenRange.max()) == false) {
                remainingRanges.add(new FeedRangeEpk(tokenRange.max(), range.max()));
            }
        }

        for (FeedRangeEpk range : remainingRanges) {
            splitRanges.put(range, null);
        }
        return splitRanges;
    }

    /**
     * The target is the range of the token with the smallest start key.
     */
    @VisibleForTesting
    static FeedRangeEpk targetRange(List<? extends PartitionedToken> tokens) {
        return tokens.stream()
            .map(PartitionedToken::range)
            .min(FeedRangeEpk.BY_MIN)
            .orElseThrow(() -> new IllegalArgumentException("tokens must not be empty"));
    }

    private static <T extends PartitionedToken> PartitionMapping<T> classify(NavigableMap<FeedRangeEpk, T> splitRanges,
                                                                             List<T> tokens,
                                                                             FeedRangeEpk targetRange) {
        Map<FeedRangeEpk, T> left = new LinkedHashMap<>();
        Map<FeedRangeEpk, T> target = new LinkedHashMap<>();
        Map<FeedRangeEpk, T> right = new LinkedHashMap<>();

        boolean containsTarget = splitRanges.keySet().stream().anyMatch(targetRange::equals);
        if (containsTarget == false) {
            if (splitRanges.size() != 1) {
                throw new MalformedContinuationTokenException(String.format(
                    Locale.ENGLISH,
                    "Could not find range %s of the continuation token in the current ranges %s",
                    targetRange,
                    splitRanges.keySet()
                ));
            }
            // A single range that no longer lines up with the token, e.g. a partition key query
            // whose range got split. Resume it with the first token.
            FeedRangeEpk onlyRange = splitRanges.firstKey();
            T firstToken = tokens.stream()
                .min(Comparator.comparing(PartitionedToken::range, FeedRangeEpk.BY_MIN))
                .orElseThrow();
            target.put(onlyRange, firstToken);
            return new PartitionMapping<>(left, target, right);
        }

        Map<FeedRangeEpk, T> current = left;
        for (Map.Entry<FeedRangeEpk, T> entry : splitRanges.entrySet()) {
            if (entry.getKey().equals(targetRange)) {
                target.put(entry.getKey(), entry.getValue());
                current = right;
            } else {
                current.put(entry.getKey(), entry.getValue());
            }
        }
        return new PartitionMapping<>(left, target, right);
    }
}
