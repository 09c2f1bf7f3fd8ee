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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;

import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;

import org.junit.Test;

import io.docdb.exceptions.AmbiguousFeedRangeException;
import io.docdb.exceptions.MalformedContinuationTokenException;

public class PartitionMapperTest {

    private record Token(FeedRangeEpk range, String value) implements PartitionedToken {
    }

    private static FeedRangeEpk range(String min, String max) {
        return new FeedRangeEpk(min, max);
    }

    private static Token token(String min, String max, String value) {
        return new Token(range(min, max), value);
    }

    private final PartitionMapper mapper = new PartitionMapper();

    @Test
    public void test_adjacent_ranges_are_merged() {
        List<FeedRangeEpk> merged = PartitionMapper.mergeRangesWherePossible(List.of(
            range("H", "I"),
            range("A", "B"),
            range("E", "F"),
            range("B", "C"),
            range("I", "J")));

        assertThat(merged).containsExactly(range("A", "C"), range("E", "F"), range("H", "J"));
    }

    @Test
    public void test_ranges_are_cut_around_tokens() {
        Token first = token("A", "C", "5");
        Token second = token("I", "J", "6");
        NavigableMap<FeedRangeEpk, Token> split = PartitionMapper.splitRangesBasedOffContinuationToken(
            List.of(range("A", "E"), range("H", "K")),
            List.of(first, second));

        List<FeedRangeEpk> ranges = new ArrayList<>(split.keySet());
        assertThat(ranges).containsExactly(
            range("A", "C"),
            range("C", "E"),
            range("H", "I"),
            range("I", "J"),
            range("J", "K"));
        assertThat(split.get(range("A", "C"))).isEqualTo(first);
        assertThat(split.get(range("C", "E"))).isNull();
        assertThat(split.get(range("H", "I"))).isNull();
        assertThat(split.get(range("I", "J"))).isEqualTo(second);
        assertThat(split.get(range("J", "K"))).isNull();
    }

    @Test
    public void test_token_overlapping_two_ranges_is_ambiguous() {
        assertThatThrownBy(() -> PartitionMapper.splitRangesBasedOffContinuationToken(
            List.of(range("A", "C"), range("E", "G")),
            List.of(token("B", "F", "1"))))
            .isInstanceOf(MalformedContinuationTokenException.class)
            .isExactlyInstanceOf(AmbiguousFeedRangeException.class)
            .hasMessageContaining("[B,F)");
    }

    @Test
    public void test_token_without_enclosing_range_is_dropped() {
        NavigableMap<FeedRangeEpk, Token> split = PartitionMapper.splitRangesBasedOffContinuationToken(
            List.of(range("A", "C")),
            List.of(token("X", "Y", "1")));

        assertThat(split).containsExactly(entry(range("A", "C"), null));
    }

    @Test
    public void test_ranges_are_classified_around_target() {
        Token target = token("B", "C", "t");
        Token right = token("D", "E", "r");
        PartitionMapping<Token> mapping = mapper.mapPartitions(
            List.of(range("", "B"), range("B", "D"), range("D", "FF")),
            List.of(right, target));

        assertThat(mapping.targetRange()).isEqualTo(range("B", "C"));
        assertThat(mapping.targetToken()).isEqualTo(target);
        assertThat(mapping.mappingLeftOfTarget()).containsExactly(entry(range("", "B"), null));
        assertThat(mapping.mappingRightOfTarget()).containsExactly(
            entry(range("C", "D"), null),
            entry(range("D", "E"), right),
            entry(range("E", "FF"), null));
    }

    @Test
    public void test_mapping_after_split_keeps_token_on_parent_range() {
        // Token recorded on [A,E), the partition got split into [A,C) and [C,E) since.
        Token token = token("A", "E", "7");
        PartitionMapping<Token> mapping = mapper.mapPartitions(
            List.of(range("A", "C"), range("C", "E")),
            List.of(token));

        assertThat(mapping.targetMapping()).containsExactly(entry(range("A", "E"), token));
        assertThat(mapping.mappingLeftOfTarget()).isEmpty();
        assertThat(mapping.mappingRightOfTarget()).isEmpty();
    }

    @Test
    public void test_mapping_after_merge_cuts_merged_range() {
        Token token = token("C", "E", "3");
        PartitionMapping<Token> mapping = mapper.mapPartitions(List.of(range("A", "G")), List.of(token));

        assertThat(mapping.mappingLeftOfTarget()).containsExactly(entry(range("A", "C"), null));
        assertThat(mapping.targetMapping()).containsExactly(entry(range("C", "E"), token));
        assertThat(mapping.mappingRightOfTarget()).containsExactly(entry(range("E", "G"), null));
    }

    @Test
    public void test_single_range_that_lost_its_token_falls_back_to_first_token() {
        Token token = token("X", "Y", "1");
        PartitionMapping<Token> mapping = mapper.mapPartitions(List.of(range("A", "C")), List.of(token));

        assertThat(mapping.targetMapping()).containsExactly(entry(range("A", "C"), token));
    }

    @Test
    public void test_target_that_cannot_be_placed_is_rejected() {
        assertThatThrownBy(() -> mapper.mapPartitions(
            List.of(range("A", "C"), range("E", "G")),
            List.of(token("X", "Y", "1"))))
            .isExactlyInstanceOf(MalformedContinuationTokenException.class)
            .hasMessageContaining("[X,Y)");
    }

    @Test
    public void test_orphaned_token_is_dropped_from_multi_range_mapping() {
        Token target = token("E", "F", "1");
        Token orphan = token("X", "Y", "2");
        PartitionMapping<Token> mapping = mapper.mapPartitions(
            List.of(range("A", "C"), range("E", "G"), range("H", "K")),
            List.of(target, orphan));

        assertThat(mapping.mappingLeftOfTarget()).containsExactly(entry(range("A", "C"), null));
        assertThat(mapping.targetMapping()).containsExactly(entry(range("E", "F"), target));
        assertThat(mapping.mappingRightOfTarget()).containsExactly(
            entry(range("F", "G"), null),
            entry(range("H", "K"), null));
    }

    @Test
    public void test_gone_range_is_mapped_onto_split_children() {
        assertThat(mapper.mapGoneRange(range("A", "C"), List.of(range("B", "C"), range("A", "B"))))
            .containsExactly(range("A", "B"), range("B", "C"));
    }

    @Test
    public void test_gone_range_keeps_its_bounds_on_merged_partition() {
        assertThat(mapper.mapGoneRange(range("A", "B"), List.of(range("A", "C"))))
            .containsExactly(range("A", "B"));
    }

    @Test
    public void test_gone_range_is_cut_to_overlapping_parts() {
        assertThat(mapper.mapGoneRange(
            range("B", "D"),
            List.of(range("A", "C"), range("C", "E"), range("E", "G"))))
            .containsExactly(range("B", "C"), range("C", "D"));
    }

    @Test
    public void test_gone_range_on_overlapping_replacements_is_ambiguous() {
        assertThatThrownBy(() -> mapper.mapGoneRange(range("A", "D"), List.of(range("A", "C"), range("B", "D"))))
            .isExactlyInstanceOf(AmbiguousFeedRangeException.class);
    }

    @Test
    public void test_empty_inputs_are_rejected() {
        assertThatThrownBy(() -> mapper.mapPartitions(List.of(), List.of(token("A", "B", "1"))))
            .isExactlyInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> mapper.mapPartitions(List.of(range("A", "B")), List.<Token>of()))
            .isExactlyInstanceOf(IllegalArgumentException.class);
    }
}
