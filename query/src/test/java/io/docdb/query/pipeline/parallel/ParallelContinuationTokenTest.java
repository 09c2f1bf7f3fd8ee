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

package io.docdb.query.pipeline.parallel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.Test;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;
import io.docdb.pagination.CrossFeedRangeState;
import io.docdb.pagination.FeedRangeState;
import io.docdb.pagination.PageState;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.FeedRangePartitionKeyRange;

public class ParallelContinuationTokenTest {

    @Test
    public void test_state_is_encoded_as_token_list() {
        CrossFeedRangeState state = new CrossFeedRangeState(List.of(
            new FeedRangeState(new FeedRangeEpk("", "80"), new PageState(Json.text("c7"))),
            new FeedRangeState(new FeedRangeEpk("80", "FF"), null)));

        assertThat(ParallelContinuationToken.listToJson(state)).isEqualTo(Json.parse("""
            [
              {"token": "c7", "range": {"min": "", "max": "80"}},
              {"token": null, "range": {"min": "80", "max": "FF"}}
            ]
            """));
    }

    @Test
    public void test_token_list_is_decoded() {
        List<ParallelContinuationToken> tokens = ParallelContinuationToken.listFromJson(Json.parse(
            "[{\"token\": {\"skip\": 2}, \"range\": {\"min\": \"10\", \"max\": \"20\"}}]"));

        assertThat(tokens).containsExactly(
            new ParallelContinuationToken(Json.parse("{\"skip\": 2}"), new FeedRangeEpk("10", "20")));
    }

    @Test
    public void test_token_without_token_property_is_rejected() {
        assertThatThrownBy(() -> ParallelContinuationToken.fromJson(
            Json.parse("{\"range\": {\"min\": \"10\", \"max\": \"20\"}}")))
            .isExactlyInstanceOf(MalformedContinuationTokenException.class)
            .hasMessageContaining("token");
    }

    @Test
    public void test_only_epk_ranges_can_be_encoded() {
        CrossFeedRangeState state = new CrossFeedRangeState(List.of(
            new FeedRangeState(new FeedRangePartitionKeyRange("0"), null)));

        assertThatThrownBy(() -> ParallelContinuationToken.listToJson(state))
            .isExactlyInstanceOf(IllegalStateException.class);
    }
}
