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

package io.docdb.query.pipeline.groupby;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.Test;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;

public class GroupByContinuationTokenTest {

    @Test
    public void test_token_layout() {
        GroupByContinuationToken token = new GroupByContinuationToken(Json.parse("{}"), Json.text("7"));

        assertThat(token.toJson()).isEqualTo(Json.parse(
            "{\"SourceToken\": \"7\", \"GroupingTableContinuationToken\": {}}"));
        assertThat(GroupByContinuationToken.fromJson(token.toJson())).isEqualTo(token);
    }

    @Test
    public void test_null_source_token_means_source_starts_over() {
        GroupByContinuationToken token = GroupByContinuationToken.fromJson(
            Json.parse("{\"SourceToken\": null, \"GroupingTableContinuationToken\": {}}"));

        assertThat(token.sourceContinuationToken()).isNull();
        assertThat(token.groupingTableContinuationToken()).isEqualTo(Json.parse("{}"));
    }

    @Test
    public void test_missing_source_token_is_rejected() {
        assertThatThrownBy(() -> GroupByContinuationToken.fromJson(
            Json.parse("{\"GroupingTableContinuationToken\": {}}")))
            .isExactlyInstanceOf(MalformedContinuationTokenException.class)
            .hasMessageContaining("SourceToken");
    }

    @Test
    public void test_grouping_table_token_must_be_an_object() {
        assertThatThrownBy(() -> GroupByContinuationToken.fromJson(
            Json.parse("{\"SourceToken\": \"7\", \"GroupingTableContinuationToken\": []}")))
            .isExactlyInstanceOf(MalformedContinuationTokenException.class)
            .hasMessageContaining("GroupingTableContinuationToken");
    }
}
