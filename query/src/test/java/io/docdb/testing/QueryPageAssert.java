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

package io.docdb.testing;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.assertj.core.api.AbstractAssert;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.json.Json;
import io.docdb.pagination.QueryPage;

public final class QueryPageAssert extends AbstractAssert<QueryPageAssert, QueryPage> {

    public QueryPageAssert(QueryPage actual) {
        super(actual, QueryPageAssert.class);
    }

    public QueryPageAssert hasDocuments(String... expectedJson) {
        isNotNull();
        List<JsonNode> expected = new ArrayList<>(expectedJson.length);
        for (String json : expectedJson) {
            expected.add(Json.parse(json));
        }
        assertThat(actual.documents())
            .as("documents")
            .containsExactlyElementsOf(expected);
        return this;
    }

    public QueryPageAssert hasNoDocuments() {
        isNotNull();
        assertThat(actual.documents()).as("documents").isEmpty();
        return this;
    }

    public QueryPageAssert hasContinuation() {
        isNotNull();
        assertThat(actual.state()).as("continuation").isNotNull();
        return this;
    }

    public QueryPageAssert hasContinuation(String expectedJson) {
        hasContinuation();
        assertThat(actual.state().value()).as("continuation").isEqualTo(Json.parse(expectedJson));
        return this;
    }

    public QueryPageAssert hasNoContinuation() {
        isNotNull();
        assertThat(actual.state()).as("continuation").isNull();
        return this;
    }

    public QueryPageAssert hasRequestCharge(double expected) {
        isNotNull();
        assertThat(actual.requestCharge()).as("request charge").isEqualTo(expected);
        return this;
    }

    public QueryPageAssert disallowsContinuation() {
        isNotNull();
        assertThat(actual.disallowContinuationTokenMessage()).as("disallow continuation message").isNotBlank();
        return this;
    }
}
