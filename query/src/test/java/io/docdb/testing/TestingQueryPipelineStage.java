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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.data.AsyncPageIterator;
import io.docdb.data.CloseAssertingPageIterator;
import io.docdb.data.ForwardingPageIterator;
import io.docdb.data.InMemoryPageIterator;
import io.docdb.data.Outcome;
import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.json.Json;
import io.docdb.pagination.PageState;
import io.docdb.pagination.QueryPage;
import io.docdb.query.pipeline.CreatePipelineStage;
import io.docdb.query.pipeline.QueryPipelineStage;

/**
 * Input stage returning scripted pages.
 */
public final class TestingQueryPipelineStage extends ForwardingPageIterator<QueryPage> implements QueryPipelineStage {

    private final CloseAssertingPageIterator<QueryPage> delegate;

    public TestingQueryPipelineStage(List<Outcome<QueryPage>> outcomes) {
        this.delegate = InMemoryPageIterator.of(outcomes);
    }

    public static TestingQueryPipelineStage of(QueryPage... pages) {
        List<Outcome<QueryPage>> outcomes = new ArrayList<>(pages.length);
        for (QueryPage page : pages) {
            outcomes.add(Outcome.success(page));
        }
        return new TestingQueryPipelineStage(outcomes);
    }

    @Override
    protected AsyncPageIterator<QueryPage> delegate() {
        return delegate;
    }

    public boolean isClosed() {
        return delegate.isClosed();
    }

    public static QueryPage page(@Nullable String state, String... documents) {
        List<JsonNode> parsed = new ArrayList<>(documents.length);
        for (String document : documents) {
            parsed.add(Json.parse(document));
        }
        return new QueryPage(parsed, 1.0, null, null, state == null ? null : new PageState(Json.text(state)));
    }

    /**
     * A source that can be resumed: page {@code i} carries the continuation {@code "i+1"},
     * the last page carries none.
     */
    public static CreatePipelineStage resumableSource(List<List<String>> pagesOfDocuments) {
        return continuationToken -> {
            int start = 0;
            if (continuationToken != null) {
                if (continuationToken.isTextual() == false) {
                    throw MalformedContinuationTokenException.invalidShape("test source token", continuationToken);
                }
                start = Integer.parseInt(continuationToken.textValue());
            }
            List<QueryPage> pages = new ArrayList<>();
            for (int i = start; i < pagesOfDocuments.size(); i++) {
                String state = i + 1 < pagesOfDocuments.size() ? String.valueOf(i + 1) : null;
                pages.add(page(state, pagesOfDocuments.get(i).toArray(new String[0])));
            }
            return of(pages.toArray(new QueryPage[0]));
        };
    }

    public static List<String> docs(String... documents) {
        return Arrays.asList(documents);
    }
}
