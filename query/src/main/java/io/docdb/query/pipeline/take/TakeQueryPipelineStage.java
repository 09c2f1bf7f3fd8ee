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

package io.docdb.query.pipeline.take;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.base.Preconditions;

import io.docdb.concurrent.CompletableFutures;
import io.docdb.data.CancellationToken;
import io.docdb.data.Outcome;
import io.docdb.pagination.PageState;
import io.docdb.pagination.QueryPage;
import io.docdb.query.pipeline.CreatePipelineStage;
import io.docdb.query.pipeline.QueryPipelineStage;
import io.docdb.query.pipeline.QueryPipelineStageBase;

/**
 * Passes on at most {@code takeCount} documents in total ({@code TOP} / {@code LIMIT}).
 */
public final class TakeQueryPipelineStage extends QueryPipelineStageBase {

    private int takeCount;

    private TakeQueryPipelineStage(QueryPipelineStage inputStage, int takeCount) {
        super(inputStage);
        this.takeCount = takeCount;
    }

    public static QueryPipelineStage create(int takeCount,
                                            @Nullable JsonNode continuationToken,
                                            CreatePipelineStage createSourceStage) {
        Preconditions.checkArgument(takeCount >= 0, "takeCount must not be negative");
        if (continuationToken == null) {
            return new TakeQueryPipelineStage(createSourceStage.create(null), takeCount);
        }
        TakeContinuationToken token = TakeContinuationToken.fromJson(continuationToken);
        return new TakeQueryPipelineStage(createSourceStage.create(token.sourceToken()), token.takeCount());
    }

    @Override
    public CompletableFuture<Boolean> moveNextAsync(CancellationToken cancellationToken) {
        return CompletableFutures.supplySafely(() -> {
            cancellationToken.throwIfCancelled();
            if (takeCount <= 0) {
                current = null;
                return CompletableFuture.completedFuture(false);
            }
            return inputStage.moveNextAsync(cancellationToken).thenApply(hasNext -> {
                if (hasNext == false) {
                    current = null;
                    return false;
                }
                Outcome<QueryPage> outcome = inputStage.current();
                if (outcome.failed()) {
                    current = outcome;
                    return true;
                }
                QueryPage page = outcome.result();
                List<JsonNode> documents = page.documents();
                List<JsonNode> taken = documents.subList(0, Math.min(takeCount, documents.size()));
                takeCount -= taken.size();
                PageState state = null;
                if (page.state() != null && takeCount > 0) {
                    state = new PageState(new TakeContinuationToken(takeCount, page.state().value()).toJson());
                }
                current = Outcome.success(new QueryPage(
                    taken,
                    page.requestCharge(),
                    page.activityId(),
                    page.disallowContinuationTokenMessage(),
                    state));
                return true;
            });
        });
    }
}
