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

package io.docdb.query.pipeline;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

import io.docdb.pagination.DocumentContainer;
import io.docdb.query.pipeline.aggregate.AggregateQueryPipelineStage;
import io.docdb.query.pipeline.groupby.GroupByQueryPipelineStage;
import io.docdb.query.pipeline.parallel.ParallelCrossPartitionQueryPipelineStage;
import io.docdb.query.pipeline.take.TakeQueryPipelineStage;
import io.docdb.routing.FeedRangeEpk;
import io.docdb.routing.PartitionMapper;

/**
 * Assembles the stages of a query: the parallel source, group by or aggregate, take.
 * Each stage decodes its own part of the continuation and hands the source token on to its input.
 */
public final class QueryPipelineFactory {

    private static final Logger LOGGER = LogManager.getLogger(QueryPipelineFactory.class);

    private final DocumentContainer documentContainer;
    private final PartitionMapper partitionMapper;

    public QueryPipelineFactory(DocumentContainer documentContainer, PartitionMapper partitionMapper) {
        this.documentContainer = documentContainer;
        this.partitionMapper = partitionMapper;
    }

    /**
     * @throws io.docdb.exceptions.MalformedContinuationTokenException if the continuation can't be decoded
     */
    public QueryPipelineStage create(QueryInfo queryInfo,
                                     List<FeedRangeEpk> targetRanges,
                                     QueryExecutionOptions options,
                                     @Nullable JsonNode continuationToken) {
        CreatePipelineStage createStage = token -> ParallelCrossPartitionQueryPipelineStage.create(
            documentContainer,
            partitionMapper,
            queryInfo.rewrittenQuery(),
            targetRanges,
            options.maxItemCount(),
            options.direction(),
            token);

        if (queryInfo.hasGroupBy()) {
            CreatePipelineStage createSource = createStage;
            createStage = token -> GroupByQueryPipelineStage.create(
                options.executionEnvironment(),
                queryInfo.aggregates(),
                queryInfo.groupByAliasToAggregateType(),
                queryInfo.orderedAliases(),
                queryInfo.hasSelectValue(),
                options.maxItemCount(),
                token,
                createSource);
        } else if (queryInfo.hasAggregates()) {
            CreatePipelineStage createSource = createStage;
            createStage = token -> AggregateQueryPipelineStage.create(
                options.executionEnvironment(),
                queryInfo.aggregates(),
                queryInfo.groupByAliasToAggregateType(),
                queryInfo.orderedAliases(),
                queryInfo.hasSelectValue(),
                token,
                createSource);
        }

        Integer top = queryInfo.top();
        if (top != null) {
            CreatePipelineStage createSource = createStage;
            createStage = token -> TakeQueryPipelineStage.create(top, token, createSource);
        }

        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("Creating pipeline for query `{}` on {} ranges with {}",
                queryInfo.rewrittenQuery(), targetRanges.size(), options);
        }
        return createStage.create(continuationToken);
    }
}
