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

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

import io.docdb.exceptions.MalformedContinuationTokenException;
import io.docdb.pagination.PageState;

public final class ContinuationTokens {

    /**
     * Source token recorded once the input stage is drained.
     */
    public static final JsonNode DONE = TextNode.valueOf("DONE");

    public static final String CLIENT_DISALLOW_CONTINUATION_MESSAGE =
        "Continuation tokens are not supported when the query runs in the client execution environment";

    private ContinuationTokens() {
    }

    public static boolean isDone(@Nullable JsonNode sourceToken) {
        return DONE.equals(sourceToken);
    }

    public static JsonNode sourceTokenOf(@Nullable PageState sourceState) {
        return sourceState == null ? DONE : sourceState.value();
    }

    /**
     * Stages of the client environment can't resume, they must start from scratch.
     */
    public static void ensureNoContinuation(@Nullable JsonNode continuationToken, String stage) {
        if (continuationToken != null) {
            throw new MalformedContinuationTokenException(
                stage + " does not support continuation tokens in the client execution environment");
        }
    }
}
