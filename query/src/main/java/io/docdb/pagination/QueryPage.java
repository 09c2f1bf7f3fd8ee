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

import java.util.List;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.databind.JsonNode;

public final class QueryPage extends Page {

    private final List<JsonNode> documents;
    @Nullable
    private final String disallowContinuationTokenMessage;

    public QueryPage(List<JsonNode> documents,
                     double requestCharge,
                     @Nullable String activityId,
                     @Nullable String disallowContinuationTokenMessage,
                     @Nullable PageState state) {
        super(requestCharge, activityId, state);
        this.documents = List.copyOf(documents);
        this.disallowContinuationTokenMessage = disallowContinuationTokenMessage;
    }

    public List<JsonNode> documents() {
        return documents;
    }

    /**
     * Set if the producer of this page can't be resumed; explains why no continuation is available.
     */
    @Nullable
    public String disallowContinuationTokenMessage() {
        return disallowContinuationTokenMessage;
    }

    @Override
    public String toString() {
        return "QueryPage{documents=" + documents + ", state=" + state() + '}';
    }
}
