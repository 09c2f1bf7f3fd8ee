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

import io.docdb.data.AsyncPageIterator;
import io.docdb.pagination.QueryPage;

/**
 * One step of the client side query pipeline. A stage pulls pages from its input stage,
 * transforms them and exposes the result as pages of its own.
 *
 * The continuation of a page a stage emits encodes everything needed to create an equivalent
 * stage later, including the continuation of the input stage.
 */
public interface QueryPipelineStage extends AsyncPageIterator<QueryPage> {
}
