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

import java.util.Collections;
import java.util.Map;

import com.google.common.base.Preconditions;

/**
 * Current ranges classified relative to the range a query resumes from.
 * Values are null for ranges that are not covered by a prior token.
 * The maps iterate in ascending order of the range start keys.
 *
 * @param mappingLeftOfTarget ranges before the target range
 * @param targetMapping exactly one entry: the range the query resumes from and its token
 * @param mappingRightOfTarget ranges after the target range
 */
public record PartitionMapping<T extends PartitionedToken>(Map<FeedRangeEpk, T> mappingLeftOfTarget,
                                                           Map<FeedRangeEpk, T> targetMapping,
                                                           Map<FeedRangeEpk, T> mappingRightOfTarget) {

    public PartitionMapping {
        Preconditions.checkArgument(targetMapping.size() == 1, "target mapping must have exactly one entry");
        mappingLeftOfTarget = Collections.unmodifiableMap(mappingLeftOfTarget);
        targetMapping = Collections.unmodifiableMap(targetMapping);
        mappingRightOfTarget = Collections.unmodifiableMap(mappingRightOfTarget);
    }

    public FeedRangeEpk targetRange() {
        return targetMapping.keySet().iterator().next();
    }

    public T targetToken() {
        return targetMapping.values().iterator().next();
    }
}
