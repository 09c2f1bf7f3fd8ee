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

package io.docdb.exceptions;

import java.util.List;
import java.util.Locale;

import io.docdb.routing.FeedRangeEpk;

/**
 * A continuation token covers a range that overlaps more than one of the current ranges.
 * The token and the current partition topology are inconsistent.
 */
public class AmbiguousFeedRangeException extends MalformedContinuationTokenException {

    public AmbiguousFeedRangeException(FeedRangeEpk tokenRange, List<FeedRangeEpk> overlappingRanges) {
        super(String.format(
            Locale.ENGLISH,
            "Continuation token range %s overlaps multiple ranges: %s",
            tokenRange,
            overlappingRanges
        ));
    }
}
