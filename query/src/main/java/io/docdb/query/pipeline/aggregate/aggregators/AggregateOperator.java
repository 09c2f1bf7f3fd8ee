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

package io.docdb.query.pipeline.aggregate.aggregators;

import java.util.Locale;

public enum AggregateOperator {
    AVERAGE("Average"),
    COUNT("Count"),
    MAX("Max"),
    MIN("Min"),
    SUM("Sum"),
    MAKE_LIST("MakeList"),
    MAKE_SET("MakeSet");

    private final String wireName;

    AggregateOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Resolves the operator names used in query plans. {@code CountIf} folds like {@code Count}.
     */
    public static AggregateOperator fromName(String name) {
        if ("CountIf".equalsIgnoreCase(name)) {
            return COUNT;
        }
        for (AggregateOperator operator : values()) {
            if (operator.wireName.equalsIgnoreCase(name) || operator.name().equalsIgnoreCase(name)) {
                return operator;
            }
        }
        throw new IllegalArgumentException(String.format(Locale.ENGLISH, "Unknown aggregate operator: %s", name));
    }
}
