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

import java.util.Locale;
import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

import io.docdb.pagination.Direction;

/**
 * Settings of a single query execution.
 */
public final class QueryExecutionOptions {

    public static final String MAX_ITEM_COUNT = "query.max_item_count";
    public static final String EXECUTION_ENVIRONMENT = "query.execution_environment";
    public static final String DIRECTION = "query.direction";

    public static final int DEFAULT_MAX_ITEM_COUNT = 1000;

    public static final QueryExecutionOptions DEFAULT = builder().build();

    private final int maxItemCount;
    private final ExecutionEnvironment executionEnvironment;
    private final Direction direction;

    private QueryExecutionOptions(Builder builder) {
        this.maxItemCount = builder.maxItemCount;
        this.executionEnvironment = builder.executionEnvironment;
        this.direction = builder.direction;
    }

    /**
     * Page size hint for the data source and number of groups per page of a group by query.
     */
    public int maxItemCount() {
        return maxItemCount;
    }

    public ExecutionEnvironment executionEnvironment() {
        return executionEnvironment;
    }

    public Direction direction() {
        return direction;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads options from flat settings, for example {@code query.max_item_count=100}.
     * Settings that are not present keep their default.
     *
     * @throws IllegalArgumentException on unknown settings or invalid values
     */
    public static QueryExecutionOptions fromSettings(Map<String, String> settings) {
        Builder builder = builder();
        for (Map.Entry<String, String> setting : settings.entrySet()) {
            String value = setting.getValue().trim();
            switch (setting.getKey()) {
                case MAX_ITEM_COUNT -> {
                    try {
                        builder.maxItemCount(Integer.parseInt(value));
                    } catch (NumberFormatException e) {
                        throw new IllegalArgumentException(String.format(
                            Locale.ENGLISH, "Invalid value for setting `%s`: %s", MAX_ITEM_COUNT, value), e);
                    }
                }
                case EXECUTION_ENVIRONMENT -> builder.executionEnvironment(
                    parseEnum(ExecutionEnvironment.class, EXECUTION_ENVIRONMENT, value));
                case DIRECTION -> builder.direction(parseEnum(Direction.class, DIRECTION, value));
                default -> throw new IllegalArgumentException(String.format(
                    Locale.ENGLISH, "Unknown setting `%s`", setting.getKey()));
            }
        }
        return builder.build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> enumClass, String setting, String value) {
        try {
            return Enum.valueOf(enumClass, value.toUpperCase(Locale.ENGLISH));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(String.format(
                Locale.ENGLISH, "Invalid value for setting `%s`: %s", setting, value), e);
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("maxItemCount", maxItemCount)
            .add("executionEnvironment", executionEnvironment)
            .add("direction", direction)
            .toString();
    }

    public static final class Builder {

        private int maxItemCount = DEFAULT_MAX_ITEM_COUNT;
        private ExecutionEnvironment executionEnvironment = ExecutionEnvironment.CLIENT;
        private Direction direction = Direction.FORWARD;

        private Builder() {
        }

        public Builder maxItemCount(int maxItemCount) {
            Preconditions.checkArgument(maxItemCount > 0, "maxItemCount must be greater than 0, got %s", maxItemCount);
            this.maxItemCount = maxItemCount;
            return this;
        }

        public Builder executionEnvironment(ExecutionEnvironment executionEnvironment) {
            this.executionEnvironment = Preconditions.checkNotNull(executionEnvironment);
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = Preconditions.checkNotNull(direction);
            return this;
        }

        public QueryExecutionOptions build() {
            return new QueryExecutionOptions(this);
        }
    }
}
