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

package io.docdb.json;

import java.util.Comparator;
import java.util.Locale;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Orders primitive values across types:
 * undefined &lt; null &lt; false &lt; true &lt; numbers &lt; strings.
 */
public final class ItemComparator implements Comparator<JsonNode> {

    public static final ItemComparator INSTANCE = new ItemComparator();

    private ItemComparator() {
    }

    public static boolean isPrimitive(JsonNode value) {
        return value.isMissingNode()
            || value.isNull()
            || value.isBoolean()
            || value.isNumber()
            || value.isTextual();
    }

    @Override
    public int compare(JsonNode a, JsonNode b) {
        int cmp = Integer.compare(rank(a), rank(b));
        if (cmp != 0) {
            return cmp;
        }
        if (a.isNumber()) {
            return Double.compare(a.doubleValue(), b.doubleValue());
        }
        if (a.isTextual()) {
            return a.textValue().compareTo(b.textValue());
        }
        return 0;
    }

    private static int rank(JsonNode value) {
        switch (value.getNodeType()) {
            case MISSING:
                return 0;
            case NULL:
                return 1;
            case BOOLEAN:
                return value.booleanValue() ? 3 : 2;
            case NUMBER:
                return 4;
            case STRING:
                return 5;
            default:
                throw new IllegalArgumentException(String.format(
                    Locale.ENGLISH, "Cannot compare non primitive value: %s", value));
        }
    }
}
