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

import java.util.Locale;

import org.jetbrains.annotations.Nullable;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.DoubleNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.LongNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * Helpers around the structured values documents and continuation tokens are made of.
 * {@link MissingNode} represents <i>undefined</i>, which is distinct from JSON {@code null}.
 */
public final class Json {

    public static final ObjectMapper MAPPER = new ObjectMapper();
    public static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private Json() {
    }

    public static JsonNode parse(String json) {
        try {
            return MAPPER.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                String.format(Locale.ENGLISH, "Invalid JSON: %s", e.getOriginalMessage()), e);
        }
    }

    public static String toJson(JsonNode node) {
        try {
            return MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    public static JsonNode undefined() {
        return MissingNode.getInstance();
    }

    public static boolean isUndefined(@Nullable JsonNode node) {
        return node == null || node.isMissingNode();
    }

    public static ObjectNode object() {
        return NODES.objectNode();
    }

    public static TextNode text(String value) {
        return TextNode.valueOf(value);
    }

    /**
     * Creates the number node a JSON parser would create for the same literal,
     * integral values become int or long nodes.
     */
    public static JsonNode number(double value) {
        if (value == Math.rint(value) && Double.isInfinite(value) == false) {
            if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
                return IntNode.valueOf((int) value);
            }
            if (value >= Long.MIN_VALUE && value <= Long.MAX_VALUE) {
                return LongNode.valueOf((long) value);
            }
        }
        return DoubleNode.valueOf(value);
    }

    public static JsonNode number(long value) {
        if (value >= Integer.MIN_VALUE && value <= Integer.MAX_VALUE) {
            return IntNode.valueOf((int) value);
        }
        return LongNode.valueOf(value);
    }
}
