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

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.google.common.hash.HashCode;
import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

/**
 * 128 bit hash over the content of a value.
 *
 * <ul>
 *     <li>Object properties are combined independently of their order.</li>
 *     <li>Array elements are seeded with their position.</li>
 *     <li>Undefined elements and properties are skipped.</li>
 *     <li>Every type is tagged, so {@code 1}, {@code "1"} and {@code true} differ.</li>
 * </ul>
 *
 * Numbers are hashed by their double value, {@code 1} and {@code 1.0} hash the same.
 */
public final class ContentHash {

    private static final HashFunction HASH_FUNCTION = Hashing.murmur3_128();

    private static final byte UNDEFINED = 0;
    private static final byte NULL = 1;
    private static final byte FALSE = 2;
    private static final byte TRUE = 3;
    private static final byte NUMBER = 4;
    private static final byte STRING = 5;
    private static final byte ARRAY = 6;
    private static final byte OBJECT = 7;

    private ContentHash() {
    }

    public static HashCode of(JsonNode value) {
        Hasher hasher = HASH_FUNCTION.newHasher();
        put(hasher, value);
        return hasher.hash();
    }

    private static void put(Hasher hasher, JsonNode value) {
        switch (value.getNodeType()) {
            case MISSING -> hasher.putByte(UNDEFINED);
            case NULL -> hasher.putByte(NULL);
            case BOOLEAN -> hasher.putByte(value.booleanValue() ? TRUE : FALSE);
            case NUMBER -> hasher.putByte(NUMBER).putDouble(value.doubleValue());
            case STRING -> hasher.putByte(STRING).putString(value.textValue(), StandardCharsets.UTF_8);
            case ARRAY -> {
                hasher.putByte(ARRAY);
                int index = 0;
                for (JsonNode element : value) {
                    if (Json.isUndefined(element)) {
                        continue;
                    }
                    hasher.putInt(index);
                    put(hasher, element);
                    index++;
                }
                hasher.putInt(index);
            }
            case OBJECT -> {
                hasher.putByte(OBJECT);
                List<HashCode> properties = new ArrayList<>(value.size());
                Iterator<Map.Entry<String, JsonNode>> fields = value.fields();
                while (fields.hasNext()) {
                    Map.Entry<String, JsonNode> field = fields.next();
                    if (Json.isUndefined(field.getValue())) {
                        continue;
                    }
                    Hasher propertyHasher = HASH_FUNCTION.newHasher();
                    propertyHasher.putString(field.getKey(), StandardCharsets.UTF_8);
                    put(propertyHasher, field.getValue());
                    properties.add(propertyHasher.hash());
                }
                if (properties.isEmpty() == false) {
                    hasher.putBytes(Hashing.combineUnordered(properties).asBytes());
                }
                hasher.putInt(properties.size());
            }
            default -> throw new IllegalArgumentException(String.format(
                Locale.ENGLISH, "Cannot hash value of type %s", value.getNodeType()));
        }
    }
}
