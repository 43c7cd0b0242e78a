/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.botical.workflow.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Value semantics shared by bindings, conditions and step messages.
 * <p>
 * Values are the plain objects produced by JSON: {@link Map}, {@link List}, {@link String},
 * {@link Number}, {@link Boolean} and {@code null}. {@code null} stands for both an absent and an
 * explicitly null value.
 */
public final class Values {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);

    private Values() {
    }

    /**
     * Walks a dot-separated path through maps and lists.
     * <p>
     * Returns {@code root} for an empty path, and {@code null} as soon as a segment cannot be
     * followed. Never throws.
     *
     * @param root the value to start from
     * @param path e.g. {@code "order.items.0.sku"}
     * @return the value at the path, or null
     */
    public static Object getPath(Object root, String path) {
        if (path == null || path.isEmpty()) {
            return root;
        }
        Object current = root;
        for (String segment : path.split("\\.", -1)) {
            if (current == null) {
                return null;
            }
            current = child(current, segment);
        }
        return current;
    }

    private static Object child(Object parent, String segment) {
        if (parent instanceof Map<?, ?> map) {
            return map.get(segment);
        }
        if (parent instanceof List<?> list) {
            int index = parseIndex(segment);
            return index >= 0 && index < list.size() ? list.get(index) : null;
        }
        if (parent instanceof Object[] array) {
            int index = parseIndex(segment);
            return index >= 0 && index < array.length ? array[index] : null;
        }
        return null;
    }

    private static int parseIndex(String segment) {
        if (segment.isEmpty() || segment.length() > 9) {
            return -1;
        }
        for (int i = 0; i < segment.length(); i++) {
            if (!Character.isDigit(segment.charAt(i))) {
                return -1;
            }
        }
        return Integer.parseInt(segment);
    }

    /**
     * Strict equality: numbers by numeric value, strings, booleans and characters by value,
     * everything else by identity. {@code NaN} equals nothing.
     */
    public static boolean strictEquals(Object left, Object right) {
        if (left == null || right == null) {
            return left == right;
        }
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        if (left instanceof String || left instanceof Boolean || left instanceof Character) {
            return left.equals(right);
        }
        return left == right;
    }

    /**
     * Truthiness: {@code null}, {@code false}, zero, {@code NaN} and the empty string are falsy.
     * Every other value, including empty maps and lists, is truthy.
     */
    public static boolean isTruthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        if (value instanceof BigDecimal d) {
            return d.signum() != 0;
        }
        if (value instanceof BigInteger i) {
            return i.signum() != 0;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        return true;
    }

    /**
     * Renders a value as text. {@code null} becomes the empty string, integral numbers carry no
     * fraction, maps and lists are rendered as JSON.
     */
    public static String stringify(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String s) {
            return s;
        }
        if (value instanceof Double || value instanceof Float) {
            double d = ((Number) value).doubleValue();
            if (Double.isNaN(d)) {
                return "NaN";
            }
            if (Double.isInfinite(d)) {
                return d > 0 ? "Infinity" : "-Infinity";
            }
            if (d == Math.rint(d) && Math.abs(d) < 1e15) {
                return Long.toString((long) d);
            }
            return Double.toString(d);
        }
        if (value instanceof BigDecimal d) {
            return d.stripTrailingZeros().toPlainString();
        }
        if (value instanceof Map<?, ?> || value instanceof Collection<?> || value instanceof Object[]) {
            try {
                return MAPPER.writeValueAsString(value);
            } catch (JsonProcessingException e) {
                return String.valueOf(value);
            }
        }
        return String.valueOf(value);
    }

    /**
     * Reads a numeric value. Numbers are taken as they are and numeric strings are parsed;
     * anything else, including blank or unparseable strings, yields {@code null}.
     */
    @Nullable
    public static Double toNumber(@Nullable Object value) {
        if (value instanceof Number n) {
            return n.doubleValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            try {
                return Double.valueOf(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    /**
     * Renders a value as text, substituting {@code fallback} for falsy values.
     */
    public static String stringifyOr(Object value, String fallback) {
        return isTruthy(value) ? stringify(value) : fallback;
    }
}
