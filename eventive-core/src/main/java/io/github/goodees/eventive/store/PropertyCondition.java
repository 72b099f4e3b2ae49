package io.github.goodees.eventive.store;

/*-
 * #%L
 * eventive
 * %%
 * Copyright (C) 2017 Patrik Duditš
 * %%
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 * 
 *      http://www.apache.org/licenses/LICENSE-2.0
 * 
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 * #L%
 */

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Equality condition on a property of an event body or snapshot state.
 *
 * <p>Conditions are evaluated against the JSON tree of the document, so that in-memory and database backed stores
 * agree on the semantics. The property is addressed by a dotted path ({@code "address.city"}), segments are taken
 * literally, so keys may contain {@code /} and {@code ~} but not dots. Numbers compare by
 * value regardless of their JSON representation, any other expected value is compared by its string form with
 * textual properties. A condition
 * expecting {@code null} matches a missing property as well as an explicit null.</p>
 */
public final class PropertyCondition {
    private final String path;
    private final Object expected;
    private final JsonPointer pointer;

    private PropertyCondition(String path, Object expected) {
        this.path = Objects.requireNonNull(path, "path");
        this.expected = expected;
        this.pointer = toPointer(path);
    }

    /**
     * @param path dotted path of the property
     * @param expected expected value, {@code null} for a missing or null property
     * @throws IllegalArgumentException when expected is a NaN or infinite number, which JSON cannot hold
     */
    public static PropertyCondition equalTo(String path, Object expected) {
        if (expected instanceof Double && !Double.isFinite((Double) expected)
                || expected instanceof Float && !Float.isFinite((Float) expected)) {
            throw new IllegalArgumentException("Cannot compare " + path + " with non-finite number " + expected);
        }
        return new PropertyCondition(path, expected);
    }

    private static JsonPointer toPointer(String path) {
        StringBuilder pointer = new StringBuilder();
        for (String segment : path.split("\\.", -1)) {
            pointer.append('/').append(segment.replace("~", "~0").replace("/", "~1"));
        }
        return JsonPointer.compile(pointer.toString());
    }

    public String getPath() {
        return path;
    }

    public Object getExpected() {
        return expected;
    }

    public boolean matches(JsonNode document) {
        JsonNode node = document == null ? null : document.at(pointer);
        if (node == null || node.isMissingNode() || node.isNull()) {
            return expected == null;
        }
        if (expected == null) {
            return false;
        }
        if (expected instanceof Number) {
            return node.isNumber() && node.decimalValue().compareTo(new BigDecimal(expected.toString())) == 0;
        }
        if (expected instanceof Boolean) {
            return node.isBoolean() && node.booleanValue() == (Boolean) expected;
        }
        return node.isTextual() && node.asText().equals(expected.toString());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        PropertyCondition that = (PropertyCondition) o;
        return path.equals(that.path) && Objects.equals(expected, that.expected);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, expected);
    }

    @Override
    public String toString() {
        return path + "=" + expected;
    }
}
