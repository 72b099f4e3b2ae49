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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Jackson based serialization. Event bodies are bound to classes through a registry keyed by event name and
 * revision; a lookup for a revision that is not registered falls back to the registration without revision, and then
 * to the default type.
 *
 * <pre>{@code
 * JsonSerialization<OrderBody> serialization = JsonSerialization.<OrderBody>builder()
 *         .register("placed", OrderPlaced.class)
 *         .register("placed", "1", OrderPlacedV1.class)
 *         .build();
 * }</pre>
 *
 * @param <T> serialized supertype
 */
public class JsonSerialization<T> implements Serialization<T> {
    private final ObjectMapper mapper;
    private final Map<String, Class<? extends T>> registry;
    private final Class<? extends T> defaultType;

    private JsonSerialization(Builder<T> b) {
        this.mapper = b.mapper;
        this.registry = new HashMap<>(b.registry);
        this.defaultType = b.defaultType;
    }

    /**
     * Serialization binding every payload to single class, regardless of type. Suitable for states.
     * @param type the class
     * @param <T> the type
     * @return new serialization
     */
    public static <T> JsonSerialization<T> of(Class<T> type) {
        return JsonSerialization.<T>builder().defaultType(type).build();
    }

    /**
     * Serialization that can write any object, but reads nothing. In-memory stores use it for evaluating
     * property conditions.
     * @param <T> the type
     * @return new serialization
     */
    public static <T> JsonSerialization<T> writeOnly() {
        return JsonSerialization.<T>builder().build();
    }

    public static <T> Builder<T> builder() {
        return new Builder<>();
    }

    /**
     * Mapper configuration used unless another one is given: jdk8 and java time support, ISO dates, unknown
     * properties are ignored to allow for future changes in payloads.
     * @return new ObjectMapper
     */
    public static ObjectMapper createMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModules(new Jdk8Module(), new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Override
    public String serialize(T object) {
        try {
            return mapper.writeValueAsString(object);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize " + object, e);
        }
    }

    @Override
    public T deserialize(String type, String revision, String payload) {
        Class<? extends T> target = resolve(type, revision);
        if (target == null) {
            return null;
        }
        try {
            return mapper.readValue(payload, target);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot deserialize " + type + " revision " + revision, e);
        }
    }

    @Override
    public boolean supports(String type, String revision) {
        return resolve(type, revision) != null;
    }

    @Override
    public JsonNode toDocument(T object) {
        return mapper.valueToTree(object);
    }

    @Override
    public JsonNode parseDocument(String payload) {
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot parse payload", e);
        }
    }

    Class<? extends T> resolve(String type, String revision) {
        if (type != null) {
            Class<? extends T> exact = registry.get(key(type, revision));
            if (exact != null) {
                return exact;
            }
            Class<? extends T> anyRevision = registry.get(key(type, null));
            if (anyRevision != null) {
                return anyRevision;
            }
        }
        return defaultType;
    }

    private static String key(String type, String revision) {
        return revision == null ? type : type + "@" + revision;
    }

    public static class Builder<T> {
        private ObjectMapper mapper = createMapper();
        private final Map<String, Class<? extends T>> registry = new HashMap<>();
        private Class<? extends T> defaultType;

        public Builder<T> mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper);
            return this;
        }

        /**
         * Bind an event name to a class, for any revision without own registration.
         * @param type event name
         * @param clazz body class
         * @return this
         */
        public Builder<T> register(String type, Class<? extends T> clazz) {
            registry.put(key(Objects.requireNonNull(type), null), Objects.requireNonNull(clazz));
            return this;
        }

        /**
         * Bind specific revision of an event to a class.
         * @param type event name
         * @param revision revision tag
         * @param clazz body class of that revision
         * @return this
         */
        public Builder<T> register(String type, String revision, Class<? extends T> clazz) {
            registry.put(key(Objects.requireNonNull(type), Objects.requireNonNull(revision)),
                Objects.requireNonNull(clazz));
            return this;
        }

        public Builder<T> defaultType(Class<? extends T> clazz) {
            this.defaultType = clazz;
            return this;
        }

        public JsonSerialization<T> build() {
            return new JsonSerialization<>(this);
        }
    }
}
