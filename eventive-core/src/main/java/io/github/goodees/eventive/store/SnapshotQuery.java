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

import org.immutables.value.Value;

import java.util.List;
import java.util.OptionalInt;

/**
 * Conditions on the state of snapshot documents, and maximal number of returned documents.
 */
@Value.Immutable
@ValueStyle
public interface SnapshotQuery {

    List<PropertyCondition> getStateConditions();

    OptionalInt getLimit();

    @Value.Check
    default void check() {
        if (getLimit().isPresent() && getLimit().getAsInt() <= 0) {
            throw new IllegalStateException("Limit must be positive, was " + getLimit().getAsInt());
        }
    }

    static SnapshotQuery all() {
        return builder().build();
    }

    static SnapshotQuery where(String path, Object expected) {
        return builder().addStateCondition(PropertyCondition.equalTo(path, expected)).build();
    }

    static Builder builder() {
        return new Builder();
    }

    class Builder extends ImmutableSnapshotQuery.Builder {

    }
}
