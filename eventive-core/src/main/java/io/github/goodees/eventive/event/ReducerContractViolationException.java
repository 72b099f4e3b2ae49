package io.github.goodees.eventive.event;

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

/**
 * An event reached a reducer that has no branch for it. The projection of the aggregate cannot be computed.
 */
public class ReducerContractViolationException extends RuntimeException {
    private final transient DomainEvent<?> event;

    public ReducerContractViolationException(DomainEvent<?> event) {
        super("No reducer branch for event " + event.getEventName() + " (revision "
                + event.getRevision().orElse("-") + ") of " + event.getEntityName() + " " + event.getEntityId());
        this.event = event;
    }

    public DomainEvent<?> getEvent() {
        return event;
    }
}
