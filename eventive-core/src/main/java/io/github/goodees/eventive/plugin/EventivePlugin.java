package io.github.goodees.eventive.plugin;

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

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Hooks around persistence of a commit. Plugins are registered with the runtime as an ordered list; for every commit
 * the runtime awaits each hook before calling the next one, so side effects of hooks are observed in registration
 * order.
 *
 * <p>Lifecycle of a commit:</p>
 * <ol>
 *     <li>{@link #beforeCommit(CommitContext)} of every plugin. The first one to return {@link CommitDecision#ABORT}
 *     ends the commit, nothing is persisted and no further hook runs.</li>
 *     <li>The event is appended, and the snapshot is stored if enabled.</li>
 *     <li>{@link #onCommitted(CommitContext)} of every plugin.</li>
 * </ol>
 * A hook that throws or returns a failed stage fails the commit. When that happens in beforeCommit, nothing is
 * persisted.
 *
 * @param <P> body supertype
 * @param <S> type of state
 */
public interface EventivePlugin<P, S> {

    default CompletionStage<CommitDecision> beforeCommit(CommitContext<P, S> context) {
        return CompletableFuture.completedFuture(CommitDecision.PROCEED);
    }

    default CompletionStage<Void> onCommitted(CommitContext<P, S> context) {
        return CompletableFuture.completedFuture(null);
    }

    /**
     * Plugin with synchronous beforeCommit hook only.
     * @param gate decision to make before persisting
     * @param <P> body supertype
     * @param <S> type of state
     * @return new plugin
     */
    static <P, S> EventivePlugin<P, S> gate(Function<CommitContext<P, S>, CommitDecision> gate) {
        Objects.requireNonNull(gate);
        return new EventivePlugin<P, S>() {
            @Override
            public CompletionStage<CommitDecision> beforeCommit(CommitContext<P, S> context) {
                return CompletableFuture.completedFuture(gate.apply(context));
            }
        };
    }

    /**
     * Plugin with synchronous onCommitted hook only.
     * @param listener action to take after commit
     * @param <P> body supertype
     * @param <S> type of state
     * @return new plugin
     */
    static <P, S> EventivePlugin<P, S> listener(Consumer<CommitContext<P, S>> listener) {
        Objects.requireNonNull(listener);
        return new EventivePlugin<P, S>() {
            @Override
            public CompletionStage<Void> onCommitted(CommitContext<P, S> context) {
                listener.accept(context);
                return CompletableFuture.completedFuture(null);
            }
        };
    }
}
