package io.github.goodees.eventive;

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

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Helper class for constructing asynchronous responses of the runtime. Exceptions thrown by wrapped actions, checked
 * ones included, complete the result exceptionally and are reported unchanged as the cause of
 * {@link java.util.concurrent.ExecutionException} by {@link #get()}.
 *
 * @param <T> the type of result
 */
public class AsyncResult<T> extends CompletableFuture<T> {
    private AsyncResult() {
        super();
    }

    private AsyncResult(CompletionStage<T> parent) {
        super();
        parent.whenComplete((r, t) -> {
            if (t == null) {
                complete(r);
            } else {
                completeExceptionally(t);
            }
        });
    }

    @Override
    public <U> AsyncResult<U> thenApply(Function<? super T, ? extends U> transformation) {
        return new AsyncResult<>(super.thenApply(transformation));
    }

    @Override
    public <U> AsyncResult<U> thenCompose(Function<? super T, ? extends CompletionStage<U>> fn) {
        return new AsyncResult<>(super.thenCompose(fn));
    }

    /**
     * Wrap a result of callable. The callable is invoked immediately.
     * @param action The action to perform
     * @param <V> type of result
     * @return Async result wrapping the return value or exception thrown from a callable
     */
    public static <V> AsyncResult<V> invoke(Callable<V> action) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            result.complete(action.call());
        } catch (Exception e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Wrap a result of callable executed by an executor.
     * @param executor executor to run the action with
     * @param action The action to perform
     * @param <V> type of result
     * @return Async result completing with the return value or exception thrown from a callable, or with
     *         {@link RejectedExecutionException} when the executor doesn't accept the action
     */
    public static <V> AsyncResult<V> invokeOn(Executor executor, Callable<V> action) {
        AsyncResult<V> result = new AsyncResult<>();
        try {
            executor.execute(() -> {
                try {
                    result.complete(action.call());
                } catch (Exception e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(e);
        }
        return result;
    }

    /**
     * Call a function returning a stage, converting exception thrown by the function itself into failed stage.
     * Null returned by the function is treated as a stage completed with null.
     * @param hook function to call
     * @param <V> type of result
     * @return the stage returned by hook, or a failed result
     */
    public static <V> AsyncResult<V> stage(Supplier<? extends CompletionStage<V>> hook) {
        try {
            CompletionStage<V> stage = hook.get();
            return stage == null ? returning(null) : new AsyncResult<>(stage);
        } catch (RuntimeException e) {
            return throwing(e);
        }
    }

    /**
     * Wrap a value.
     * @param result value to wrap
     * @param <V> type of result
     * @return an AsyncResult that completed successfully with the result.
     */
    public static <V> AsyncResult<V> returning(V result) {
        AsyncResult<V> r = new AsyncResult<>();
        r.complete(result);
        return r;
    }

    /**
     * Wrap an exception
     * @param t Throwable to wrap.
     * @param <V> The original return type of the throwable.
     * @return an AsyncResult that completed exceptionally with given throwable.
     */
    public static <V> AsyncResult<V> throwing(Throwable t) {
        AsyncResult<V> r = new AsyncResult<>();
        r.completeExceptionally(t);
        return r;
    }

    /**
     * Strip the wrappers dependent stages and blocking calls put around the original exception.
     * @param t exception a future completed with
     * @return the original exception
     */
    public static Throwable unwrap(Throwable t) {
        Throwable result = t;
        while ((result instanceof CompletionException || result instanceof ExecutionException)
                && result.getCause() != null) {
            result = result.getCause();
        }
        return result;
    }
}
