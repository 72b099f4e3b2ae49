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

import io.github.goodees.eventive.event.DomainEvent;
import io.github.goodees.eventive.event.Entity;
import org.junit.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;

public class EventivePluginTest {
    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private final CommitContext<String, Integer> context = new CommitContext<>(
            new DomainEvent<>("e1", "added", T0, "counter", "c1", "one", null),
            new Entity<>("c1", "counter", T0, T0, 1),
            null);

    @Test
    public void default_hooks_proceed() throws Exception {
        EventivePlugin<String, Integer> plugin = new EventivePlugin<String, Integer>() {
        };

        assertEquals(CommitDecision.PROCEED,
            plugin.beforeCommit(context).toCompletableFuture().get(1, TimeUnit.SECONDS));
        assertNull(plugin.onCommitted(context).toCompletableFuture().get(1, TimeUnit.SECONDS));
    }

    @Test
    public void gate_decides_before_commit() throws Exception {
        EventivePlugin<String, Integer> plugin = EventivePlugin.gate(
            ctx -> ctx.getEntity().getState() > 0 ? CommitDecision.ABORT : CommitDecision.PROCEED);

        assertEquals(CommitDecision.ABORT, plugin.beforeCommit(context).toCompletableFuture().get(1, TimeUnit.SECONDS));
    }

    @Test
    public void listener_observes_committed_context() throws Exception {
        List<CommitContext<String, Integer>> seen = new ArrayList<>();
        EventivePlugin<String, Integer> plugin = EventivePlugin.listener(seen::add);

        assertEquals(CommitDecision.PROCEED,
            plugin.beforeCommit(context).toCompletableFuture().get(1, TimeUnit.SECONDS));
        assertEquals(0, seen.size());
        plugin.onCommitted(context).toCompletableFuture().get(1, TimeUnit.SECONDS);

        assertEquals(1, seen.size());
        assertSame(context, seen.get(0));
        assertFalse(seen.get(0).getPriorEntity().isPresent());
    }
}
