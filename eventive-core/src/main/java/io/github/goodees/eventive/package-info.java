/**
 * Small event sourcing projection engine. Entities are never stored directly; their state is always a fold of the
 * events recorded for them.
 *
 * <h2>Entities and events</h2>
 * <p>An entity is identified by its {@linkplain io.github.goodees.eventive.event.Entity#getEntityId() id} and belongs
 * to an entity name, e. g. an order or a bank account. Every change of an entity is recorded as a
 * {@link io.github.goodees.eventive.event.DomainEvent}, which carries name, creation time, an optional revision tag and
 * a body. Events are appended only; they are never updated or removed.
 * <p>The state of an entity is computed by a {@link io.github.goodees.eventive.event.Reducer}, applied to the events in
 * order of their creation, starting from the initial state. Before reduction every event passes through an
 * {@link io.github.goodees.eventive.event.EventMapper}, that upgrades events of older revisions to the current shape.
 * Timestamps of an entity are derived from its events: created at is creation time of the first one, updated at of the
 * last one.
 *
 * <h2>Runtime</h2>
 * <p>{@link io.github.goodees.eventive.EventiveRuntime} binds together reducer, mapper, event storage and optional
 * snapshot storage for single entity name. It offers reads ({@code findOne}, {@code findByIds}, {@code all},
 * {@code queryEvents}, {@code querySnapshots}) and writes in two steps: {@code create} or {@code dispatch} compute the
 * new projection without touching the storage, {@link io.github.goodees.eventive.PendingCommit#commit()} persists it.
 * <p>Commit runs the {@linkplain io.github.goodees.eventive.plugin.EventivePlugin plugins} in order of their
 * registration. Any plugin may abort the commit before anything is stored.
 * <p>Snapshots are not a source of truth. They store the last projected state, so that entities can be searched by
 * their state, but results of such search are always replayed from events.
 *
 * <h2>Storage</h2>
 * <p>Storage is represented by {@link io.github.goodees.eventive.store.EventStore},
 * {@link io.github.goodees.eventive.store.EventLog} and {@link io.github.goodees.eventive.store.SnapshotStore}. In-memory
 * implementations are available in {@linkplain io.github.goodees.eventive.store.inmemory inmemory package}, relational
 * ones in {@linkplain io.github.goodees.eventive.store.jdbc jdbc package}.
 *
 * @see io.github.goodees.eventive.EventiveRuntime
 * @see io.github.goodees.eventive.event.EventReducer
 * @see io.github.goodees.eventive.store.EventQuery
 */
package io.github.goodees.eventive;
