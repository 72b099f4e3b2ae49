/**
 * Storage in relational database. Statements are produced by {@link io.github.goodees.eventive.store.jdbc.JdbcSchema},
 * payloads are converted by {@link io.github.goodees.eventive.store.Serialization}.
 */
package io.github.goodees.eventive.store.jdbc;
