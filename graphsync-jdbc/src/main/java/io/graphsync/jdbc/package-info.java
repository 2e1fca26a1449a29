/**
 * JDBC plumbing shared by the outbox stores and the aggregate reader.
 */
package io.graphsync.jdbc;
