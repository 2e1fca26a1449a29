/**
 * Graph vocabulary and the projector that turns snapshots into graph documents.
 */
package io.graphsync.projection;
