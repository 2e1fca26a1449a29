/**
 * The polling consumer loop: claim, dispatch, acknowledge.
 */
package io.graphsync.consumer;
