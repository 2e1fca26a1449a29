/**
 * Internal utilities.
 */
package io.graphsync.util;
