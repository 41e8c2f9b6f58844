/**
 * Event store with the at-most-once ACCEPTED and terminal guards.
 */
@NullMarked
package io.taskrelay.server.store;

import org.jspecify.annotations.NullMarked;
