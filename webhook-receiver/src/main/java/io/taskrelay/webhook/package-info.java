/**
 * Receives push notifications from target agents and records the terminal outcome of
 * non-blocking tasks.
 */
@NullMarked
package io.taskrelay.webhook;

import org.jspecify.annotations.NullMarked;
