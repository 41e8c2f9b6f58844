/**
 * Forwarding of proxied tasks to target agents.
 */
@NullMarked
package io.taskrelay.client;

import org.jspecify.annotations.NullMarked;
