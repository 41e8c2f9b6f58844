/**
 * The proxy agent executor: endpoint resolution, delivery mode choice and dispatch.
 */
@NullMarked
package io.taskrelay.server.executor;

import org.jspecify.annotations.NullMarked;
