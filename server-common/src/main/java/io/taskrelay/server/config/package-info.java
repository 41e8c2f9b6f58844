/**
 * Proxy configuration: shipped defaults overridden by system properties and environment variables.
 */
@NullMarked
package io.taskrelay.server.config;

import org.jspecify.annotations.NullMarked;
