package io.taskrelay.server.resolver;

import io.taskrelay.spec.DeliveryMode;
import io.taskrelay.spec.Endpoint;
import org.jspecify.annotations.Nullable;

/**
 * Result of {@link EndpointResolver#resolve}.
 *
 * @param endpoint the target agent
 * @param requestedMode the delivery mode the caller asked for, or {@code null} for automatic
 * @param profile the agent's profile image or description, passed through to events
 * @param fromDefault whether the configured default endpoint was used
 */
public record ResolvedEndpoint(Endpoint endpoint, @Nullable DeliveryMode requestedMode,
                               @Nullable String profile, boolean fromDefault) {
}
