package io.taskrelay.server.resolver;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import io.taskrelay.server.agentexecution.RequestContext;
import io.taskrelay.spec.AgentCapabilities;
import io.taskrelay.spec.DeliveryMode;
import io.taskrelay.spec.Endpoint;
import io.taskrelay.spec.ResolutionException;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Picks the target agent of a task from the candidates listed in its context.
 * <p>
 * Selection order: the first usable candidate whose role (or name) equals the
 * {@value RequestContext#AGENT_ROLE} hint; otherwise the first usable candidate; otherwise the
 * configured default endpoint. A candidate is usable when its {@code endpoint} is an absolute
 * http(s) URL. Performs no I/O.
 */
public class EndpointResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(EndpointResolver.class);

    private final @Nullable String defaultEndpoint;

    public EndpointResolver(@Nullable String defaultEndpoint) {
        this.defaultEndpoint = Utils.trimToNull(defaultEndpoint);
    }

    /**
     * @throws ResolutionException if no candidate is usable and no default endpoint is configured
     */
    public ResolvedEndpoint resolve(RequestContext context) {
        DeliveryMode requestedMode = DeliveryMode.fromHint(context.getHint(RequestContext.DELIVERY_MODE));
        Object roleHint = context.getHint(RequestContext.AGENT_ROLE);
        String role = roleHint == null ? null : Utils.trimToNull(roleHint.toString());

        List<Map<String, Object>> candidates = context.getAgents();
        Map<String, Object> selected = null;
        Map<String, Object> firstUsable = null;
        for (Map<String, Object> candidate : candidates) {
            if (!isUsable(candidate)) {
                LOGGER.debug("Skipping agent without a usable endpoint for task {}: {}", context.getTaskId(),
                        nameOf(candidate));
                continue;
            }
            if (firstUsable == null) {
                firstUsable = candidate;
            }
            if (role != null && matchesRole(candidate, role)) {
                selected = candidate;
                break;
            }
        }
        if (selected == null) {
            if (role != null && firstUsable != null) {
                LOGGER.info("No agent with role {} for task {}, using the first candidate", role, context.getTaskId());
            }
            selected = firstUsable;
        }

        if (selected != null) {
            Endpoint endpoint = new Endpoint(
                    stringOf(selected.get("endpoint")),
                    nameOf(selected),
                    stringOf(selected.get("role")),
                    capabilitiesOf(selected.get("capabilities")));
            LOGGER.debug("Resolved {} for task {}", endpoint.url(), context.getTaskId());
            return new ResolvedEndpoint(endpoint, requestedMode, stringOf(selected.get("profile")), false);
        }
        if (defaultEndpoint != null) {
            LOGGER.debug("No usable agent in context of task {}, using default endpoint {}", context.getTaskId(),
                    defaultEndpoint);
            return new ResolvedEndpoint(Endpoint.of(defaultEndpoint), requestedMode, null, true);
        }
        throw new ResolutionException(candidates.isEmpty()
                ? "No agent info found and no default endpoint configured"
                : "No agent with a usable endpoint among " + candidates.size() + " candidate(s)");
    }

    private static boolean isUsable(Map<String, Object> candidate) {
        String endpoint = stringOf(candidate.get("endpoint"));
        if (endpoint == null) {
            return false;
        }
        try {
            URI uri = URI.create(endpoint);
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static boolean matchesRole(Map<String, Object> candidate, String role) {
        String wanted = role.toLowerCase(Locale.ROOT);
        String candidateRole = stringOf(candidate.get("role"));
        String name = nameOf(candidate);
        return (candidateRole != null && candidateRole.toLowerCase(Locale.ROOT).equals(wanted))
                || (name != null && name.toLowerCase(Locale.ROOT).equals(wanted));
    }

    private static @Nullable String nameOf(Map<String, Object> candidate) {
        String name = stringOf(candidate.get("name"));
        return name != null ? name : stringOf(candidate.get("username"));
    }

    private static AgentCapabilities capabilitiesOf(@Nullable Object value) {
        if (!(value instanceof Map<?, ?> map)) {
            return AgentCapabilities.UNKNOWN;
        }
        return new AgentCapabilities(booleanOf(map.get("streaming")), booleanOf(map.get("pushNotifications")));
    }

    private static @Nullable Boolean booleanOf(@Nullable Object value) {
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s && !s.isBlank()) {
            return Boolean.parseBoolean(s.trim());
        }
        return null;
    }

    private static @Nullable String stringOf(@Nullable Object value) {
        return value == null ? null : Utils.trimToNull(value.toString());
    }
}
