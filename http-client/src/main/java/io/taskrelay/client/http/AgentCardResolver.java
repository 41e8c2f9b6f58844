package io.taskrelay.client.http;

import static io.taskrelay.util.Utils.unmarshalFrom;

import java.net.URI;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.taskrelay.spec.AgentCard;
import io.taskrelay.spec.ProtocolRejectionException;
import io.taskrelay.spec.TransportException;

/**
 * Fetches the agent card a target agent publishes next to its JSON-RPC endpoint.
 */
public class AgentCardResolver {

    static final String DEFAULT_AGENT_CARD_PATH = "/.well-known/agent-card.json";

    private final HttpClient httpClient;
    private final String agentCardPath;
    private final Duration timeout;

    /**
     * @param agentUrl the JSON-RPC endpoint of the agent; the card is looked up below its path
     * @param timeout bound for the whole lookup
     * @throws IllegalArgumentException if the URL is invalid
     */
    public AgentCardResolver(String agentUrl, Duration timeout) {
        this(HttpClient.createHttpClient(agentUrl), URI.create(agentUrl).getPath(), timeout);
    }

    /**
     * @param httpClient the http client to use
     * @param agentPath path of the agent relative to the client's base URL; may be empty or
     *                  already end with the well-known card path
     * @param timeout bound for the whole lookup
     */
    public AgentCardResolver(HttpClient httpClient, String agentPath, Duration timeout) {
        this.httpClient = httpClient;
        this.timeout = timeout;
        String path = agentPath == null ? "" : agentPath;
        if (path.endsWith("/")) {
            path = path.substring(0, path.length() - 1);
        }
        if (path.isEmpty()) {
            this.agentCardPath = DEFAULT_AGENT_CARD_PATH;
        } else if (path.endsWith(DEFAULT_AGENT_CARD_PATH)) {
            this.agentCardPath = path;
        } else {
            this.agentCardPath = path + DEFAULT_AGENT_CARD_PATH;
        }
    }

    String getAgentCardPath() {
        return agentCardPath;
    }

    /**
     * Get the agent card for the configured agent.
     *
     * @return the agent card
     * @throws TransportException if the agent could not be reached in time
     * @throws ProtocolRejectionException if the agent answered with an error status or an unreadable card
     */
    public AgentCard getAgentCard() {
        String body;
        try {
            HttpResponse response = httpClient.get(agentCardPath)
                    .addHeader("Accept", "application/json")
                    .timeout(timeout)
                    .send()
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!response.success()) {
                throw new ProtocolRejectionException("Failed to obtain agent card: " + response.statusCode(),
                        response.statusCode());
            }
            body = response.body().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while fetching agent card", e);
        } catch (ExecutionException e) {
            throw new TransportException("Failed to obtain agent card: " + e.getCause(), e.getCause());
        } catch (TimeoutException e) {
            throw new TransportException("Timed out fetching agent card", e);
        }

        try {
            return unmarshalFrom(body, AgentCard.class);
        } catch (JsonProcessingException e) {
            throw new ProtocolRejectionException("Could not unmarshal agent card response: " + e.getOriginalMessage());
        }
    }
}
