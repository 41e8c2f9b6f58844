package io.taskrelay.server.agentexecution;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import io.taskrelay.util.Assert;
import io.taskrelay.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Everything the caller handed over for one task: ids, the request text and free-form metadata.
 * <p>
 * Well-known metadata keys:
 * <ul>
 *   <li>{@value #AGENTS}: candidate target agents, a list of maps with {@code endpoint},
 *       {@code name} or {@code username}, {@code role}, {@code profile} and optional
 *       {@code capabilities}. Also read from {@code extras.agents}.</li>
 *   <li>{@value #AGENT_ROLE}: which candidate to pick.</li>
 *   <li>{@value #DELIVERY_MODE}: {@code blocking} or {@code non_blocking}.</li>
 *   <li>{@value #TODOLIST_ID}: correlation key; defaults to the task id.</li>
 *   <li>{@value #FEEDBACK}: list of {@code {time, content}} maps; the newest entry is appended
 *       to the forwarded message.</li>
 * </ul>
 */
public class RequestContext {

    public static final String AGENTS = "agents";
    public static final String EXTRAS = "extras";
    public static final String AGENT_ROLE = "agentRole";
    public static final String DELIVERY_MODE = "deliveryMode";
    public static final String TODOLIST_ID = "todolistId";
    public static final String FEEDBACK = "feedback";

    private final String taskId;
    private final @Nullable String contextId;
    private final String userInput;
    private final Map<String, Object> metadata;

    private RequestContext(String taskId, @Nullable String contextId, String userInput, Map<String, Object> metadata) {
        this.taskId = taskId;
        this.contextId = contextId;
        this.userInput = userInput;
        this.metadata = metadata;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getTaskId() {
        return taskId;
    }

    public @Nullable String getContextId() {
        return contextId;
    }

    public String getUserInput() {
        return userInput;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public @Nullable Object getHint(String key) {
        return metadata.get(key);
    }

    public String getTodolistId() {
        String todolistId = stringValue(metadata.get(TODOLIST_ID));
        if (todolistId == null) {
            todolistId = stringValue(metadata.get("todolist_id"));
        }
        return todolistId == null ? taskId : todolistId;
    }

    /**
     * @return the candidate agents, skipping entries that are not maps
     */
    public List<Map<String, Object>> getAgents() {
        Object agents = metadata.get(AGENTS);
        if (agents == null && metadata.get(EXTRAS) instanceof Map<?, ?> extras) {
            agents = extras.get(AGENTS);
        }
        return mapsOf(agents);
    }

    public List<Map<String, Object>> getFeedback() {
        Object feedback = metadata.get(FEEDBACK);
        if (feedback == null && metadata.get(EXTRAS) instanceof Map<?, ?> extras) {
            feedback = extras.get(FEEDBACK);
        }
        return mapsOf(feedback);
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> mapsOf(@Nullable Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<Map<String, Object>> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (item instanceof Map<?, ?> map) {
                result.add((Map<String, Object>) map);
            }
        }
        return result;
    }

    private static @Nullable String stringValue(@Nullable Object value) {
        return value == null ? null : Utils.trimToNull(value.toString());
    }

    @Override
    public String toString() {
        return "RequestContext{taskId=" + taskId + ", todolistId=" + getTodolistId() + "}";
    }

    public static class Builder {
        private @Nullable String taskId;
        private @Nullable String contextId;
        private String userInput = "";
        private final Map<String, Object> metadata = new HashMap<>();

        private Builder() {
        }

        public Builder taskId(@Nullable String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder contextId(@Nullable String contextId) {
            this.contextId = contextId;
            return this;
        }

        public Builder userInput(@Nullable String userInput) {
            this.userInput = userInput == null ? "" : userInput;
            return this;
        }

        public Builder metadata(@Nullable Map<String, Object> metadata) {
            if (metadata != null) {
                this.metadata.putAll(metadata);
            }
            return this;
        }

        public Builder metadata(String key, Object value) {
            Assert.checkNotNullParam("key", key);
            this.metadata.put(key, value);
            return this;
        }

        public RequestContext build() {
            String id = Utils.trimToNull(taskId);
            return new RequestContext(id == null ? UUID.randomUUID().toString() : id, contextId, userInput,
                    Collections.unmodifiableMap(new HashMap<>(metadata)));
        }
    }
}
