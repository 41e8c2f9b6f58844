package io.taskrelay.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatusUpdateEvent(@Nullable String taskId, @Nullable String contextId, TaskStatus status,
                                    @JsonProperty("final") boolean finalUpdate,
                                    @Nullable Map<String, Object> metadata) implements StreamingEventKind {

    public static final String STATUS_UPDATE = "status-update";

    public TaskStatusUpdateEvent {
        status = status == null ? new TaskStatus(TaskState.UNKNOWN) : status;
    }

    @Override
    public String kind() {
        return STATUS_UPDATE;
    }
}
