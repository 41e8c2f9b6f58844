package io.taskrelay.spec;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.jspecify.annotations.Nullable;

/**
 * Status of a target-side task.
 *
 * @param state the lifecycle state; never null, {@link TaskState#UNKNOWN} when absent
 * @param message an optional agent message describing the state
 * @param timestamp the ISO-8601 time the status was set, as sent by the target
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record TaskStatus(TaskState state, @Nullable Message message, @Nullable String timestamp) {

    public TaskStatus {
        state = state == null ? TaskState.UNKNOWN : state;
    }

    public TaskStatus(TaskState state) {
        this(state, null, null);
    }
}
