package io.taskrelay.client;

import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * What the proxy forwards to a target agent for one task.
 *
 * @param taskId the proxy-side task id
 * @param todolistId the correlation key embedded in callback URLs
 * @param contextId the caller's conversation context, if any
 * @param text the message text sent to the target
 */
public record ForwardRequest(String taskId, String todolistId, @Nullable String contextId, String text) {

    public ForwardRequest {
        Assert.checkNotBlankParam("taskId", taskId);
        todolistId = todolistId == null || todolistId.isBlank() ? taskId : todolistId;
        Assert.checkNotNullParam("text", text);
    }
}
