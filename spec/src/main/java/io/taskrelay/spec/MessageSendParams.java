package io.taskrelay.spec;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.taskrelay.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Parameters of {@code message/send} and {@code message/stream}.
 *
 * @param message the message to forward (required)
 * @param configuration optional processing options
 * @param metadata optional request metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MessageSendParams(Message message, @Nullable MessageSendConfiguration configuration,
                                @Nullable Map<String, Object> metadata) {

    public MessageSendParams {
        Assert.checkNotNullParam("message", message);
    }
}
