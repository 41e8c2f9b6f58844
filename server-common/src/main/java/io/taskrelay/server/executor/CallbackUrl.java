package io.taskrelay.server.executor;

import java.util.regex.Pattern;

import org.jspecify.annotations.Nullable;

/**
 * Callback URLs handed to target agents, and the todolist ids that may appear in them.
 */
public final class CallbackUrl {

    /**
     * Route the webhook receiver serves; {@code protocol} and {@code todolistId} are path parameters.
     */
    public static final String ROUTE = "/webhook/:protocol/todolist/:todolistId";

    private static final Pattern TODOLIST_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._:-]{0,127}");

    private CallbackUrl() {
    }

    public static boolean isValidTodolistId(@Nullable String todolistId) {
        return todolistId != null && TODOLIST_ID.matcher(todolistId).matches();
    }

    /**
     * @param publicBaseUrl externally reachable base URL of the receiver, without trailing slash
     * @param protocol protocol path segment, e.g. {@code a2a}
     * @param todolistId the correlation key
     * @throws IllegalArgumentException if the todolist id cannot be carried in a callback path
     */
    public static String of(String publicBaseUrl, String protocol, String todolistId) {
        if (!isValidTodolistId(todolistId)) {
            throw new IllegalArgumentException("Todolist id cannot be used in a callback URL: " + todolistId);
        }
        return publicBaseUrl + "/webhook/" + protocol + "/todolist/" + todolistId;
    }
}
