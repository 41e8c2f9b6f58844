package io.taskrelay.server.executor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

public class CallbackUrlTest {

    @Test
    public void testBuildsCallbackPath() {
        assertEquals("https://relay.example.com/webhook/a2a/todolist/8f0c-11ee:1",
                CallbackUrl.of("https://relay.example.com", "a2a", "8f0c-11ee:1"));
    }

    @Test
    public void testTodolistIdValidation() {
        assertTrue(CallbackUrl.isValidTodolistId("a"));
        assertTrue(CallbackUrl.isValidTodolistId("550e8400-e29b-41d4-a716-446655440000"));
        assertTrue(CallbackUrl.isValidTodolistId("a".repeat(128)));

        assertFalse(CallbackUrl.isValidTodolistId(null));
        assertFalse(CallbackUrl.isValidTodolistId(""));
        assertFalse(CallbackUrl.isValidTodolistId(" "));
        assertFalse(CallbackUrl.isValidTodolistId("-leading-dash"));
        assertFalse(CallbackUrl.isValidTodolistId("has/slash"));
        assertFalse(CallbackUrl.isValidTodolistId("a".repeat(129)));
    }

    @Test
    public void testRejectsUnsafeTodolistId() {
        assertThrows(IllegalArgumentException.class, () -> CallbackUrl.of("http://relay", "a2a", "../etc"));
    }
}
