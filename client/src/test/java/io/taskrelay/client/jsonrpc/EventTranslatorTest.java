package io.taskrelay.client.jsonrpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.taskrelay.client.ForwardedEvent;
import io.taskrelay.spec.FailureKind;
import io.taskrelay.spec.StreamingEvents;
import org.junit.jupiter.api.Test;

public class EventTranslatorTest {

    @Test
    public void testStreamedArtifactsBecomeResultWhenStatusHasNoText() throws Exception {
        EventTranslator translator = new EventTranslator();

        ForwardedEvent chunk = translator.translate(StreamingEvents.fromJson("""
                {"kind": "artifact-update", "taskId": "r-1",
                 "artifact": {"artifactId": "a", "parts": [{"kind": "text", "text": "Day 1: Rome. "}]}}"""));
        translator.translate(StreamingEvents.fromJson("""
                {"kind": "artifact-update", "taskId": "r-1",
                 "artifact": {"artifactId": "a", "parts": [{"kind": "text", "text": "Day 2: Florence."}]}}"""));
        ForwardedEvent done = translator.translate(StreamingEvents.fromJson("""
                {"kind": "status-update", "taskId": "r-1", "final": true, "status": {"state": "completed"}}"""));

        assertEquals(ForwardedEvent.Kind.PROGRESS, chunk.kind());
        assertEquals("artifact", chunk.sequenceHint().stage());
        assertEquals(ForwardedEvent.Kind.COMPLETED, done.kind());
        assertEquals("Day 1: Rome. Day 2: Florence.", done.text());
        assertEquals("r-1", done.remoteTaskId());
    }

    @Test
    public void testInputRequiredStopsTheForward() throws Exception {
        ForwardedEvent event = new EventTranslator().translate(StreamingEvents.fromJson("""
                {"kind": "status-update", "taskId": "r-1", "final": true, "status": {"state": "input-required"}}"""));

        assertTrue(event.isTerminal());
        assertEquals(FailureKind.PROTOCOL_REJECTION, event.failure().kind());
        assertEquals("input-required", event.remoteState());
    }

    @Test
    public void testDirectMessageCompletes() throws Exception {
        ForwardedEvent event = new EventTranslator().translateBlockingResult(StreamingEvents.fromJson("""
                {"kind": "message", "role": "agent", "messageId": "m", "parts": [{"kind": "text", "text": "42"}]}"""));

        assertEquals(ForwardedEvent.Kind.COMPLETED, event.kind());
        assertEquals("42", event.text());
    }

    @Test
    public void testCompletedWithoutAnyTextUsesDefault() throws Exception {
        ForwardedEvent event = new EventTranslator().translateBlockingResult(StreamingEvents.fromJson("""
                {"kind": "task", "id": "r-1", "status": {"state": "completed"}}"""));

        assertEquals(EventTranslator.DEFAULT_RESULT, event.text());
    }
}
