package taskline.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.JsonNode;
import taskline.coordinator.model.TaskState;
import taskline.coordinator.model.TaskView;
import taskline.coordinator.server.RouterHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON shape of the public task DTOs.
 */
class TaskStatusResponseTest {

    @Test
    @DisplayName("Pending task: null result is written, position is set")
    void pendingShape() throws Exception {
        TaskStatusResponse dto = TaskStatusResponse.from(new TaskView("t-1", TaskState.PENDING, null, 2));

        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(dto));

        assertEquals("t-1", json.get("task_id").asText());
        assertEquals("PENDING", json.get("status").asText());
        assertTrue(json.has("result"));
        assertTrue(json.get("result").isNull());
        assertEquals(2, json.get("queue_position").asInt());
    }

    @Test
    @DisplayName("Finished task: result set, queue_position written as null")
    void finishedShape() throws Exception {
        TaskStatusResponse dto = TaskStatusResponse.from(new TaskView("t-1", TaskState.SUCCESS, "hi", null));

        JsonNode json = RouterHandler.mapper().readTree(RouterHandler.mapper().writeValueAsString(dto));

        assertEquals("SUCCESS", json.get("status").asText());
        assertEquals("hi", json.get("result").asText());
        assertTrue(json.has("queue_position"));
        assertTrue(json.get("queue_position").isNull());
    }

    @Test
    void submitRequestAcceptsPayloadAlias() throws Exception {
        SubmitTaskRequest viaText = RouterHandler.mapper().readValue("{\"text\":\"a\"}", SubmitTaskRequest.class);
        SubmitTaskRequest viaPayload = RouterHandler.mapper().readValue("{\"payload\":\"b\"}", SubmitTaskRequest.class);

        assertEquals("a", viaText.text());
        assertEquals("b", viaPayload.text());
        assertThrows(IllegalArgumentException.class, () -> new SubmitTaskRequest(" ").validate());
    }

    @Test
    void submitResponseShape() throws Exception {
        JsonNode json = RouterHandler.mapper().readTree(
                RouterHandler.mapper().writeValueAsString(SubmitTaskResponse.dispatched("t-9")));

        assertEquals("Task dispatched successfully", json.get("message").asText());
        assertEquals("t-9", json.get("task_id").asText());
    }
}
