package docintel.tasks.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SubmitTaskRequestTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void parsesWorkAndArgs() throws Exception {
        SubmitTaskRequest request = MAPPER.readValue(
                "{\"work\":\"add\",\"args\":[2,3],\"client\":\"ignored\"}", SubmitTaskRequest.class);

        request.validate();
        assertEquals("add", request.work());
        assertArrayEquals(new Object[] { 2, 3 }, request.argsArray());
    }

    @Test
    void missingArgsGiveEmptyArray() throws Exception {
        SubmitTaskRequest request = MAPPER.readValue("{\"work\":\"ping\"}", SubmitTaskRequest.class);

        assertEquals(0, request.argsArray().length);
    }

    @Test
    void workIsRequired() {
        assertThrows(IllegalArgumentException.class, () -> new SubmitTaskRequest(" ", null).validate());
        assertThrows(IllegalArgumentException.class, () -> new SubmitTaskRequest(null, null).validate());
    }
}
