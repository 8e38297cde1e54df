package prism.coordinator.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CreateJobRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "config_id": "cfg-1",
                  "device_ids": ["d1", "d2"],
                  "duration": 15
                }
                """;

        CreateJobRequest req = mapper.readValue(json, CreateJobRequest.class);

        assertEquals("cfg-1", req.configId());
        assertEquals(List.of("d1", "d2"), req.deviceIds());
        assertEquals(15, req.duration());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void durationIsOptional() throws Exception {
        CreateJobRequest req = mapper.readValue("{\"config_id\":\"cfg-1\",\"device_ids\":[\"d1\"]}",
                CreateJobRequest.class);
        assertNull(req.duration());
        assertDoesNotThrow(req::validate);
    }

    @Test
    void validateRequiresConfigAndDevices() {
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest(null, List.of("d1"), 10).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("cfg-1", List.of(), 10).validate());
        assertThrows(IllegalArgumentException.class,
                () -> new CreateJobRequest("cfg-1", null, 10).validate());
    }
}
