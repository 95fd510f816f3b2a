package com.tasklane.dispatch.api;

import com.tasklane.core.model.LogEntry;
import com.tasklane.core.model.LogEntryKind;
import com.tasklane.worker.WorkerSupervisor;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Optional;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(InternalApiController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class InternalApiControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private WorkerSupervisor supervisor;

    @Test
    @DisplayName("heartbeat from an active worker is accepted")
    void heartbeatAccepted() throws Exception {
        when(supervisor.heartbeat("worker-1", 40, "running tests")).thenReturn(true);

        mockMvc.perform(post("/api/internal/workers/worker-1/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"progress_percent\": 40, \"current_step\": \"running tests\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.accepted").value(true));
    }

    @Test
    @DisplayName("heartbeat from a terminated worker returns 410")
    void heartbeatGone() throws Exception {
        when(supervisor.heartbeat("worker-1", 0, null)).thenReturn(false);

        mockMvc.perform(post("/api/internal/workers/worker-1/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isGone());
    }

    @Test
    @DisplayName("log line is appended and its sequence returned")
    void appendLog() throws Exception {
        when(supervisor.append("worker-1", LogEntryKind.FILE_CHANGE, "src/login.ts")).thenReturn(Optional.of(
                new LogEntry(12, "run-1", "task-1", "worker-1", LogEntryKind.FILE_CHANGE, "src/login.ts", Instant.now())));

        mockMvc.perform(post("/api/internal/workers/worker-1/log")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"file_change\", \"message\": \"src/login.ts\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.sequence").value(12));
    }

    @Test
    @DisplayName("log line without a message returns 400")
    void appendWithoutMessage() throws Exception {
        mockMvc.perform(post("/api/internal/workers/worker-1/log")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"action\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("unknown log kind returns 400")
    void unknownKind() throws Exception {
        mockMvc.perform(post("/api/internal/workers/worker-1/log")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"kind\": \"shout\", \"message\": \"hi\"}"))
                .andExpect(status().isBadRequest());
    }
}
