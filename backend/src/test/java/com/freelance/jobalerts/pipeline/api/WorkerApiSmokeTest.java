package com.freelance.jobalerts.pipeline.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class WorkerApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void runEndpointIsPostOnly() throws Exception {
        mockMvc.perform(get("/api/worker/run"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void manualRunPublishesStats() throws Exception {
        mockMvc.perform(post("/api/worker/run"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("COMPLETED"))
            .andExpect(jsonPath("$.sent_this_cycle").value(0))
            .andExpect(jsonPath("$.cycle_seconds").value(greaterThanOrEqualTo(0.0)))
            .andExpect(jsonPath("$.feeds").isEmpty());

        mockMvc.perform(get("/api/worker/status"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false))
            .andExpect(jsonPath("$.state").value("IDLE"))
            .andExpect(jsonPath("$.lastCycle.status").value("COMPLETED"));
    }

    @Test
    void startAndStopToggleDaemon() throws Exception {
        mockMvc.perform(post("/api/worker/start"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(true));

        mockMvc.perform(post("/api/worker/stop"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.running").value(false));
    }
}
