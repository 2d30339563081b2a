package com.certparser.masterlist.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.context.WebApplicationContext;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest
@ActiveProfiles("test")
class CertParserApiSmokeTest {

    @Autowired
    private WebApplicationContext context;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        this.mockMvc = MockMvcBuilders.webAppContextSetup(context).build();
    }

    @Test
    void infoReportsDatabaseAndSchedulerState() throws Exception {
        mockMvc.perform(get("/info"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.name").value("cert-parser"))
            .andExpect(jsonPath("$.schedulerEnabled").value(false))
            .andExpect(jsonPath("$.dbConnectivity").value(true))
            .andExpect(jsonPath("$.counts.root_ca").isNumber())
            .andExpect(jsonPath("$.counts.revoked_certificate_list").isNumber());
    }

    @Test
    void disabledSchedulerStillReportsHealthyAndReady() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.reason").value("scheduler disabled"));
        mockMvc.perform(get("/ready"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("ready"));
    }

    @Test
    void triggerIsPostOnly() throws Exception {
        mockMvc.perform(get("/trigger"))
            .andExpect(status().isMethodNotAllowed());
    }

    @Test
    void triggerAgainstUnreachableUpstreamFails() throws Exception {
        MvcResult pending = mockMvc.perform(post("/trigger"))
            .andExpect(request().asyncStarted())
            .andReturn();

        mockMvc.perform(asyncDispatch(pending))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.status").value("failed"))
            .andExpect(jsonPath("$.errorCode").value("EXTERNAL_SERVICE_ERROR"));
    }
}
