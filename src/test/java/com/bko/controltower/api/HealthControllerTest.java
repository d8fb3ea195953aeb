package com.bko.controltower.api;

import com.bko.controltower.config.ControlTowerProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HealthController.class)
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ControlTowerProperties properties;

    @Test
    void reportsHealthyWithAgentUrls() throws Exception {
        when(properties.getVision()).thenReturn(new ControlTowerProperties.AgentEndpoint("http://vision:8081"));
        when(properties.getSupplier()).thenReturn(new ControlTowerProperties.AgentEndpoint("http://supplier:8082"));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("control-tower"))
                .andExpect(jsonPath("$.vision_url").value("http://vision:8081"))
                .andExpect(jsonPath("$.supplier_url").value("http://supplier:8082"));
    }
}
