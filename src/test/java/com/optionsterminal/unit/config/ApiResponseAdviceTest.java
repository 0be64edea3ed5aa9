package com.optionsterminal.unit.config;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.optionsterminal.api.controller.HealthController;
import com.optionsterminal.config.ApiResponseAdvice;
import com.optionsterminal.session.BrokerSessionManager;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@ExtendWith(MockitoExtension.class)
class ApiResponseAdviceTest {

    private MockMvc mockMvc;

    @Mock
    private BrokerSessionManager brokerSessionManager;

    @RestController
    public static class ForeignController {

        @GetMapping("/foreign")
        public Map<String, Object> foreign() {
            return Map.of("status", "raw");
        }
    }

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-10-27T05:00:00Z"), ZoneOffset.UTC);
        mockMvc = MockMvcBuilders.standaloneSetup(
                        new HealthController(brokerSessionManager, clock), new ForeignController())
                .setControllerAdvice(new ApiResponseAdvice())
                .build();
    }

    @Test
    @DisplayName("gateway controller bodies are wrapped in the success envelope")
    void wrapsGatewayControllers() throws Exception {
        mockMvc.perform(get("/ping"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.status").value("ok"))
                .andExpect(jsonPath("$.timestamp").exists());
    }

    @Test
    @DisplayName("controllers outside the gateway's API package are left unwrapped")
    void leavesOtherControllersAlone() throws Exception {
        mockMvc.perform(get("/foreign"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("raw"))
                .andExpect(jsonPath("$.success").doesNotExist());
    }
}
