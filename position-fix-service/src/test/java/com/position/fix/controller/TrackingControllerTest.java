// com/position/fix/controller/TrackingControllerTest.java
package com.position.fix.controller;

import com.position.fix.tracking.TrackingDemandRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TrackingControllerTest {

    private TrackingDemandRegistry registry;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        registry = new TrackingDemandRegistry();
        mockMvc = MockMvcBuilders.standaloneSetup(new TrackingController(registry)).build();
    }

    @Test
    void shouldRegisterConsumerOnce() throws Exception {
        mockMvc.perform(post("/api/tracking/map-view")).andExpect(status().isCreated());
        mockMvc.perform(post("/api/tracking/map-view")).andExpect(status().isOk());

        assertThat(registry.getConsumers()).containsExactly("map-view");
        mockMvc.perform(get("/api/tracking"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0]").value("map-view"));
    }

    @Test
    void shouldReleaseConsumer() throws Exception {
        registry.startTracking("map-view");

        mockMvc.perform(delete("/api/tracking/map-view")).andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/tracking/map-view")).andExpect(status().isNotFound());

        assertThat(registry.hasContinuousDemand()).isFalse();
    }
}
