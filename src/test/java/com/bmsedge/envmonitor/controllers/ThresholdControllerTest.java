package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.exception.InvalidThresholdException;
import com.bmsedge.envmonitor.model.ThresholdConfig;
import com.bmsedge.envmonitor.service.ThresholdService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verify;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ThresholdController.class)
class ThresholdControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ThresholdService thresholdService;

    @Test
    void returnsCurrentThresholds() throws Exception {
        given(thresholdService.current()).willReturn(ThresholdConfig.serverRoomDefaults());

        mockMvc.perform(get("/api/thresholds"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tempMin").value(63.0))
                .andExpect(jsonPath("$.tempMax").value(80.0))
                .andExpect(jsonPath("$.humidityMin").value(40.0))
                .andExpect(jsonPath("$.humidityMax").value(60.0));
    }

    @Test
    void partialUpdateKeepsOmittedBoundsAndReturnsWarnings() throws Exception {
        given(thresholdService.current()).willReturn(ThresholdConfig.serverRoomDefaults());
        given(thresholdService.update(any())).willReturn(
                List.of("Temperature thresholds are outside recommended range (50°F - 100°F)"));

        mockMvc.perform(put("/api/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tempMin\": 45}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tempMin").value(45.0))
                .andExpect(jsonPath("$.tempMax").value(80.0))
                .andExpect(jsonPath("$.warnings[0]")
                        .value("Temperature thresholds are outside recommended range (50°F - 100°F)"));

        verify(thresholdService).update(argThat(c -> c.getTempMin() == 45 && c.getHumidityMax() == 60));
    }

    @Test
    void invertedThresholdsAreBadRequest() throws Exception {
        given(thresholdService.current()).willReturn(ThresholdConfig.serverRoomDefaults());
        given(thresholdService.update(any())).willThrow(
                new InvalidThresholdException(List.of("Temperature minimum must be less than maximum")));

        mockMvc.perform(put("/api/thresholds")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"tempMin\": 90, \"tempMax\": 70}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.error").value("Invalid Thresholds"))
                .andExpect(jsonPath("$.warnings[0]").value("Temperature minimum must be less than maximum"));
    }
}
