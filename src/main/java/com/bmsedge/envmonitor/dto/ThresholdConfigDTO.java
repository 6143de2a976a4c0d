package com.bmsedge.envmonitor.dto;

import com.bmsedge.envmonitor.model.ThresholdConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ThresholdConfigDTO {
    private Double tempMin;
    private Double tempMax;
    private Double humidityMin;
    private Double humidityMax;

    // Response only
    private List<String> warnings;

    public static ThresholdConfigDTO from(ThresholdConfig config) {
        return ThresholdConfigDTO.builder()
                .tempMin(config.getTempMin())
                .tempMax(config.getTempMax())
                .humidityMin(config.getHumidityMin())
                .humidityMax(config.getHumidityMax())
                .build();
    }

    /**
     * Merges this request over {@code current}; bounds left null keep their current value.
     */
    public ThresholdConfig applyTo(ThresholdConfig current) {
        return ThresholdConfig.builder()
                .tempMin(tempMin != null ? tempMin : current.getTempMin())
                .tempMax(tempMax != null ? tempMax : current.getTempMax())
                .humidityMin(humidityMin != null ? humidityMin : current.getHumidityMin())
                .humidityMax(humidityMax != null ? humidityMax : current.getHumidityMax())
                .build();
    }
}
