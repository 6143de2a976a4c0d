package com.bmsedge.envmonitor.controllers;

import com.bmsedge.envmonitor.dto.ThresholdConfigDTO;
import com.bmsedge.envmonitor.model.ThresholdConfig;
import com.bmsedge.envmonitor.service.ThresholdService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/thresholds")
@RequiredArgsConstructor
@CrossOrigin(origins = "*")
public class ThresholdController {

    private final ThresholdService thresholdService;

    // Get current thresholds
    @GetMapping
    public ResponseEntity<ThresholdConfigDTO> getThresholds() {
        return ResponseEntity.ok(ThresholdConfigDTO.from(thresholdService.current()));
    }

    // Update thresholds; omitted bounds keep their current value
    @PutMapping
    public ResponseEntity<ThresholdConfigDTO> updateThresholds(@RequestBody ThresholdConfigDTO request) {
        ThresholdConfig updated = request.applyTo(thresholdService.current());
        List<String> warnings = thresholdService.update(updated);

        ThresholdConfigDTO response = ThresholdConfigDTO.from(updated);
        response.setWarnings(warnings);
        return ResponseEntity.ok(response);
    }
}
