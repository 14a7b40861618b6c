package com.platform.datakeeper.api;

import com.platform.datakeeper.scheduler.ExternalEvent;
import com.platform.datakeeper.scheduler.TriggerScheduler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Intake surface for external metric feeds and event sources (geofence/AIS).
 */
@RestController
@RequestMapping("/api/intake")
@AllArgsConstructor
public class IntakeController {
    
    private final TriggerScheduler triggerScheduler;
    
    /**
     * Metric values for condition triggers, used from the next tick.
     */
    @PostMapping("/metrics")
    public ResponseEntity<Map<String, Object>> metrics(@RequestBody @NotEmpty Map<String, Double> values) {
        triggerScheduler.onMetrics(values);
        return ResponseEntity.accepted().body(Map.of("accepted", values.size()));
    }
    
    /**
     * An external event, handled immediately.
     */
    @PostMapping("/events")
    public List<TriggerScheduler.FireResult> event(@RequestBody @Valid EventRequest request) {
        ExternalEvent event = new ExternalEvent(
            request.getSource(),
            request.getPositionM(),
            request.getEventTime() != null ? request.getEventTime() : Instant.now(),
            request.getAttributes());
        return triggerScheduler.onEvent(event);
    }
    
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventRequest {
        @NotBlank
        private String source;
        @NotNull
        private Double positionM;
        private Instant eventTime;
        private Map<String, Object> attributes;
    }
}
