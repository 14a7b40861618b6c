package com.platform.datakeeper.api;

import com.platform.datakeeper.scheduler.TriggerScheduler;
import lombok.AllArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/scheduler")
@AllArgsConstructor
public class SchedulerController {
    
    private final TriggerScheduler triggerScheduler;
    
    @GetMapping("/stats")
    public TriggerScheduler.SchedulerStats stats() {
        return triggerScheduler.getStats();
    }
}
