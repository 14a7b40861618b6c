package com.platform.datakeeper.api;

import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.PolicyRegistry;
import com.platform.datakeeper.scheduler.TriggerScheduler;
import lombok.AllArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST API for policies.
 */
@RestController
@RequestMapping("/api/policies")
@AllArgsConstructor
public class PolicyController {
    
    private final PolicyRegistry policyRegistry;
    private final TriggerScheduler triggerScheduler;
    
    /**
     * Get all loaded policies.
     */
    @GetMapping
    public List<Policy> getAllPolicies() {
        return policyRegistry.snapshot().policies();
    }
    
    /**
     * Get policy by ID.
     */
    @GetMapping("/{id}")
    public Policy getPolicy(@PathVariable String id) {
        return policyRegistry.get(id);
    }
    
    /**
     * Delete policy and its jobs.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deletePolicy(@PathVariable String id) {
        policyRegistry.delete(id);
        return ResponseEntity.noContent().build();
    }
    
    /**
     * Reload the configured policy file.
     */
    @PostMapping("/reload")
    public Map<String, Object> reload() {
        List<Policy> loaded = policyRegistry.loadConfigured();
        return Map.of("loaded", loaded.size(), "source", String.valueOf(policyRegistry.snapshot().source()));
    }
    
    /**
     * Replace the active policies with a YAML document from the request body.
     */
    @PostMapping(value = "/load", consumes = {"application/yaml", "application/x-yaml", MediaType.TEXT_PLAIN_VALUE})
    public List<Policy> load(@RequestBody String document) {
        return policyRegistry.load(document, "api");
    }
    
    /**
     * Invoke the policy's on-demand trigger.
     */
    @PostMapping("/{id}/trigger")
    public TriggerScheduler.FireResult trigger(@PathVariable String id) {
        return triggerScheduler.fireOnDemand(id);
    }
}
