package com.platform.datakeeper.scheduler;

import com.platform.datakeeper.error.IntakeException;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.PolicyRegistry;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileStore;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Reports disk usage of the file systems holding the policies' selector paths.
 * {@code storage.utilization} is the highest percentage used among them;
 * {@code storage.utilization.<path>} gives each path.
 */
@Component
public class StorageUtilizationProbe implements MetricSource {
    
    public static final String UTILIZATION = "storage.utilization";
    
    private final PolicyRegistry policyRegistry;
    
    public StorageUtilizationProbe(PolicyRegistry policyRegistry) {
        this.policyRegistry = policyRegistry;
    }
    
    @Override
    public String name() {
        return "storage";
    }
    
    @Override
    public Map<String, Double> read() {
        Set<String> paths = new LinkedHashSet<>();
        for (Policy policy : policyRegistry.snapshot().policies()) {
            paths.addAll(policy.getSelector().paths());
        }
        
        Map<String, Double> values = new LinkedHashMap<>();
        double max = 0;
        for (String path : paths) {
            Path dir = Path.of(path);
            if (!Files.exists(dir)) {
                continue;
            }
            try {
                FileStore store = Files.getFileStore(dir);
                long total = store.getTotalSpace();
                if (total <= 0) {
                    continue;
                }
                double used = 100.0 * (total - store.getUsableSpace()) / total;
                values.put(UTILIZATION + "." + path, used);
                max = Math.max(max, used);
            } catch (IOException e) {
                throw IntakeException.unavailable(name(), e);
            }
        }
        
        if (!values.isEmpty()) {
            values.put(UTILIZATION, max);
        }
        return values;
    }
}
