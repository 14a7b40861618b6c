package com.platform.datakeeper.lifecycle;

import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.policy.Policy;
import com.platform.datakeeper.policy.PolicyRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Loads the configured policy document before the first tick. A document that fails
 * validation aborts startup.
 */
@Slf4j
@Component
@Order(0)
public class PolicyBootstrap implements ApplicationRunner {
    
    private final PolicyRegistry policyRegistry;
    private final DataKeeperProperties properties;
    
    public PolicyBootstrap(PolicyRegistry policyRegistry, DataKeeperProperties properties) {
        this.policyRegistry = policyRegistry;
        this.properties = properties;
    }
    
    @Override
    public void run(ApplicationArguments args) {
        List<Policy> policies = policyRegistry.loadConfigured();
        log.info("Startup: {} policies loaded from {} ({} enabled)",
            policies.size(), properties.getPolicyPath(),
            policies.stream().filter(Policy::isEnabled).count());
    }
}
