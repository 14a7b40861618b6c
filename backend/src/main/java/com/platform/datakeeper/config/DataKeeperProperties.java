package com.platform.datakeeper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration under {@code datakeeper.*}. Each top-level key can also be
 * given through its environment variable ({@code POLICY_PATH}, {@code DB_PATH}, ...).
 */
@Data
@ConfigurationProperties(prefix = "datakeeper")
public class DataKeeperProperties {
    
    /**
     * Directory for log files; console only when unset.
     */
    private String logDirectory;
    
    /**
     * Directory scanned for plugin jars at startup.
     */
    private String pluginDir;
    
    /**
     * Policy document (YAML).
     */
    private String policyPath = "config/policy.yaml";
    
    /**
     * H2 database file, without extension.
     */
    private String dbPath = "./data/datakeeper";
    
    /**
     * SQL script creating the schema.
     */
    private String initFilePath = "classpath:schema.sql";
    
    /**
     * Terminate the process on unrecoverable ledger storage failures.
     */
    private boolean exitOnFatal = true;
    
    private Scheduler scheduler = new Scheduler();
    
    @Data
    public static class Scheduler {
        
        private boolean enabled = true;
        
        /**
         * Tick cadence; the policy document's {@code policy_evaluation_interval} overrides it.
         */
        private Duration interval = Duration.ofSeconds(60);
        
        private int workerThreads = 4;
        
        /**
         * Upper bound for a single metric source read.
         */
        private Duration metricTimeout = Duration.ofSeconds(5);
        
        /**
         * How long shutdown waits for running jobs.
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }
}
