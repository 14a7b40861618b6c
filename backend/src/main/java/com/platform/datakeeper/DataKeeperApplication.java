package com.platform.datakeeper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.ArrayList;
import java.util.List;

/**
 * DataKeeper: data-lifecycle policy engine for the DAS archive.
 * 
 * Features:
 * - Declarative YAML policies (retention, downsampling, ROI, time-window, event proximity)
 * - Cron, date, interval, condition, on-demand and event triggers
 * - Persistent job ledger with atomic status transitions
 * - Live job feed over WebSocket
 * 
 * Usage: {@code datakeeper schedule --config /etc/datakeeper/application.yml}
 */
@SpringBootApplication
@EnableScheduling
public class DataKeeperApplication {
    
    public static final int EXIT_STARTUP_FAILURE = 2;

    public static void main(String[] args) {
        try {
            SpringApplication.run(DataKeeperApplication.class, translateArguments(args));
        } catch (RuntimeException e) {
            // the failure itself is already reported by Spring Boot
            System.exit(EXIT_STARTUP_FAILURE);
        }
    }
    
    /**
     * Maps the {@code schedule [--config FILE]} command line onto Spring Boot arguments.
     */
    static String[] translateArguments(String[] args) {
        List<String> translated = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i == 0 && "schedule".equals(arg)) {
                continue;
            }
            if ("--config".equals(arg) && i + 1 < args.length) {
                translated.add("--spring.config.additional-location=file:" + args[++i]);
            } else if (arg.startsWith("--config=")) {
                translated.add("--spring.config.additional-location=file:" + arg.substring("--config=".length()));
            } else {
                translated.add(arg);
            }
        }
        return translated.toArray(new String[0]);
    }
}
