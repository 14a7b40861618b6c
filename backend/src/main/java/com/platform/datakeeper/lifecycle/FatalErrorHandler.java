package com.platform.datakeeper.lifecycle;

import com.platform.datakeeper.config.DataKeeperProperties;
import com.platform.datakeeper.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Terminates the process when the job ledger can no longer be read or written.
 * Everything else is handled at job or trigger scope.
 */
@Slf4j
@Component
public class FatalErrorHandler {
    
    public static final int EXIT_LEDGER_FAILURE = 3;
    
    private final ApplicationContext applicationContext;
    private final DataKeeperProperties properties;
    private final MetricsRegistry metricsRegistry;
    private final AtomicBoolean triggered = new AtomicBoolean(false);
    
    public FatalErrorHandler(
            ApplicationContext applicationContext,
            DataKeeperProperties properties,
            MetricsRegistry metricsRegistry) {
        this.applicationContext = applicationContext;
        this.properties = properties;
        this.metricsRegistry = metricsRegistry;
    }
    
    public void onLedgerFailure(String operation, Throwable cause) {
        log.error("Job ledger storage failure during {}: {}", operation, cause.getMessage(), cause);
        metricsRegistry.incrementCounter("datakeeper.ledger.failures", "operation", operation);
        
        if (!properties.isExitOnFatal() || !triggered.compareAndSet(false, true)) {
            return;
        }
        
        // Exit from a separate thread: the context waits for the worker pool that may be calling us.
        Thread exit = new Thread(() -> {
            int code = SpringApplication.exit(applicationContext, () -> EXIT_LEDGER_FAILURE);
            System.exit(code);
        }, "dk-fatal-exit");
        exit.start();
    }
    
    public boolean isTriggered() {
        return triggered.get();
    }
}
