package com.platform.datakeeper.job;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out of {@link JobUpdate} events to in-process subscribers (dashboard feed,
 * notifiers). A failing subscriber is logged and does not affect the others or the ledger.
 */
@Slf4j
@Component
public class JobUpdatePublisher {
    
    private final List<Consumer<JobUpdate>> subscribers = new CopyOnWriteArrayList<>();
    
    /**
     * Registers a subscriber.
     *
     * @return handle that removes the subscription when run
     */
    public Runnable subscribe(Consumer<JobUpdate> subscriber) {
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }
    
    public void publish(JobUpdate update) {
        for (Consumer<JobUpdate> subscriber : subscribers) {
            try {
                subscriber.accept(update);
            } catch (RuntimeException e) {
                log.warn("job_update subscriber failed for job {}: {}", update.id(), e.getMessage());
            }
        }
    }
    
    public int subscriberCount() {
        return subscribers.size();
    }
}
