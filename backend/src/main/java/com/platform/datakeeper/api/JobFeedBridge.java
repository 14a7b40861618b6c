package com.platform.datakeeper.api;

import com.platform.datakeeper.job.JobUpdate;
import com.platform.datakeeper.job.JobUpdatePublisher;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Forwards {@code job_update} events to WebSocket subscribers of {@code /topic/jobs}.
 */
@Slf4j
@Component
public class JobFeedBridge {
    
    public static final String TOPIC = "/topic/jobs";
    
    private final JobUpdatePublisher publisher;
    private final SimpMessagingTemplate messagingTemplate;
    private Runnable subscription;
    
    public JobFeedBridge(JobUpdatePublisher publisher, SimpMessagingTemplate messagingTemplate) {
        this.publisher = publisher;
        this.messagingTemplate = messagingTemplate;
    }
    
    @PostConstruct
    public void start() {
        subscription = publisher.subscribe(this::forward);
    }
    
    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.run();
        }
    }
    
    void forward(JobUpdate update) {
        messagingTemplate.convertAndSend(TOPIC, update);
        log.trace("Sent job_update {} -> {}", update.id(), update.status());
    }
}
