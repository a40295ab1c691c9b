package com.gamevault.game_library.outbox;

import com.gamevault.game_library.observability.OutboxMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * Background publisher that drains the outbox to Kafka.
 *
 * Events are sent one at a time in sequence order and keyed by
 * {@code userId:gameId}, so all transitions of one pair land on the same
 * partition in the order they were committed. An event is marked published
 * only after the broker acknowledges it. Once an event fails, later events of
 * the same pair wait for it. Events that keep failing up to
 * {@code outbox.publisher.max-retries} are left in place as dead letters, and the
 * pair's later events stay unpublished until the dead letter is dealt with.
 */
@Component
@ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {

    private final OutboxService outboxService;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final OutboxMetrics outboxMetrics;

    @Value("${kafka.topic.library:library-transitions}")
    private String libraryTopic;

    @Value("${outbox.publisher.batch-size:100}")
    private int batchSize;

    @Value("${outbox.publisher.max-retries:5}")
    private int maxRetries;

    @Value("${outbox.publisher.send-timeout-ms:10000}")
    private long sendTimeoutMs;

    @Scheduled(fixedRateString = "${outbox.publisher.poll-interval-ms:1000}")
    public void publishPendingEvents() {
        try {
            List<OutboxEvent> events = outboxService.findPublishableEvents(batchSize);
            if (events.isEmpty()) {
                return;
            }

            log.debug("Found {} unpublished events to process", events.size());
            Set<String> blockedKeys = new HashSet<>();
            for (OutboxEvent event : events) {
                if (blockedKeys.contains(event.getAggregateKey())) {
                    log.debug("Holding back event {}: an earlier event for {} was not published",
                        event.getId(), event.getAggregateKey());
                    continue;
                }
                if (!publishEvent(event)) {
                    blockedKeys.add(event.getAggregateKey());
                }
            }
        } catch (Exception e) {
            log.error("Error in outbox publisher polling loop", e);
        }
    }

    /**
     * @return true if the broker acknowledged the event
     */
    private boolean publishEvent(OutboxEvent event) {
        try {
            SendResult<String, String> result = kafkaTemplate
                .send(topicFor(event), event.getAggregateKey(), event.getPayload())
                .get(sendTimeoutMs, TimeUnit.MILLISECONDS);

            log.debug("Published event: eventId={}, topic={}, partition={}, offset={}, eventType={}",
                event.getId(),
                result.getRecordMetadata().topic(),
                result.getRecordMetadata().partition(),
                result.getRecordMetadata().offset(),
                event.getEventType());

            outboxService.markPublished(event.getId());
            outboxMetrics.recordEventPublished(event.getEventType());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            recordFailure(event, "Interrupted while publishing");
            return false;
        } catch (Exception e) {
            log.error("Failed to publish event: eventId={}, eventType={}, error={}",
                event.getId(), event.getEventType(), e.getMessage());
            recordFailure(event, e.getMessage());
            return false;
        }
    }

    private void recordFailure(OutboxEvent event, String error) {
        outboxService.markFailed(event.getId(), error);
        outboxMetrics.recordEventPublishFailed(event.getEventType());
        if (event.getRetryCount() + 1 >= maxRetries) {
            log.warn("Event {} reached max retries ({}), left as dead letter; later events for {} are held back",
                event.getId(), maxRetries, event.getAggregateKey());
            outboxMetrics.recordEventDeadLettered(event.getEventType());
        }
    }

    private String topicFor(OutboxEvent event) {
        // only library aggregates are written today
        return libraryTopic;
    }

    /**
     * Runs one publishing pass immediately.
     */
    public void triggerPublish() {
        publishPendingEvents();
    }
}
