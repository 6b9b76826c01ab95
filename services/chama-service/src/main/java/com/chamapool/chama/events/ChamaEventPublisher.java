package com.chamapool.chama.events;

import com.chamapool.chama.config.ChamaProperties;
import com.chamapool.chama.engine.ChamaEvent;
import com.chamapool.chama.engine.GroupEventListener;
import com.chamapool.chama.metrics.ChamaMetricsService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes committed group events to Kafka, keyed by group id so one group's events stay
 * in order on a single partition.
 *
 * Publishing never fails the group operation that raised the event: the operation has
 * already committed, so send failures are logged and counted.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChamaEventPublisher implements GroupEventListener {

    static final String EVENT_VERSION = "1.0";

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final ChamaMetricsService metricsService;
    private final ChamaProperties properties;

    @Override
    public void onEvent(ChamaEvent event) {
        metricsService.recordGroupEvent(event.getType().name());
        recordPoolFlow(event);

        if (!Boolean.TRUE.equals(properties.getEvents().getEnabled())) {
            log.debug("Event publishing disabled, dropping {} for group {}", event.getType(), event.getGroupId());
            return;
        }
        publish(toWireEvent(event));
    }

    CompletableFuture<SendResult<String, Object>> publish(ChamaGroupEvent event) {
        String topic = properties.getEvents().getTopic();
        try {
            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topic, event.getGroupId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Published {} for group {} to {}-{}@{}", event.getEventType(), event.getGroupId(),
                            topic, result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
                } else {
                    onPublishFailure(event, topic, ex);
                }
            });
            return future;
        } catch (Exception e) {
            onPublishFailure(event, topic, e);
            return CompletableFuture.failedFuture(e);
        }
    }

    static ChamaGroupEvent toWireEvent(ChamaEvent event) {
        return ChamaGroupEvent.builder()
                .eventId(UUID.randomUUID().toString())
                .eventType(event.getType().name())
                .groupId(event.getGroupId())
                .timestamp(event.getOccurredAt())
                .version(EVENT_VERSION)
                .member(event.getMember())
                .counterparty(event.getCounterparty())
                .amount(event.getAmount())
                .period(event.getPeriod())
                .proposalId(event.getProposalId())
                .punishmentAction(event.getAction() != null ? event.getAction().name() : null)
                .reason(event.getReason())
                .wasSkipped(event.getWasSkipped())
                .support(event.getSupport())
                .build();
    }

    private void onPublishFailure(ChamaGroupEvent event, String topic, Throwable ex) {
        log.error("Failed to publish {} event {} for group {} to topic {}",
                event.getEventType(), event.getEventId(), event.getGroupId(), topic, ex);
        metricsService.recordPublishFailure(event.getEventType());
    }

    private void recordPoolFlow(ChamaEvent event) {
        switch (event.getType()) {
            case CONTRIBUTION_MADE:
            case FINE_COLLECTED:
                metricsService.recordPoolFlow("in", event.getAmount());
                break;
            case PAYOUT_PROCESSED:
            case EMERGENCY_WITHDRAWAL:
            case MEMBER_LEFT:
                metricsService.recordPoolFlow("out", event.getAmount());
                break;
            default:
                break;
        }
    }
}
