package com.susuchain.infrastructure.messaging;

import com.susuchain.domain.exception.DutyNotFoundException;
import com.susuchain.domain.exception.InvalidInputException;
import com.susuchain.domain.model.AutomationRequest;
import com.susuchain.domain.model.DutyRegistration;
import com.susuchain.domain.service.TaskRegistry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

/**
 * Kafka consumer for member opt-in / opt-out of payout automation.
 *
 * Architecture:
 * - Manual offset management for at-least-once delivery
 * - Replays are harmless: opt-in is idempotent in the registry, a repeated
 *   opt-out finds the duty gone and is acknowledged
 * - Dead Letter Queue for requests that cannot be applied
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AutomationRequestConsumer {

    private final TaskRegistry taskRegistry;
    private final KafkaTemplate<String, AutomationRequest> kafkaTemplate;
    private final MeterRegistry meterRegistry;

    @Value("${app.kafka.topics.automation-requests-dlq}")
    private String dlqTopic;

    @KafkaListener(
            topics = "${app.kafka.topics.automation-requests}",
            groupId = "${spring.kafka.consumer.group-id}",
            containerFactory = "kafkaListenerContainerFactory"
    )
    public void consumeAutomationRequest(
            ConsumerRecord<String, AutomationRequest> record,
            Acknowledgment acknowledgment) {

        AutomationRequest request = record.value();

        try {
            log.debug("Consumed automation request: partition={}, offset={}, requestId={}",
                    record.partition(), record.offset(), request.getRequestId());

            apply(request);
            acknowledgment.acknowledge();
            count("success");

        } catch (DutyNotFoundException e) {
            log.info("Opt-out for unknown duty {}; nothing to cancel", e.getDutyId());
            acknowledgment.acknowledge();
            count("duty_not_found");

        } catch (InvalidInputException | IllegalArgumentException e) {
            log.warn("Invalid automation request {}: {}", request.getRequestId(), e.getMessage());
            count("invalid");
            sendToDLQ(request, e.getMessage());
            acknowledgment.acknowledge();

        } catch (Exception e) {
            log.error("Error processing automation request {}: {}", request.getRequestId(), e.getMessage(), e);
            count("error");
            sendToDLQ(request, e.getMessage());
            acknowledgment.acknowledge();
        }
    }

    private void apply(AutomationRequest request) {
        if (request.getType() == null) {
            throw new InvalidInputException("Automation request has no type");
        }

        switch (request.getType()) {
            case OPT_IN:
                DutyRegistration registration =
                        taskRegistry.createDuty(request.getGroupAddress(), request.getGroupName());
                log.info("Opt-in for group {} -> {} (duty {})", request.getGroupAddress(),
                        registration.getStatus(), registration.getDutyId());
                break;
            case OPT_OUT:
                taskRegistry.cancelDuty(request.getDutyId());
                log.info("Opt-out for group {}: cancelled duty {}", request.getGroupAddress(), request.getDutyId());
                break;
            default:
                throw new InvalidInputException("Unsupported automation request type: " + request.getType());
        }
    }

    /**
     * Send failed request to Dead Letter Queue for manual investigation.
     */
    private void sendToDLQ(AutomationRequest request, String errorMessage) {
        try {
            log.warn("Sending automation request {} to DLQ: {}", request.getRequestId(), errorMessage);

            kafkaTemplate.send(dlqTopic, request.getGroupAddress(), request);

            Counter.builder("kafka.dlq.sent")
                    .tag("reason", "automation_request_failed")
                    .register(meterRegistry)
                    .increment();

        } catch (Exception e) {
            log.error("Failed to send automation request to DLQ: {}", e.getMessage(), e);
        }
    }

    private void count(String result) {
        Counter.builder("kafka.automation.requests.consumed")
                .tag("result", result)
                .register(meterRegistry)
                .increment();
    }
}
