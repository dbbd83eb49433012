package com.ferrybooking.booking.events;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.concurrent.CompletableFuture;

/**
 * Forwards booking lifecycle events to Kafka once the originating transaction has committed,
 * so consumers (notifications, reporting) never see a confirmation that was rolled back.
 * Events are keyed by booking code to keep one booking's events ordered on a partition.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BookingEventPublisher {

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Value("${events.topics.booking-confirmed:booking-confirmed}")
    private String confirmedTopic;

    @Value("${events.topics.booking-cancelled:booking-cancelled}")
    private String cancelledTopic;

    @Value("${events.topics.booking-expired:booking-expired}")
    private String expiredTopic;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingConfirmed(BookingConfirmedEvent event) {
        publish(confirmedTopic, event.bookingCode(), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingCancelled(BookingCancelledEvent event) {
        publish(cancelledTopic, event.bookingCode(), event);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onBookingExpired(BookingExpiredEvent event) {
        publish(expiredTopic, event.bookingCode(), event);
    }

    private void publish(String topic, String key, Object event) {
        log.info("Publishing {} to topic {}", event.getClass().getSimpleName(), topic);
        try {
            CompletableFuture<SendResult<String, Object>> future = kafkaTemplate.send(topic, key, event);
            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    log.debug("Event for {} written to {} at offset {}",
                            key, topic, result.getRecordMetadata().offset());
                } else {
                    log.error("Failed to publish event for {} to {}", key, topic, ex);
                }
            });
        } catch (RuntimeException e) {
            // Booking change is already committed at this point.
            log.error("Could not hand event for {} to Kafka", key, e);
        }
    }
}
